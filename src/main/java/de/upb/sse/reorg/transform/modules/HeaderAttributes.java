package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.Attribute;
import de.upb.sse.reorg.ast.Item;
import de.upb.sse.reorg.ast.ModItem;
import de.upb.sse.reorg.configuration.ReorganizerConfiguration;

/**
 * Recognizes the modules the translator generated per header.
 */
final class HeaderAttributes {
    private final String headerAttribute;
    private final String stdIncludeMarker;

    HeaderAttributes(ReorganizerConfiguration config) {
        this.headerAttribute = config.getHeaderAttribute();
        this.stdIncludeMarker = config.getStdIncludeMarker();
    }

    /** {@code #[header_src = "/some/path"]} is present. */
    boolean hasSourceHeader(Item item) {
        return item.hasAttribute(headerAttribute);
    }

    /** Some attribute value points into the system include directory, e.g. {@code /usr/include/stdlib.h}. */
    boolean isStd(Item item) {
        for (Attribute attr : item.getAttrs()) {
            if (attr.valueString().map(v -> v.contains(stdIncludeMarker)).orElse(false)) {
                return true;
            }
        }
        return false;
    }

    boolean isSynthetic(Item item) {
        return hasSourceHeader(item) || isStd(item);
    }

    /**
     * A generated module that gets dissolved: its items are moved out and the
     * module itself is removed. Unnamed generated modules are left alone since
     * nothing could be synthesized in their place.
     */
    boolean isCollapsible(Item item) {
        return item instanceof ModItem && isSynthetic(item) && item.hasIdent();
    }
}

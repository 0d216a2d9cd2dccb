package de.upb.sse.reorg.ast;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A declaration in the tree. Items are immutable; passes that change an item
 * build a copy carrying the same {@link NodeId}.
 */
@Getter
public abstract class Item {
    private final NodeId id;
    private final String ident;
    private final List<Attribute> attrs;
    private final Visibility vis;

    protected Item(NodeId id, String ident, List<Attribute> attrs, Visibility vis) {
        this.id = Objects.requireNonNull(id, "id");
        this.ident = ident == null ? "" : ident;
        this.attrs = attrs == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(attrs));
        this.vis = vis == null ? Visibility.INHERITED : vis;
    }

    public abstract ItemKind getKind();

    public abstract <R> R accept(ItemVisitor<R> visitor);

    /**
     * Structural comparison of the kind-specific body only. Ids, idents,
     * attributes and visibility are ignored.
     */
    public abstract boolean nodeEquivalent(Item other);

    /** Full structural comparison: ident, visibility, attributes and body. */
    public boolean equivalentTo(Item other) {
        return other != null
                && ident.equals(other.ident)
                && vis == other.vis
                && attrs.equals(other.attrs)
                && nodeEquivalent(other);
    }

    public boolean hasIdent() {
        return !ident.isEmpty();
    }

    public Optional<String> attributeValue(String name) {
        for (Attribute attr : attrs) {
            if (attr.getName().equals(name)) {
                return attr.valueString();
            }
        }
        return Optional.empty();
    }

    public boolean hasAttribute(String name) {
        return attrs.stream().anyMatch(a -> a.getName().equals(name));
    }

    @Override
    public String toString() {
        return ItemPrinter.print(this).trim();
    }
}

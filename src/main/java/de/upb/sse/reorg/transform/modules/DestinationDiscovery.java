package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.Crate;
import de.upb.sse.reorg.ast.ModItem;
import de.upb.sse.reorg.ast.Nodes;
import de.upb.sse.reorg.ast.SimplePath;
import de.upb.sse.reorg.ast.UseItem;

import java.util.logging.Logger;

/**
 * Catalogs every item and collects the modules that can receive items (any
 * module not generated from a header) together with a pending path record for
 * every import.
 */
final class DestinationDiscovery implements ReorganizeStage {
    private static final Logger logger = Logger.getLogger(DestinationDiscovery.class.getName());

    @Override
    public String name() {
        return "discover";
    }

    @Override
    public Crate apply(Crate krate, ReorganizeContext cx) {
        cx.catalog(krate);
        Nodes.visitNodes(krate, item -> {
            if (item instanceof ModItem) {
                if (!cx.headers.isSynthetic(item)) {
                    cx.addPossibleDestination(item.getId());
                }
            } else if (item instanceof UseItem) {
                SimplePath prefix = ((UseItem) item).getTree().getPrefix()
                        .withoutSegments(cx.getConfig().getRelativeSegments());
                cx.addPathRecord(item.getId(), new PathRecord(prefix));
            }
        });
        logger.fine("Catalogued " + cx.catalogSize() + " items, "
                + cx.getPossibleDestinationModules().size() + " candidate destination modules");
        return krate;
    }
}

package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.Crate;
import de.upb.sse.reorg.ast.Item;
import de.upb.sse.reorg.ast.ModItem;
import de.upb.sse.reorg.ast.NodeId;
import de.upb.sse.reorg.ast.Nodes;
import de.upb.sse.reorg.exceptions.UnresolvedDestinationException;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Walks every header module and decides, for each of its items, which module
 * the item moves to. Imports naming a resolved header module are patched to
 * name the destination instead.
 */
final class DestinationResolver implements ReorganizeStage {
    private static final Logger logger = Logger.getLogger(DestinationResolver.class.getName());

    @Override
    public String name() {
        return "resolve";
    }

    @Override
    public Crate apply(Crate krate, ReorganizeContext cx) {
        Nodes.visitNodes(krate, item -> {
            if (cx.headers.isCollapsible(item)) {
                visitHeaderModule((ModItem) item, cx);
            }
        });
        return krate;
    }

    private void visitHeaderModule(ModItem oldModule, ReorganizeContext cx) {
        Destination dest = null;
        for (Item moduleItem : oldModule.getItems()) {
            // nested header modules get their own visit
            if (cx.headers.isCollapsible(moduleItem)) {
                continue;
            }
            Destination resolved = resolve(moduleItem.getId(), oldModule, cx);
            cx.assignDestination(moduleItem.getId(), resolved.getId());
            logger.fine(() -> "Moving " + describe(moduleItem) + " from " + oldModule.getIdent()
                    + " to " + resolved.getName());
            dest = resolved;
        }
        if (dest == null) {
            return;
        }
        int patched = 0;
        for (PathRecord record : cx.pathRecords()) {
            if (record.patch(oldModule.getIdent(), dest)) {
                patched++;
            }
        }
        if (patched > 0) {
            String target = dest.getName();
            int count = patched;
            logger.fine(() -> "Rewrote " + count + " import paths from " + oldModule.getIdent() + " to " + target);
        }
    }

    /**
     * Picks the destination for {@code itemId}, an item of {@code oldModule}.
     * <ol>
     *   <li>items from system headers go to the shared stdlib module;</li>
     *   <li>otherwise the first candidate module (by id) whose name is contained
     *   in the header module's name, e.g. {@code buffer} for {@code buffer_h};</li>
     *   <li>otherwise a new module named after the header module, shared by all
     *   header modules of that name.</li>
     * </ol>
     */
    Destination resolve(NodeId itemId, ModItem oldModule, ReorganizeContext cx) {
        if (cx.headers.isStd(oldModule)) {
            return new Destination(cx.stdlibModuleId(), cx.getConfig().getStdlibModuleName());
        }

        // Naive heuristic: substring match on module names.
        for (NodeId candidateId : cx.getPossibleDestinationModules()) {
            Optional<Item> candidate = cx.lookup(candidateId);
            if (candidate.isEmpty()) {
                continue;
            }
            String displayName = displayName(candidate.get(), cx);
            if (!displayName.isEmpty() && oldModule.getIdent().contains(displayName)) {
                return new Destination(candidateId, displayName);
            }
        }

        if (!cx.hasDestination(itemId)) {
            NodeId id = cx.newModuleId(oldModule.getIdent());
            return new Destination(id, oldModule.getIdent());
        }
        throw new UnresolvedDestinationException(itemId, oldModule.getIdent());
    }

    /** The module's name, or the crate's source file name for an unnamed module. */
    private static String displayName(Item module, ReorganizeContext cx) {
        if (module.hasIdent()) {
            return module.getIdent();
        }
        return cx.getSession().sourceFileStem();
    }

    private static String describe(Item item) {
        return item.getKind() + (item.hasIdent() ? " " + item.getIdent() : "") + " (" + item.getId() + ")";
    }
}

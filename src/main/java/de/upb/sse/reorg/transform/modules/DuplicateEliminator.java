package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.ForeignItem;
import de.upb.sse.reorg.ast.ForeignModItem;
import de.upb.sse.reorg.ast.Item;
import de.upb.sse.reorg.ast.NodeId;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Removes items of a module that duplicate an earlier item of the same
 * module. The first occurrence is kept. Extern blocks are deduplicated per
 * symbol; a block left without symbols is removed.
 */
final class DuplicateEliminator {
    private static final Logger logger = Logger.getLogger(DuplicateEliminator.class.getName());

    private final ReorganizeContext cx;

    DuplicateEliminator(ReorganizeContext cx) {
        this.cx = cx;
    }

    List<Item> removeDuplicates(String moduleName, List<Item> items) {
        List<Item> retained = new ArrayList<>(items.size());
        Set<NodeId> seenIds = new HashSet<>();
        for (Item item : items) {
            if (!seenIds.add(item.getId())) {
                cx.getStats().incrementRemovedDuplicates();
                continue;
            }
            if (item instanceof ForeignModItem) {
                ForeignModItem fm = (ForeignModItem) item;
                ForeignModItem deduped = dedupForeignMod(fm, retained);
                if (deduped.getItems().isEmpty() && !fm.getItems().isEmpty()) {
                    cx.getStats().incrementRemovedDuplicates();
                    continue;
                }
                retained.add(deduped);
                continue;
            }
            Item duplicateOf = findEquivalent(item, retained);
            if (duplicateOf != null) {
                logger.fine(() -> "Removing " + item.getKind() + " " + item.getIdent() + " from " + moduleName
                        + ", duplicate of " + duplicateOf.getId());
                cx.getStats().incrementRemovedDuplicates();
                continue;
            }
            retained.add(item);
        }
        return retained;
    }

    private Item findEquivalent(Item item, List<Item> retained) {
        for (Item other : retained) {
            if (!other.getId().equals(item.getId()) && cx.getEquivalence().compareItems(other, item)) {
                return other;
            }
        }
        return null;
    }

    private ForeignModItem dedupForeignMod(ForeignModItem fm, List<Item> retained) {
        List<ForeignItem> kept = new ArrayList<>();
        for (ForeignItem fi : fm.getItems()) {
            if (declaredEarlier(fi, retained) || matchesAny(fi, kept)) {
                logger.fine(() -> "Removing duplicate extern symbol " + fi.getIdent());
                continue;
            }
            kept.add(fi);
        }
        if (kept.size() == fm.getItems().size()) {
            return fm;
        }
        cx.getStats().addRemovedForeignItems(fm.getItems().size() - kept.size());
        return fm.withItems(kept);
    }

    private boolean declaredEarlier(ForeignItem fi, List<Item> retained) {
        for (Item other : retained) {
            if (other instanceof ForeignModItem && matchesAny(fi, ((ForeignModItem) other).getItems())) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesAny(ForeignItem fi, List<ForeignItem> others) {
        for (ForeignItem other : others) {
            if (cx.getEquivalence().compareForeignItems(fi, other)) {
                return true;
            }
        }
        return false;
    }
}

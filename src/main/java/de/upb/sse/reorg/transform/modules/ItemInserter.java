package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.Crate;
import de.upb.sse.reorg.ast.ForeignItem;
import de.upb.sse.reorg.ast.ForeignModItem;
import de.upb.sse.reorg.ast.Item;
import de.upb.sse.reorg.ast.ModItem;
import de.upb.sse.reorg.ast.NodeId;
import de.upb.sse.reorg.ast.Nodes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Removes the header modules and appends their items to the destination
 * modules, skipping items the destination already has.
 */
final class ItemInserter implements ReorganizeStage {
    private static final Logger logger = Logger.getLogger(ItemInserter.class.getName());

    @Override
    public String name() {
        return "insert";
    }

    @Override
    public Crate apply(Crate krate, ReorganizeContext cx) {
        return Nodes.foldItems(krate, item -> {
            if (cx.headers.isCollapsible(item)) {
                cx.getStats().incrementRemovedHeaderModules();
                return Collections.emptyList();
            }
            if (item instanceof ModItem) {
                List<NodeId> newItemIds = cx.getDestModToItems().get(item.getId());
                if (newItemIds != null) {
                    return List.of(insertInto((ModItem) item, newItemIds, cx));
                }
            }
            return List.of(item);
        });
    }

    private ModItem insertInto(ModItem module, List<NodeId> newItemIds, ReorganizeContext cx) {
        List<Item> items = new ArrayList<>(module.getItems());
        for (NodeId newItemId : newItemIds) {
            Optional<Item> snapshot = cx.lookup(newItemId);
            if (snapshot.isEmpty()) {
                logger.fine(() -> "No catalog entry for " + newItemId + ", skipping");
                continue;
            }
            Item newItem = snapshot.get();

            // extern blocks are merged symbol by symbol: drop whatever the
            // module already declares
            if (newItem instanceof ForeignModItem) {
                ForeignModItem fm = withoutDeclaredSymbols((ForeignModItem) newItem, items, cx);
                if (fm.getItems().isEmpty()) {
                    continue;
                }
                newItem = fm;
            }

            if (containsEquivalent(items, newItem, cx)) {
                continue;
            }
            items.add(newItem);
            cx.getStats().incrementMovedItems();
        }
        return module.withItems(items);
    }

    private static boolean containsEquivalent(List<Item> items, Item newItem, ReorganizeContext cx) {
        for (Item item : items) {
            if (cx.getEquivalence().compareItems(newItem, item)) {
                return true;
            }
        }
        return false;
    }

    private static ForeignModItem withoutDeclaredSymbols(ForeignModItem fm, List<Item> items, ReorganizeContext cx) {
        Set<String> declared = new HashSet<>();
        for (Item item : items) {
            if (item.hasIdent()) {
                declared.add(item.getIdent());
            }
        }
        List<ForeignItem> kept = new ArrayList<>();
        for (ForeignItem fi : fm.getItems()) {
            if (declared.contains(fi.getIdent())) {
                logger.fine(() -> "Dropping extern symbol " + fi.getIdent() + ", already declared");
            } else {
                kept.add(fi);
            }
        }
        if (kept.size() == fm.getItems().size()) {
            return fm;
        }
        cx.getStats().addRemovedForeignItems(fm.getItems().size() - kept.size());
        return fm.withItems(kept);
    }
}

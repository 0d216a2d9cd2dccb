package de.upb.sse.reorg.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Whole-tree walks over items.
 */
public final class Nodes {
    private Nodes() {}

    /**
     * Calls {@code visitor} for every item of the crate, parents before their
     * children.
     */
    public static void visitNodes(Crate krate, Consumer<Item> visitor) {
        for (Item item : krate.getItems()) {
            visitItem(item, visitor);
        }
    }

    private static void visitItem(Item item, Consumer<Item> visitor) {
        visitor.accept(item);
        if (item instanceof ModItem) {
            for (Item child : ((ModItem) item).getItems()) {
                visitItem(child, visitor);
            }
        }
    }

    /**
     * Rewrites every item of the crate bottom-up. Module children are folded
     * first, then the callback sees the module with its already folded
     * children. The callback replaces an item by zero, one or several items.
     */
    public static Crate foldItems(Crate krate, Function<Item, List<Item>> folder) {
        return krate.withItems(foldList(krate.getItems(), folder));
    }

    private static List<Item> foldList(List<Item> items, Function<Item, List<Item>> folder) {
        List<Item> out = new ArrayList<>(items.size());
        for (Item item : items) {
            Item current = item;
            if (item instanceof ModItem) {
                ModItem mod = (ModItem) item;
                current = mod.withItems(foldList(mod.getItems(), folder));
            }
            out.addAll(folder.apply(current));
        }
        return out;
    }

    /** Largest id used anywhere in the crate, foreign symbols included; -1 for an empty crate. */
    public static int maxNodeId(Crate krate) {
        int[] max = {-1};
        visitNodes(krate, item -> {
            max[0] = Math.max(max[0], item.getId().value());
            if (item instanceof ForeignModItem) {
                for (ForeignItem fi : ((ForeignModItem) item).getItems()) {
                    max[0] = Math.max(max[0], fi.getId().value());
                }
            }
        });
        return max[0];
    }
}

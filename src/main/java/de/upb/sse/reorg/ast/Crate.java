package de.upb.sse.reorg.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of the tree: the top-level items of the translated crate.
 */
public final class Crate {
    private final List<Item> items;

    public Crate(List<Item> items) {
        this.items = items == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(items));
    }

    public List<Item> getItems() {
        return items;
    }

    public Crate withItems(List<Item> newItems) {
        return new Crate(newItems);
    }

    /** Structural comparison ignoring node ids. */
    public boolean equivalentTo(Crate other) {
        if (other == null || items.size() != other.items.size()) {
            return false;
        }
        for (int i = 0; i < items.size(); i++) {
            if (!items.get(i).equivalentTo(other.items.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return ItemPrinter.print(this);
    }
}

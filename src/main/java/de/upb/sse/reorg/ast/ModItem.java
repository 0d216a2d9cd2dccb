package de.upb.sse.reorg.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A module (namespace) holding an ordered list of child items.
 */
public final class ModItem extends Item {
    private final List<Item> items;
    private final boolean inline;

    public ModItem(NodeId id, String ident, List<Attribute> attrs, Visibility vis, List<Item> items, boolean inline) {
        super(id, ident, attrs, vis);
        this.items = items == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(items));
        this.inline = inline;
    }

    public List<Item> getItems() {
        return items;
    }

    public boolean isInline() {
        return inline;
    }

    public ModItem withItems(List<Item> newItems) {
        return new ModItem(getId(), getIdent(), getAttrs(), getVis(), newItems, inline);
    }

    @Override
    public ItemKind getKind() {
        return ItemKind.MOD;
    }

    @Override
    public <R> R accept(ItemVisitor<R> visitor) {
        return visitor.visitMod(this);
    }

    @Override
    public boolean nodeEquivalent(Item other) {
        if (!(other instanceof ModItem)) {
            return false;
        }
        ModItem that = (ModItem) other;
        if (inline != that.inline || items.size() != that.items.size()) {
            return false;
        }
        for (int i = 0; i < items.size(); i++) {
            if (!items.get(i).equivalentTo(that.items.get(i))) {
                return false;
            }
        }
        return true;
    }
}

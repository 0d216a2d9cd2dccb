package de.upb.sse.reorg.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An {@code extern "ABI" { ... }} block. Blocks are anonymous; their symbols
 * are merged and deduplicated one by one.
 */
public final class ForeignModItem extends Item {
    private final String abi;
    private final List<ForeignItem> items;

    public ForeignModItem(NodeId id, List<Attribute> attrs, String abi, List<ForeignItem> items) {
        super(id, "", attrs, Visibility.INHERITED);
        this.abi = abi;
        this.items = items == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(items));
    }

    public String getAbi() {
        return abi;
    }

    public List<ForeignItem> getItems() {
        return items;
    }

    public ForeignModItem withItems(List<ForeignItem> newItems) {
        return new ForeignModItem(getId(), getAttrs(), abi, newItems);
    }

    @Override
    public ItemKind getKind() {
        return ItemKind.FOREIGN_MOD;
    }

    @Override
    public <R> R accept(ItemVisitor<R> visitor) {
        return visitor.visitForeignMod(this);
    }

    @Override
    public boolean nodeEquivalent(Item other) {
        if (!(other instanceof ForeignModItem)) {
            return false;
        }
        ForeignModItem that = (ForeignModItem) other;
        if (!Objects.equals(abi, that.abi) || items.size() != that.items.size()) {
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

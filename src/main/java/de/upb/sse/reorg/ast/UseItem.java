package de.upb.sse.reorg.ast;

import java.util.List;

public final class UseItem extends Item {
    private final UseTree tree;

    public UseItem(NodeId id, List<Attribute> attrs, Visibility vis, UseTree tree) {
        super(id, "", attrs, vis);
        this.tree = tree;
    }

    public UseTree getTree() {
        return tree;
    }

    public UseItem withTree(UseTree newTree) {
        return new UseItem(getId(), getAttrs(), getVis(), newTree);
    }

    @Override
    public ItemKind getKind() {
        return ItemKind.USE;
    }

    @Override
    public <R> R accept(ItemVisitor<R> visitor) {
        return visitor.visitUse(this);
    }

    @Override
    public boolean nodeEquivalent(Item other) {
        return other instanceof UseItem && tree.equals(((UseItem) other).tree);
    }
}

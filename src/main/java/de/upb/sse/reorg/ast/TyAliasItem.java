package de.upb.sse.reorg.ast;

import java.util.List;

/** {@code type Foo = unnamed;} */
public final class TyAliasItem extends Item {
    private final String ty;

    public TyAliasItem(NodeId id, String ident, List<Attribute> attrs, Visibility vis, String ty) {
        super(id, ident, attrs, vis);
        this.ty = ty;
    }

    public String getTy() {
        return ty;
    }

    @Override
    public ItemKind getKind() {
        return ItemKind.TY_ALIAS;
    }

    @Override
    public <R> R accept(ItemVisitor<R> visitor) {
        return visitor.visitTyAlias(this);
    }

    @Override
    public boolean nodeEquivalent(Item other) {
        return other instanceof TyAliasItem && ty.equals(((TyAliasItem) other).ty);
    }
}

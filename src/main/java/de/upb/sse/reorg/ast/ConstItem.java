package de.upb.sse.reorg.ast;

import java.util.List;

/** {@code const FOO: unnamed = 0;} */
public final class ConstItem extends Item {
    private final String ty;
    private final String expr;

    public ConstItem(NodeId id, String ident, List<Attribute> attrs, Visibility vis, String ty, String expr) {
        super(id, ident, attrs, vis);
        this.ty = ty;
        this.expr = expr;
    }

    public String getTy() {
        return ty;
    }

    public String getExpr() {
        return expr;
    }

    @Override
    public ItemKind getKind() {
        return ItemKind.CONST;
    }

    @Override
    public <R> R accept(ItemVisitor<R> visitor) {
        return visitor.visitConst(this);
    }

    @Override
    public boolean nodeEquivalent(Item other) {
        if (!(other instanceof ConstItem)) {
            return false;
        }
        ConstItem that = (ConstItem) other;
        return ty.equals(that.ty) && expr.equals(that.expr);
    }
}

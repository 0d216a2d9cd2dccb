package de.upb.sse.reorg.ast;

import java.util.List;

/**
 * Any declaration the reorganizer does not look into: structs, unions, enums,
 * functions, statics. The parser hands over the keyword and the rendered body
 * (everything after the name).
 */
public final class OpaqueItem extends Item {
    private final String keyword;
    private final String body;

    public OpaqueItem(NodeId id, String ident, List<Attribute> attrs, Visibility vis, String keyword, String body) {
        super(id, ident, attrs, vis);
        this.keyword = keyword;
        this.body = body == null ? "" : body;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getBody() {
        return body;
    }

    @Override
    public ItemKind getKind() {
        return ItemKind.OTHER;
    }

    @Override
    public <R> R accept(ItemVisitor<R> visitor) {
        return visitor.visitOther(this);
    }

    @Override
    public boolean nodeEquivalent(Item other) {
        if (!(other instanceof OpaqueItem)) {
            return false;
        }
        OpaqueItem that = (OpaqueItem) other;
        return keyword.equals(that.keyword) && body.equals(that.body);
    }
}

package de.upb.sse.reorg.ast;

import java.util.List;

/**
 * Renders items as Rust-like source text. Used for stage dumps and test
 * assertions; it is not a faithful pretty-printer.
 */
public final class ItemPrinter implements ItemVisitor<Void> {
    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int depth;

    private ItemPrinter() {}

    public static String print(Crate krate) {
        ItemPrinter printer = new ItemPrinter();
        printer.printAll(krate.getItems());
        return printer.out.toString();
    }

    public static String print(Item item) {
        ItemPrinter printer = new ItemPrinter();
        item.accept(printer);
        return printer.out.toString();
    }

    private void printAll(List<Item> items) {
        for (Item item : items) {
            item.accept(this);
        }
    }

    private void line(String text) {
        for (int i = 0; i < depth; i++) {
            out.append(INDENT);
        }
        out.append(text).append('\n');
    }

    private void header(Item item) {
        for (Attribute attr : item.getAttrs()) {
            line(attr.getValue() == null
                    ? "#[" + attr.getName() + "]"
                    : "#[" + attr.getName() + " = \"" + attr.getValue() + "\"]");
        }
    }

    @Override
    public Void visitMod(ModItem item) {
        header(item);
        if (item.getItems().isEmpty()) {
            line(item.getVis().keyword() + "mod " + item.getIdent() + " {}");
            return null;
        }
        line(item.getVis().keyword() + "mod " + item.getIdent() + " {");
        depth++;
        printAll(item.getItems());
        depth--;
        line("}");
        return null;
    }

    @Override
    public Void visitUse(UseItem item) {
        header(item);
        line(item.getVis().keyword() + "use " + item.getTree() + ";");
        return null;
    }

    @Override
    public Void visitForeignMod(ForeignModItem item) {
        header(item);
        String abi = item.getAbi() == null ? "extern" : "extern \"" + item.getAbi() + "\"";
        if (item.getItems().isEmpty()) {
            line(abi + " {}");
            return null;
        }
        line(abi + " {");
        depth++;
        for (ForeignItem fi : item.getItems()) {
            line(fi.getVis().keyword() + fi.getKind().keyword() + " " + fi.getIdent() + fi.getSignature() + ";");
        }
        depth--;
        line("}");
        return null;
    }

    @Override
    public Void visitTyAlias(TyAliasItem item) {
        header(item);
        line(item.getVis().keyword() + "type " + item.getIdent() + " = " + item.getTy() + ";");
        return null;
    }

    @Override
    public Void visitConst(ConstItem item) {
        header(item);
        line(item.getVis().keyword() + "const " + item.getIdent() + ": " + item.getTy() + " = " + item.getExpr() + ";");
        return null;
    }

    @Override
    public Void visitOther(OpaqueItem item) {
        header(item);
        String body = item.getBody();
        String rendered;
        if (body.isEmpty()) {
            rendered = ";";
        } else if (body.startsWith("(") || body.startsWith(":") || body.startsWith(";")) {
            rendered = body;
        } else {
            rendered = " " + body;
        }
        line(item.getVis().keyword() + item.getKeyword() + " " + item.getIdent() + rendered);
        return null;
    }
}

package de.upb.sse.reorg.ast;

public enum Visibility {
    PUBLIC,
    INHERITED;

    public String keyword() {
        return this == PUBLIC ? "pub " : "";
    }
}

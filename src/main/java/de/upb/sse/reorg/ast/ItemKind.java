package de.upb.sse.reorg.ast;

public enum ItemKind {
    MOD,
    USE,
    FOREIGN_MOD,
    TY_ALIAS,
    CONST,
    /** structs, functions, statics, enums and everything else the transform treats opaquely */
    OTHER
}

package de.upb.sse.reorg.ast;

import lombok.Getter;

import java.util.Objects;

/**
 * One externally linked symbol inside an {@code extern} block, e.g.
 * {@code fn malloc(_: libc::c_ulong) -> *mut libc::c_void;}.
 */
@Getter
public final class ForeignItem {
    public enum Kind {
        FN("fn"), STATIC("static"), TYPE("type");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    private final NodeId id;
    private final String ident;
    private final Kind kind;
    /** Everything after the name, e.g. {@code (_: usize) -> *mut c_void} or {@code : i32}. */
    private final String signature;
    private final Visibility vis;

    public ForeignItem(NodeId id, String ident, Kind kind, String signature, Visibility vis) {
        this.id = Objects.requireNonNull(id, "id");
        this.ident = Objects.requireNonNull(ident, "ident");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.signature = signature == null ? "" : signature;
        this.vis = vis == null ? Visibility.INHERITED : vis;
    }

    public boolean nodeEquivalent(ForeignItem other) {
        return other != null && kind == other.kind && signature.equals(other.signature);
    }

    public boolean equivalentTo(ForeignItem other) {
        return nodeEquivalent(other) && ident.equals(other.ident) && vis == other.vis;
    }
}

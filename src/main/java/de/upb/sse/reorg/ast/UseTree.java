package de.upb.sse.reorg.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The body of an import: a prefix and either a single target (optionally
 * renamed), a nested group of sub-trees sharing the prefix, or a glob.
 */
public final class UseTree {
    public enum Kind { SIMPLE, NESTED, GLOB }

    private final SimplePath prefix;
    private final Kind kind;
    private final String rename;
    private final List<UseTree> nested;

    private UseTree(SimplePath prefix, Kind kind, String rename, List<UseTree> nested) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.kind = kind;
        this.rename = rename;
        this.nested = nested == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(nested));
    }

    public static UseTree simple(SimplePath path) {
        return new UseTree(path, Kind.SIMPLE, null, null);
    }

    public static UseTree simple(SimplePath path, String rename) {
        return new UseTree(path, Kind.SIMPLE, rename, null);
    }

    public static UseTree nested(SimplePath prefix, List<UseTree> trees) {
        return new UseTree(prefix, Kind.NESTED, null, trees);
    }

    public static UseTree glob(SimplePath prefix) {
        return new UseTree(prefix, Kind.GLOB, null, null);
    }

    public SimplePath getPrefix() {
        return prefix;
    }

    public Kind getKind() {
        return kind;
    }

    public String getRename() {
        return rename;
    }

    public boolean hasRename() {
        return rename != null;
    }

    public List<UseTree> getNested() {
        return nested;
    }

    public UseTree withPrefix(SimplePath newPrefix) {
        return new UseTree(newPrefix, kind, rename, nested);
    }

    /** A single-segment, non-renamed simple tree such as the {@code item} in {@code foo::{item}}. */
    public boolean isPlainName() {
        return kind == Kind.SIMPLE && rename == null && prefix.size() == 1;
    }

    /** Copy with the relative segments stripped from the top-level prefix. */
    public UseTree normalized(Collection<String> relativeSegments) {
        return withPrefix(prefix.withoutSegments(relativeSegments));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UseTree that = (UseTree) o;
        return prefix.equals(that.prefix) && kind == that.kind
                && Objects.equals(rename, that.rename) && nested.equals(that.nested);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, kind, rename, nested);
    }

    @Override
    public String toString() {
        switch (kind) {
            case GLOB:
                return prefix.isEmpty() ? "*" : prefix + SimplePath.SEPARATOR + "*";
            case NESTED:
                String group = nested.stream().map(UseTree::toString).collect(Collectors.joining(", ", "{", "}"));
                return prefix.isEmpty() ? group : prefix + SimplePath.SEPARATOR + group;
            case SIMPLE:
            default:
                return rename == null ? prefix.toString() : prefix + " as " + rename;
        }
    }
}

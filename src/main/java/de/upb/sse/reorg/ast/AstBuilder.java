package de.upb.sse.reorg.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Convenience constructors for tree nodes. Every node built here draws a fresh
 * id from the supplied allocator.
 */
public final class AstBuilder {
    public static final String HEADER_SRC = "header_src";

    private final Supplier<NodeId> ids;

    public AstBuilder(Supplier<NodeId> ids) {
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public NodeId nextId() {
        return ids.get();
    }

    public Crate crate(Item... items) {
        return new Crate(Arrays.asList(items));
    }

    public ModItem mod(String name, Item... items) {
        return new ModItem(nextId(), name, Collections.emptyList(), Visibility.PUBLIC, Arrays.asList(items), true);
    }

    /** A translator-generated module tagged with the header it came from. */
    public ModItem headerMod(String name, String headerPath, Item... items) {
        return new ModItem(nextId(), name, List.of(Attribute.of(HEADER_SRC, headerPath)),
                Visibility.PUBLIC, Arrays.asList(items), true);
    }

    /** A new, empty-attribute public inline module with an id chosen by the caller. */
    public static ModItem newModule(NodeId id, String name, List<Item> items) {
        return new ModItem(id, name, Collections.emptyList(), Visibility.PUBLIC, items, true);
    }

    public OpaqueItem struct(String name, String body) {
        return new OpaqueItem(nextId(), name, Collections.emptyList(), Visibility.PUBLIC, "struct", body);
    }

    public OpaqueItem fn(String name, String body) {
        return new OpaqueItem(nextId(), name, Collections.emptyList(), Visibility.PUBLIC, "fn", body);
    }

    public OpaqueItem item(String keyword, String name, String body) {
        return new OpaqueItem(nextId(), name, Collections.emptyList(), Visibility.PUBLIC, keyword, body);
    }

    public TyAliasItem tyAlias(String name, String ty) {
        return new TyAliasItem(nextId(), name, Collections.emptyList(), Visibility.PUBLIC, ty);
    }

    public ConstItem constant(String name, String ty, String expr) {
        return new ConstItem(nextId(), name, Collections.emptyList(), Visibility.PUBLIC, ty, expr);
    }

    /** {@code use a::b::c;} */
    public UseItem use(String path) {
        return new UseItem(nextId(), Collections.emptyList(), Visibility.INHERITED,
                UseTree.simple(SimplePath.parse(path)));
    }

    /** {@code use a::b as c;} */
    public UseItem useAs(String path, String rename) {
        return new UseItem(nextId(), Collections.emptyList(), Visibility.INHERITED,
                UseTree.simple(SimplePath.parse(path), rename));
    }

    /** {@code use a::*;} */
    public UseItem useGlob(String prefix) {
        return new UseItem(nextId(), Collections.emptyList(), Visibility.INHERITED,
                UseTree.glob(SimplePath.parse(prefix)));
    }

    /** {@code use prefix::{a, b, c};} */
    public UseItem useNested(String prefix, String... names) {
        return useMultipleItem(SimplePath.parse(prefix), Arrays.asList(names));
    }

    public UseItem useMultipleItem(SimplePath prefix, List<String> names) {
        List<UseTree> trees = names.stream()
                .map(n -> UseTree.simple(SimplePath.of(n)))
                .collect(Collectors.toList());
        return new UseItem(nextId(), Collections.emptyList(), Visibility.INHERITED, UseTree.nested(prefix, trees));
    }

    public ForeignModItem foreignMod(ForeignItem... items) {
        return new ForeignModItem(nextId(), Collections.emptyList(), "C", new ArrayList<>(Arrays.asList(items)));
    }

    public ForeignItem foreignFn(String name, String signature) {
        return new ForeignItem(nextId(), name, ForeignItem.Kind.FN, signature, Visibility.PUBLIC);
    }

    public ForeignItem foreignStatic(String name, String signature) {
        return new ForeignItem(nextId(), name, ForeignItem.Kind.STATIC, signature, Visibility.PUBLIC);
    }
}

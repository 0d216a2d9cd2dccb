package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.AstBuilder;
import de.upb.sse.reorg.command.CommandState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ItemEquivalenceTest {
    private AstBuilder b;
    private ItemEquivalence eq;

    @BeforeEach
    void setup() {
        CommandState ids = new CommandState(0);
        b = new AstBuilder(ids::nextNodeId);
        eq = new ItemEquivalence(List.of("self", "super"));
    }

    @Test
    @DisplayName("same body and same name are equivalent regardless of ids")
    void structural() {
        assertTrue(eq.compareItems(b.struct("buffer_t", "{ data: i32 }"), b.struct("buffer_t", "{ data: i32 }")));
        assertFalse(eq.compareItems(b.struct("buffer_t", "{ data: i32 }"), b.struct("buffer_t", "{ data: i64 }")));
        assertFalse(eq.compareItems(b.struct("a", "{ data: i32 }"), b.struct("b", "{ data: i32 }")));
    }

    @Test
    @DisplayName("type aliases and constants match by name alone")
    void generatedNames() {
        assertTrue(eq.compareItems(b.tyAlias("Foo", "unnamed"), b.tyAlias("Foo", "unnamed_0")));
        assertTrue(eq.compareItems(b.constant("BAR", "unnamed", "0"), b.constant("BAR", "unnamed_1", "0")));
        assertFalse(eq.compareItems(b.tyAlias("Foo", "unnamed"), b.tyAlias("Bar", "unnamed")));
        // a constant and an alias never match
        assertFalse(eq.compareItems(b.tyAlias("Foo", "u32"), b.constant("Foo", "u32", "0")));
    }

    @Test
    @DisplayName("imports are compared after dropping self and super")
    void imports() {
        assertTrue(eq.compareItems(b.use("super::stddef_h::size_t"), b.use("self::stddef_h::size_t")));
        assertTrue(eq.compareItems(b.use("stddef_h::size_t"), b.use("super::stddef_h::size_t")));
        assertFalse(eq.compareItems(b.use("stddef_h::size_t"), b.use("stddef_h::ptrdiff_t")));
        assertFalse(eq.compareItems(b.use("foo::a"), b.useNested("foo", "a")));
    }

    @Test
    @DisplayName("extern symbols match on name and signature")
    void foreignItems() {
        assertTrue(eq.compareForeignItems(b.foreignFn("malloc", "(_: c_ulong) -> *mut c_void"),
                b.foreignFn("malloc", "(_: c_ulong) -> *mut c_void")));
        assertFalse(eq.compareForeignItems(b.foreignFn("malloc", "(_: c_ulong) -> *mut c_void"),
                b.foreignFn("malloc", "(_: c_uint) -> *mut c_void")));
        assertFalse(eq.compareForeignItems(b.foreignFn("stdin", ": *mut FILE"),
                b.foreignStatic("stdin", ": *mut FILE")));
    }

    @Test
    @DisplayName("extern blocks with the same symbols are equivalent")
    void foreignBlocks() {
        assertTrue(eq.compareItems(b.foreignMod(b.foreignFn("free", "(_: *mut c_void)")),
                b.foreignMod(b.foreignFn("free", "(_: *mut c_void)"))));
        assertFalse(eq.compareItems(b.foreignMod(b.foreignFn("free", "(_: *mut c_void)")),
                b.foreignMod(b.foreignFn("free", "(_: *mut c_void)"), b.foreignFn("abort", "() -> !"))));
    }
}

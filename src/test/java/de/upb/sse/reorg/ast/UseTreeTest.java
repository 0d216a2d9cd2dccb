package de.upb.sse.reorg.ast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class UseTreeTest {

    @Test
    @DisplayName("the three import forms render like Rust")
    void rendering() {
        UseTree nested = UseTree.nested(SimplePath.of("foo"),
                List.of(UseTree.simple(SimplePath.of("a")), UseTree.simple(SimplePath.of("b"))));
        assertEquals("foo::{a, b}", nested.toString());
        assertEquals("foo::*", UseTree.glob(SimplePath.of("foo")).toString());
        assertEquals("foo::bar as baz", UseTree.simple(SimplePath.parse("foo::bar"), "baz").toString());
    }

    @Test
    @DisplayName("normalizing strips relative segments from the prefix only")
    void normalized() {
        UseTree tree = UseTree.nested(SimplePath.parse("super::foo_h"),
                List.of(UseTree.simple(SimplePath.of("item"))));
        UseTree other = UseTree.nested(SimplePath.parse("self::foo_h"),
                List.of(UseTree.simple(SimplePath.of("item"))));
        List<String> relative = List.of("self", "super");

        assertNotEquals(tree, other);
        assertEquals(tree.normalized(relative), other.normalized(relative));
    }

    @Test
    void plainName() {
        assertTrue(UseTree.simple(SimplePath.of("item")).isPlainName());
        assertFalse(UseTree.simple(SimplePath.of("item"), "it").isPlainName());
        assertFalse(UseTree.simple(SimplePath.parse("a::item")).isPlainName());
        assertFalse(UseTree.glob(SimplePath.of("a")).isPlainName());
    }
}

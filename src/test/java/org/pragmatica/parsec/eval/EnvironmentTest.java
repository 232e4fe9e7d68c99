package org.pragmatica.parsec.eval;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentTest {

    @Test
    void lookup_unboundName_isEmpty() {
        assertEquals(Optional.empty(), Environment.root().lookup("x"));
    }

    @Test
    void child_seesParentBindings() {
        var root = Environment.root();
        root.assign("x", 1);

        assertEquals(Optional.of(1), root.child().lookup("x"));
    }

    @Test
    void assign_existingOuterName_writesThrough() {
        var root = Environment.root();
        root.assign("x", 1);
        var block = root.child();

        block.assign("x", 2);

        assertEquals(Optional.of(2), root.lookup("x"));
        assertFalse(block.isBoundLocally("x"));
    }

    @Test
    void assign_newName_staysInChild() {
        var root = Environment.root();
        var block = root.child();

        block.assign("y", 3);

        assertEquals(Optional.of(3), block.lookup("y"));
        assertEquals(Optional.empty(), root.lookup("y"));
    }

    @Test
    void define_shadowsOuterBinding() {
        var root = Environment.root();
        root.assign("x", 1);
        var block = root.child();

        block.define("x", 10);
        block.assign("x", 11);

        assertEquals(Optional.of(11), block.lookup("x"));
        assertEquals(Optional.of(1), root.lookup("x"));
    }

    @Test
    void snapshot_isDetachedFromOriginal() {
        var root = Environment.root();
        root.assign("x", 1);
        var inner = root.child();
        inner.define("x", 2);
        inner.assign("z", 5);

        var copy = inner.snapshot();
        copy.assign("x", 100);
        copy.assign("w", 7);

        assertEquals(Map.of("x", 100, "z", 5, "w", 7), copy.visibleBindings());
        assertEquals(Optional.of(2), inner.lookup("x"));
        assertEquals(Optional.of(1), root.lookup("x"));
        assertEquals(Optional.empty(), inner.lookup("w"));
    }
}

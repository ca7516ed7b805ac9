package com.querytree.visitor;

import com.querytree.tree.Item.Word;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class VisitContextTest {

    @Test
    public void testEmptyContext() {
        VisitContext context = VisitContext.empty();
        assertNull(context.get("anything"));
        assertFalse(context.containsKey(VisitContext.PARENTS));
        assertTrue(context.parents().isEmpty());
        assertTrue(context.newParents().isEmpty());
        assertTrue(context.path().isEmpty());
        assertEquals(0, context.depth());
    }

    @Test
    public void testWithDoesNotModifyReceiver() {
        VisitContext base = VisitContext.of("replacement", "rotfl");
        VisitContext derived = base.with("field", "title");

        assertEquals("rotfl", derived.get("replacement"));
        assertEquals("title", derived.get("field"));
        assertFalse(base.containsKey("field"));
    }

    @Test
    public void testOfMap() {
        Map<String, Object> values = new HashMap<>();
        values.put("a", 1);
        values.put("b", "two");
        VisitContext context = VisitContext.of(values);

        values.put("c", 3);
        assertEquals(1, context.get("a"));
        assertEquals("two", context.get("b"));
        assertFalse(context.containsKey("c"));
        assertSame(VisitContext.empty(), VisitContext.of((Map<String, ?>) null));
    }

    @Test
    public void testGetOrDefault() {
        VisitContext context = VisitContext.of("a", 1);
        assertEquals(1, context.getOrDefault("a", 2));
        assertEquals("lol", context.getOrDefault("replacement", "lol"));
    }

    @ParameterizedTest
    @ValueSource(strings = {VisitContext.PARENTS, VisitContext.NEW_PARENTS, VisitContext.PATH})
    public void testReservedKeysRejected(String key) {
        assertThrows(IllegalArgumentException.class, () -> VisitContext.empty().with(key, Lists.immutable.empty()));
        assertThrows(IllegalArgumentException.class, () -> VisitContext.of(Map.of(key, "x")));
    }

    @Test
    public void testReservedAccessors() {
        Word root = new Word("root");
        VisitContext context = VisitContext.empty()
            .withReserved(VisitContext.PARENTS, Lists.immutable.of(root))
            .withReserved(VisitContext.PATH, Lists.immutable.of(0, 2))
            .descend();

        assertEquals(Lists.immutable.of(root), context.parents());
        assertEquals(Lists.immutable.of(0, 2), context.path());
        assertEquals(1, context.depth());
    }

    @Test
    public void testEquality() {
        assertEquals(VisitContext.of("a", 1), VisitContext.empty().with("a", 1));
        assertNotEquals(VisitContext.of("a", 1), VisitContext.of("a", 1).descend());
    }
}

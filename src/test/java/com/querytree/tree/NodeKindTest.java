package com.querytree.tree;

import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

public class NodeKindTest {

    @Test
    public void testConcreteOperationLineage() {
        assertEquals(Lists.immutable.of(NodeKind.AND_OPERATION, NodeKind.BASE_OPERATION),
            NodeKind.AND_OPERATION.lineage());
        assertEquals(Lists.immutable.of(NodeKind.OR_OPERATION, NodeKind.BASE_OPERATION),
            NodeKind.OR_OPERATION.lineage());
    }

    @Test
    public void testRootKindsHaveSingleEntryLineage() {
        assertEquals(Lists.immutable.of(NodeKind.SEARCH_FIELD), NodeKind.SEARCH_FIELD.lineage());
        assertEquals(Lists.immutable.of(NodeKind.NONE_ITEM), NodeKind.NONE_ITEM.lineage());
        assertNull(NodeKind.NONE_ITEM.parent());
    }

    @ParameterizedTest
    @EnumSource(NodeKind.class)
    public void testLineageStartsWithItselfAndFollowsParents(NodeKind kind) {
        assertSame(kind, kind.lineage().get(0));
        NodeKind current = kind;
        for (NodeKind ancestor : kind.lineage()) {
            assertSame(current, ancestor);
            current = current.parent();
        }
        assertNull(current);
    }

    @ParameterizedTest
    @CsvSource({
        "WORD, Word",
        "PHRASE, Phrase",
        "BASE_OPERATION, BaseOperation",
        "AND_OPERATION, AndOperation",
        "SEARCH_FIELD, SearchField",
        "NONE_ITEM, NoneItem",
        "FIELD_GROUP, FieldGroup"
    })
    public void testVariantName(NodeKind kind, String expected) {
        assertEquals(expected, kind.variantName());
    }

    @Test
    public void testIsA() {
        assertTrue(NodeKind.PHRASE.isA(NodeKind.TERM));
        assertTrue(NodeKind.PHRASE.isA(NodeKind.PHRASE));
        assertFalse(NodeKind.TERM.isA(NodeKind.PHRASE));
        assertFalse(NodeKind.GROUP.isA(NodeKind.BASE_OPERATION));
    }

    @Test
    public void testAbstractKinds() {
        assertTrue(NodeKind.TERM.isAbstract());
        assertTrue(NodeKind.BASE_OPERATION.isAbstract());
        assertTrue(NodeKind.UNARY.isAbstract());
        assertFalse(NodeKind.WORD.isAbstract());
        assertFalse(NodeKind.NONE_ITEM.isAbstract());
    }
}

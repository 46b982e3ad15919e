package com.blockflow.pygen.graph;

import com.blockflow.pygen.catalog.BlockCatalog;
import com.blockflow.pygen.catalog.BlockKind;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class BlockGraphTest {

    private BlockGraph graph;

    @Before
    public void setUp() {
        graph = new BlockGraph(BlockCatalog.standard());
    }

    @Test
    public void testAutoIdsSkipTakenIds() {
        graph.newNode("b1", BlockKind.TEXT);
        BlockNode n = graph.newNode(BlockKind.TEXT);
        assertEquals("b2", n.id());
        assertEquals(2, graph.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateIdRejected() {
        graph.newNode("x", BlockKind.TEXT);
        graph.newNode("x", BlockKind.MATH_NUMBER);
    }

    @Test
    public void testConnectMovesChild() {
        BlockNode p1 = graph.newNode(BlockKind.TEXT_PRINT);
        BlockNode p2 = graph.newNode(BlockKind.TEXT_PRINT);
        BlockNode t = graph.newNode(BlockKind.TEXT);

        graph.connect(p1, "TEXT", t);
        graph.connect(p2, "TEXT", t);

        assertNull(p1.input("TEXT"));
        assertSame(t, p2.input("TEXT"));
        assertSame(p2, t.parent());
        assertEquals("TEXT", t.parentSocket());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCycleRejected() {
        BlockNode outer = graph.newNode(BlockKind.LOGIC_NEGATE);
        BlockNode inner = graph.newNode(BlockKind.LOGIC_NEGATE);
        graph.connect(outer, "BOOL", inner);
        graph.connect(inner, "BOOL", outer);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSelfConnectRejected() {
        BlockNode n = graph.newNode(BlockKind.LOGIC_NEGATE);
        graph.connect(n, "BOOL", n);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownSocketRejected() {
        BlockNode p = graph.newNode(BlockKind.TEXT_PRINT);
        graph.connect(p, "NOPE", graph.newNode(BlockKind.TEXT));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownFieldRejected() {
        graph.newNode(BlockKind.TEXT).setField("NUM", "1");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDropdownRejectsUnknownOption() {
        graph.newNode(BlockKind.MATH_ARITHMETIC).setField("OP", "MODULO");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExpressionsCannotChain() {
        graph.chain(graph.newNode(BlockKind.TEXT), graph.newNode(BlockKind.TEXT));
    }

    @Test
    public void testChainAndProgram() {
        BlockNode s1 = graph.newNode(BlockKind.TEXT_PRINT);
        BlockNode s2 = graph.newNode(BlockKind.TEXT_PRINT);
        graph.chain(s1, s2);
        graph.addToProgram(s1);
        graph.addToProgram(s1);

        assertEquals(List.of(s1), graph.program());
        assertSame(s1, s2.previous());
        assertSame(s1, s2.owner());
        try {
            graph.addToProgram(s2);
            fail("A chained block is not top-level");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("not top-level"));
        }
    }

    @Test
    public void testConnectingRootRemovesItFromProgram() {
        BlockNode t = graph.newNode(BlockKind.TEXT);
        graph.addToProgram(t);
        BlockNode p = graph.newNode(BlockKind.TEXT_PRINT);
        graph.connect(p, "TEXT", t);
        assertTrue(graph.program().isEmpty());
    }

    @Test
    public void testLastAssignmentWins() {
        BlockNode first = graph.newNode(BlockKind.VARIABLES_SET).setField("VAR", "x");
        BlockNode second = graph.newNode(BlockKind.VARIABLES_SET).setField("VAR", "x");
        BlockNode v1 = graph.newNode(BlockKind.MATH_NUMBER);
        BlockNode v2 = graph.newNode(BlockKind.TEXT);
        graph.connect(first, "VALUE", v1);
        graph.connect(second, "VALUE", v2);

        assertSame(second, graph.assignmentOf("x"));
        assertSame(v2, graph.producerOf("x"));

        second.setField("VAR", "y");
        assertSame(first, graph.assignmentOf("x"));
        assertSame(second, graph.assignmentOf("y"));
    }

    @Test
    public void testNamesMatchByIdentifier() {
        BlockNode set = graph.newNode(BlockKind.VARIABLES_SET).setField("VAR", "my df");
        BlockNode v = graph.newNode(BlockKind.MATH_NUMBER);
        graph.connect(set, "VALUE", v);

        assertSame(set, graph.assignmentOf("my_df"));
        assertSame(v, graph.producerOf("my df"));

        set.setField("VAR", "other");
        assertNull(graph.assignmentOf("my_df"));
    }

    @Test
    public void testRemoveDetachesChildren() {
        BlockNode set = graph.newNode(BlockKind.VARIABLES_SET).setField("VAR", "x");
        BlockNode v = graph.newNode(BlockKind.MATH_NUMBER);
        graph.connect(set, "VALUE", v);

        graph.remove(set);

        assertNull(graph.node(set.id()));
        assertNull(v.parent());
        assertNull(graph.assignmentOf("x"));
    }

    @Test
    public void testVariableNames() {
        graph.newNode(BlockKind.VARIABLES_SET).setField("VAR", "df");
        graph.newNode(BlockKind.VARIABLES_GET).setField("VAR", "model");
        graph.newNode(BlockKind.VARIABLES_GET).setField("VAR", "df");
        assertEquals(Set.of("df", "model"), graph.variableNames());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testForeignBlockRejected() {
        BlockGraph other = new BlockGraph(BlockCatalog.standard());
        graph.addToProgram(other.newNode(BlockKind.TEXT));
    }
}

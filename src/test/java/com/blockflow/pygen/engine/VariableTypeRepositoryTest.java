package com.blockflow.pygen.engine;

import com.blockflow.pygen.CompilerOptions;
import com.blockflow.pygen.catalog.BlockKind;
import com.blockflow.pygen.dsl.GraphBuilder;
import com.blockflow.pygen.graph.BlockNode;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class VariableTypeRepositoryTest {

    private GraphBuilder g;

    @Before
    public void setUp() {
        g = GraphBuilder.create();
    }

    private CompileContext rebuild() {
        CompileContext ctx = new CompileContext(g.graph(), CompilerOptions.defaults(), new CodeGenEngine(), null, 1);
        ctx.repository().rebuild(ctx);
        return ctx;
    }

    @Test
    public void testModelSignature() {
        BlockNode model = g.block(BlockKind.LINEAR_REGRESSION_MODEL,
                Map.of("features", g.get("v"), "label", g.numbers("4", "5", "6")));
        g.assign("m", model);

        Signature sig = rebuild().repository().lookup("m").orElseThrow();
        assertEquals("[4, 5, 6]", sig.label());
        assertEquals("v", sig.features());
        assertEquals(BlockKind.LINEAR_REGRESSION_MODEL, sig.origin());
    }

    @Test
    public void testUnboundModelOperands() {
        g.assign("m", g.block(BlockKind.KNN_MODEL));

        Signature sig = rebuild().repository().lookup("m").orElseThrow();
        assertEquals("[]", sig.label());
        assertEquals("[]", sig.features());
    }

    @Test
    public void testListSignature() {
        BlockNode list = g.block(BlockKind.LISTS_CREATE_WITH);
        g.connectRow(list, 0, g.number("1")).connectRow(list, 1, g.text("a"));
        g.assign("v", list);

        Signature sig = rebuild().repository().lookup("v").orElseThrow();
        assertEquals("", sig.label());
        assertEquals("[\"1\",\"'a'\",\"None\"]", sig.features());
        assertEquals(BlockKind.LISTS_CREATE_WITH, sig.origin());
    }

    @Test
    public void testAggregateSignature() {
        g.assign("mean", g.block(BlockKind.AGG_FUNC));

        Signature sig = rebuild().repository().lookup("mean").orElseThrow();
        assertEquals(new Signature("", "", BlockKind.AGG_FUNC), sig);
    }

    @Test
    public void testLaterAssignmentReplaces() {
        g.assign("x", g.numbers("1"));
        g.assign("x", g.block(BlockKind.AGG_FUNC));

        assertEquals(BlockKind.AGG_FUNC, rebuild().repository().lookup("x").orElseThrow().origin());
    }

    @Test
    public void testUntaggedLaterAssignmentClears() {
        g.assign("x", g.numbers("1", "2"));
        g.assign("x", g.number("5"));
        g.assign("y", null);

        CompileContext ctx = rebuild();
        assertFalse(ctx.repository().lookup("x").isPresent());
        assertFalse(ctx.repository().lookup("y").isPresent());
        assertEquals(0, ctx.repository().size());
    }

    @Test
    public void testLookupByReference() {
        g.assign("v", g.numbers("1"));
        BlockNode ref = g.get("v");
        BlockNode other = g.text("v");

        CompileContext ctx = rebuild();
        assertTrue(ctx.signatureOf(ref).isPresent());
        assertFalse(ctx.signatureOf(other).isPresent());
        assertFalse(ctx.signatureOf(null).isPresent());
    }

    @Test
    public void testRebuildLeavesPassStateUntouched() {
        BlockNode model = g.block(BlockKind.LINEAR_REGRESSION_MODEL,
                Map.of("features", g.block(BlockKind.READ_CSV, Map.of("read", g.text("data.csv")))));
        g.assign("m", model);

        CompileContext ctx = rebuild();
        assertTrue(ctx.preamble().isEmpty());
        assertTrue(ctx.diagnostics().isEmpty());
        assertEquals(0, ctx.blocksEmitted());
    }
}

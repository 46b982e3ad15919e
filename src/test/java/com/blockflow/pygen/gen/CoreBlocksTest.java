package com.blockflow.pygen.gen;

import com.blockflow.pygen.BlockCompiler;
import com.blockflow.pygen.CompilerOptions;
import com.blockflow.pygen.catalog.BlockKind;
import com.blockflow.pygen.dsl.GraphBuilder;
import com.blockflow.pygen.engine.CodeGenEngine;
import com.blockflow.pygen.engine.CompileContext;
import com.blockflow.pygen.graph.BlockNode;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class CoreBlocksTest {

    private GraphBuilder g;
    private CompileContext ctx;

    @Before
    public void setUp() {
        g = GraphBuilder.create();
    }

    private String emit(BlockNode node) {
        ctx = new CompileContext(g.graph(), CompilerOptions.defaults(), new CodeGenEngine(), null, 1);
        ctx.repository().rebuild(ctx);
        return ctx.emit(node).text();
    }

    @Test
    public void testSortDefaultsToNumericAscending() {
        BlockNode sort = g.block(BlockKind.LISTS_SORT, Map.of("LIST", g.numbers("3", "1", "2")));
        assertEquals("lists_sort([3, 1, 2], \"NUMERIC\", False)", emit(sort));

        assertEquals(1, ctx.preamble().declarations().size());
        String helper = ctx.preamble().declarations().get(0);
        assertTrue(helper.startsWith("def lists_sort(my_list, type, reverse):\n"));
        assertTrue(helper.endsWith("  return sorted(list_cpy, key=key_func, reverse=reverse)"));
    }

    @Test
    public void testSortDescendingIgnoringCase() {
        BlockNode sort = g.block(BlockKind.LISTS_SORT, Map.of("LIST", g.get("names")));
        g.field(sort, "TYPE", "IGNORE_CASE").field(sort, "DIRECTION", "-1");
        assertEquals("lists_sort(names, \"IGNORE_CASE\", True)", emit(sort));
    }

    @Test
    public void testSortOfEmptySocket() {
        BlockNode sort = g.block(BlockKind.LISTS_SORT);
        assertEquals("lists_sort([], \"NUMERIC\", False)", emit(sort));
    }

    @Test
    public void testTwoSortsShareOneHelper() {
        BlockNode first = g.block(BlockKind.LISTS_SORT, Map.of("LIST", g.get("a")));
        BlockNode second = g.block(BlockKind.LISTS_SORT, Map.of("LIST", g.get("b")));
        g.statements(g.assign("x", first), g.assign("y", second));

        String code = new BlockCompiler().compile(g.build());
        assertEquals(code.indexOf("def lists_sort"), code.lastIndexOf("def lists_sort"));
        assertTrue(code.endsWith("x = lists_sort(a, \"NUMERIC\", False)\ny = lists_sort(b, \"NUMERIC\", False)\n"));
    }

    @Test
    public void testOverflowingNumberIsInfinity() {
        g.statements(g.assign("big", g.number("1e50000000")));
        assertEquals("\n\n\n\nbig = float('inf')\n", new BlockCompiler().compile(g.build()));
    }

    @Test
    public void testNumberAndArithmetic() {
        BlockNode sum = g.block(BlockKind.MATH_ARITHMETIC, Map.of("A", g.number("2.50"), "B", g.number("1")));
        assertEquals("2.5 + 1", emit(sum));
    }
}

package com.blockflow.pygen.gen;

import com.blockflow.pygen.CompilerOptions;
import com.blockflow.pygen.api.DiagnosticCode;
import com.blockflow.pygen.catalog.BlockKind;
import com.blockflow.pygen.dsl.GraphBuilder;
import com.blockflow.pygen.engine.CodeGenEngine;
import com.blockflow.pygen.engine.CompileContext;
import com.blockflow.pygen.graph.BlockNode;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class FrameBlocksTest {

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
    public void testReadCsv() {
        BlockNode read = g.block(BlockKind.READ_CSV, Map.of("read", g.text("sales.csv")));
        assertEquals("pd.read_csv('sales.csv')", emit(read));
        assertTrue(ctx.preamble().imports().contains(PyImports.PANDAS));
    }

    @Test
    public void testSelectColumns() {
        assertEquals("df[\"age\"]", emit(g.select(g.get("df"), "age")));
        assertEquals("df[[\"age\",\"city\"]]", emit(g.select(g.get("df"), "age", "city")));
        assertEquals("df[[]]", emit(g.select(g.get("df"))));
    }

    @Test
    public void testFilterAnd() {
        BlockNode filter = g.block(BlockKind.FILTER, Map.of("dataframe", g.get("df")));
        g.arity(filter, 2)
                .rowField(filter, 0, "FIELDNAME", "age")
                .rowField(filter, 0, "DROPDOWN", "gt")
                .connectRow(filter, 0, g.number("18"))
                .rowField(filter, 1, "FIELDNAME", "city")
                .rowField(filter, 1, "DROPDOWN", "eq")
                .connectRow(filter, 1, g.text("NY"));

        assertEquals("df[(df[\"age\"]>18) & (df[\"city\"]=='NY')]", emit(filter));
    }

    @Test
    public void testFilterOr() {
        BlockNode filter = g.block(BlockKind.FILTER, Map.of("dataframe", g.get("df")));
        g.arity(filter, 2)
                .rowField(filter, 0, "FIELDNAME", "age")
                .rowField(filter, 0, "DROPDOWN", "lt")
                .connectRow(filter, 0, g.number("18"))
                .rowField(filter, 1, "MIDDLE", "or")
                .rowField(filter, 1, "FIELDNAME", "age")
                .rowField(filter, 1, "DROPDOWN", "ge")
                .connectRow(filter, 1, g.number("65"));

        assertEquals("df[(df[\"age\"]<18) | (df[\"age\"]>=65)]", emit(filter));
    }

    @Test
    public void testDataFrameDictionary() {
        BlockNode dic = g.block(BlockKind.DATAFRAME_DIC);
        g.arity(dic, 2)
                .rowField(dic, 0, "FIELDNAME", "a")
                .connectRow(dic, 0, g.numbers("1", "2"))
                .rowField(dic, 1, "FIELDNAME", "b")
                .connectRow(dic, 1, g.list(g.text("x"), g.text("y")));

        assertEquals("pd.DataFrame({\"a\":[1,2],\"b\":[\"x\",\"y\"]})", emit(dic));
        assertTrue(ctx.diagnostics().isEmpty());
    }

    @Test
    public void testDataFrameDictionaryWithEmptyRow() {
        BlockNode dic = g.block(BlockKind.DATAFRAME_DIC);
        g.rowField(dic, 0, "FIELDNAME", "a").connectRow(dic, 0, g.numbers("1"));
        assertEquals("pd.DataFrame({})", emit(dic));
    }

    @Test
    public void testDataFrameDictionaryMalformedValues() {
        BlockNode dic = g.block(BlockKind.DATAFRAME_DIC);
        g.arity(dic, 1).rowField(dic, 0, "FIELDNAME", "a").connectRow(dic, 0, g.get("values"));

        assertEquals("pd.DataFrame({\"a\":values})", emit(dic));
        assertEquals(DiagnosticCode.MALFORMED_LITERAL, ctx.diagnostics().get(0).code());
    }

    @Test
    public void testHeadTail() {
        BlockNode head = g.block(BlockKind.HEAD_TAIL, Map.of("dataframe", g.get("df")));
        assertEquals("df.head(5)", emit(head));

        g.field(head, "FIELDNAME", "tail").connect(head, "n", g.number("3"));
        assertEquals("df.tail(3)", emit(head));
    }

    @Test
    public void testHeadTailWithoutFrameIsEmpty() {
        assertEquals("", emit(g.block(BlockKind.HEAD_TAIL)));
    }

    @Test
    public void testGroupByAndAggregate() {
        BlockNode groups = g.block(BlockKind.GROUPBY, Map.of("dataframe", g.get("df"), "by", g.text("region")));
        assertEquals("df.groupby('region')", emit(groups));

        BlockNode agg = g.block(BlockKind.AGG_FUNC, Map.of("dataframe", groups, "on", g.text("price")));
        g.field(agg, "FIELDNAME", "sum");
        assertEquals("df.groupby('region')['price'].sum()", emit(agg));
    }

    @Test
    public void testTrainTestSplit() {
        BlockNode split = g.block(BlockKind.TRAIN_TEST_SPLIT, Map.of(
                "dataframe", g.get("df"),
                "features", g.list(g.text("a"), g.text("b")),
                "label", g.text("y"),
                "teste_size", g.number("0.30")));

        assertEquals("train_test_split(df[['a', 'b']], df['y'], test_size=0.3)", emit(split));
        assertTrue(ctx.preamble().imports().contains(PyImports.TRAIN_TEST_SPLIT));
    }

    @Test
    public void testSplitSelector() {
        BlockNode selector = g.block(BlockKind.SELECTOR_TRAIN_TEST_SPLIT, Map.of("train_test", g.get("parts")));
        g.field(selector, "FIELDNAME", "y_train");
        assertEquals("parts[2]", emit(selector));
    }

    @Test
    public void testFrequencyOfListVariable() {
        g.assign("v", g.numbers("1", "2", "2"));
        BlockNode freq = g.block(BlockKind.FREQUENCY, Map.of("x", g.get("v")));
        assertEquals("pd.DataFrame(v).value_counts()", emit(freq));

        g.connect(freq, "bins", g.number("4"));
        assertEquals("pd.value_counts(pd.cut(pd.DataFrame(v), bins=4))", emit(freq));
    }

    @Test
    public void testQuartisAndCorrelation() {
        assertEquals("pd.DataFrame([1, 2]).describe()",
                emit(g.block(BlockKind.QUARTIS, Map.of("x", g.numbers("1", "2")))));
        assertEquals("df.describe()", emit(g.block(BlockKind.QUARTIS, Map.of("x", g.get("df")))));
        assertEquals("df.corr()", emit(g.block(BlockKind.CORRELATION, Map.of("dataframe", g.get("df")))));
    }
}

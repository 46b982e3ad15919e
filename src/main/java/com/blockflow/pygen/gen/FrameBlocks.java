package com.blockflow.pygen.gen;

import com.blockflow.pygen.api.DiagnosticCode;
import com.blockflow.pygen.api.Fragment;
import com.blockflow.pygen.api.OutputKind;
import com.blockflow.pygen.api.Precedence;
import com.blockflow.pygen.catalog.BlockCatalog;
import com.blockflow.pygen.catalog.BlockKind;
import com.blockflow.pygen.catalog.BlockSchema;
import com.blockflow.pygen.catalog.RowSpec;
import com.blockflow.pygen.catalog.RowSpec.RowField;
import com.blockflow.pygen.engine.CompileContext;
import com.blockflow.pygen.engine.Inputs;
import com.blockflow.pygen.graph.BlockNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.util.RawValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * pandas data-frame blocks: loading, column selection, construction from a
 * dictionary, slicing, grouping, aggregation, filtering, train/test splitting
 * and descriptive statistics.
 */
public final class FrameBlocks {

    static final Map<String, String> FILTER_OPERATORS = Map.of(
            "gt", ">", "lt", "<", "ge", ">=", "le", "<=", "eq", "==", "ne", "!=");
    static final Map<String, String> FILTER_JOINS = Map.of("and", "&", "or", "|");
    private static final Map<String, String> SPLIT_PARTS = Map.of(
            "x_train", "[0]", "x_test", "[1]", "y_train", "[2]", "y_test", "[3]");

    private FrameBlocks() {
    }

    public static void register(BlockCatalog catalog) {
        catalog.register(BlockKind.READ_CSV,
                BlockSchema.expression(OutputKind.TABULAR).required("read", OutputKind.TEXT, "").build(),
                (node, in, ctx) -> {
                    ctx.preamble().addImport(PyImports.PANDAS);
                    return Fragment.of("pd.read_csv(" + in.code("read") + ")", Precedence.FUNCTION_CALL);
                });
        catalog.register(BlockKind.SELECT,
                BlockSchema.expression(OutputKind.TABULAR)
                        .required("select", OutputKind.TABULAR, "")
                        .rows(new RowSpec(1, "(Select)", OutputKind.TEXT, "", List.of()))
                        .build(),
                FrameBlocks::select);
        catalog.register(BlockKind.DATAFRAME_DIC,
                BlockSchema.expression(OutputKind.TABULAR)
                        .rows(new RowSpec(3, "(dataFrame dictionary)", OutputKind.ARRAY, "",
                                List.of(RowField.text("FIELDNAME", ""))))
                        .build(),
                FrameBlocks::dictionary);
        catalog.register(BlockKind.HEAD_TAIL,
                BlockSchema.expression(OutputKind.TABULAR)
                        .dropdown("FIELDNAME", "head", "tail")
                        .required("dataframe", OutputKind.TABULAR, "")
                        .value("n", OutputKind.NUMBER, "5")
                        .build(),
                (node, in, ctx) -> {
                    if (!in.has("dataframe"))
                        return Fragment.EMPTY;
                    return Fragment.of(in.code("dataframe") + "." + in.field("FIELDNAME") + "(" + in.code("n") + ")",
                            Precedence.FUNCTION_CALL);
                });
        catalog.register(BlockKind.GROUPBY,
                BlockSchema.expression(OutputKind.TABULAR)
                        .required("dataframe", OutputKind.TABULAR, "")
                        .value("by", OutputKind.ANY, "None")
                        .build(),
                (node, in, ctx) -> {
                    if (!in.has("dataframe"))
                        return Fragment.EMPTY;
                    return Fragment.of(in.code("dataframe") + ".groupby(" + in.code("by") + ")",
                            Precedence.FUNCTION_CALL);
                });
        catalog.register(BlockKind.AGG_FUNC,
                BlockSchema.expression(OutputKind.ARRAY)
                        .dropdown("FIELDNAME", "mean", "sum", "count", "max", "min", "std", "var")
                        .required("dataframe", OutputKind.TABULAR, "")
                        .value("on", OutputKind.TEXT, "")
                        .build(),
                (node, in, ctx) -> {
                    if (!in.has("dataframe"))
                        return Fragment.EMPTY;
                    return Fragment.of(in.code("dataframe") + "[" + in.code("on") + "]." + in.field("FIELDNAME") + "()",
                            Precedence.FUNCTION_CALL);
                });
        catalog.register(BlockKind.FILTER,
                BlockSchema.expression(OutputKind.TABULAR)
                        .required("dataframe", OutputKind.TABULAR, "")
                        .rows(new RowSpec(1, "(Filter)", OutputKind.ANY, "", List.of(
                                RowField.dropdown("MIDDLE", 1, "and", "or"),
                                RowField.text("FIELDNAME", "Field"),
                                RowField.dropdown("DROPDOWN", 0, "gt", "lt", "ge", "le", "eq", "ne"))))
                        .build(),
                FrameBlocks::filter);
        catalog.register(BlockKind.TRAIN_TEST_SPLIT,
                BlockSchema.expression(OutputKind.ARRAY)
                        .value("teste_size", OutputKind.NUMBER, "0.2")
                        .required("dataframe", OutputKind.TABULAR, "[]")
                        .value("label", OutputKind.ANY, "[]")
                        .value("features", OutputKind.ANY, "[]")
                        .build(),
                (node, in, ctx) -> {
                    ctx.preamble().addImport(PyImports.TRAIN_TEST_SPLIT);
                    String df = in.code("dataframe");
                    return Fragment.of("train_test_split(" + df + "[" + in.code("features") + "], "
                            + df + "[" + in.code("label") + "], test_size=" + in.code("teste_size") + ")",
                            Precedence.FUNCTION_CALL);
                });
        catalog.register(BlockKind.SELECTOR_TRAIN_TEST_SPLIT,
                BlockSchema.expression(OutputKind.TABULAR)
                        .dropdown("FIELDNAME", "x_train", "x_test", "y_train", "y_test")
                        .required("train_test", OutputKind.ARRAY, "")
                        .build(),
                (node, in, ctx) -> {
                    if (!in.has("train_test"))
                        return Fragment.EMPTY;
                    return Fragment.of(in.code("train_test") + SPLIT_PARTS.get(in.field("FIELDNAME")),
                            Precedence.MEMBER);
                });

        // --- Descriptive statistics ---
        catalog.register(BlockKind.CORRELATION,
                BlockSchema.expression(OutputKind.TABULAR).required("dataframe", OutputKind.TABULAR, "").build(),
                (node, in, ctx) -> Fragment.of(in.code("dataframe") + ".corr()", Precedence.FUNCTION_CALL));
        catalog.register(BlockKind.FREQUENCY,
                BlockSchema.expression(OutputKind.TABULAR)
                        .required("x", OutputKind.ARRAY, "")
                        .value("bins", OutputKind.ARRAY, "")
                        .build(),
                FrameBlocks::frequency);
        catalog.register(BlockKind.QUARTIS,
                BlockSchema.expression(OutputKind.TABULAR).required("x", OutputKind.ARRAY, "").build(),
                (node, in, ctx) -> {
                    String x = in.code("x");
                    if (Operands.isListVariable(in.child("x"), ctx)
                            || Operands.isKind(in.child("x"), BlockKind.LISTS_CREATE_WITH)) {
                        ctx.preamble().addImport(PyImports.PANDAS);
                        x = "pd.DataFrame(" + x + ")";
                    }
                    return Fragment.of(x + ".describe()", Precedence.FUNCTION_CALL);
                });
    }

    private static Fragment select(BlockNode node, Inputs in, CompileContext ctx) {
        List<String> columns = Operands.columnNames(node, ctx);
        String key = columns.isEmpty() ? "[]" : Literals.columnKey(columns);
        return Fragment.of(in.code("select") + "[" + key + "]", Precedence.MEMBER);
    }

    /**
     * {@code pd.DataFrame({...})} from the rows: each row's FIELDNAME is a
     * column, its bound list literal the values. A row that is not bound leaves
     * the dictionary empty.
     */
    private static Fragment dictionary(BlockNode node, Inputs in, CompileContext ctx) {
        ObjectNode dict = CompileContext.json().createObjectNode();
        boolean complete = true;
        for (int i = 0; i < in.arity(); i++) {
            if (!in.hasRow(i)) {
                complete = false;
                break;
            }
        }
        if (complete) {
            for (int i = 0; i < in.arity(); i++) {
                String column = in.rowField(i, "FIELDNAME");
                String values = in.row(i, Precedence.NONE);
                try {
                    JsonNode parsed = CompileContext.json().readTree(values.replace('\'', '"'));
                    dict.set(column, parsed);
                } catch (JsonProcessingException e) {
                    ctx.diagnose(DiagnosticCode.MALFORMED_LITERAL, node,
                            "Values of column '" + column + "' are not a literal: " + values);
                    dict.putRawValue(column, new RawValue(values));
                }
            }
        }
        ctx.preamble().addImport(PyImports.PANDAS);
        return Fragment.of("pd.DataFrame(" + Literals.json(dict) + ")", Precedence.FUNCTION_CALL);
    }

    /**
     * {@code df[(df["a"]>1) & (df["b"]=='x')]}. Row i is one predicate; the
     * MIDDLE field of row i joins it to row i-1.
     */
    private static Fragment filter(BlockNode node, Inputs in, CompileContext ctx) {
        String df = in.code("dataframe");
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < in.arity(); i++) {
            if (i > 0) {
                String join = FILTER_JOINS.get(in.rowField(i, "MIDDLE"));
                if (join != null)
                    parts.add(join);
            }
            String field = in.rowField(i, "FIELDNAME");
            String column = field.isEmpty() ? "" : "[" + Literals.json(field) + "]";
            String operator = FILTER_OPERATORS.getOrDefault(in.rowField(i, "DROPDOWN"), "");
            String value = in.hasRow(i) ? in.row(i) : "";
            parts.add("(" + df + column + operator + value + ")");
        }
        return Fragment.of(df + "[" + String.join(" ", parts) + "]", Precedence.MEMBER);
    }

    private static Fragment frequency(BlockNode node, Inputs in, CompileContext ctx) {
        String base = in.code("x");
        if (Operands.isListVariable(in.child("x"), ctx)) {
            ctx.preamble().addImport(PyImports.PANDAS);
            base = "pd.DataFrame(" + base + ")";
        }
        if (in.has("bins")) {
            ctx.preamble().addImport(PyImports.PANDAS);
            return Fragment.of("pd.value_counts(pd.cut(" + base + ", bins=" + in.code("bins") + "))",
                    Precedence.FUNCTION_CALL);
        }
        return Fragment.of(base + ".value_counts()", Precedence.FUNCTION_CALL);
    }
}

package com.blockflow.pygen.gen;

import com.blockflow.pygen.api.DiagnosticCode;
import com.blockflow.pygen.api.Fragment;
import com.blockflow.pygen.api.OutputKind;
import com.blockflow.pygen.api.Precedence;
import com.blockflow.pygen.catalog.BlockCatalog;
import com.blockflow.pygen.catalog.BlockKind;
import com.blockflow.pygen.catalog.BlockSchema;
import com.blockflow.pygen.catalog.RowSpec;
import com.blockflow.pygen.engine.CompileContext;
import com.blockflow.pygen.engine.Inputs;
import com.blockflow.pygen.engine.NameGenerator;
import com.blockflow.pygen.graph.BlockGraph;
import com.blockflow.pygen.graph.BlockNode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Core language blocks: variables, literals, arithmetic and logic, lists,
 * print, conditionals and counted loops.
 */
public final class CoreBlocks {

    static final String SORT_FUNCTION = "lists_sort";

    private static final Map<String, String> ARITHMETIC = Map.of(
            "ADD", " + ", "MINUS", " - ", "MULTIPLY", " * ", "DIVIDE", " / ", "POWER", " ** ");
    private static final Map<String, Precedence> ARITHMETIC_ORDER = Map.of(
            "ADD", Precedence.ADDITIVE, "MINUS", Precedence.ADDITIVE,
            "MULTIPLY", Precedence.MULTIPLICATIVE, "DIVIDE", Precedence.MULTIPLICATIVE,
            "POWER", Precedence.EXPONENTIATION);
    private static final Map<String, String> COMPARISON = Map.of(
            "EQ", "==", "NEQ", "!=", "LT", "<", "LTE", "<=", "GT", ">", "GTE", ">=");

    private CoreBlocks() {
    }

    public static void register(BlockCatalog catalog) {
        // --- Variables ---
        catalog.register(BlockKind.VARIABLES_SET,
                BlockSchema.statement()
                        .text(BlockGraph.VAR_FIELD, "item")
                        .value(BlockGraph.VALUE_SOCKET, OutputKind.ANY, "0")
                        .build(),
                CoreBlocks::assignment);
        catalog.register(BlockKind.VARIABLES_GET,
                BlockSchema.expression(OutputKind.ANY).text(BlockGraph.VAR_FIELD, "item").build(),
                (node, in, ctx) -> Fragment.of(NameGenerator.variableName(in.field(BlockGraph.VAR_FIELD)),
                        Precedence.ATOMIC));

        // --- Literals ---
        catalog.register(BlockKind.TEXT,
                BlockSchema.expression(OutputKind.TEXT).text("TEXT", "").build(),
                (node, in, ctx) -> Fragment.of(Literals.quote(in.field("TEXT")), Precedence.ATOMIC));
        catalog.register(BlockKind.MATH_NUMBER,
                BlockSchema.expression(OutputKind.NUMBER).text("NUM", "0").build(),
                CoreBlocks::number);
        catalog.register(BlockKind.LOGIC_BOOLEAN,
                BlockSchema.expression(OutputKind.BOOLEAN).dropdown("BOOL", "TRUE", "FALSE").build(),
                (node, in, ctx) -> Fragment.of("TRUE".equals(in.field("BOOL")) ? "True" : "False",
                        Precedence.ATOMIC));
        catalog.register(BlockKind.LOGIC_NULL,
                BlockSchema.expression(OutputKind.ANY).build(),
                (node, in, ctx) -> Fragment.of("None", Precedence.ATOMIC));

        // --- Operators ---
        catalog.register(BlockKind.MATH_ARITHMETIC,
                BlockSchema.expression(OutputKind.NUMBER)
                        .dropdown("OP", "ADD", "MINUS", "MULTIPLY", "DIVIDE", "POWER")
                        .value("A", OutputKind.NUMBER, "0")
                        .value("B", OutputKind.NUMBER, "0")
                        .build(),
                (node, in, ctx) -> {
                    String op = in.field("OP");
                    Precedence order = ARITHMETIC_ORDER.get(op);
                    return Fragment.of(in.code("A", order) + ARITHMETIC.get(op) + in.code("B", order), order);
                });
        catalog.register(BlockKind.LOGIC_COMPARE,
                BlockSchema.expression(OutputKind.BOOLEAN)
                        .dropdown("OP", "EQ", "NEQ", "LT", "LTE", "GT", "GTE")
                        .value("A", OutputKind.ANY, "0")
                        .value("B", OutputKind.ANY, "0")
                        .build(),
                (node, in, ctx) -> Fragment.of(
                        in.code("A", Precedence.RELATIONAL) + " " + COMPARISON.get(in.field("OP")) + " "
                                + in.code("B", Precedence.RELATIONAL),
                        Precedence.RELATIONAL));
        catalog.register(BlockKind.LOGIC_OPERATION,
                BlockSchema.expression(OutputKind.BOOLEAN)
                        .dropdown("OP", "AND", "OR")
                        .value("A", OutputKind.BOOLEAN, "")
                        .value("B", OutputKind.BOOLEAN, "")
                        .build(),
                CoreBlocks::logicOperation);
        catalog.register(BlockKind.LOGIC_NEGATE,
                BlockSchema.expression(OutputKind.BOOLEAN).value("BOOL", OutputKind.BOOLEAN, "True").build(),
                (node, in, ctx) -> Fragment.of("not " + in.code("BOOL", Precedence.LOGICAL_NOT),
                        Precedence.LOGICAL_NOT));

        // --- Lists ---
        catalog.register(BlockKind.LISTS_CREATE_WITH,
                BlockSchema.expression(OutputKind.ARRAY)
                        .rows(new RowSpec(3, "create empty list", OutputKind.ANY, "None", List.of()))
                        .build(),
                (node, in, ctx) -> {
                    List<String> items = new ArrayList<>(in.arity());
                    for (int i = 0; i < in.arity(); i++) {
                        items.add(in.row(i, Precedence.NONE));
                    }
                    return Fragment.of("[" + String.join(", ", items) + "]", Precedence.ATOMIC);
                });
        catalog.register(BlockKind.LISTS_SORT,
                BlockSchema.expression(OutputKind.ARRAY)
                        .dropdown("TYPE", "NUMERIC", "TEXT", "IGNORE_CASE")
                        .dropdown("DIRECTION", "1", "-1")
                        .value("LIST", OutputKind.ARRAY, "[]")
                        .build(),
                CoreBlocks::sort);

        // --- Statements ---
        catalog.register(BlockKind.TEXT_PRINT,
                BlockSchema.statement().value("TEXT", OutputKind.ANY, "''").build(),
                (node, in, ctx) -> Fragment.statement("print(" + in.code("TEXT", Precedence.NONE) + ")\n"));
        catalog.register(BlockKind.CONTROLS_IF,
                BlockSchema.statement()
                        .value("IF0", OutputKind.BOOLEAN, "False")
                        .statements("DO0")
                        .statements("ELSE")
                        .build(),
                (node, in, ctx) -> {
                    StringBuilder sb = new StringBuilder();
                    sb.append("if ").append(in.code("IF0", Precedence.NONE)).append(":\n");
                    sb.append(in.statements("DO0"));
                    if (in.isBound("ELSE"))
                        sb.append("else:\n").append(in.statements("ELSE"));
                    return Fragment.statement(sb.toString());
                });
        catalog.register(BlockKind.CONTROLS_REPEAT_EXT,
                BlockSchema.statement()
                        .value("TIMES", OutputKind.NUMBER, "0")
                        .statements("DO")
                        .build(),
                CoreBlocks::repeat);
    }

    private static Fragment assignment(BlockNode node, Inputs in, CompileContext ctx) {
        String name = NameGenerator.variableName(in.field(BlockGraph.VAR_FIELD));
        return Fragment.statement(name + " = " + in.code(BlockGraph.VALUE_SOCKET, Precedence.NONE) + "\n");
    }

    /**
     * {@code lists_sort(list, "TYPE", reverse)} through a shared helper that
     * keys numeric sorts on {@code float} and case-insensitive ones on
     * {@code lower()}.
     */
    private static Fragment sort(BlockNode node, Inputs in, CompileContext ctx) {
        String fn = ctx.preamble().provideFunction(SORT_FUNCTION, List.of(
                "def " + SORT_FUNCTION + "(my_list, type, reverse):",
                "  def try_float(s):",
                "    try:",
                "      return float(s)",
                "    except:",
                "      return 0",
                "  key_funcs = {",
                "    \"NUMERIC\": try_float,",
                "    \"TEXT\": str,",
                "    \"IGNORE_CASE\": lambda s: str(s).lower()",
                "  }",
                "  key_func = key_funcs[type]",
                "  list_cpy = list(my_list)",
                "  return sorted(list_cpy, key=key_func, reverse=reverse)"));
        String reverse = "-1".equals(in.field("DIRECTION")) ? "True" : "False";
        return Fragment.of(fn + "(" + in.code("LIST", Precedence.NONE) + ", \"" + in.field("TYPE") + "\", "
                + reverse + ")", Precedence.FUNCTION_CALL);
    }

    private static Fragment number(BlockNode node, Inputs in, CompileContext ctx) {
        String n = Literals.number(in.field("NUM"));
        if (n == null) {
            ctx.diagnose(DiagnosticCode.MALFORMED_LITERAL, node, "'" + in.field("NUM") + "' is not a number");
            return Fragment.of("0", Precedence.ATOMIC);
        }
        return Fragment.of(n, n.startsWith("-") ? Precedence.UNARY_SIGN : Precedence.ATOMIC);
    }

    private static Fragment logicOperation(BlockNode node, Inputs in, CompileContext ctx) {
        boolean and = "AND".equals(in.field("OP"));
        Precedence order = and ? Precedence.LOGICAL_AND : Precedence.LOGICAL_OR;
        String a = in.has("A") ? in.code("A", order) : "";
        String b = in.has("B") ? in.code("B", order) : "";
        if (a.isEmpty() && b.isEmpty()) {
            a = "False";
            b = "False";
        } else {
            String fallback = and ? "True" : "False";
            if (a.isEmpty())
                a = fallback;
            if (b.isEmpty())
                b = fallback;
        }
        return Fragment.of(a + (and ? " and " : " or ") + b, order);
    }

    private static Fragment repeat(BlockNode node, Inputs in, CompileContext ctx) {
        String times = in.code("TIMES", Precedence.NONE);
        if (Literals.isNumber(times)) {
            times = new BigDecimal(times.trim()).setScale(0, RoundingMode.DOWN).toPlainString();
        } else {
            times = "int(" + times + ")";
        }
        String counter = ctx.names().distinct("count");
        return Fragment.statement("for " + counter + " in range(" + times + "):\n" + in.statements("DO"));
    }
}

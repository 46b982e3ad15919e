package com.blockflow.pygen.gen;

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
import com.blockflow.pygen.engine.Signature;
import com.blockflow.pygen.graph.BlockNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Chart statements (seaborn, matplotlib, folium) and the {@code layout}
 * expression that feeds their {@code .set(**layout)} call.
 *
 * <p>
 * Line and bar charts pick one of several renderings from the shape of their
 * operands:
 * <ol>
 * <li>a single series (anything but a literal list or a select, with the other
 * axis unbound) is plotted as {@code index} against {@code values};</li>
 * <li>a y operand that selects more than one column is reshaped with
 * {@code pd.melt} first and plotted with a hue per column, taking precedence
 * over the plain form;</li>
 * <li>otherwise x and y are passed through.</li>
 * </ol>
 * Shape decisions look through variables to the block last assigned to them;
 * the emitted operands stay the variable names.
 */
public final class ChartBlocks {

    static final String MAP_FUNCTION = "choroplethMap";
    static final String MELT_VARIABLE = "melted_df";

    private static final Map<String, GeoSource> GEO = Map.of(
            "usa", new GeoSource("https://raw.githubusercontent.com/lcbjrrr/quant/master/us_states.json", "43", "-85"),
            "brazil", new GeoSource("https://raw.githubusercontent.com/lcbjrrr/quant/master/br_states.json",
                    "-15.8299", "-47.8599"),
            "world", new GeoSource("https://raw.githubusercontent.com/johan/world.geo.json/master/countries.geo.json",
                    "-15.8299", "-30"));

    private record GeoSource(String geojson, String lon, String lat) {
    }

    private ChartBlocks() {
    }

    public static void register(BlockCatalog catalog) {
        catalog.register(BlockKind.LINE_GRAPH, xyChart("None").build(),
                (node, in, ctx) -> seriesChart("lineplot", true, node, in, ctx));
        catalog.register(BlockKind.BAR_GRAPH, xyChart("[]").build(),
                (node, in, ctx) -> seriesChart("barplot", false, node, in, ctx));
        catalog.register(BlockKind.PIE_GRAPH, xyChart("").build(), ChartBlocks::pie);
        catalog.register(BlockKind.HISTOGRAM_GRAPH,
                BlockSchema.statement()
                        .value("x", OutputKind.ARRAY, "[]")
                        .value("y", OutputKind.NUMBER, "")
                        .value("layout", OutputKind.ANY, "{}")
                        .build(),
                (node, in, ctx) -> {
                    ctx.preamble().addImport(PyImports.SEABORN);
                    String bins = in.has("y") ? ", bins = " + in.code("y") : "";
                    return Fragment.statement("sns.histplot(" + in.code("x") + bins + ", kde=False).set(**"
                            + in.code("layout") + ")\n");
                });
        catalog.register(BlockKind.BOXPLOT_GRAPH,
                BlockSchema.statement()
                        .value("x", OutputKind.ARRAY, "[]")
                        .value("layout", OutputKind.ANY, "{}")
                        .build(),
                (node, in, ctx) -> {
                    ctx.preamble().addImport(PyImports.SEABORN);
                    return Fragment.statement("sns.boxplot(" + in.code("x") + ").set(**" + in.code("layout") + ")\n");
                });
        catalog.register(BlockKind.SCATTER_GRAPH,
                xyChart("[]").value("colour", OutputKind.ARRAY, "").build(),
                ChartBlocks::scatter);
        catalog.register(BlockKind.TABLE_VIEW_GRAPH,
                BlockSchema.statement().value("tableView", OutputKind.TABULAR, "").build(),
                (node, in, ctx) -> Fragment.statement("print(" + in.code("tableView", Precedence.NONE) + ")\n"));
        catalog.register(BlockKind.MAP_GRAPH,
                BlockSchema.statement()
                        .dropdown("COUNTRY", "brazil", "usa", "world")
                        .value("location", OutputKind.TABULAR, "\"\"")
                        .value("values", OutputKind.TABULAR, "[]")
                        .value("zoom", OutputKind.NUMBER, "5")
                        .build(),
                ChartBlocks::map);
        catalog.register(BlockKind.HEAT_MAP,
                BlockSchema.statement().value("data", OutputKind.TABULAR, "[]").build(),
                (node, in, ctx) -> {
                    ctx.preamble().addImport(PyImports.SEABORN);
                    return Fragment.statement("sns.heatmap(" + in.code("data") + ", annot=True)\n");
                });
        catalog.register(BlockKind.LAYOUT,
                BlockSchema.expression(OutputKind.ANY)
                        .rows(new RowSpec(3, "Layout", OutputKind.ANY, "None",
                                List.of(RowField.text("FIELDNAME", "").withDefaults("xaxis", "yaxis", "title"))))
                        .build(),
                ChartBlocks::layout);
    }

    private static BlockSchema.Builder xyChart(String axisDefault) {
        return BlockSchema.statement()
                .value("x", OutputKind.ARRAY, axisDefault)
                .value("y", OutputKind.ARRAY, axisDefault)
                .value("layout", OutputKind.ANY, "{}");
    }

    // ── Line and bar charts ──────────────────────────────────────────

    private static Fragment seriesChart(String plot, boolean aggregates, BlockNode node, Inputs in,
            CompileContext ctx) {
        ctx.preamble().addImport(PyImports.SEABORN);
        String x = in.code("x");
        String y = in.code("y");
        String set = ".set(**" + in.code("layout") + ")";

        if (aggregates && isAggregate(in.child("x"), ctx))
            return Fragment.statement("sns." + plot + "(" + x + ")" + set + "\n");

        String series = singleSeries(in, x, y);
        if (series != null)
            return Fragment.statement("sns." + plot + "(x = " + series + ".index, y = " + series + ".values)" + set
                    + "\n");

        BlockNode ySelect = ctx.provenance(in.child("y"));
        if (Operands.isKind(ySelect, BlockKind.SELECT) && ySelect.arity() > 1) {
            BlockNode xSelect = ctx.provenance(in.child("x"));
            List<String> idVars = Operands.isKind(xSelect, BlockKind.SELECT) ? columnOperands(xSelect, ctx)
                    : List.of();
            String dataframe = ctx.reemit(ySelect.input("select")).textIn(Precedence.MEMBER);
            String melted = ctx.names().distinct(MELT_VARIABLE);
            ctx.preamble().addImport(PyImports.PANDAS);
            String xs = String.join(", ", idVars);
            return Fragment.statement(melted + " = pd.melt(" + (dataframe.isEmpty() ? "None" : dataframe)
                    + ", id_vars=[" + xs + "], value_vars=[" + String.join(", ", columnOperands(ySelect, ctx))
                    + "], var_name=\"hue\", value_name=\"value\")\n"
                    + "sns." + plot + "(data=" + melted + ", x=" + (xs.isEmpty() ? "None" : xs)
                    + ", y=\"value\", hue=\"hue\")" + (aggregates ? set : "") + "\n");
        }
        return Fragment.statement("sns." + plot + "(x = " + x + ", y = " + y + ")" + set + "\n");
    }

    private static boolean isAggregate(BlockNode child, CompileContext ctx) {
        if (Operands.isKind(ctx.provenance(child), BlockKind.AGG_FUNC))
            return true;
        return ctx.signatureOf(child).map(Signature::origin).filter(o -> o == BlockKind.AGG_FUNC).isPresent();
    }

    /**
     * The operand to plot as index against values, or null. Decided on the
     * directly bound block: a series is anything but a literal list or a
     * select, with the other axis left unbound.
     */
    private static String singleSeries(Inputs in, String x, String y) {
        if (isSeries(in.child("x")) && !in.isBound("y"))
            return x;
        if (isSeries(in.child("y")) && !in.isBound("x"))
            return y;
        return null;
    }

    private static boolean isSeries(BlockNode child) {
        return child != null && child.kind() != BlockKind.LISTS_CREATE_WITH && child.kind() != BlockKind.SELECT;
    }

    private static List<String> columnOperands(BlockNode select, CompileContext ctx) {
        List<String> out = new ArrayList<>(select.arity());
        for (int i = 0; i < select.arity(); i++) {
            String text = ctx.reemit(select.row(i)).textIn(Precedence.NONE);
            out.add(text.isEmpty() ? "None" : text);
        }
        return out;
    }

    // ── Other charts ─────────────────────────────────────────────────

    /**
     * {@code plt.pie}. A legend is added when the layout is not empty; only the
     * first entry of a literal layout is kept for it.
     */
    private static Fragment pie(BlockNode node, Inputs in, CompileContext ctx) {
        ctx.preamble().addImport(PyImports.PYPLOT);
        String x = in.code("x");
        String y = in.code("y");
        String series = singleSeries(in, x, y);
        String code = series != null
                ? "plt.pie(" + series + ".values, labels=" + series + ".index)"
                : "plt.pie(" + y + ", labels=" + x + ")";

        String layout = in.code("layout");
        if (layout.startsWith("{")) {
            int comma = layout.indexOf(',');
            if (comma >= 0)
                layout = layout.substring(0, comma) + "}";
        }
        if (!"{}".equals(layout))
            code += "\nplt.legend(**" + layout + ")";
        return Fragment.statement(code + "\n");
    }

    private static Fragment scatter(BlockNode node, Inputs in, CompileContext ctx) {
        ctx.preamble().addImport(PyImports.SEABORN);
        String x = in.code("x");
        String y = in.code("y");
        String hue = in.has("colour") ? ", hue = " + in.code("colour") : "";
        String set = ".set(**" + in.code("layout") + ")";
        String series = singleSeries(in, x, y);
        if (series != null)
            return Fragment.statement("sns.scatterplot(x = " + series + ".index, y = " + series + ".values" + hue
                    + ")" + set + "\n");
        return Fragment.statement("sns.scatterplot(x = " + x + ", y = " + y + hue + ")" + set + "\n");
    }

    /**
     * Choropleth of the selected country. The data frame comes from the
     * location select; the key and value columns are the first column of the
     * location and values selects.
     */
    private static Fragment map(BlockNode node, Inputs in, CompileContext ctx) {
        GeoSource geo = GEO.get(in.field("COUNTRY"));
        BlockNode location = ctx.provenance(in.child("location"));
        BlockNode values = ctx.provenance(in.child("values"));

        String df = "None";
        List<String> columns = new ArrayList<>();
        if (Operands.isKind(location, BlockKind.SELECT)) {
            String text = ctx.reemit(location.input("select")).textIn(Precedence.MEMBER);
            if (!text.isEmpty())
                df = text;
            if (location.arity() > 0)
                columns.add(Operands.columnName(location.row(0), ctx));
        }
        if (Operands.isKind(values, BlockKind.SELECT) && values.arity() > 0)
            columns.add(Operands.columnName(values.row(0), ctx));

        ctx.preamble().addImport(PyImports.FOLIUM);
        String fn = ctx.preamble().provideFunction(MAP_FUNCTION, List.of(
                "def " + MAP_FUNCTION + "(dataframe, columns, zoom):",
                "  map = folium.Map(location=[" + geo.lon() + ", " + geo.lat() + "], zoom_start=zoom)",
                "  folium.Choropleth(",
                "    geo_data = \"" + geo.geojson() + "\",",
                "    data = dataframe,",
                "    columns = columns,",
                "    key_on = \"feature.id\",",
                "  ).add_to(map)",
                "  return map"));
        return Fragment.statement(fn + "(" + df + ", " + Literals.json(columns) + ", " + in.code("zoom") + ")\n");
    }

    /**
     * {@code {'title':T, 'xlabel':X, 'ylabel':Y}} from the rows whose
     * FIELDNAME is {@code title}, {@code xaxis} (or {@code x}) and
     * {@code yaxis} (or {@code y}). A key with no row maps to None.
     */
    private static Fragment layout(BlockNode node, Inputs in, CompileContext ctx) {
        String title = layoutValue(in, "title", null);
        String x = layoutValue(in, "xaxis", "x");
        String y = layoutValue(in, "yaxis", "y");
        return Fragment.of("{'title':" + title + ", 'xlabel':" + x + ", 'ylabel':" + y + "}", Precedence.ATOMIC);
    }

    private static String layoutValue(Inputs in, String key, String alias) {
        int row = rowWithKey(in, key);
        if (row < 0 && alias != null)
            row = rowWithKey(in, alias);
        return row < 0 ? "None" : in.row(row, Precedence.NONE);
    }

    private static int rowWithKey(Inputs in, String key) {
        for (int i = 0; i < in.arity(); i++) {
            if (key.equals(in.rowField(i, "FIELDNAME")))
                return i;
        }
        return -1;
    }
}

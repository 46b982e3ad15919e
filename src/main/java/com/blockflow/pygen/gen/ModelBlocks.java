package com.blockflow.pygen.gen;

import com.blockflow.pygen.api.DiagnosticCode;
import com.blockflow.pygen.api.Fragment;
import com.blockflow.pygen.api.OutputKind;
import com.blockflow.pygen.api.Precedence;
import com.blockflow.pygen.catalog.BlockCatalog;
import com.blockflow.pygen.catalog.BlockKind;
import com.blockflow.pygen.catalog.BlockSchema;
import com.blockflow.pygen.engine.CompileContext;
import com.blockflow.pygen.engine.Inputs;
import com.blockflow.pygen.graph.BlockNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Model-training and prediction blocks.
 *
 * A model block fits an estimator on (features, label) and evaluates to the
 * fitted model; its predictor counterpart calls {@code predict} on it. Decision
 * trees and neural networks go through helper functions declared in the
 * preamble.
 */
public final class ModelBlocks {

    static final String DECISION_TREE_FUNCTION = "decisionTree";
    static final String NEURAL_NETWORK_FUNCTION = "neuralNetworkModel";

    private ModelBlocks() {
    }

    public static void register(BlockCatalog catalog) {
        for (ModelFamily family : ModelFamily.values()) {
            BlockSchema.Builder schema = BlockSchema.expression(OutputKind.MODEL);
            if (family == ModelFamily.KNN)
                schema.value("k", OutputKind.NUMBER, "1");
            catalog.register(family.model(), trainingSockets(schema).build(),
                    (node, in, ctx) -> {
                        ctx.preamble().addImport(family.importLine());
                        String k = family == ModelFamily.KNN ? in.code("k") : null;
                        return Fragment.of(family.constructor(k) + ".fit(" + Operands.features(in, "features", ctx)
                                + ", " + in.code("label") + ")", Precedence.FUNCTION_CALL);
                    });
            catalog.register(family.predictor(), predictorSchema(), ModelBlocks::predict);
        }

        catalog.register(BlockKind.DECISION_TREE_MODEL,
                trainingSockets(BlockSchema.expression(OutputKind.MODEL)
                        .value("max_depth", OutputKind.NUMBER, "2")).build(),
                ModelBlocks::decisionTree);
        catalog.register(BlockKind.DECISION_TREE_PREDICTOR, predictorSchema(), ModelBlocks::predict);

        catalog.register(BlockKind.NEURAL_NETWORK_MODEL,
                trainingSockets(BlockSchema.expression(OutputKind.MODEL)
                        .value("hidden_layers", OutputKind.ARRAY, "[]")).build(),
                ModelBlocks::neuralNetwork);
        catalog.register(BlockKind.NEURAL_NETWORK_PREDICTOR, predictorSchema(),
                (node, in, ctx) -> Fragment.of(predict(node, in, ctx).text() + " > 0.5", Precedence.RELATIONAL));

        catalog.register(BlockKind.KMEANS,
                BlockSchema.expression(OutputKind.ARRAY)
                        .value("k", OutputKind.NUMBER, "2")
                        .required("features", OutputKind.ARRAY, "")
                        .build(),
                (node, in, ctx) -> {
                    ctx.preamble().addImport(PyImports.KMEANS);
                    return Fragment.of("KMeans(n_clusters=" + in.code("k") + ").fit("
                            + Operands.features(in, "features", ctx) + ").labels_", Precedence.MEMBER);
                });
    }

    private static BlockSchema.Builder trainingSockets(BlockSchema.Builder schema) {
        return schema.required("label", OutputKind.ARRAY, "").required("features", OutputKind.ARRAY, "");
    }

    private static BlockSchema predictorSchema() {
        return BlockSchema.expression(OutputKind.ARRAY)
                .required("model", OutputKind.MODEL, "")
                .required("features", OutputKind.ARRAY, "")
                .build();
    }

    private static Fragment predict(BlockNode node, Inputs in, CompileContext ctx) {
        return Fragment.of(in.code("model") + ".predict(" + Operands.features(in, "features", ctx) + ")",
                Precedence.FUNCTION_CALL);
    }

    private static Fragment decisionTree(BlockNode node, Inputs in, CompileContext ctx) {
        ctx.preamble().addImports(PyImports.DECISION_TREE, PyImports.GRAPHVIZ);
        String fn = ctx.preamble().provideFunction(DECISION_TREE_FUNCTION, List.of(
                "def " + DECISION_TREE_FUNCTION + "(label, features, maxDepth):",
                "  tree = DecisionTreeClassifier(max_depth=maxDepth).fit(features, label)",
                "  labels = [str(x) for x in label.unique()]",
                "  labels.sort()",
                "  display(Source(export_graphviz(tree, filled=True, feature_names=features.columns.tolist(),"
                        + " class_names = labels)))",
                "  return tree"));
        return Fragment.of(fn + "(" + in.code("label") + ", " + Operands.features(in, "features", ctx) + ", "
                + in.code("max_depth") + ")", Precedence.FUNCTION_CALL);
    }

    /**
     * Declares {@code neuralNetworkModel(features, labels)}: one relu Dense
     * layer per hidden-layer width, then a single sigmoid output. The hidden
     * layers operand must be a JSON-like list; anything else is reported and
     * treated as no hidden layers.
     */
    private static Fragment neuralNetwork(BlockNode node, Inputs in, CompileContext ctx) {
        String features = in.code("features");
        String inputWidth = "features.T";
        if (Operands.isListVariable(in.child("features"), ctx)) {
            ctx.preamble().addImport(PyImports.NUMPY);
            features = "np.array(" + features + ").T.tolist()";
            inputWidth = "features[0]";
        }

        List<String> lines = new ArrayList<>();
        lines.add("def " + NEURAL_NETWORK_FUNCTION + "(features, labels):");
        lines.add("  nn = keras.Sequential([");
        lines.add("    keras.layers.Input(shape=(len(" + inputWidth + "),)),");
        for (String width : hiddenLayers(node, in.code("hidden_layers", Precedence.NONE), ctx)) {
            lines.add("    keras.layers.Dense(" + width + ", activation=\"relu\"),");
        }
        lines.add("    keras.layers.Dense(1, activation=\"sigmoid\")");
        lines.add("  ])");
        lines.add("");
        lines.add("  nn.compile(optimizer=\"adam\", loss=\"binary_crossentropy\")");
        lines.add("  nn.fit(features, labels)");
        lines.add("  return nn");

        ctx.preamble().addImports(PyImports.ACCURACY_SCORE, PyImports.TENSORFLOW, PyImports.KERAS);
        String fn = ctx.preamble().provideFunction(NEURAL_NETWORK_FUNCTION, lines);
        return Fragment.of(fn + "(" + features + ", " + in.code("label") + ")", Precedence.FUNCTION_CALL);
    }

    private static List<String> hiddenLayers(BlockNode node, String literal, CompileContext ctx) {
        List<String> widths = new ArrayList<>();
        try {
            JsonNode parsed = CompileContext.json().readTree(literal);
            if (parsed == null || !parsed.isArray())
                throw new IllegalArgumentException("not a list");
            for (JsonNode w : parsed) {
                widths.add(w.isTextual() ? w.asText() : w.toString());
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            ctx.diagnose(DiagnosticCode.MALFORMED_LITERAL, node, "Hidden layers are not a list: " + literal);
            widths.clear();
        }
        return widths;
    }
}

package com.blockflow.pygen.gen;

import com.blockflow.pygen.api.Fragment;
import com.blockflow.pygen.api.KindTag;
import com.blockflow.pygen.api.OutputKind;
import com.blockflow.pygen.api.Precedence;
import com.blockflow.pygen.catalog.BlockCatalog;
import com.blockflow.pygen.catalog.BlockKind;
import com.blockflow.pygen.catalog.BlockSchema;
import com.blockflow.pygen.engine.CompileContext;
import com.blockflow.pygen.engine.Inputs;
import com.blockflow.pygen.engine.Signature;
import com.blockflow.pygen.graph.BlockNode;

import java.util.Optional;

/** Model evaluation blocks. */
public final class MetricBlocks {

    private MetricBlocks() {
    }

    public static void register(BlockCatalog catalog) {
        catalog.register(BlockKind.SCORE,
                BlockSchema.expression(OutputKind.NUMBER).required("model", OutputKind.MODEL, "").build(),
                MetricBlocks::score);
        catalog.register(BlockKind.ACCURACY,
                BlockSchema.expression(OutputKind.NUMBER)
                        .required("predictor", OutputKind.ANY, "")
                        .required("expected_y", OutputKind.ARRAY, "")
                        .build(),
                (node, in, ctx) -> {
                    ctx.preamble().addImport(PyImports.ACCURACY_SCORE);
                    return Fragment.of("accuracy_score(" + in.code("predictor", Precedence.NONE) + ", "
                            + Operands.labels(in, "expected_y", ctx) + ")", Precedence.FUNCTION_CALL);
                });
        catalog.register(BlockKind.CONFUSION_MATRIX,
                BlockSchema.expression(OutputKind.TABULAR)
                        .required("predictor", OutputKind.ANY, "")
                        .required("true_labels", OutputKind.ARRAY, "")
                        .build(),
                (node, in, ctx) -> {
                    ctx.preamble().addImport(PyImports.CONFUSION_MATRIX);
                    return Fragment.of("confusion_matrix(" + in.code("predictor", Precedence.NONE) + ", "
                            + Operands.labels(in, "true_labels", ctx) + ")", Precedence.FUNCTION_CALL);
                });
        catalog.register(BlockKind.PRECISION_RECALL,
                BlockSchema.expression(OutputKind.TEXT)
                        .required("predictor", OutputKind.ANY, "")
                        .required("true_labels", OutputKind.ARRAY, "")
                        .build(),
                (node, in, ctx) -> {
                    ctx.preamble().addImport(PyImports.CLASSIFICATION_REPORT);
                    return Fragment.of("classification_report(" + Operands.labels(in, "true_labels", ctx) + ", "
                            + in.code("predictor", Precedence.NONE) + ")", Precedence.FUNCTION_CALL);
                });
        catalog.register(BlockKind.R2,
                BlockSchema.expression(OutputKind.NUMBER)
                        .required("model", OutputKind.ANY, "")
                        .required("expected_y", OutputKind.ARRAY, "")
                        .build(),
                (node, in, ctx) -> {
                    String model = in.code("model");
                    Optional<Signature> sig = ctx.signatureOf(in.child("model"));
                    if (sig.isPresent() && sig.get().origin().is(KindTag.MODEL_LIKE))
                        model = model + ".predict(" + sig.get().features() + ")";
                    ctx.preamble().addImport(PyImports.METRICS);
                    return Fragment.of("metrics.r2_score(" + Operands.labels(in, "expected_y", ctx) + ", " + model + ")",
                            Precedence.FUNCTION_CALL);
                });
    }

    /**
     * {@code m.score(X, y)} with the operands the model was trained on. A
     * variable takes them from its recorded signature; an inline model block
     * has them re-emitted. Neural networks have no {@code score}, so they are
     * scored with {@code accuracy_score} on thresholded predictions.
     */
    private static Fragment score(BlockNode node, Inputs in, CompileContext ctx) {
        String model = in.code("model");
        BlockNode child = in.child("model");
        Optional<Signature> sig = ctx.signatureOf(child);

        String label;
        String features;
        BlockKind origin;
        if (sig.isPresent() && sig.get().origin().is(KindTag.MODEL_LIKE)) {
            label = sig.get().label();
            features = sig.get().features();
            origin = sig.get().origin();
        } else if (child != null && child.kind().is(KindTag.MODEL_LIKE)) {
            label = operand(child, "label", ctx);
            features = operand(child, "features", ctx);
            origin = child.kind();
        } else {
            return Fragment.EMPTY;
        }

        if (origin == BlockKind.NEURAL_NETWORK_MODEL) {
            ctx.preamble().addImport(PyImports.ACCURACY_SCORE);
            return Fragment.of("accuracy_score(" + model + ".predict(" + features + ") > 0.5, " + label + ")",
                    Precedence.FUNCTION_CALL);
        }
        return Fragment.of(model + ".score(" + features + ", " + label + ")", Precedence.FUNCTION_CALL);
    }

    private static String operand(BlockNode model, String socket, CompileContext ctx) {
        String text = ctx.reemit(model.input(socket)).textIn(Precedence.MEMBER);
        return text.isEmpty() ? "[]" : text;
    }
}

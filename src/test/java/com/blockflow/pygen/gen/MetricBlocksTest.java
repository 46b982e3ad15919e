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

public class MetricBlocksTest {

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

    private BlockNode train(BlockKind kind) {
        return g.block(kind, Map.of("features", g.get("X"), "label", g.get("y")));
    }

    @Test
    public void testScoreOfModelVariable() {
        g.assign("m", train(BlockKind.LOGISTIC_REGRESSION_MODEL));
        BlockNode score = g.block(BlockKind.SCORE, Map.of("model", g.get("m")));
        assertEquals("m.score(X, y)", emit(score));
    }

    @Test
    public void testScoreOfInlineModel() {
        BlockNode score = g.block(BlockKind.SCORE, Map.of("model", train(BlockKind.LINEAR_REGRESSION_MODEL)));
        assertEquals("LinearRegression().fit(X, y).score(X, y)", emit(score));
    }

    @Test
    public void testScoreUsesLastAssignment() {
        g.assign("m", train(BlockKind.LINEAR_REGRESSION_MODEL));
        g.assign("m", g.block(BlockKind.NAIVE_BAYES_MODEL,
                Map.of("features", g.get("X2"), "label", g.get("y2"))));
        BlockNode score = g.block(BlockKind.SCORE, Map.of("model", g.get("m")));
        assertEquals("m.score(X2, y2)", emit(score));
    }

    @Test
    public void testScoreOfNeuralNetwork() {
        g.assign("nn", train(BlockKind.NEURAL_NETWORK_MODEL));
        BlockNode score = g.block(BlockKind.SCORE, Map.of("model", g.get("nn")));
        assertEquals("accuracy_score(nn.predict(X) > 0.5, y)", emit(score));
        assertTrue(ctx.preamble().imports().contains(PyImports.ACCURACY_SCORE));
    }

    @Test
    public void testScoreWithoutModelIsEmpty() {
        assertEquals("", emit(g.block(BlockKind.SCORE)));
        assertEquals(DiagnosticCode.MISSING_REQUIRED_SOCKET, ctx.diagnostics().get(0).code());

        assertEquals("", emit(g.block(BlockKind.SCORE, Map.of("model", g.get("unknown")))));
    }

    @Test
    public void testAccuracyWrapsListLabels() {
        g.assign("expected", g.numbers("1", "0"));
        BlockNode accuracy = g.block(BlockKind.ACCURACY,
                Map.of("predictor", g.get("p"), "expected_y", g.get("expected")));
        assertEquals("accuracy_score(p, pd.DataFrame(expected))", emit(accuracy));
        assertTrue(ctx.preamble().imports().contains(PyImports.PANDAS));
    }

    @Test
    public void testConfusionMatrixAndReport() {
        Map<String, BlockNode> inputs = Map.of("predictor", g.get("p"), "true_labels", g.get("y"));
        assertEquals("confusion_matrix(p, y)", emit(g.block(BlockKind.CONFUSION_MATRIX, inputs)));

        inputs = Map.of("predictor", g.get("p"), "true_labels", g.get("y"));
        assertEquals("classification_report(y, p)", emit(g.block(BlockKind.PRECISION_RECALL, inputs)));
        assertTrue(ctx.preamble().imports().contains(PyImports.CLASSIFICATION_REPORT));
    }

    @Test
    public void testR2PredictsWithTrainingFeatures() {
        g.assign("m", train(BlockKind.LINEAR_REGRESSION_MODEL));
        BlockNode r2 = g.block(BlockKind.R2, Map.of("model", g.get("m"), "expected_y", g.get("y_test")));
        assertEquals("metrics.r2_score(y_test, m.predict(X))", emit(r2));
        assertTrue(ctx.preamble().imports().contains(PyImports.METRICS));
    }

    @Test
    public void testR2OfPredictions() {
        BlockNode r2 = g.block(BlockKind.R2, Map.of("model", g.get("pred"), "expected_y", g.get("y_test")));
        assertEquals("metrics.r2_score(y_test, pred)", emit(r2));
    }
}

package com.blockflow.pygen.gen;

import com.blockflow.pygen.CompilerOptions;
import com.blockflow.pygen.api.DiagnosticCode;
import com.blockflow.pygen.api.Precedence;
import com.blockflow.pygen.catalog.BlockKind;
import com.blockflow.pygen.dsl.GraphBuilder;
import com.blockflow.pygen.engine.CodeGenEngine;
import com.blockflow.pygen.engine.CompileContext;
import com.blockflow.pygen.graph.BlockNode;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ModelBlocksTest {

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
    public void testEstimatorFamilies() {
        assertEquals("LinearRegression().fit(X, y)", emit(train(BlockKind.LINEAR_REGRESSION_MODEL)));
        assertEquals(List.of(PyImports.LINEAR_REGRESSION), ctx.preamble().imports());

        assertEquals("LogisticRegression().fit(X, y)", emit(train(BlockKind.LOGISTIC_REGRESSION_MODEL)));
        assertEquals("MultinomialNB().fit(X, y)", emit(train(BlockKind.NAIVE_BAYES_MODEL)));
        assertEquals("KNeighborsClassifier(n_neighbors=1).fit(X, y)", emit(train(BlockKind.KNN_MODEL)));
    }

    @Test
    public void testKnnNeighbourCount() {
        BlockNode knn = train(BlockKind.KNN_MODEL);
        g.connect(knn, "k", g.number("3"));
        assertEquals("KNeighborsClassifier(n_neighbors=3).fit(X, y)", emit(knn));
        assertEquals(List.of(PyImports.KNN), ctx.preamble().imports());
    }

    @Test
    public void testListVariableFeaturesAreTransposed() {
        g.assign("v", g.numbers("1", "2", "3"));
        BlockNode model = g.block(BlockKind.LINEAR_REGRESSION_MODEL,
                Map.of("features", g.get("v"), "label", g.numbers("4", "5", "6")));

        assertEquals("LinearRegression().fit(pd.DataFrame(v).T, [4, 5, 6])", emit(model));
        assertTrue(ctx.preamble().imports().contains(PyImports.PANDAS));
    }

    @Test
    public void testMissingOperandsAreReported() {
        assertEquals("LinearRegression().fit(, )", emit(g.block(BlockKind.LINEAR_REGRESSION_MODEL)));
        assertEquals(2, ctx.diagnostics().size());
        assertEquals(DiagnosticCode.MISSING_REQUIRED_SOCKET, ctx.diagnostics().get(0).code());
    }

    @Test
    public void testPredictors() {
        BlockNode predict = g.block(BlockKind.LINEAR_REGRESSION_PREDICTOR,
                Map.of("model", g.get("m"), "features", g.get("X_test")));
        assertEquals("m.predict(X_test)", emit(predict));

        BlockNode inline = g.block(BlockKind.KNN_PREDICTOR,
                Map.of("model", train(BlockKind.KNN_MODEL), "features", g.get("X_test")));
        assertEquals("KNeighborsClassifier(n_neighbors=1).fit(X, y).predict(X_test)", emit(inline));
    }

    @Test
    public void testDecisionTreeDeclaresHelper() {
        BlockNode tree = train(BlockKind.DECISION_TREE_MODEL);
        g.connect(tree, "max_depth", g.number("4"));

        assertEquals("decisionTree(y, X, 4)", emit(tree));
        assertEquals(List.of(PyImports.GRAPHVIZ, PyImports.DECISION_TREE), ctx.preamble().imports());
        List<String> declarations = ctx.preamble().declarations();
        assertEquals(1, declarations.size());
        assertTrue(declarations.get(0).startsWith("def decisionTree(label, features, maxDepth):\n"));
        assertTrue(declarations.get(0).endsWith("\n  return tree"));
    }

    @Test
    public void testTwoDecisionTreesShareOneHelper() {
        BlockNode first = train(BlockKind.DECISION_TREE_MODEL);
        BlockNode second = train(BlockKind.DECISION_TREE_MODEL);

        emit(first);
        assertEquals("decisionTree(y, X, 2)", ctx.emit(second).text());
        assertEquals(1, ctx.preamble().declarations().size());
    }

    @Test
    public void testNeuralNetwork() {
        BlockNode nn = train(BlockKind.NEURAL_NETWORK_MODEL);
        g.connect(nn, "hidden_layers", g.numbers("8", "4"));

        assertEquals("neuralNetworkModel(X, y)", emit(nn));
        String helper = ctx.preamble().declarations().get(0);
        assertEquals(String.join("\n",
                "def neuralNetworkModel(features, labels):",
                "  nn = keras.Sequential([",
                "    keras.layers.Input(shape=(len(features.T),)),",
                "    keras.layers.Dense(8, activation=\"relu\"),",
                "    keras.layers.Dense(4, activation=\"relu\"),",
                "    keras.layers.Dense(1, activation=\"sigmoid\")",
                "  ])",
                "",
                "  nn.compile(optimizer=\"adam\", loss=\"binary_crossentropy\")",
                "  nn.fit(features, labels)",
                "  return nn"), helper);
        assertTrue(ctx.preamble().imports().contains(PyImports.KERAS));
        assertTrue(ctx.preamble().imports().contains(PyImports.TENSORFLOW));
    }

    @Test
    public void testNeuralNetworkOnListVariable() {
        g.assign("v", g.numbers("1", "0"));
        BlockNode nn = g.block(BlockKind.NEURAL_NETWORK_MODEL, Map.of("features", g.get("v"), "label", g.get("y")));

        assertEquals("neuralNetworkModel(np.array(v).T.tolist(), y)", emit(nn));
        assertTrue(ctx.preamble().declarations().get(0).contains("shape=(len(features[0]),)"));
        assertTrue(ctx.preamble().imports().contains(PyImports.NUMPY));
    }

    @Test
    public void testNeuralNetworkMalformedLayers() {
        BlockNode nn = train(BlockKind.NEURAL_NETWORK_MODEL);
        g.connect(nn, "hidden_layers", g.text("wide"));

        emit(nn);
        assertEquals(DiagnosticCode.MALFORMED_LITERAL, ctx.diagnostics().get(0).code());
        assertFalse(ctx.preamble().declarations().get(0).contains("relu"));
    }

    @Test
    public void testNeuralNetworkPredictorIsThresholded() {
        BlockNode predict = g.block(BlockKind.NEURAL_NETWORK_PREDICTOR,
                Map.of("model", g.get("nn"), "features", g.get("X")));
        emit(predict);
        assertEquals("nn.predict(X) > 0.5", ctx.emit(predict).text());
        assertEquals(Precedence.RELATIONAL, ctx.emit(predict).precedence());
    }

    @Test
    public void testKMeans() {
        BlockNode kmeans = g.block(BlockKind.KMEANS, Map.of("features", g.get("X")));
        assertEquals("KMeans(n_clusters=2).fit(X).labels_", emit(kmeans));
        assertEquals(List.of(PyImports.KMEANS), ctx.preamble().imports());
    }
}

package com.blockflow.pygen.gen;

import com.blockflow.pygen.catalog.BlockKind;

/**
 * The scikit-learn estimators that share the plain {@code Ctor().fit(X, y)}
 * shape, with the constructor call and import each needs.
 */
enum ModelFamily {
    LINEAR_REGRESSION(BlockKind.LINEAR_REGRESSION_MODEL, BlockKind.LINEAR_REGRESSION_PREDICTOR,
            "LinearRegression()", PyImports.LINEAR_REGRESSION),
    LOGISTIC_REGRESSION(BlockKind.LOGISTIC_REGRESSION_MODEL, BlockKind.LOGISTIC_REGRESSION_PREDICTOR,
            "LogisticRegression()", PyImports.LOGISTIC_REGRESSION),
    KNN(BlockKind.KNN_MODEL, BlockKind.KNN_PREDICTOR,
            "KNeighborsClassifier(n_neighbors=%s)", PyImports.KNN),
    NAIVE_BAYES(BlockKind.NAIVE_BAYES_MODEL, BlockKind.NAIVE_BAYES_PREDICTOR,
            "MultinomialNB()", PyImports.NAIVE_BAYES);

    private final BlockKind model;
    private final BlockKind predictor;
    private final String constructor;
    private final String importLine;

    ModelFamily(BlockKind model, BlockKind predictor, String constructor, String importLine) {
        this.model = model;
        this.predictor = predictor;
        this.constructor = constructor;
        this.importLine = importLine;
    }

    BlockKind model() {
        return model;
    }

    BlockKind predictor() {
        return predictor;
    }

    String importLine() {
        return importLine;
    }

    /** Constructor call; {@code k} fills the neighbour count of KNN. */
    String constructor(String k) {
        return this == KNN ? String.format(constructor, k) : constructor;
    }
}

package com.blockflow.pygen.catalog;

import com.blockflow.pygen.api.KindTag;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of block kinds the compiler knows about.
 *
 * The persisted id is the editor's {@code type} string. Tags are fixed here so
 * the engine and the variable type repository dispatch on them instead of on
 * id substrings.
 */
public enum BlockKind {
    // --- Core language ---
    VARIABLES_SET("variables_set", KindTag.ASSIGNMENT),
    VARIABLES_GET("variables_get", KindTag.NAME_REFERENCE),
    TEXT("text"),
    MATH_NUMBER("math_number"),
    MATH_ARITHMETIC("math_arithmetic"),
    LOGIC_BOOLEAN("logic_boolean"),
    LOGIC_NULL("logic_null"),
    LOGIC_COMPARE("logic_compare"),
    LOGIC_OPERATION("logic_operation"),
    LOGIC_NEGATE("logic_negate"),
    LISTS_CREATE_WITH("lists_create_with", KindTag.DYNAMIC_COLLECTION),
    LISTS_SORT("lists_sort"),
    TEXT_PRINT("text_print"),
    CONTROLS_IF("controls_if"),
    CONTROLS_REPEAT_EXT("controls_repeat_ext"),

    // --- Data frames ---
    READ_CSV("read_csv"),
    SELECT("select", KindTag.MULTI_SELECT),
    DATAFRAME_DIC("dataframe_dic"),
    HEAD_TAIL("headTail"),
    GROUPBY("groupby"),
    AGG_FUNC("aggFunc", KindTag.AGGREGATE_LIKE),
    FILTER("filter"),
    TRAIN_TEST_SPLIT("train_test_split"),
    SELECTOR_TRAIN_TEST_SPLIT("selector_train_test_split"),
    CORRELATION("correlation"),
    FREQUENCY("frequency"),
    QUARTIS("quartis"),

    // --- Models and predictors ---
    LINEAR_REGRESSION_MODEL("linear_regression_model", KindTag.MODEL_LIKE),
    LINEAR_REGRESSION_PREDICTOR("linear_regression_predictor"),
    LOGISTIC_REGRESSION_MODEL("logistic_regression_model", KindTag.MODEL_LIKE),
    LOGISTIC_REGRESSION_PREDICTOR("logistic_regression_predictor"),
    KNN_MODEL("knn_model", KindTag.MODEL_LIKE),
    KNN_PREDICTOR("knn_predictor"),
    NAIVE_BAYES_MODEL("naive_bayes_model", KindTag.MODEL_LIKE),
    NAIVE_BAYES_PREDICTOR("naive_bayes_predictor"),
    DECISION_TREE_MODEL("decision_tree_model", KindTag.MODEL_LIKE),
    DECISION_TREE_PREDICTOR("decision_tree_predictor"),
    NEURAL_NETWORK_MODEL("neural_network_model", KindTag.MODEL_LIKE),
    NEURAL_NETWORK_PREDICTOR("neural_network_predictor"),
    KMEANS("kmeans"),

    // --- Metrics ---
    SCORE("score"),
    ACCURACY("accuracy"),
    CONFUSION_MATRIX("confusionMatrix"),
    PRECISION_RECALL("precisionRecall"),
    R2("r2"),

    // --- Charts ---
    LINE_GRAPH("lineGraph"),
    BAR_GRAPH("barGraph"),
    PIE_GRAPH("pieGraph"),
    HISTOGRAM_GRAPH("histogramGraph"),
    BOXPLOT_GRAPH("boxplotGraph"),
    SCATTER_GRAPH("scatterGraph"),
    TABLE_VIEW_GRAPH("tableViewGraph"),
    MAP_GRAPH("mapGraph"),
    HEAT_MAP("heatMap"),
    LAYOUT("layout");

    private final String id;
    private final Set<KindTag> tags;

    BlockKind(String id, KindTag... tags) {
        this.id = id;
        this.tags = tags.length == 0 ? EnumSet.noneOf(KindTag.class) : EnumSet.of(tags[0], tags);
    }

    /** The persisted type string. */
    public String id() {
        return id;
    }

    public boolean is(KindTag tag) {
        return tags.contains(tag);
    }

    public Set<KindTag> tags() {
        return Set.copyOf(tags);
    }

    public static BlockKind fromId(String id) {
        for (BlockKind k : values()) {
            if (k.id.equals(id)) {
                return k;
            }
        }
        throw new UnknownKindException("Unknown block type: " + id);
    }
}

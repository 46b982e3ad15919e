package com.blockflow.pygen.api;

/**
 * Classification tags the engine and the variable type repository dispatch on.
 */
public enum KindTag {
    /** Binds a variable name to the value plugged into its VALUE socket. */
    ASSIGNMENT,
    /** Reads a variable by name; carries no graph edge to the producer. */
    NAME_REFERENCE,
    /** Trains a model from label and features sockets. */
    MODEL_LIKE,
    /** Literal list constructor with a dynamic number of elements. */
    DYNAMIC_COLLECTION,
    /** Reduces a column to a single aggregated series. */
    AGGREGATE_LIKE,
    /** Selects any number of columns from a data frame. */
    MULTI_SELECT
}

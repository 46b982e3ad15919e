package com.blockflow.pygen.api;

/**
 * Declared output capability of a block kind.
 *
 * Also used on sockets as the accepted-kind hint. The compiler never enforces
 * it; the editor uses it to decide which blocks may be plugged where.
 */
public enum OutputKind {
    TABULAR,
    ARRAY,
    NUMBER,
    TEXT,
    BOOLEAN,
    MODEL,
    ANY,
    /** Statement only, chained through "next" instead of plugged into a socket. */
    NONE;

    public boolean isStatement() {
        return this == NONE;
    }
}

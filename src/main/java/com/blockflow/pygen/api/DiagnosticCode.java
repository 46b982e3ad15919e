package com.blockflow.pygen.api;

/** Kinds of non-fatal problems recorded during a compile pass. */
public enum DiagnosticCode {
    /** A required socket was unbound; its default literal was substituted. */
    MISSING_REQUIRED_SOCKET,
    /** A generator threw; the block was emitted as empty text. */
    GENERATOR_FAULT,
    /** A block was reached again while it was still being emitted. */
    CYCLE_DETECTED,
    /** An operand was expected to be a literal (list, dictionary) but was not parseable. */
    MALFORMED_LITERAL
}

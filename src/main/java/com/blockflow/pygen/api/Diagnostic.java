package com.blockflow.pygen.api;

/**
 * A non-fatal problem found while compiling one block.
 *
 * @param code    What went wrong.
 * @param blockId Id of the block the problem belongs to.
 * @param kind    Persisted type id of that block.
 * @param message Human-readable detail.
 */
public record Diagnostic(DiagnosticCode code, String blockId, String kind, String message) {

    @Override
    public String toString() {
        return code + " at " + kind + "#" + blockId + ": " + message;
    }
}

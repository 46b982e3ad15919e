package com.blockflow.pygen.api;

import java.util.List;

/**
 * Output of one compile pass: the program text plus every diagnostic raised
 * while producing it.
 */
public record CompileResult(String code, List<Diagnostic> diagnostics) {

    public CompileResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isClean() {
        return diagnostics.isEmpty();
    }
}

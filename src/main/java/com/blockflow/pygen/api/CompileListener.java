package com.blockflow.pygen.api;

/**
 * Observability interface for monitoring compile passes.
 *
 * Implementations are registered with the BlockCompiler and receive callbacks
 * from inside the recursive emission. This is the hook for:
 *
 * - Profiling: how long a pass takes and how many blocks it visits.
 * - Debugging: tracing which blocks were emitted, in which order.
 * - Reporting: surfacing diagnostics to an editor while a pass runs.
 *
 * Callbacks run on the compiling thread inside the pass. Keep them cheap.
 */
public interface CompileListener {

    CompileListener NOOP = new CompileListener() {
    };

    /**
     * Called before the variable type repository is rebuilt.
     *
     * @param pass Incrementing number of the compile pass on this compiler.
     */
    default void onCompileStart(long pass) {
    }

    /**
     * Called after a block produced its fragment.
     *
     * @param pass          Current pass number.
     * @param blockId       Id of the emitted block.
     * @param kind          Persisted type id of the block.
     * @param durationNanos Time spent in the block, children included.
     */
    default void onBlockEmitted(long pass, String blockId, String kind, long durationNanos) {
    }

    /**
     * Called when a diagnostic is recorded.
     *
     * @param pass       Current pass number.
     * @param diagnostic The diagnostic.
     */
    default void onDiagnostic(long pass, Diagnostic diagnostic) {
    }

    /**
     * Called when the pass has assembled its final text.
     *
     * @param pass          Current pass number.
     * @param blocksEmitted Number of block emissions performed (a block
     *                      reached twice counts twice).
     */
    default void onCompileEnd(long pass, int blocksEmitted) {
    }
}

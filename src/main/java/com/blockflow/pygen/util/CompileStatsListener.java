package com.blockflow.pygen.util;

import com.blockflow.pygen.api.CompileListener;
import com.blockflow.pygen.api.Diagnostic;
import com.blockflow.pygen.api.DiagnosticCode;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * A listener that tracks compile statistics.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> last, min, max and average time per pass.</li>
 * <li><b>Workload:</b> blocks emitted in the last pass, and emissions and
 * time per block kind over all passes.</li>
 * <li><b>Diagnostics:</b> counts per {@link DiagnosticCode}.</li>
 * </ul>
 * Safe to share between compiles running on different threads: every method
 * locks the listener, and pass latency is measured per pass number.
 */
public final class CompileStatsListener implements CompileListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(CompileStatsListener.class);

    private long lastLatencyNanos;
    private final Map<Long, Long> passStarts = new HashMap<>();
    private long totalPasses, totalLatencyNanos;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private int lastBlocksEmitted;
    private final Map<String, KindStats> kinds = new TreeMap<>();
    private final Map<DiagnosticCode, Integer> diagnostics = new EnumMap<>(DiagnosticCode.class);

    /** Emission count and accumulated time of one block kind. */
    public static final class KindStats {
        private long count, totalNanos;

        public long count() {
            return count;
        }

        public long totalNanos() {
            return totalNanos;
        }

        public double avgMicros() {
            return count > 0 ? totalNanos / 1000.0 / count : 0;
        }
    }

    @Override
    public synchronized void onCompileStart(long pass) {
        passStarts.put(pass, System.nanoTime());
    }

    @Override
    public synchronized void onBlockEmitted(long pass, String blockId, String kind, long durationNanos) {
        KindStats s = kinds.computeIfAbsent(kind, k -> new KindStats());
        s.count++;
        s.totalNanos += durationNanos;
    }

    @Override
    public synchronized void onDiagnostic(long pass, Diagnostic diagnostic) {
        diagnostics.merge(diagnostic.code(), 1, Integer::sum);
        log.debug("Pass {}: {}", pass, diagnostic);
    }

    @Override
    public synchronized void onCompileEnd(long pass, int blocksEmitted) {
        Long start = passStarts.remove(pass);
        if (start == null)
            return;
        lastLatencyNanos = System.nanoTime() - start;
        lastBlocksEmitted = blocksEmitted;
        totalPasses++;
        totalLatencyNanos += lastLatencyNanos;
        if (lastLatencyNanos < minLatencyNanos)
            minLatencyNanos = lastLatencyNanos;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
    }

    public synchronized long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public synchronized int lastBlocksEmitted() {
        return lastBlocksEmitted;
    }

    public synchronized long totalPasses() {
        return totalPasses;
    }

    public synchronized double avgLatencyMicros() {
        return totalPasses > 0 ? (double) totalLatencyNanos / totalPasses / 1000.0 : 0;
    }

    public synchronized long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public synchronized long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    /** Emissions of the given block kind over all passes. */
    public synchronized long emissions(String kind) {
        KindStats s = kinds.get(kind);
        return s == null ? 0 : s.count;
    }

    public synchronized int diagnostics(DiagnosticCode code) {
        return diagnostics.getOrDefault(code, 0);
    }

    public synchronized void reset() {
        totalPasses = 0;
        totalLatencyNanos = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
        kinds.clear();
        diagnostics.clear();
        passStarts.clear();
    }

    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-24s | %10s | %10s | %10s | %10s\n", "Metric", "Value", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("--------------------------------------------------------------------------\n");
        sb.append(String.format("%-24s | %10d | %10.2f | %10.2f | %10.2f\n",
                "Total Passes", totalPasses, avgLatencyMicros(),
                minLatencyNanos() / 1000.0, maxLatencyNanos() / 1000.0));
        for (Map.Entry<String, KindStats> e : kinds.entrySet()) {
            sb.append(String.format("%-24s | %10d | %10.2f |\n", e.getKey(), e.getValue().count(),
                    e.getValue().avgMicros()));
        }
        for (Map.Entry<DiagnosticCode, Integer> e : diagnostics.entrySet()) {
            sb.append(String.format("%-24s | %10d |\n", e.getKey(), e.getValue()));
        }
        return sb.toString();
    }
}

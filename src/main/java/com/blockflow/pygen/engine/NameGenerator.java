package com.blockflow.pygen.engine;

import com.blockflow.pygen.graph.Identifiers;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Turns user variable names into Python identifiers and hands out fresh names
 * for generated temporaries ({@code melted_df}, {@code count}, ...) that do not
 * clash with them.
 */
public final class NameGenerator {

    private final Set<String> used = new HashSet<>();

    /**
     * Python identifier for a user variable name. Stable: the same input always
     * maps to the same output.
     */
    public static String variableName(String raw) {
        return Identifiers.of(raw);
    }

    /** Marks user variables as taken so generated names avoid them. */
    public void reserveVariables(Collection<String> rawNames) {
        for (String raw : rawNames)
            used.add(variableName(raw));
    }

    /** Returns {@code base}, or {@code base2}, {@code base3}, ... if taken. */
    public String distinct(String base) {
        String candidate = base;
        int i = 2;
        while (used.contains(candidate) || Identifiers.isReserved(candidate)) {
            candidate = base + i++;
        }
        used.add(candidate);
        return candidate;
    }

    public void reset() {
        used.clear();
    }
}

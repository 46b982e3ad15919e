package com.blockflow.pygen.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicated import lines and auxiliary function declarations collected
 * during one compile pass.
 *
 * Entries are keyed. Re-inserting a key keeps its first position and takes the
 * last body. Import-like entries (starting with {@code import } or
 * {@code from }) are returned sorted; everything else keeps insertion order.
 */
public final class Preamble {
    private final Map<String, String> entries = new LinkedHashMap<>();

    /** Adds an entry under an explicit key. */
    public void define(String key, String text) {
        entries.put(key, text);
    }

    /** Adds one import line, keyed by itself. */
    public void addImport(String line) {
        define(line, line);
    }

    public void addImports(String... lines) {
        for (String l : lines)
            addImport(l);
    }

    /**
     * Declares an auxiliary function.
     *
     * @param name  Function name, also the deduplication key.
     * @param lines Source lines, the first one being the {@code def} line.
     * @return The name to call.
     */
    public String provideFunction(String name, List<String> lines) {
        define(name, String.join("\n", lines));
        return name;
    }

    public List<String> imports() {
        List<String> out = new ArrayList<>();
        for (String text : entries.values()) {
            if (isImport(text) && !out.contains(text))
                out.add(text);
        }
        Collections.sort(out);
        return out;
    }

    public List<String> declarations() {
        List<String> out = new ArrayList<>();
        for (String text : entries.values()) {
            if (!isImport(text))
                out.add(text);
        }
        return out;
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void reset() {
        entries.clear();
    }

    private static boolean isImport(String text) {
        return text.startsWith("import ") || text.startsWith("from ");
    }
}

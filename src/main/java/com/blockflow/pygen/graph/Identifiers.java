package com.blockflow.pygen.graph;

import java.util.Set;

/**
 * Mapping from user variable names to Python identifiers. Two names that map
 * to the same identifier are the same variable.
 */
public final class Identifiers {

    private static final Set<String> RESERVED = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "print", "raise", "return", "try", "while",
            "with", "yield",
            // module aliases used by generated code
            "pd", "np", "sns", "plt", "metrics", "keras", "tensorflow", "folium");

    private Identifiers() {
    }

    /** Identifier for a raw name; {@code unnamed} for null or empty. */
    public static String of(String raw) {
        if (raw == null || raw.isEmpty())
            return "unnamed";
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            sb.append(c < 128 && (Character.isLetterOrDigit(c) || c == '_') ? c : '_');
        }
        String name = sb.toString();
        if (Character.isDigit(name.charAt(0)))
            name = "my_" + name;
        if (RESERVED.contains(name))
            name = name + "_";
        return name;
    }

    /** Python keywords and the module aliases generated code relies on. */
    public static boolean isReserved(String name) {
        return RESERVED.contains(name);
    }
}

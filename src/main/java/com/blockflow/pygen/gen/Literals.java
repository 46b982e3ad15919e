package com.blockflow.pygen.gen;

import com.blockflow.pygen.engine.CompileContext;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.math.BigDecimal;
import java.util.List;

/**
 * Rendering of Python literals.
 */
public final class Literals {
    private static final String INFINITY = "float('inf')";
    private static final BigDecimal MAX_DOUBLE = new BigDecimal(Double.MAX_VALUE);
    private static final BigDecimal MIN_DOUBLE = new BigDecimal(Double.MIN_VALUE);

    private Literals() {
    }

    /**
     * Python string literal. Single-quoted unless the text contains a single
     * quote and no double quote.
     */
    public static String quote(String text) {
        String s = text.replace("\\", "\\\\").replace("\n", "\\n");
        char q = '\'';
        if (s.indexOf('\'') >= 0) {
            if (s.indexOf('"') < 0) {
                q = '"';
            } else {
                s = s.replace("'", "\\'");
            }
        }
        return q + s + q;
    }

    /**
     * Canonical Python number for a numeric field, or null if the text is not
     * a number. Trailing zeros are dropped ("2.50" becomes "2.5"). Magnitudes
     * beyond a double become {@code float('inf')}, those below its smallest
     * value become 0, and exponents outside [-7, 21) stay in scientific form.
     */
    public static String number(String text) {
        if (text == null)
            return null;
        String t = text.trim();
        if (t.equalsIgnoreCase("Infinity") || t.equalsIgnoreCase("inf"))
            return INFINITY;
        if (t.equalsIgnoreCase("-Infinity") || t.equalsIgnoreCase("-inf"))
            return "-" + INFINITY;
        BigDecimal d;
        try {
            d = new BigDecimal(t);
        } catch (NumberFormatException e) {
            return null;
        }
        if (d.signum() == 0)
            return "0";
        BigDecimal abs = d.abs();
        if (abs.compareTo(MAX_DOUBLE) > 0)
            return d.signum() < 0 ? "-" + INFINITY : INFINITY;
        if (abs.compareTo(MIN_DOUBLE) < 0)
            return "0";
        BigDecimal stripped = d.stripTrailingZeros();
        int exponent = stripped.precision() - stripped.scale() - 1;
        if (exponent >= 21 || exponent < -7)
            return stripped.toString();
        return stripped.toPlainString();
    }

    /** True if the text is a plain number literal. */
    public static boolean isNumber(String text) {
        try {
            new BigDecimal(text.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /** Compact JSON rendering, used for column lists and dictionaries. */
    public static String json(Object value) {
        try {
            return CompileContext.json().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot render " + value + " as JSON", e);
        }
    }

    /** {@code "a"} for one column, {@code ["a","b"]} for several. */
    public static String columnKey(List<String> columns) {
        return columns.size() == 1 ? json(columns.get(0)) : json(columns);
    }

    /** Strips one pair of matching surrounding quotes. */
    public static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '\'' || first == '"') && first == last)
                return text.substring(1, text.length() - 1);
        }
        return text;
    }
}

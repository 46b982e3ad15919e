package com.blockflow.pygen.catalog;

import java.util.List;

/**
 * A literal field of a block kind (text input, number, dropdown).
 *
 * @param name         Field name as persisted by the editor.
 * @param defaultValue Value a new block starts with.
 * @param options      Allowed dropdown values, empty for free text.
 */
public record FieldSpec(String name, String defaultValue, List<String> options) {

    public FieldSpec {
        options = List.copyOf(options);
    }

    public static FieldSpec text(String name, String defaultValue) {
        return new FieldSpec(name, defaultValue, List.of());
    }

    public static FieldSpec dropdown(String name, String... options) {
        return new FieldSpec(name, options[0], List.of(options));
    }

    public boolean accepts(String value) {
        return options.isEmpty() || options.contains(value);
    }
}

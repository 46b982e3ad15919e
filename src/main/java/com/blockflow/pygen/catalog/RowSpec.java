package com.blockflow.pygen.catalog;

import com.blockflow.pygen.api.OutputKind;

import java.util.List;
import java.util.Optional;

/**
 * Shape of the homogeneous, dynamic-arity part of a block kind.
 *
 * Row {@code i} is the socket {@code ADD<i>} plus one field per
 * {@link RowField} that applies to that index. Fields are associated with their
 * row by name and index, never by their position in the block.
 *
 * @param defaultArity     Rows a newly created block starts with.
 * @param placeholderLabel Label of the filler socket shown at arity 0.
 * @param accepts          Editor hint for the accepted output kind of each row.
 * @param elementDefault   Text substituted for an unbound row.
 * @param fields           Per-row literal fields.
 */
public record RowSpec(int defaultArity, String placeholderLabel, OutputKind accepts, String elementDefault,
        List<RowField> fields) {

    public static final String SOCKET_PREFIX = "ADD";
    public static final String PLACEHOLDER_SOCKET = "EMPTY";

    public RowSpec {
        if (defaultArity < 0)
            throw new IllegalArgumentException("defaultArity must be >= 0");
        fields = List.copyOf(fields);
    }

    public static String socketName(int index) {
        return SOCKET_PREFIX + index;
    }

    /**
     * Returns the row index encoded in a socket name, or -1 if the name is not
     * a row socket.
     */
    public static int rowIndex(String socketName) {
        if (socketName == null || !socketName.startsWith(SOCKET_PREFIX)
                || socketName.length() == SOCKET_PREFIX.length())
            return -1;
        String digits = socketName.substring(SOCKET_PREFIX.length());
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i)))
                return -1;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public Optional<RowField> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    /**
     * A literal field repeated on every row from {@code firstRow} on.
     *
     * @param name            Base name; row {@code i} stores it as {@code name + i}.
     * @param defaultsByIndex Initial value of the first rows, by index.
     * @param fallback        Initial value of rows past {@code defaultsByIndex}.
     * @param options         Allowed dropdown values, empty for free text.
     * @param firstRow        First row index carrying the field.
     */
    public record RowField(String name, List<String> defaultsByIndex, String fallback, List<String> options,
            int firstRow) {

        public RowField {
            defaultsByIndex = List.copyOf(defaultsByIndex);
            options = List.copyOf(options);
        }

        public static RowField text(String name, String fallback) {
            return new RowField(name, List.of(), fallback, List.of(), 0);
        }

        public static RowField dropdown(String name, int firstRow, String... options) {
            return new RowField(name, List.of(), options[0], List.of(options), firstRow);
        }

        public RowField withDefaults(String... byIndex) {
            return new RowField(name, List.of(byIndex), fallback, options, firstRow);
        }

        public boolean appliesTo(int row) {
            return row >= firstRow;
        }

        public String defaultFor(int row) {
            return row < defaultsByIndex.size() ? defaultsByIndex.get(row) : fallback;
        }

        public boolean accepts(String value) {
            return options.isEmpty() || options.contains(value);
        }

        public String storedName(int row) {
            return name + row;
        }
    }
}

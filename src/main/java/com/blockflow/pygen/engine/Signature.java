package com.blockflow.pygen.engine;

import com.blockflow.pygen.catalog.BlockKind;

/**
 * Recorded shape of a variable: the label and features its producer was built
 * from, and the kind of that producer.
 *
 * @param label    Label operand text, empty when not applicable.
 * @param features Features operand text, or the serialized elements of a
 *                 literal collection.
 * @param origin   Kind of the block assigned to the variable.
 */
public record Signature(String label, String features, BlockKind origin) {
}

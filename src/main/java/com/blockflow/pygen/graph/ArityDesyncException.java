package com.blockflow.pygen.graph;

/**
 * Thrown when a row socket at or beyond a block's live arity is addressed.
 */
public class ArityDesyncException extends RuntimeException {
    private final String blockId;
    private final int index;
    private final int arity;

    public ArityDesyncException(String blockId, int index, int arity) {
        super("Block " + blockId + " has arity " + arity + ", row socket ADD" + index + " does not exist");
        this.blockId = blockId;
        this.index = index;
        this.arity = arity;
    }

    public String blockId() {
        return blockId;
    }

    public int index() {
        return index;
    }

    public int arity() {
        return arity;
    }
}

package com.blockflow.pygen.graph;

/**
 * One item of the companion list editor of a dynamic block.
 *
 * A token remembers the child that was bound to its row when the list was
 * opened, or nothing for a row that was empty or newly added. Reordering the
 * tokens and handing them back to {@link ArityMutator#reconnect} rebinds the
 * children in the new order.
 */
public final class MutatorToken {
    private final BlockNode child;

    private MutatorToken(BlockNode child) {
        this.child = child;
    }

    public static MutatorToken of(BlockNode child) {
        return new MutatorToken(child);
    }

    /** A token for a new, empty row. */
    public static MutatorToken empty() {
        return new MutatorToken(null);
    }

    /** The remembered child, or null. */
    public BlockNode child() {
        return child;
    }

    @Override
    public String toString() {
        return child == null ? "token(empty)" : "token(" + child.id() + ")";
    }
}

package com.blockflow.pygen.graph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Arity state machine of one dynamic block.
 *
 * States are {@code arity = k}, k >= 0; at k = 0 the block shows a single
 * filler socket. After every transition rows {@code ADD0..ADD(k-1)} exist with
 * no gaps and nothing exists beyond them.
 *
 * <ul>
 * <li>{@link #grow()} appends an empty row; existing bindings are untouched.</li>
 * <li>{@link #shrink()} drops the last row; its child is detached and becomes
 * unreachable. Growing again yields an empty row.</li>
 * <li>{@link #reconnect(List)} replays an edited token list: children missing
 * from it are detached, the arity is resized to the token count, then rows are
 * rebound in token order.</li>
 * </ul>
 */
public final class ArityMutator {
    private static final Logger log = LogManager.getLogger(ArityMutator.class);

    private final BlockGraph graph;
    private final BlockNode node;

    ArityMutator(BlockGraph graph, BlockNode node) {
        this.graph = graph;
        this.node = node;
    }

    public BlockNode node() {
        return node;
    }

    public int arity() {
        return node.arity();
    }

    /** arity k -> k+1. */
    public ArityMutator grow() {
        node.growRow();
        return this;
    }

    /**
     * arity k -> k-1.
     *
     * @throws IllegalStateException at arity 0.
     */
    public ArityMutator shrink() {
        if (node.arity() == 0)
            throw new IllegalStateException(node + " is already at arity 0");
        BlockNode dropped = node.shrinkRow();
        if (dropped != null)
            log.debug("Shrinking {} discarded binding to {}", node, dropped);
        return this;
    }

    /** Grows or shrinks one row at a time until the arity equals {@code target}. */
    public ArityMutator resize(int target) {
        if (target < 0)
            throw new IllegalArgumentException("Arity cannot be negative: " + target);
        while (node.arity() < target)
            grow();
        while (node.arity() > target)
            shrink();
        return this;
    }

    /** One token per row, remembering the currently bound child. */
    public List<MutatorToken> saveConnections() {
        List<MutatorToken> tokens = new ArrayList<>(node.arity());
        for (int i = 0; i < node.arity(); i++) {
            tokens.add(MutatorToken.of(node.row(i)));
        }
        return tokens;
    }

    /**
     * Applies an edited token list.
     *
     * A row whose token still names its current child keeps the binding.
     * Children no longer named by any token are detached and become
     * unreachable. Tokens naming a child are rebound to their new index; empty
     * tokens yield empty rows.
     */
    public ArityMutator reconnect(List<MutatorToken> tokens) {
        Set<BlockNode> kept = Collections.newSetFromMap(new IdentityHashMap<>());
        for (MutatorToken t : tokens) {
            if (t.child() != null)
                kept.add(t.child());
        }

        for (int i = 0; i < node.arity(); i++) {
            BlockNode child = node.row(i);
            if (child != null && !kept.contains(child))
                graph.disconnectRow(node, i);
        }

        resize(tokens.size());

        for (int i = 0; i < tokens.size(); i++) {
            BlockNode wanted = tokens.get(i).child();
            BlockNode current = node.row(i);
            if (current == wanted)
                continue;
            if (wanted == null) {
                // the current child is named by a later token and gets rebound there
                graph.disconnectRow(node, i);
            } else {
                graph.connectRow(node, i, wanted);
            }
        }
        return this;
    }
}

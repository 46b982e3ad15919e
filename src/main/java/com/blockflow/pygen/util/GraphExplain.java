package com.blockflow.pygen.util;

import com.blockflow.pygen.graph.BlockGraph;
import com.blockflow.pygen.graph.BlockNode;

import java.util.Map;

/**
 * Diagnostic utility for inspecting block graphs.
 *
 * <p>
 * Renders the program as an indented tree, or the whole workspace as a
 * Mermaid diagram.
 *
 * <p>
 * <b>Usage:</b> intended for debugging sessions and logging. Allocates freely.
 */
public final class GraphExplain {
    private final BlockGraph graph;

    public GraphExplain(BlockGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps one block: kind, fields, bindings and position.
     */
    public String explainBlock(String id) {
        BlockNode node = graph.node(id);
        if (node == null)
            throw new IllegalArgumentException("Unknown block: " + id);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Block: ").append(id).append('\n')
                .append("  Kind: ").append(node.kind().id()).append('\n')
                .append("  Statement: ").append(node.isStatement()).append('\n');
        if (node.isDynamic())
            sb.append("  Arity: ").append(node.arity()).append('\n');
        sb.append("  Fields: ").append(node.fields()).append('\n');
        sb.append("  Inputs: ");
        boolean first = true;
        for (Map.Entry<String, BlockNode> e : node.bindings().entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(e.getKey()).append("=").append(e.getValue().id());
            first = false;
        }
        sb.append('\n');
        if (node.owner() != null)
            sb.append("  Owner: ").append(node.owner().id()).append('\n');
        return sb.toString();
    }

    /**
     * The program as an indented tree. Statement chains are listed in order,
     * socket bindings nested below their block. Blocks outside the program
     * are listed at the end.
     */
    public String dumpProgram() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Program (").append(graph.program().size()).append(" roots, ")
                .append(graph.size()).append(" blocks):\n");
        for (BlockNode root : graph.program()) {
            for (BlockNode n = root; n != null; n = n.next()) {
                appendTree(sb, n, null, 1);
            }
        }
        boolean header = false;
        for (BlockNode node : graph.nodes()) {
            if (node.owner() == null && !graph.program().contains(node)) {
                if (!header) {
                    sb.append("Unattached:\n");
                    header = true;
                }
                for (BlockNode n = node; n != null; n = n.next()) {
                    appendTree(sb, n, null, 1);
                }
            }
        }
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, BlockNode node, String socket, int depth) {
        sb.append("  ".repeat(depth));
        if (socket != null)
            sb.append(socket).append(": ");
        sb.append(node);
        if (!node.fields().isEmpty())
            sb.append(' ').append(node.fields());
        sb.append('\n');
        for (Map.Entry<String, BlockNode> e : node.bindings().entrySet()) {
            BlockNode child = e.getValue();
            appendTree(sb, child, e.getKey(), depth + 1);
            for (BlockNode n = child.next(); n != null; n = n.next()) {
                appendTree(sb, n, null, depth + 1);
            }
        }
    }

    /**
     * Generates a Mermaid graph diagram: one node per block, socket bindings
     * as labelled edges from child to parent, statement links as dotted edges.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare blocks in declaration order
        for (BlockNode node : graph.nodes()) {
            sb.append("  ").append(sanitize(node.id()))
                    .append("[\"").append(node.id()).append("<br/>").append(node.kind().id()).append("\"];\n");
        }

        // 2. Edges afterwards
        for (BlockNode node : graph.nodes()) {
            String safe = sanitize(node.id());
            for (Map.Entry<String, BlockNode> e : node.bindings().entrySet()) {
                sb.append("  ").append(sanitize(e.getValue().id())).append(" -- \"").append(e.getKey())
                        .append("\" --> ").append(safe).append(";\n");
            }
            if (node.next() != null)
                sb.append("  ").append(safe).append(" -.-> ").append(sanitize(node.next().id())).append(";\n");
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}

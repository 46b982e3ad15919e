package com.blockflow.pygen.dsl;

import com.blockflow.pygen.catalog.BlockCatalog;
import com.blockflow.pygen.catalog.BlockKind;
import com.blockflow.pygen.graph.BlockGraph;
import com.blockflow.pygen.graph.BlockNode;

import java.util.Map;

/**
 * Graph Builder -- fluent API for assembling block workspaces in code.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = GraphBuilder.create();
 * 2. Define values: var v = g.list(g.number("1"), g.number("2"));
 * 3. Define statements: g.statements(g.assign("v", v), g.print(g.get("v")));
 * 4. Build: BlockGraph graph = g.build();
 *
 * Every block is created in declaration order, which is also the order the
 * variable type repository scans assignments in.
 */
public final class GraphBuilder {
    private final BlockGraph graph;

    // Flag to prevent modification after building
    private boolean built;

    private GraphBuilder(BlockCatalog catalog) {
        this.graph = new BlockGraph(catalog);
    }

    public static GraphBuilder create() {
        return new GraphBuilder(BlockCatalog.standard());
    }

    public static GraphBuilder create(BlockCatalog catalog) {
        return new GraphBuilder(catalog);
    }

    // ── Literals ─────────────────────────────────────────────────

    public BlockNode text(String value) {
        return block(BlockKind.TEXT).setField("TEXT", value);
    }

    public BlockNode number(String value) {
        return block(BlockKind.MATH_NUMBER).setField("NUM", value);
    }

    public BlockNode bool(boolean value) {
        return block(BlockKind.LOGIC_BOOLEAN).setField("BOOL", value ? "TRUE" : "FALSE");
    }

    /** A literal list with one row per element. */
    public BlockNode list(BlockNode... elements) {
        BlockNode list = block(BlockKind.LISTS_CREATE_WITH);
        graph.mutator(list).resize(elements.length);
        for (int i = 0; i < elements.length; i++) {
            graph.connectRow(list, i, elements[i]);
        }
        return list;
    }

    /** A list of number literals. */
    public BlockNode numbers(String... values) {
        BlockNode[] elements = new BlockNode[values.length];
        for (int i = 0; i < values.length; i++) {
            elements[i] = number(values[i]);
        }
        return list(elements);
    }

    // ── Variables ────────────────────────────────────────────────

    /** {@code name = value}; a null value leaves the socket unbound. */
    public BlockNode assign(String name, BlockNode value) {
        BlockNode set = block(BlockKind.VARIABLES_SET).setField(BlockGraph.VAR_FIELD, name);
        if (value != null)
            graph.connect(set, BlockGraph.VALUE_SOCKET, value);
        return set;
    }

    public BlockNode get(String name) {
        return block(BlockKind.VARIABLES_GET).setField(BlockGraph.VAR_FIELD, name);
    }

    public BlockNode print(BlockNode value) {
        return block(BlockKind.TEXT_PRINT, Map.of("TEXT", value));
    }

    // ── Data frames ──────────────────────────────────────────────

    /** {@code df[...]} over the given column names. */
    public BlockNode select(BlockNode dataframe, String... columns) {
        BlockNode select = block(BlockKind.SELECT);
        if (dataframe != null)
            graph.connect(select, "select", dataframe);
        graph.mutator(select).resize(columns.length);
        for (int i = 0; i < columns.length; i++) {
            graph.connectRow(select, i, text(columns[i]));
        }
        return select;
    }

    // ── Generic blocks ───────────────────────────────────────────

    public BlockNode block(BlockKind kind) {
        checkNotBuilt();
        return graph.newNode(kind);
    }

    /** A block with its sockets bound as given. */
    public BlockNode block(BlockKind kind, Map<String, BlockNode> inputs) {
        BlockNode node = block(kind);
        for (Map.Entry<String, BlockNode> e : inputs.entrySet()) {
            graph.connect(node, e.getKey(), e.getValue());
        }
        return node;
    }

    public GraphBuilder connect(BlockNode parent, String socket, BlockNode child) {
        checkNotBuilt();
        graph.connect(parent, socket, child);
        return this;
    }

    public GraphBuilder connectRow(BlockNode parent, int row, BlockNode child) {
        checkNotBuilt();
        graph.connectRow(parent, row, child);
        return this;
    }

    public GraphBuilder field(BlockNode node, String name, String value) {
        checkNotBuilt();
        node.setField(name, value);
        return this;
    }

    public GraphBuilder rowField(BlockNode node, int row, String name, String value) {
        checkNotBuilt();
        node.setRowField(row, name, value);
        return this;
    }

    public GraphBuilder arity(BlockNode node, int arity) {
        checkNotBuilt();
        graph.mutator(node).resize(arity);
        return this;
    }

    // ── Program ──────────────────────────────────────────────────

    /** Chains the statements in order and appends the first to the program. */
    public GraphBuilder statements(BlockNode... chain) {
        checkNotBuilt();
        for (int i = 1; i < chain.length; i++) {
            graph.chain(chain[i - 1], chain[i]);
        }
        if (chain.length > 0)
            graph.addToProgram(chain[0]);
        return this;
    }

    /** Appends a top-level block, statement or expression, to the program. */
    public GraphBuilder program(BlockNode root) {
        checkNotBuilt();
        graph.addToProgram(root);
        return this;
    }

    /** The graph under construction, for edits the builder does not cover. */
    public BlockGraph graph() {
        return graph;
    }

    public BlockGraph build() {
        checkNotBuilt();
        built = true;
        return graph;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph already built");
    }
}

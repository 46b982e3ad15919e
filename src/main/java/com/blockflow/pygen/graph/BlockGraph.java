package com.blockflow.pygen.graph;

import com.blockflow.pygen.api.KindTag;
import com.blockflow.pygen.catalog.BlockCatalog;
import com.blockflow.pygen.catalog.BlockKind;
import com.blockflow.pygen.catalog.BlockSchema;
import com.blockflow.pygen.catalog.RowSpec;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory block graph: block instances, socket bindings, statement chains and
 * the ordered list of top-level program blocks.
 *
 * The graph is the sole owner of reachability. Disconnecting or removing a
 * block never deletes its descendants; they stay in the graph, unreachable
 * from the program, until removed themselves.
 *
 * Besides structure the graph keeps an index of assignment blocks by variable
 * name, ordered by declaration, so the producer of a name is known without a
 * scan. The index follows every change of a {@code VAR} field and every
 * removal.
 *
 * Not thread-safe. Editing must not overlap with a compile pass.
 */
public final class BlockGraph {
    private static final Logger log = LogManager.getLogger(BlockGraph.class);

    public static final String VAR_FIELD = "VAR";
    public static final String VALUE_SOCKET = "VALUE";

    private final BlockCatalog catalog;
    private final Map<String, BlockNode> nodes = new LinkedHashMap<>();
    private final List<BlockNode> program = new ArrayList<>();
    private final Map<String, TreeMap<Long, BlockNode>> assignmentsByName = new HashMap<>();
    private long nextSeq;
    private long nextAutoId = 1;

    public BlockGraph() {
        this(BlockCatalog.standard());
    }

    public BlockGraph(BlockCatalog catalog) {
        this.catalog = catalog;
    }

    public BlockCatalog catalog() {
        return catalog;
    }

    // ── Blocks ───────────────────────────────────────────────────────

    /** Creates a block with a generated id ("b1", "b2", ...). */
    public BlockNode newNode(BlockKind kind) {
        String id;
        do {
            id = "b" + nextAutoId++;
        } while (nodes.containsKey(id));
        return newNode(id, kind);
    }

    /**
     * Creates a parentless block. Dynamic kinds start at their default arity.
     *
     * @throws IllegalArgumentException if the id is already taken.
     */
    public BlockNode newNode(String id, BlockKind kind) {
        if (nodes.containsKey(id))
            throw new IllegalArgumentException("Duplicate block id: " + id);
        BlockSchema schema = catalog.schema(kind).orElse(null);
        if (schema == null)
            log.debug("Block {} has kind {} without catalog entry", id, kind.id());

        BlockNode node = new BlockNode(this, id, kind, schema, nextSeq++);
        nodes.put(id, node);
        if (schema != null && schema.isDynamic()) {
            for (int i = 0; i < schema.rows().defaultArity(); i++) {
                node.growRow();
            }
        }
        if (kind.is(KindTag.ASSIGNMENT)) {
            indexAssignment(node, node.field(VAR_FIELD));
        }
        return node;
    }

    public BlockNode node(String id) {
        return nodes.get(id);
    }

    /** All blocks in declaration order. */
    public List<BlockNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Removes a block. Its children and successor are detached and stay in the
     * graph, unreachable.
     */
    public void remove(BlockNode node) {
        checkOwned(node);
        detach(node);
        for (String socket : new ArrayList<>(node.bindings().keySet())) {
            node.unbind(socket);
        }
        node.unlink();
        program.remove(node);
        nodes.remove(node.id());
        if (node.kind().is(KindTag.ASSIGNMENT)) {
            unindexAssignment(node, node.field(VAR_FIELD));
        }
    }

    // ── Connections ──────────────────────────────────────────────────

    /**
     * Binds {@code child} to {@code socket} of {@code parent}. A child plugged
     * elsewhere is moved; a child previously bound to this socket is detached.
     *
     * @throws ArityDesyncException     if the socket is a row at or beyond the
     *                                  parent's arity.
     * @throws IllegalArgumentException if the socket does not exist, or the
     *                                  binding would create a cycle.
     */
    public void connect(BlockNode parent, String socket, BlockNode child) {
        checkOwned(parent);
        checkOwned(child);
        checkSocket(parent, socket);
        if (isAncestorOrSelf(child, parent))
            throw new IllegalArgumentException(
                    "Connecting " + child + " to " + parent + "." + socket + " would create a cycle");

        if (parent.input(socket) == child)
            return;
        detach(child);
        parent.unbind(socket);
        parent.bind(socket, child);
    }

    /** Binds {@code child} to row socket {@code ADD<row>} of {@code parent}. */
    public void connectRow(BlockNode parent, int row, BlockNode child) {
        connect(parent, RowSpec.socketName(row), child);
    }

    /**
     * Unbinds whatever is plugged into the socket. The child becomes
     * unreachable, not top-level.
     *
     * @return The detached child, or null.
     */
    public BlockNode disconnect(BlockNode parent, String socket) {
        checkOwned(parent);
        return parent.unbind(socket);
    }

    public BlockNode disconnectRow(BlockNode parent, int row) {
        return disconnect(parent, RowSpec.socketName(row));
    }

    /**
     * Appends {@code successor} after {@code block} in a statement chain,
     * replacing any current successor (which becomes unreachable).
     *
     * @throws IllegalArgumentException if either block is not a statement or
     *                                  the link would create a cycle.
     */
    public void chain(BlockNode block, BlockNode successor) {
        checkOwned(block);
        checkOwned(successor);
        if (!isChainable(block) || !isChainable(successor))
            throw new IllegalArgumentException(
                    "Only statement blocks can be chained: " + block + " -> " + successor);
        if (isAncestorOrSelf(successor, block))
            throw new IllegalArgumentException(
                    "Chaining " + successor + " after " + block + " would create a cycle");
        if (block.next() == successor)
            return;
        detach(successor);
        block.unlink();
        block.link(successor);
    }

    /** Cuts the chain after {@code block}; the old successor becomes unreachable. */
    public BlockNode unchain(BlockNode block) {
        checkOwned(block);
        return block.unlink();
    }

    // ── Program ──────────────────────────────────────────────────────

    /**
     * Appends a top-level block to the program.
     *
     * @throws IllegalArgumentException if the block is plugged into a socket or
     *                                  chained after another block.
     */
    public void addToProgram(BlockNode root) {
        checkOwned(root);
        if (root.owner() != null)
            throw new IllegalArgumentException(root + " is not top-level");
        if (!program.contains(root))
            program.add(root);
    }

    public void removeFromProgram(BlockNode root) {
        program.remove(root);
    }

    /** Top-level blocks in program order. */
    public List<BlockNode> program() {
        return Collections.unmodifiableList(program);
    }

    // ── Variables ────────────────────────────────────────────────────

    /** All assignment blocks in declaration order. */
    public List<BlockNode> assignments() {
        List<BlockNode> out = new ArrayList<>();
        for (BlockNode n : nodes.values()) {
            if (n.kind().is(KindTag.ASSIGNMENT))
                out.add(n);
        }
        return out;
    }

    /**
     * The last-declared assignment to a variable name, or null. Names are
     * compared by their Python identifier, and duplicate assignments resolve
     * last-write-wins.
     */
    public BlockNode assignmentOf(String name) {
        TreeMap<Long, BlockNode> byName = assignmentsByName.get(Identifiers.of(name));
        if (byName == null || byName.isEmpty())
            return null;
        if (byName.size() > 1)
            log.debug("Variable {} has {} assignments, using the last one", name, byName.size());
        return byName.lastEntry().getValue();
    }

    /** Block bound to the VALUE socket of the last assignment to a name, or null. */
    public BlockNode producerOf(String name) {
        BlockNode assignment = assignmentOf(name);
        return assignment == null ? null : assignment.input(VALUE_SOCKET);
    }

    /** Names of every variable assigned or read in the graph, in declaration order. */
    public Set<String> variableNames() {
        Set<String> names = new LinkedHashSet<>();
        for (BlockNode n : nodes.values()) {
            if (n.kind().is(KindTag.ASSIGNMENT) || n.kind().is(KindTag.NAME_REFERENCE)) {
                String var = n.field(VAR_FIELD);
                if (var != null && !var.isEmpty())
                    names.add(var);
            }
        }
        return names;
    }

    /** Returns a mutator for a dynamic block. */
    public ArityMutator mutator(BlockNode node) {
        checkOwned(node);
        if (!node.isDynamic())
            throw new IllegalArgumentException(node + " has no dynamic arity");
        return new ArityMutator(this, node);
    }

    // ── Internals ────────────────────────────────────────────────────

    void onFieldChanged(BlockNode node, String field, String oldValue, String newValue) {
        if (!VAR_FIELD.equals(field) || !node.kind().is(KindTag.ASSIGNMENT) || !nodes.containsKey(node.id()))
            return;
        unindexAssignment(node, oldValue);
        indexAssignment(node, newValue);
    }

    private void indexAssignment(BlockNode node, String name) {
        assignmentsByName.computeIfAbsent(Identifiers.of(name), k -> new TreeMap<>()).put(node.seq(), node);
    }

    private void unindexAssignment(BlockNode node, String name) {
        String key = Identifiers.of(name);
        TreeMap<Long, BlockNode> byName = assignmentsByName.get(key);
        if (byName != null) {
            byName.remove(node.seq());
            if (byName.isEmpty())
                assignmentsByName.remove(key);
        }
    }

    /** Cuts a block loose from whatever holds it: parent socket, predecessor, program. */
    private void detach(BlockNode node) {
        BlockNode parent = node.parent();
        if (parent != null)
            parent.unbind(node.parentSocket());
        BlockNode previous = node.previous();
        if (previous != null)
            previous.unlink();
        program.remove(node);
    }

    private void checkSocket(BlockNode parent, String socket) {
        if (parent.hasSocket(socket))
            return;
        int row = RowSpec.rowIndex(socket);
        if (parent.isDynamic() && row >= 0)
            throw new ArityDesyncException(parent.id(), row, parent.arity());
        if (RowSpec.PLACEHOLDER_SOCKET.equals(socket))
            throw new IllegalArgumentException("The placeholder socket of " + parent + " accepts no block");
        throw new IllegalArgumentException(parent + " has no socket " + socket);
    }

    private static boolean isChainable(BlockNode node) {
        return node.schema() == null || node.isStatement();
    }

    private static boolean isAncestorOrSelf(BlockNode candidate, BlockNode node) {
        for (BlockNode n = node; n != null; n = n.owner()) {
            if (n == candidate)
                return true;
        }
        return false;
    }

    private void checkOwned(BlockNode node) {
        if (node == null || node.graph() != this || nodes.get(node.id()) != node)
            throw new IllegalArgumentException("Block does not belong to this graph: " + node);
    }
}

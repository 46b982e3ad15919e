package com.blockflow.pygen.graph;

import com.blockflow.pygen.catalog.BlockKind;
import com.blockflow.pygen.catalog.BlockSchema;
import com.blockflow.pygen.catalog.FieldSpec;
import com.blockflow.pygen.catalog.RowSpec;
import com.blockflow.pygen.catalog.SocketSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One block instance inside a {@link BlockGraph}.
 *
 * Holds literal field values and the children bound to its sockets. Structure
 * (connections, chaining, arity) is changed only through the owning graph so
 * that parent pointers, the program list and the assignment index stay
 * consistent. Field values may be set directly.
 *
 * A block whose kind has no catalog entry has no schema; it accepts any field
 * and socket name and compiles to nothing.
 */
public final class BlockNode {
    private final String id;
    private final BlockKind kind;
    private final BlockSchema schema;
    private final BlockGraph graph;
    private final long seq;

    private final Map<String, BlockNode> inputs = new LinkedHashMap<>();
    private final Map<String, String> fields = new LinkedHashMap<>();
    private int arity;

    private BlockNode parent;
    private String parentSocket;
    private BlockNode next;
    private BlockNode previous;

    BlockNode(BlockGraph graph, String id, BlockKind kind, BlockSchema schema, long seq) {
        this.graph = graph;
        this.id = id;
        this.kind = kind;
        this.schema = schema;
        this.seq = seq;

        if (schema != null) {
            for (FieldSpec f : schema.fields()) {
                fields.put(f.name(), f.defaultValue());
            }
        }
    }

    public String id() {
        return id;
    }

    public BlockKind kind() {
        return kind;
    }

    /** Schema of this block, or null when its kind has no catalog entry. */
    public BlockSchema schema() {
        return schema;
    }

    public BlockGraph graph() {
        return graph;
    }

    /** Declaration order within the graph. */
    public long seq() {
        return seq;
    }

    public boolean isDynamic() {
        return schema != null && schema.isDynamic();
    }

    public boolean isStatement() {
        return schema != null && schema.isStatement();
    }

    public int arity() {
        return arity;
    }

    /** True when the block is dynamic and currently shows its filler socket. */
    public boolean showsPlaceholder() {
        return isDynamic() && arity == 0;
    }

    // ── Sockets ──────────────────────────────────────────────────────

    /** Child bound to the socket, or null. */
    public BlockNode input(String socket) {
        return inputs.get(socket);
    }

    /** Child bound to row socket {@code ADD<index>}, or null. */
    public BlockNode row(int index) {
        return inputs.get(RowSpec.socketName(index));
    }

    /** Names of all live sockets: fixed ones first, then the rows in order. */
    public List<String> sockets() {
        List<String> names = new ArrayList<>();
        if (schema == null) {
            names.addAll(inputs.keySet());
            return names;
        }
        for (SocketSpec s : schema.sockets()) {
            names.add(s.name());
        }
        if (showsPlaceholder()) {
            names.add(RowSpec.PLACEHOLDER_SOCKET);
        }
        for (int i = 0; i < arity; i++) {
            names.add(RowSpec.socketName(i));
        }
        return names;
    }

    public boolean hasSocket(String socket) {
        if (schema == null)
            return true;
        if (schema.socket(socket).isPresent())
            return true;
        int row = RowSpec.rowIndex(socket);
        return isDynamic() && row >= 0 && row < arity;
    }

    /** Bound sockets in socket order. */
    public Map<String, BlockNode> bindings() {
        Map<String, BlockNode> out = new LinkedHashMap<>();
        for (String s : sockets()) {
            BlockNode child = inputs.get(s);
            if (child != null)
                out.put(s, child);
        }
        return Collections.unmodifiableMap(out);
    }

    // ── Fields ───────────────────────────────────────────────────────

    /** Field value, or null if the field is not set. */
    public String field(String name) {
        return fields.get(name);
    }

    /** Value of a per-row field, e.g. {@code rowField(1, "FIELDNAME")}. */
    public String rowField(int row, String name) {
        return fields.get(name + row);
    }

    public Map<String, String> fields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Sets a fixed field.
     *
     * @throws IllegalArgumentException if the schema has no such field or the
     *                                  value is not one of its dropdown options.
     */
    public BlockNode setField(String name, String value) {
        if (schema != null) {
            FieldSpec spec = schema.field(name)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Block " + id + " (" + kind.id() + ") has no field " + name));
            if (!spec.accepts(value))
                throw new IllegalArgumentException(
                        "Field " + name + " of block " + id + " does not accept '" + value + "'");
        }
        String old = fields.put(name, value);
        graph.onFieldChanged(this, name, old, value);
        return this;
    }

    /**
     * Sets the field of one row.
     *
     * @throws ArityDesyncException    if the row does not exist.
     * @throws IllegalArgumentException if the row layout has no such field for
     *                                  that row or rejects the value.
     */
    public BlockNode setRowField(int row, String name, String value) {
        if (!isDynamic())
            throw new IllegalArgumentException("Block " + id + " (" + kind.id() + ") has no rows");
        if (row < 0 || row >= arity)
            throw new ArityDesyncException(id, row, arity);
        RowSpec.RowField spec = schema.rows().field(name)
                .filter(f -> f.appliesTo(row))
                .orElseThrow(() -> new IllegalArgumentException(
                        "Row " + row + " of block " + id + " has no field " + name));
        if (!spec.accepts(value))
            throw new IllegalArgumentException(
                    "Field " + name + row + " of block " + id + " does not accept '" + value + "'");
        fields.put(spec.storedName(row), value);
        return this;
    }

    // ── Structure ────────────────────────────────────────────────────

    public BlockNode parent() {
        return parent;
    }

    /** Socket of the parent this block is plugged into, or null. */
    public String parentSocket() {
        return parentSocket;
    }

    public BlockNode next() {
        return next;
    }

    public BlockNode previous() {
        return previous;
    }

    /** The block this one hangs from, either as a socket child or as a successor. */
    public BlockNode owner() {
        return parent != null ? parent : previous;
    }

    // Package-private mutators, used by BlockGraph and ArityMutator only.

    void bind(String socket, BlockNode child) {
        inputs.put(socket, child);
        child.parent = this;
        child.parentSocket = socket;
    }

    BlockNode unbind(String socket) {
        BlockNode child = inputs.remove(socket);
        if (child != null) {
            child.parent = null;
            child.parentSocket = null;
        }
        return child;
    }

    void link(BlockNode successor) {
        this.next = successor;
        successor.previous = this;
    }

    BlockNode unlink() {
        BlockNode successor = next;
        if (successor != null) {
            successor.previous = null;
            next = null;
        }
        return successor;
    }

    void growRow() {
        int row = arity++;
        for (RowSpec.RowField f : schema.rows().fields()) {
            if (f.appliesTo(row))
                fields.put(f.storedName(row), f.defaultFor(row));
        }
    }

    BlockNode shrinkRow() {
        int row = --arity;
        BlockNode dropped = unbind(RowSpec.socketName(row));
        for (RowSpec.RowField f : schema.rows().fields()) {
            fields.remove(f.storedName(row));
        }
        return dropped;
    }

    @Override
    public String toString() {
        return kind.id() + "#" + id;
    }
}

package com.blockflow.pygen.engine;

import com.blockflow.pygen.api.Fragment;
import com.blockflow.pygen.api.Precedence;
import com.blockflow.pygen.catalog.BlockSchema;
import com.blockflow.pygen.catalog.RowSpec;
import com.blockflow.pygen.catalog.SocketSpec;
import com.blockflow.pygen.graph.BlockNode;

import java.util.Map;

/**
 * Already-emitted socket fragments of one block, as seen by its generator.
 *
 * Unbound sockets read as the default literal of their schema. Operand text
 * is parenthesized against the precedence of the context it is placed in,
 * {@link Precedence#MEMBER} unless stated otherwise.
 */
public final class Inputs {
    private final BlockNode node;
    private final BlockSchema schema;
    private final Map<String, Fragment> resolved;
    private final String indent;

    Inputs(BlockNode node, BlockSchema schema, Map<String, Fragment> resolved, String indent) {
        this.node = node;
        this.schema = schema;
        this.resolved = resolved;
        this.indent = indent;
    }

    /** True if a block is plugged into the socket and produced text. */
    public boolean has(String socket) {
        Fragment f = resolved.get(socket);
        return f != null && !f.isEmpty();
    }

    /** True if a block is plugged into the socket, whatever it produced. */
    public boolean isBound(String socket) {
        return node.input(socket) != null;
    }

    /** Block plugged into the socket, or null. */
    public BlockNode child(String socket) {
        return node.input(socket);
    }

    public String code(String socket) {
        return code(socket, Precedence.MEMBER);
    }

    public String code(String socket, Precedence outer) {
        Fragment f = resolved.get(socket);
        if (f == null || f.isEmpty())
            return defaultOf(socket);
        return f.textIn(outer);
    }

    /** Raw fragment of the socket, {@link Fragment#EMPTY} if unbound. */
    public Fragment fragment(String socket) {
        return resolved.getOrDefault(socket, Fragment.EMPTY);
    }

    // ── Rows ─────────────────────────────────────────────────────────

    public int arity() {
        return node.arity();
    }

    public boolean hasRow(int row) {
        return has(RowSpec.socketName(row));
    }

    public BlockNode rowChild(int row) {
        return node.row(row);
    }

    public String row(int row) {
        return row(row, Precedence.MEMBER);
    }

    public String row(int row, Precedence outer) {
        Fragment f = resolved.get(RowSpec.socketName(row));
        if (f == null || f.isEmpty())
            return schema.isDynamic() ? schema.rows().elementDefault() : "";
        return f.textIn(outer);
    }

    // ── Fields ───────────────────────────────────────────────────────

    public String field(String name) {
        String v = node.field(name);
        return v == null ? "" : v;
    }

    public String rowField(int row, String name) {
        String v = node.rowField(row, name);
        return v == null ? "" : v;
    }

    // ── Statements ───────────────────────────────────────────────────

    /**
     * Body of a statement socket, indented one level; {@code pass} when the
     * socket is empty.
     */
    public String statements(String socket) {
        Fragment f = resolved.get(socket);
        String body = f == null || f.isEmpty() ? "pass\n" : f.text();
        return indentLines(body, indent);
    }

    static String indentLines(String text, String indent) {
        StringBuilder sb = new StringBuilder(text.length() + 16);
        int start = 0;
        while (start < text.length()) {
            int nl = text.indexOf('\n', start);
            int end = nl < 0 ? text.length() : nl + 1;
            String line = text.substring(start, end);
            if (!line.isBlank())
                sb.append(indent);
            sb.append(line);
            start = end;
        }
        return sb.toString();
    }

    private String defaultOf(String socket) {
        return schema.socket(socket).map(SocketSpec::defaultLiteral).orElse("");
    }
}

package com.blockflow.pygen.catalog;

import com.blockflow.pygen.api.OutputKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Socket and field layout of a block kind plus its output capability.
 */
public final class BlockSchema {
    private final OutputKind output;
    private final List<SocketSpec> sockets;
    private final List<FieldSpec> fields;
    private final RowSpec rows;

    private BlockSchema(Builder b) {
        this.output = b.output;
        this.sockets = List.copyOf(b.sockets);
        this.fields = List.copyOf(b.fields);
        this.rows = b.rows;
    }

    /** Starts a schema for an expression block. */
    public static Builder expression(OutputKind output) {
        if (output == OutputKind.NONE)
            throw new IllegalArgumentException("Use statement() for blocks without output");
        return new Builder(output);
    }

    /** Starts a schema for a statement block, chained through "next". */
    public static Builder statement() {
        return new Builder(OutputKind.NONE);
    }

    public OutputKind output() {
        return output;
    }

    public boolean isStatement() {
        return output.isStatement();
    }

    public List<SocketSpec> sockets() {
        return sockets;
    }

    public List<FieldSpec> fields() {
        return fields;
    }

    public boolean isDynamic() {
        return rows != null;
    }

    /** Row layout, or null for fixed-arity kinds. */
    public RowSpec rows() {
        return rows;
    }

    public Optional<SocketSpec> socket(String name) {
        for (SocketSpec s : sockets) {
            if (s.name().equals(name))
                return Optional.of(s);
        }
        return Optional.empty();
    }

    public Optional<FieldSpec> field(String name) {
        for (FieldSpec f : fields) {
            if (f.name().equals(name))
                return Optional.of(f);
        }
        return Optional.empty();
    }

    /** Fluent builder for schemas. */
    public static final class Builder {
        private final OutputKind output;
        private final List<SocketSpec> sockets = new ArrayList<>();
        private final List<FieldSpec> fields = new ArrayList<>();
        private RowSpec rows;

        private Builder(OutputKind output) {
            this.output = output;
        }

        public Builder socket(SocketSpec socket) {
            for (SocketSpec s : sockets) {
                if (s.name().equals(socket.name()))
                    throw new IllegalArgumentException("Duplicate socket: " + socket.name());
            }
            if (RowSpec.rowIndex(socket.name()) >= 0 || RowSpec.PLACEHOLDER_SOCKET.equals(socket.name()))
                throw new IllegalArgumentException("Reserved socket name: " + socket.name());
            sockets.add(socket);
            return this;
        }

        public Builder value(String name, OutputKind accepts, String defaultLiteral) {
            return socket(SocketSpec.value(name, accepts, defaultLiteral));
        }

        public Builder required(String name, OutputKind accepts, String defaultLiteral) {
            return socket(SocketSpec.required(name, accepts, defaultLiteral));
        }

        public Builder statements(String name) {
            return socket(SocketSpec.statements(name));
        }

        public Builder field(FieldSpec field) {
            fields.add(field);
            return this;
        }

        public Builder text(String name, String defaultValue) {
            return field(FieldSpec.text(name, defaultValue));
        }

        public Builder dropdown(String name, String... options) {
            return field(FieldSpec.dropdown(name, options));
        }

        public Builder rows(RowSpec rows) {
            this.rows = rows;
            return this;
        }

        public BlockSchema build() {
            return new BlockSchema(this);
        }
    }
}

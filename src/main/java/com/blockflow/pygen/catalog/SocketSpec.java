package com.blockflow.pygen.catalog;

import com.blockflow.pygen.api.OutputKind;

/**
 * A fixed, named input socket of a block kind.
 *
 * @param name           Socket name as persisted by the editor.
 * @param accepts        Editor hint for the accepted output kind, never enforced.
 * @param defaultLiteral Text substituted when the socket is unbound.
 * @param required       Whether an unbound socket raises a diagnostic.
 * @param statement      Whether the socket takes a statement chain instead of a value.
 */
public record SocketSpec(String name, OutputKind accepts, String defaultLiteral, boolean required,
        boolean statement) {

    public static SocketSpec value(String name, OutputKind accepts, String defaultLiteral) {
        return new SocketSpec(name, accepts, defaultLiteral, false, false);
    }

    public static SocketSpec required(String name, OutputKind accepts, String defaultLiteral) {
        return new SocketSpec(name, accepts, defaultLiteral, true, false);
    }

    public static SocketSpec statements(String name) {
        return new SocketSpec(name, OutputKind.NONE, "", false, true);
    }
}

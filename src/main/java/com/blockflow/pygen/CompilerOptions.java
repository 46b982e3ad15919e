package com.blockflow.pygen;

import lombok.Data;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Compiler and server settings.
 *
 * Read from a properties file by {@link #load(Path)}:
 *
 * <pre>
 * pygen.indent=4             # spaces per indentation level (or the literal "tab")
 * pygen.comment-diagnostics=true
 * pygen.server.port=8080
 * </pre>
 *
 * Unknown keys are ignored.
 */
@Data
public final class CompilerOptions {
    public static final String INDENT_KEY = "pygen.indent";
    public static final String COMMENT_DIAGNOSTICS_KEY = "pygen.comment-diagnostics";
    public static final String SERVER_PORT_KEY = "pygen.server.port";

    /** One indentation level of generated code. */
    private String indent = "  ";

    /** Append diagnostics to the generated program as "# warning:" comments. */
    private boolean commentDiagnostics;

    /** Port of the compile server. */
    private int serverPort = 7070;

    public static CompilerOptions defaults() {
        return new CompilerOptions();
    }

    /**
     * Loads options from a properties file, keeping defaults for absent keys.
     *
     * @throws IOException              if the file cannot be read.
     * @throws IllegalArgumentException if a value is malformed.
     */
    public static CompilerOptions load(Path file) throws IOException {
        Properties props = new Properties();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(r);
        }
        return from(props);
    }

    public static CompilerOptions from(Properties props) {
        CompilerOptions o = new CompilerOptions();

        String indent = props.getProperty(INDENT_KEY);
        if (indent != null) {
            indent = indent.trim();
            if (indent.equalsIgnoreCase("tab")) {
                o.setIndent("\t");
            } else {
                int width = parseInt(INDENT_KEY, indent);
                if (width < 1)
                    throw new IllegalArgumentException(INDENT_KEY + " must be positive: " + indent);
                o.setIndent(" ".repeat(width));
            }
        }

        String comments = props.getProperty(COMMENT_DIAGNOSTICS_KEY);
        if (comments != null)
            o.setCommentDiagnostics(Boolean.parseBoolean(comments.trim()));

        String port = props.getProperty(SERVER_PORT_KEY);
        if (port != null) {
            int p = parseInt(SERVER_PORT_KEY, port.trim());
            if (p < 0 || p > 65535)
                throw new IllegalArgumentException(SERVER_PORT_KEY + " out of range: " + p);
            o.setServerPort(p);
        }
        return o;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + value, e);
        }
    }
}

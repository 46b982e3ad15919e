package com.blockflow.pygen.io;

/** A persisted workspace that cannot be read at all. */
public class GraphDefinitionException extends RuntimeException {
    public GraphDefinitionException(String message) {
        super(message);
    }

    public GraphDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.blockflow.pygen.catalog;

/**
 * Thrown when a block kind id is not known, or a kind has no catalog entry.
 */
public class UnknownKindException extends RuntimeException {

    public UnknownKindException(String message) {
        super(message);
    }
}

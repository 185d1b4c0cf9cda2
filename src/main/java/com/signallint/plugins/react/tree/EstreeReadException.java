package com.signallint.plugins.react.tree;

/**
 * Raised when parser output cannot be turned into a typed tree.
 */
public class EstreeReadException extends Exception {
    public EstreeReadException(String message) {
        super(message);
    }

    public EstreeReadException(String message, Throwable cause) {
        super(message, cause);
    }
}

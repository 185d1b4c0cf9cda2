package com.signallint.api.error;

/**
 * A broken invariant inside the analysis core. Never caught by the core itself.
 */
public class InternalFaultException extends RuntimeException {
    public InternalFaultException(String message) {
        super(message);
    }
}

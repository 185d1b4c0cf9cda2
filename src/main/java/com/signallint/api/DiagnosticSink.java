package com.signallint.api;

/**
 * Receives diagnostics as a run finishes, in report order.
 */
public interface DiagnosticSink {
    void report(Diagnostic diagnostic);
}

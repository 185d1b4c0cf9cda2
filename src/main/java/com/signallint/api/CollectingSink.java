package com.signallint.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sink that keeps every diagnostic in arrival order.
 */
public class CollectingSink implements DiagnosticSink {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}

package com.signallint.api;

import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;

/**
 * A finding as delivered to users: the finding itself, its rendered message and its fix.
 */
public final class Diagnostic {
    private final Finding finding;
    private final String message;
    private final Fix fix;

    public Diagnostic(Finding finding, String message, Fix fix) {
        this.finding = finding;
        this.message = message;
        this.fix = fix != null ? fix : Fix.none();
    }

    // Getters
    public Finding getFinding() { return finding; }
    public String getMessage() { return message; }
    public Fix getFix() { return fix; }

    public Severity getSeverity() {
        return finding.getSeverity();
    }

    public String getRuleId() {
        return finding.getRuleId();
    }

    public int getLine() {
        return finding.getLine();
    }

    public int getColumn() {
        return finding.getColumn();
    }

    @Override
    public String toString() {
        return getLine() + ":" + getColumn() + " " + finding.getSeverity() + " " + message
                + " [" + finding.getRuleId() + "]";
    }
}

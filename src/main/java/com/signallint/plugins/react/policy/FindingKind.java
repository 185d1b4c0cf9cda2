package com.signallint.plugins.react.policy;

import com.signallint.api.error.Severity;

/**
 * A message id of a rule, with its default severity and message template.
 */
public final class FindingKind {
    private final String id;
    private final Severity defaultSeverity;
    private final String template;

    public FindingKind(String id, Severity defaultSeverity, String template) {
        this.id = id;
        this.defaultSeverity = defaultSeverity;
        this.template = template;
    }

    // Getters
    public String getId() { return id; }
    public Severity getDefaultSeverity() { return defaultSeverity; }
    public String getTemplate() { return template; }

    @Override
    public String toString() {
        return id;
    }
}

package com.signallint.api.error;

import com.signallint.plugins.react.tree.SourceRange;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A problem reported by one rule at one source location.
 */
public final class Finding {
    private final SourceRange location;
    private final String ruleId;
    private final String kind;
    private final Severity severity;
    private final Map<String, String> params;

    public Finding(SourceRange location, String ruleId, String kind, Severity severity, Map<String, String> params) {
        this.location = location;
        this.ruleId = ruleId;
        this.kind = kind;
        this.severity = severity;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    // Getters
    public SourceRange getLocation() { return location; }
    public String getRuleId() { return ruleId; }
    public String getKind() { return kind; }
    public Severity getSeverity() { return severity; }
    public Map<String, String> getParams() { return params; }

    /** 1-based line. */
    public int getLine() {
        return location.getLine();
    }

    /** 1-based column. */
    public int getColumn() {
        return location.getColumn() + 1;
    }

    @Override
    public String toString() {
        return ruleId + "/" + kind + " at " + location;
    }
}

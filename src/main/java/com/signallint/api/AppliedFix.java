package com.signallint.api;

/**
 * Record of a primary fix that was applied to the output source.
 */
public class AppliedFix {
    private final String ruleId;
    private final String kind;
    private final int line;
    private final String description;

    public AppliedFix(String ruleId, String kind, int line, String description) {
        this.ruleId = ruleId;
        this.kind = kind;
        this.line = line;
        this.description = description;
    }

    // Getters
    public String getRuleId() { return ruleId; }
    public String getKind() { return kind; }
    public int getLine() { return line; }
    public String getDescription() { return description; }
}

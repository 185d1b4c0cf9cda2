package com.signallint.api;

import com.signallint.plugins.react.tree.SourceRange;

/**
 * Replaces one source range with new text. Edits sharing a group id are applied together or not at all.
 */
public final class Edit {
    private final SourceRange range;
    private final String replacement;
    private final String groupId;

    public Edit(SourceRange range, String replacement, String groupId) {
        this.range = range;
        this.replacement = replacement;
        this.groupId = groupId;
    }

    // Getters
    public SourceRange getRange() { return range; }
    public String getReplacement() { return replacement; }
    public String getGroupId() { return groupId; }

    @Override
    public String toString() {
        return range + " -> \"" + replacement + "\"";
    }
}

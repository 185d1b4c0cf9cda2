package com.signallint.api;

import java.util.List;

/**
 * An alternative rewrite offered to the user. Never applied automatically.
 */
public final class Suggestion {
    private final String kind;
    private final String description;
    private final List<Edit> edits;

    public Suggestion(String kind, String description, List<Edit> edits) {
        this.kind = kind;
        this.description = description;
        this.edits = List.copyOf(edits);
    }

    // Getters
    public String getKind() { return kind; }
    public String getDescription() { return description; }
    public List<Edit> getEdits() { return edits; }
}

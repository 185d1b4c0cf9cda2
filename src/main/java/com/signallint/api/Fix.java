package com.signallint.api;

import java.util.Collections;
import java.util.List;

/**
 * The rewrite attached to a diagnostic: nothing, one primary edit group,
 * or a list of mutually exclusive suggestions.
 */
public final class Fix {
    public enum Type {
        NONE,
        PRIMARY,
        SUGGESTIONS
    }

    private static final Fix NONE = new Fix(Type.NONE, null, Collections.emptyList(), Collections.emptyList());

    private final Type type;
    private final String description;
    private final List<Edit> edits;
    private final List<Suggestion> suggestions;

    private Fix(Type type, String description, List<Edit> edits, List<Suggestion> suggestions) {
        this.type = type;
        this.description = description;
        this.edits = edits;
        this.suggestions = suggestions;
    }

    public static Fix none() {
        return NONE;
    }

    public static Fix primary(String description, List<Edit> edits) {
        if (edits.isEmpty()) {
            return NONE;
        }
        return new Fix(Type.PRIMARY, description, List.copyOf(edits), Collections.emptyList());
    }

    public static Fix suggestions(List<Suggestion> suggestions) {
        if (suggestions.isEmpty()) {
            return NONE;
        }
        return new Fix(Type.SUGGESTIONS, null, Collections.emptyList(), List.copyOf(suggestions));
    }

    /**
     * Turns a primary fix into a single suggestion carrying the same edits.
     */
    public Fix downgrade(String suggestionKind) {
        if (type != Type.PRIMARY) {
            return this;
        }
        return suggestions(List.of(new Suggestion(suggestionKind, description, edits)));
    }

    public Type getType() {
        return type;
    }

    public boolean isPrimary() {
        return type == Type.PRIMARY;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Edits of a primary fix; empty otherwise.
     */
    public List<Edit> getEdits() {
        return edits;
    }

    public List<Suggestion> getSuggestions() {
        return suggestions;
    }
}

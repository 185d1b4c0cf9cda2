package com.signallint.plugins.react.scope;

import com.signallint.plugins.react.tree.JsNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A declared name and every identifier that refers to it.
 */
public final class Binding {
    private final String name;
    private final JsNode identifier;
    private final LexicalScope scope;
    private final List<JsNode> references = new ArrayList<>();

    Binding(String name, JsNode identifier, LexicalScope scope) {
        this.name = name;
        this.identifier = identifier;
        this.scope = scope;
    }

    public String getName() {
        return name;
    }

    /**
     * The declaring identifier.
     */
    public JsNode getIdentifier() {
        return identifier;
    }

    public LexicalScope getScope() {
        return scope;
    }

    /**
     * Referencing identifiers in source order, the declaration excluded.
     */
    public List<JsNode> getReferences() {
        return Collections.unmodifiableList(references);
    }

    void addReference(JsNode reference) {
        references.add(reference);
    }

    @Override
    public String toString() {
        return name + "@" + identifier.range() + " (" + references.size() + " references)";
    }
}

package com.signallint.plugins.react.scope;

import com.signallint.plugins.react.tree.JsNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A region that owns declarations: the module, a function, a block or a catch clause.
 */
public final class LexicalScope {
    public enum Kind {
        MODULE,
        FUNCTION,
        BLOCK,
        CATCH
    }

    private final Kind kind;
    private final JsNode node;
    private final LexicalScope parent;
    private final Map<String, Binding> bindings = new LinkedHashMap<>();

    LexicalScope(Kind kind, JsNode node, LexicalScope parent) {
        this.kind = kind;
        this.node = node;
        this.parent = parent;
    }

    public Kind getKind() {
        return kind;
    }

    public JsNode getNode() {
        return node;
    }

    public LexicalScope getParent() {
        return parent;
    }

    public Map<String, Binding> getBindings() {
        return Collections.unmodifiableMap(bindings);
    }

    /**
     * Nearest scope that receives {@code var} and function declarations.
     */
    LexicalScope functionScope() {
        LexicalScope current = this;
        while (current.kind != Kind.FUNCTION && current.kind != Kind.MODULE) {
            current = current.parent;
        }
        return current;
    }

    Binding declare(String name, JsNode identifier) {
        return bindings.computeIfAbsent(name, key -> new Binding(key, identifier, this));
    }

    /**
     * Binding visible under {@code name} from this scope, or null.
     */
    public Binding lookup(String name) {
        LexicalScope current = this;
        while (current != null) {
            Binding binding = current.bindings.get(name);
            if (binding != null) {
                return binding;
            }
            current = current.parent;
        }
        return null;
    }

    @Override
    public String toString() {
        return kind + "@" + node.range();
    }
}

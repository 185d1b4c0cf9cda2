package com.signallint.plugins.react.scope;

import com.signallint.plugins.react.traversal.Operation;
import com.signallint.plugins.react.traversal.OperationCounters;
import com.signallint.plugins.react.tree.JsNode;

/**
 * Per-run access to the scope model, built on first use. Only rename fixes need it.
 */
public class ScopeResolver {
    private final JsNode program;
    private final OperationCounters counters;
    private ScopeModel model;

    public ScopeResolver(JsNode program, OperationCounters counters) {
        this.program = program;
        this.counters = counters;
    }

    public Binding bindingOf(JsNode identifier) {
        counters.increment(Operation.SCOPE_LOOKUP);
        return _model().bindingOf(identifier);
    }

    /**
     * Whether {@code name} resolves to any binding at {@code site}.
     */
    public boolean isBoundAt(String name, JsNode site) {
        counters.increment(Operation.SCOPE_LOOKUP);
        return _model().scopeAt(site).lookup(name) != null;
    }

    /**
     * Whether {@code binding} can be renamed to {@code newName} without capturing or being captured:
     * the name must be unbound at the declaration and at every reference, and no existing reference
     * to that name may sit inside the binding's scope.
     */
    public boolean isNameFree(String newName, Binding binding) {
        if (isBoundAt(newName, binding.getIdentifier())) {
            return false;
        }
        for (JsNode reference : binding.getReferences()) {
            if (isBoundAt(newName, reference)) {
                return false;
            }
        }
        JsNode scopeNode = binding.getScope().getNode();
        for (JsNode other : _model().referencesNamed(newName)) {
            if (scopeNode.range().contains(other.range())) {
                return false;
            }
        }
        return true;
    }

    private ScopeModel _model() {
        if (model == null) {
            model = ScopeModel.build(program);
        }
        return model;
    }
}

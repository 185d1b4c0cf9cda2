package com.signallint.plugins.react.context;

import com.signallint.config.AnalysisOptions;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.plugins.react.tree.Nodes;

import java.util.Set;

/**
 * Decides whether a function opens an effect callback, a component render body or a hook body.
 */
public class FrameClassifier {
    private static final Set<String> COMPONENT_WRAPPERS = Set.of("memo", "forwardRef", "observer");
    private static final String REACT_NAMESPACE = "React";

    private final AnalysisOptions options;

    public FrameClassifier(AnalysisOptions options) {
        this.options = options;
    }

    /**
     * Result of classifying one function.
     */
    public static final class Classification {
        private final ScopeKind kind;
        private final String label;

        Classification(ScopeKind kind, String label) {
            this.kind = kind;
            this.label = label;
        }

        public ScopeKind getKind() {
            return kind;
        }

        public String getLabel() {
            return label;
        }
    }

    /**
     * Classifies a function node; returns null for a plain function.
     */
    public Classification classify(JsNode function) {
        String effectCallee = effectCalleeOf(function);
        if (effectCallee != null) {
            return new Classification(ScopeKind.EFFECT_CALLBACK, effectCallee);
        }

        String name = boundName(function);
        if (name == null || name.isEmpty()) {
            return null;
        }
        if (Character.isUpperCase(name.charAt(0))) {
            return new Classification(ScopeKind.COMPONENT_RENDER, name);
        }
        if (options.isHookName(name)) {
            return new Classification(ScopeKind.HOOK_BODY, name);
        }
        return null;
    }

    /**
     * Name of the effect-like callee when the function is its first argument, else null.
     */
    public String effectCalleeOf(JsNode function) {
        JsNode argument = Nodes.outermostWrapper(function);
        JsNode call = argument.parent();
        if (call == null || call.kind() != NodeKind.CALL_EXPRESSION
                || argument.parentField() != Field.ARGUMENTS || argument.indexInParent() != 0) {
            return null;
        }
        return isEffectCall(call) ? Nodes.calleeName(call) : null;
    }

    /**
     * Whether a call targets an effect-like hook, bare or {@code React.}-qualified.
     */
    public boolean isEffectCall(JsNode call) {
        String callee = Nodes.calleeName(call);
        if (callee == null || !options.getEffectCallees().contains(callee)) {
            return false;
        }
        JsNode calleeNode = call.child(Field.CALLEE).unwrap();
        return calleeNode.kind() == NodeKind.IDENTIFIER || REACT_NAMESPACE.equals(Nodes.calleeObjectName(call));
    }

    /**
     * The name a function is bound to: its own id, or the variable or assignment target it initializes,
     * looking through wrapper calls such as {@code memo(...)} and {@code forwardRef(...)}.
     */
    public String boundName(JsNode function) {
        JsNode id = function.child(Field.ID);
        if (id != null && id.name() != null) {
            return id.name();
        }

        JsNode current = Nodes.outermostWrapper(function);
        JsNode parent = current.parent();
        while (parent != null && parent.kind() == NodeKind.CALL_EXPRESSION
                && current.parentField() == Field.ARGUMENTS && _isComponentWrapper(parent)) {
            current = Nodes.outermostWrapper(parent);
            parent = current.parent();
        }
        if (parent == null) {
            return null;
        }

        if (parent.kind() == NodeKind.VARIABLE_DECLARATOR && current.parentField() == Field.INIT) {
            JsNode target = parent.child(Field.ID);
            return target.kind() == NodeKind.IDENTIFIER ? target.name() : null;
        }
        if (parent.kind() == NodeKind.ASSIGNMENT_EXPRESSION && current.parentField() == Field.RIGHT) {
            JsNode target = parent.child(Field.LEFT).unwrap();
            return target.kind() == NodeKind.IDENTIFIER ? target.name() : null;
        }
        return null;
    }

    private static boolean _isComponentWrapper(JsNode call) {
        String callee = Nodes.calleeName(call);
        if (callee == null || !COMPONENT_WRAPPERS.contains(callee)) {
            return false;
        }
        JsNode calleeNode = call.child(Field.CALLEE).unwrap();
        return calleeNode.kind() == NodeKind.IDENTIFIER || REACT_NAMESPACE.equals(Nodes.calleeObjectName(call));
    }
}

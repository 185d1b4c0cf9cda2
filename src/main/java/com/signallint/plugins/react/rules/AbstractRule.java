package com.signallint.plugins.react.rules;

import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.Policy;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.plugins.react.tree.Nodes;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Identity and dispatch data shared by all rules, plus small structural helpers.
 */
abstract class AbstractRule implements Policy {
    private final String ruleId;
    private final int specificity;
    private final Set<NodeKind> triggers;
    private final List<FindingKind> kinds;

    protected AbstractRule(String ruleId, int specificity, Set<NodeKind> triggers, FindingKind... kinds) {
        this.ruleId = ruleId;
        this.specificity = specificity;
        this.triggers = EnumSet.copyOf(triggers);
        this.kinds = List.of(kinds);
    }

    @Override
    public String ruleId() {
        return ruleId;
    }

    @Override
    public int specificity() {
        return specificity;
    }

    @Override
    public Set<NodeKind> triggers() {
        return triggers;
    }

    @Override
    public List<FindingKind> kinds() {
        return kinds;
    }

    protected boolean enabled(PolicyContext context, FindingKind kind) {
        return context.isEnabled(this, kind);
    }

    /**
     * Whether a node sits in the dependency list (second argument) of a hook call,
     * without crossing a function boundary.
     */
    static boolean isInDependencyArray(JsNode node) {
        JsNode current = node;
        JsNode parent = current.parent();
        while (parent != null && !parent.kind().isFunction()) {
            if (parent.kind() == NodeKind.ARRAY_EXPRESSION) {
                JsNode array = parent;
                JsNode call = array.parent();
                if (call != null && call.kind() == NodeKind.CALL_EXPRESSION && array.parentField() == Field.ARGUMENTS
                        && array.indexInParent() >= 1) {
                    return true;
                }
            }
            current = parent;
            parent = current.parent();
        }
        return false;
    }

    /**
     * The expression statement holding an expression directly, or null.
     */
    static JsNode enclosingExpressionStatement(JsNode expression) {
        JsNode parent = Nodes.outermostWrapper(expression).parent();
        return parent != null && parent.kind() == NodeKind.EXPRESSION_STATEMENT ? parent : null;
    }
}

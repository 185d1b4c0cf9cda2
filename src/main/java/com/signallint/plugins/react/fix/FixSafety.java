package com.signallint.plugins.react.fix;

import com.signallint.api.Fix;
import com.signallint.plugins.react.traversal.Operation;
import com.signallint.plugins.react.traversal.OperationCounters;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.Flag;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.plugins.react.tree.Nodes;

/**
 * Decides whether a primary fix may be applied automatically at its target expression.
 */
public class FixSafety {
    private final OperationCounters counters;

    public FixSafety(OperationCounters counters) {
        this.counters = counters;
    }

    /**
     * Returns the fix unchanged when it is safe, or downgraded to a suggestion when the target is
     * optional-chained, written to, or (for fixes that add or remove calls) evaluated conditionally.
     */
    public Fix guard(Fix fix, JsNode target, boolean changesCalls, String suggestionKind) {
        if (!fix.isPrimary()) {
            return fix;
        }
        if (isOptionalChained(target) || Nodes.isWriteTarget(target)
                || (changesCalls && isConditionallyEvaluated(target))) {
            counters.increment(Operation.FIX_DOWNGRADED);
            return fix.downgrade(suggestionKind);
        }
        return fix;
    }

    /**
     * Whether the expression is part of an optional chain ({@code a?.b}, {@code a?.()}).
     */
    public static boolean isOptionalChained(JsNode target) {
        if (target.kind() == NodeKind.CHAIN_EXPRESSION
                || Nodes.outermostWrapper(target).kind() == NodeKind.CHAIN_EXPRESSION) {
            return true;
        }
        JsNode current = target.unwrap();
        while (current != null && (current.kind() == NodeKind.MEMBER_EXPRESSION
                || current.kind() == NodeKind.CALL_EXPRESSION)) {
            if (current.has(Flag.OPTIONAL)) {
                return true;
            }
            JsNode next = current.kind() == NodeKind.MEMBER_EXPRESSION
                    ? current.child(Field.OBJECT) : current.child(Field.CALLEE);
            current = next != null ? next.unwrap() : null;
        }
        return false;
    }

    /**
     * Whether the expression sits in the right operand of a short-circuit or a branch of a
     * conditional within its own statement.
     */
    public static boolean isConditionallyEvaluated(JsNode target) {
        JsNode current = target;
        JsNode parent = current.parent();
        while (parent != null && !parent.kind().isFunction()) {
            Field field = current.parentField();
            if (parent.kind() == NodeKind.LOGICAL_EXPRESSION && field == Field.RIGHT) {
                return true;
            }
            if (parent.kind() == NodeKind.CONDITIONAL_EXPRESSION && field != Field.TEST) {
                return true;
            }
            if (parent.kind() == NodeKind.ASSIGNMENT_EXPRESSION && field == Field.RIGHT
                    && parent.operator() != null && !"=".equals(parent.operator())
                    && (parent.operator().startsWith("&&") || parent.operator().startsWith("||")
                    || parent.operator().startsWith("??"))) {
                return true;
            }
            if (Nodes.isStatement(parent)) {
                return false;
            }
            current = parent;
            parent = current.parent();
        }
        return false;
    }
}

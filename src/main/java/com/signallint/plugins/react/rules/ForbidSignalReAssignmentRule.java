package com.signallint.plugins.react.rules;

import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.provenance.Handle;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reports a handle copied into another identifier, whether by declaration, plain assignment or a
 * parameter default.
 */
public class ForbidSignalReAssignmentRule extends AbstractRule {
    public static final String RULE_ID = "forbid-signal-re-assignment";

    static final FindingKind REASSIGN_SIGNAL = new FindingKind("reassignSignal", Severity.ERROR,
            "Avoid re-assigning or aliasing signal '{{ name }}'. Access its '.value' or pass it directly instead.");

    public ForbidSignalReAssignmentRule() {
        super(RULE_ID, 10, Set.of(NodeKind.VARIABLE_DECLARATOR, NodeKind.ASSIGNMENT_EXPRESSION,
                NodeKind.ASSIGNMENT_PATTERN), REASSIGN_SIGNAL);
    }

    @Override
    public Optional<Finding> evaluate(JsNode node, PolicyContext context) {
        JsNode target;
        JsNode source;
        switch (node.kind()) {
            case VARIABLE_DECLARATOR:
                target = node.child(Field.ID);
                source = node.child(Field.INIT);
                break;
            case ASSIGNMENT_EXPRESSION:
                if (!"=".equals(node.operator())) {
                    return Optional.empty();
                }
                target = node.child(Field.LEFT);
                source = node.child(Field.RIGHT);
                break;
            default:
                target = node.child(Field.LEFT);
                source = node.child(Field.RIGHT);
                break;
        }
        if (target == null || source == null || target.unwrap().kind() != NodeKind.IDENTIFIER) {
            return Optional.empty();
        }

        JsNode value = source.unwrap();
        if (value.kind() != NodeKind.IDENTIFIER && value.kind() != NodeKind.MEMBER_EXPRESSION) {
            return Optional.empty();
        }
        Optional<Handle> handle = context.handles().isHandle(value);
        if (handle.isEmpty()) {
            return Optional.empty();
        }
        String name = value.kind() == NodeKind.IDENTIFIER ? value.name() : context.textOf(value);
        return context.report(this, REASSIGN_SIGNAL, node, Map.of("name", name));
    }
}

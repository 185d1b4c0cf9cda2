package com.signallint.plugins.react.rules;

import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.provenance.CreatorCall;
import com.signallint.plugins.react.provenance.Handle;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Destructuring a handle reads its fields once and loses reactivity.
 */
public class ForbidSignalDestructuringRule extends AbstractRule {
    public static final String RULE_ID = "forbid-signal-destructuring";

    static final FindingKind DESTRUCTURE_SIGNAL = new FindingKind("destructureSignal", Severity.ERROR,
            "Avoid destructuring from signal '{{ name }}'. Read from '.value' or use direct member access instead.");

    public ForbidSignalDestructuringRule() {
        super(RULE_ID, 10, Set.of(NodeKind.OBJECT_PATTERN, NodeKind.ARRAY_PATTERN), DESTRUCTURE_SIGNAL);
    }

    @Override
    public Optional<Finding> evaluate(JsNode node, PolicyContext context) {
        JsNode source = _sourceOf(node);
        if (source == null) {
            return Optional.empty();
        }
        JsNode value = source.unwrap();
        String name = _handleName(value, context);
        if (name == null) {
            return Optional.empty();
        }
        return context.report(this, DESTRUCTURE_SIGNAL, node, Map.of("name", name));
    }

    /**
     * The expression a pattern is matched against, when the pattern is the whole left side.
     */
    private static JsNode _sourceOf(JsNode pattern) {
        JsNode parent = pattern.parent();
        if (parent == null) {
            return null;
        }
        Field field = pattern.parentField();
        switch (parent.kind()) {
            case VARIABLE_DECLARATOR:
                return field == Field.ID ? parent.child(Field.INIT) : null;
            case ASSIGNMENT_EXPRESSION:
            case ASSIGNMENT_PATTERN:
                return field == Field.LEFT ? parent.child(Field.RIGHT) : null;
            default:
                return null;
        }
    }

    private static String _handleName(JsNode value, PolicyContext context) {
        Optional<CreatorCall> creator = context.handles().creatorCall(value);
        if (creator.isPresent()) {
            return creator.get().getBaseName() + "()";
        }
        if (value.kind() == NodeKind.IDENTIFIER || value.kind() == NodeKind.MEMBER_EXPRESSION) {
            Optional<Handle> handle = context.handles().isHandle(value);
            if (handle.isPresent()) {
                return value.kind() == NodeKind.IDENTIFIER ? value.name() : context.textOf(value);
            }
            return null;
        }
        if ((value.kind() == NodeKind.OBJECT_EXPRESSION || value.kind() == NodeKind.ARRAY_EXPRESSION)
                && context.handles().containsHandle(value)) {
            return value.kind() == NodeKind.OBJECT_EXPRESSION ? "{...}" : "[...]";
        }
        return null;
    }
}

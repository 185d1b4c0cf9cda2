package com.signallint.plugins.react.rules;

import com.signallint.api.Edit;
import com.signallint.api.Fix;
import com.signallint.api.Suggestion;
import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.plugins.react.fix.FixContext;
import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.Flag;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.plugins.react.tree.Nodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Flags writes to a handle's value while a component renders.
 */
public class NoMutationInRenderRule extends AbstractRule {
    public static final String RULE_ID = "no-mutation-in-render";

    private static final String MOVE_HINT = " Move this to an effect or event handler.";

    static final FindingKind VALUE_ASSIGNMENT = new FindingKind("signalValueAssignment", Severity.ERROR,
            "Avoid mutating signal.value directly in render." + MOVE_HINT);
    static final FindingKind VALUE_UPDATE = new FindingKind("signalValueUpdate", Severity.ERROR,
            "Avoid updating signal.value with operators (++, --, +=, etc.) in render." + MOVE_HINT);
    static final FindingKind PROPERTY_ASSIGNMENT = new FindingKind("signalPropertyAssignment", Severity.ERROR,
            "Avoid mutating signal properties directly in render." + MOVE_HINT);
    static final FindingKind ARRAY_INDEX_ASSIGNMENT = new FindingKind("signalArrayIndexAssignment", Severity.ERROR,
            "Avoid mutating array indexes of signal values in render." + MOVE_HINT);
    static final FindingKind NESTED_PROPERTY_ASSIGNMENT = new FindingKind("signalNestedPropertyAssignment",
            Severity.ERROR, "Avoid mutating nested properties of signal values in render." + MOVE_HINT);

    static final Set<String> MUTATING_METHODS = Set.of("push", "pop", "splice", "sort", "reverse", "copyWithin",
            "fill", "shift", "unshift", "set", "add", "delete", "clear");

    public NoMutationInRenderRule() {
        super(RULE_ID, 30,
                Set.of(NodeKind.ASSIGNMENT_EXPRESSION, NodeKind.UPDATE_EXPRESSION, NodeKind.UNARY_EXPRESSION,
                        NodeKind.CALL_EXPRESSION),
                VALUE_ASSIGNMENT, VALUE_UPDATE, PROPERTY_ASSIGNMENT, ARRAY_INDEX_ASSIGNMENT,
                NESTED_PROPERTY_ASSIGNMENT);
    }

    @Override
    public Optional<Finding> evaluate(JsNode node, PolicyContext context) {
        if (!context.context().renderPhase() || context.options().isAllowedFile(context.fileName())) {
            return Optional.empty();
        }

        FindingKind kind = _classify(node, context);
        if (kind == null) {
            return Optional.empty();
        }
        return context.report(this, kind, node, Map.of());
    }

    private FindingKind _classify(JsNode node, PolicyContext context) {
        switch (node.kind()) {
            case ASSIGNMENT_EXPRESSION:
                return _classifyWrite(node.child(Field.LEFT), "=".equals(node.operator()), context);
            case UPDATE_EXPRESSION:
                return _classifyWrite(node.child(Field.ARGUMENT), false, context);
            case UNARY_EXPRESSION:
                return "delete".equals(node.operator())
                        ? _classifyWrite(node.child(Field.ARGUMENT), true, context) : null;
            case CALL_EXPRESSION:
                return _classifyMethodCall(node, context);
            default:
                return null;
        }
    }

    /**
     * Kind for a write to {@code target}: the {@code .value} itself, an index of it or a property below it.
     */
    private FindingKind _classifyWrite(JsNode target, boolean plainAssignment, PolicyContext context) {
        JsNode member = target.unwrap();
        if (member.kind() != NodeKind.MEMBER_EXPRESSION) {
            return null;
        }
        if (context.handles().valueAccessTarget(member).isPresent()) {
            return plainAssignment ? VALUE_ASSIGNMENT : VALUE_UPDATE;
        }
        if (!_hasHandleValueBelow(member.child(Field.OBJECT), context)) {
            return null;
        }
        return member.has(Flag.COMPUTED) ? ARRAY_INDEX_ASSIGNMENT : NESTED_PROPERTY_ASSIGNMENT;
    }

    private FindingKind _classifyMethodCall(JsNode call, PolicyContext context) {
        JsNode callee = call.child(Field.CALLEE).unwrap();
        if (callee.kind() != NodeKind.MEMBER_EXPRESSION || callee.has(Flag.COMPUTED)
                || !MUTATING_METHODS.contains(Nodes.propertyName(callee))) {
            return null;
        }
        return _hasHandleValueBelow(callee.child(Field.OBJECT), context) ? PROPERTY_ASSIGNMENT : null;
    }

    private static boolean _hasHandleValueBelow(JsNode object, PolicyContext context) {
        JsNode current = object != null ? object.unwrap() : null;
        while (current != null && current.kind() == NodeKind.MEMBER_EXPRESSION) {
            if (context.handles().valueAccessTarget(current).isPresent()) {
                return true;
            }
            current = current.child(Field.OBJECT).unwrap();
        }
        return false;
    }

    @Override
    public Fix composeFix(Finding finding, JsNode node, FixContext fixes) {
        if (!fixes.options().ruleFlag(RULE_ID, "unsafeAutofix", false)) {
            return Fix.none();
        }
        JsNode statement = enclosingExpressionStatement(node);
        if (statement == null) {
            return Fix.none();
        }
        String body = fixes.textOf(node);
        List<Suggestion> suggestions = new ArrayList<>();

        String effectGroup = fixes.newGroup();
        List<Edit> effectEdits = new ArrayList<>(
                fixes.imports().ensureNamedImport("useEffect", FixContext.REACT_MODULE, effectGroup));
        effectEdits.add(fixes.replace(statement, "useEffect(() => { " + body + "; }, []);", effectGroup));
        suggestions.add(new Suggestion("suggestUseEffect", "Wrap in useEffect", effectEdits));

        String handlerGroup = fixes.newGroup();
        suggestions.add(new Suggestion("suggestEventHandler", "Move to event handler",
                List.of(fixes.replace(statement, "const handleEvent = () => { " + body + "; };", handlerGroup))));
        return Fix.suggestions(suggestions);
    }
}

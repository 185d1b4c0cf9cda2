package com.signallint.plugins.react.rules;

import com.signallint.api.Fix;
import com.signallint.api.Suggestion;
import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.plugins.react.context.ScopeKind;
import com.signallint.plugins.react.fix.FixContext;
import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.Flag;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.plugins.react.tree.Nodes;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Inside effect callbacks, handle reads should not subscribe: {@code h.value} and bare operand uses
 * of {@code h} become {@code h.peek()}.
 */
public class PreferSignalMethodsRule extends AbstractRule {
    public static final String RULE_ID = "prefer-signal-methods";

    static final FindingKind PREFER_PEEK_IN_EFFECT = new FindingKind("preferPeekInEffect", Severity.WARN,
            "Prefer .peek() when reading signal value without using its reactive value");
    static final FindingKind USE_PEEK_IN_EFFECT = new FindingKind("usePeekInEffect", Severity.WARN,
            "Use signal.peek() to read the current value without subscribing to changes in this effect");

    private static final Set<String> ARITHMETIC_OPERATORS = Set.of("+", "-", "*", "/", "%", "**");

    public PreferSignalMethodsRule() {
        super(RULE_ID, 20, Set.of(NodeKind.MEMBER_EXPRESSION, NodeKind.IDENTIFIER),
                PREFER_PEEK_IN_EFFECT, USE_PEEK_IN_EFFECT);
    }

    @Override
    public Optional<Finding> evaluate(JsNode node, PolicyContext context) {
        if (context.context().currentKind() != ScopeKind.EFFECT_CALLBACK || isInDependencyArray(node)) {
            return Optional.empty();
        }
        if (node.kind() == NodeKind.MEMBER_EXPRESSION) {
            return _valueRead(node, context);
        }
        return _bareOperand(node, context);
    }

    private Optional<Finding> _valueRead(JsNode member, PolicyContext context) {
        if (!enabled(context, PREFER_PEEK_IN_EFFECT) || Nodes.isWriteTarget(member) || _isMutatedBelow(member)
                || context.handles().valueAccessTarget(member).isEmpty()) {
            return Optional.empty();
        }
        return context.report(this, PREFER_PEEK_IN_EFFECT, member.child(Field.PROPERTY), Map.of());
    }

    private Optional<Finding> _bareOperand(JsNode identifier, PolicyContext context) {
        if (!enabled(context, USE_PEEK_IN_EFFECT) || !Nodes.isReference(identifier) || !_isOperand(identifier)) {
            return Optional.empty();
        }
        if (context.handles().isHandle(identifier).filter(h -> !h.isContainer()).isEmpty()) {
            return Optional.empty();
        }
        return context.report(this, USE_PEEK_IN_EFFECT, identifier, Map.of());
    }

    /**
     * Arithmetic operand or template literal substitution.
     */
    private static boolean _isOperand(JsNode identifier) {
        JsNode outer = Nodes.outermostWrapper(identifier);
        JsNode parent = outer.parent();
        if (parent == null) {
            return false;
        }
        if (parent.kind() == NodeKind.BINARY_EXPRESSION) {
            return ARITHMETIC_OPERATORS.contains(parent.operator());
        }
        return parent.kind() == NodeKind.TEMPLATE_LITERAL && outer.parentField() == Field.EXPRESSIONS;
    }

    /**
     * {@code h.value.x = 1} or {@code h.value.push(x)}: the value is mutated, not read.
     */
    private static boolean _isMutatedBelow(JsNode member) {
        JsNode current = Nodes.outermostWrapper(member);
        JsNode parent = current.parent();
        while (parent != null && parent.kind() == NodeKind.MEMBER_EXPRESSION && current.parentField() == Field.OBJECT) {
            current = Nodes.outermostWrapper(parent);
            parent = current.parent();
        }
        if (current == Nodes.outermostWrapper(member)) {
            return false;
        }
        if (Nodes.isWriteTarget(current)) {
            return true;
        }
        return parent != null && parent.kind() == NodeKind.CALL_EXPRESSION && current.parentField() == Field.CALLEE
                && NoMutationInRenderRule.MUTATING_METHODS.contains(Nodes.propertyName(current.unwrap()));
    }

    @Override
    public Fix composeFix(Finding finding, JsNode node, FixContext fixes) {
        String group = fixes.newGroup();
        Fix fix;
        String description;
        if (node.kind() == NodeKind.MEMBER_EXPRESSION) {
            String object = fixes.textOf(node.child(Field.OBJECT));
            description = "Replace .value with .peek()";
            fix = Fix.primary(description, List.of(fixes.replace(node,
                    object + (node.has(Flag.OPTIONAL) ? "?.peek()" : ".peek()"), group)));
        } else {
            description = "Read " + node.name() + " with .peek()";
            fix = Fix.primary(description, List.of(fixes.replace(node, node.name() + ".peek()", group)));
        }

        if (fixes.options().ruleFlag(RULE_ID, "effectsSuggestionOnly", false)) {
            return Fix.suggestions(List.of(new Suggestion(finding.getKind(), description, fix.getEdits())));
        }
        return fixes.safety().guard(fix, node, true, finding.getKind());
    }
}

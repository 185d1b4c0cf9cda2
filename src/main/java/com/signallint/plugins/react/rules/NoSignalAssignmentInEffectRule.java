package com.signallint.plugins.react.rules;

import com.signallint.api.Edit;
import com.signallint.api.Fix;
import com.signallint.api.Suggestion;
import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.plugins.react.context.ScopeFrame;
import com.signallint.plugins.react.context.ScopeKind;
import com.signallint.plugins.react.fix.FixContext;
import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.plugins.react.tree.Nodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Writes to {@code h.value} inside a React effect run twice under strict mode; {@code useSignalEffect}
 * is the signal-aware replacement.
 */
public class NoSignalAssignmentInEffectRule extends AbstractRule {
    public static final String RULE_ID = "no-signal-assignment-in-effect";

    static final FindingKind AVOID_SIGNAL_ASSIGNMENT_IN_EFFECT = new FindingKind("avoidSignalAssignmentInEffect",
            Severity.WARN, "Avoid direct signal assignments in {{ hookName }}. This can cause unexpected behavior "
                    + "in React 18+ strict mode. Use useSignalEffect instead.");

    private static final String SIGNAL_EFFECT = "useSignalEffect";

    public NoSignalAssignmentInEffectRule() {
        super(RULE_ID, 25, Set.of(NodeKind.ASSIGNMENT_EXPRESSION, NodeKind.UPDATE_EXPRESSION),
                AVOID_SIGNAL_ASSIGNMENT_IN_EFFECT);
    }

    @Override
    public Optional<Finding> evaluate(JsNode node, PolicyContext context) {
        if (context.context().currentKind() != ScopeKind.EFFECT_CALLBACK) {
            return Optional.empty();
        }
        JsNode target = node.kind() == NodeKind.ASSIGNMENT_EXPRESSION
                ? node.child(Field.LEFT) : node.child(Field.ARGUMENT);
        if (target == null || context.handles().valueAccessTarget(target).isEmpty()) {
            return Optional.empty();
        }
        ScopeFrame effect = context.context().innermost(ScopeKind.EFFECT_CALLBACK);
        String hookName = effect != null ? effect.getLabel() : "useEffect";
        return context.report(this, AVOID_SIGNAL_ASSIGNMENT_IN_EFFECT, node, Map.of("hookName", hookName));
    }

    @Override
    public Fix composeFix(Finding finding, JsNode node, FixContext fixes) {
        JsNode call = _effectCall(node, finding.getParams().get("hookName"));
        if (call == null) {
            return Fix.none();
        }

        String group = fixes.newGroup();
        List<Edit> edits = new ArrayList<>();
        JsNode callee = call.child(Field.CALLEE).unwrap();
        edits.add(fixes.replace(callee, SIGNAL_EFFECT, group));

        List<JsNode> arguments = call.children(Field.ARGUMENTS);
        if (arguments.size() > 1) {
            edits.add(fixes.replace(arguments.get(0).end(), arguments.get(arguments.size() - 1).end(), "", group));
        }
        edits.addAll(fixes.imports().ensureNamedImport(SIGNAL_EFFECT, fixes.signalModule(), group));
        return Fix.suggestions(List.of(new Suggestion("suggestUseSignalEffect",
                "Use " + SIGNAL_EFFECT + " instead of " + finding.getParams().get("hookName"), edits)));
    }

    /**
     * The effect call whose callback encloses {@code node}, searching outwards through nested functions.
     */
    private static JsNode _effectCall(JsNode node, String hookName) {
        JsNode current = node.parent();
        while (current != null) {
            if (current.kind().isFunction()) {
                JsNode argument = Nodes.outermostWrapper(current);
                JsNode call = argument.parent();
                if (call != null && call.kind() == NodeKind.CALL_EXPRESSION
                        && argument.parentField() == Field.ARGUMENTS && argument.indexInParent() == 0
                        && hookName != null && hookName.equals(Nodes.calleeName(call))) {
                    return call;
                }
            }
            current = current.parent();
        }
        return null;
    }
}

package com.signallint.plugins.react.rules;

import com.signallint.api.Fix;
import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.plugins.react.context.ScopeKind;
import com.signallint.plugins.react.fix.FixContext;
import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.plugins.react.tree.Nodes;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A handle rendered as a markup child can be passed directly; reading {@code .value} there
 * re-renders the whole component.
 */
public class PreferSignalInJsxRule extends AbstractRule {
    public static final String RULE_ID = "prefer-signal-in-jsx";

    static final FindingKind PREFER_DIRECT_SIGNAL_USAGE = new FindingKind("preferDirectSignalUsage", Severity.WARN,
            "Use the signal directly in JSX instead of accessing .value");

    public PreferSignalInJsxRule() {
        super(RULE_ID, 20, Set.of(NodeKind.MEMBER_EXPRESSION), PREFER_DIRECT_SIGNAL_USAGE);
    }

    @Override
    public Optional<Finding> evaluate(JsNode node, PolicyContext context) {
        if (context.context().currentKind() != ScopeKind.MARKUP_SUBTREE || !Nodes.isMarkupChild(node)
                || Nodes.isWriteTarget(node)) {
            return Optional.empty();
        }
        if (context.handles().valueAccessTarget(node).isEmpty()) {
            return Optional.empty();
        }
        return context.report(this, PREFER_DIRECT_SIGNAL_USAGE, node, Map.of());
    }

    @Override
    public Fix composeFix(Finding finding, JsNode node, FixContext fixes) {
        String object = fixes.textOf(node.child(Field.OBJECT));
        Fix fix = Fix.primary("Replace with " + object,
                List.of(fixes.replace(node, object, fixes.newGroup())));
        if (fixes.options().ruleFlag(RULE_ID, "suggestOnly", false)) {
            return fix.downgrade(finding.getKind());
        }
        return fixes.safety().guard(fix, node, false, finding.getKind());
    }
}

package com.signallint.plugins.react.rules;

import com.signallint.api.Edit;
import com.signallint.api.Fix;
import com.signallint.api.Suggestion;
import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.plugins.react.fix.FixContext;
import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.provenance.CreatorCall;
import com.signallint.plugins.react.provenance.HandleOrigin;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Flags {@code signal()} and {@code computed()} calls made while a component renders; every render
 * would create a fresh handle.
 */
public class NoSignalCreationInComponentRule extends AbstractRule {
    public static final String RULE_ID = "no-signal-creation-in-component";

    static final FindingKind AVOID_SIGNAL_IN_COMPONENT = new FindingKind("avoidSignalInComponent", Severity.ERROR,
            "Avoid creating {{ signalType }} signals inside {{ context }}. "
                    + "Move signal creation to module level or a custom hook.");

    private static final Map<String, String> HOOK_VARIANTS = Map.of("signal", "useSignal", "computed", "useComputed");

    public NoSignalCreationInComponentRule() {
        super(RULE_ID, 20, Set.of(NodeKind.CALL_EXPRESSION), AVOID_SIGNAL_IN_COMPONENT);
    }

    @Override
    public Optional<Finding> evaluate(JsNode node, PolicyContext context) {
        if (!context.context().renderPhase()) {
            return Optional.empty();
        }
        Optional<CreatorCall> creator = context.handles().creatorCall(node);
        if (creator.isEmpty() || creator.get().isHook() || "effect".equals(creator.get().getBaseName())) {
            return Optional.empty();
        }
        String signalType = "signal".equals(creator.get().getBaseName()) ? "reactive" : "computed";
        return context.report(this, AVOID_SIGNAL_IN_COMPONENT, node,
                Map.of("signalType", signalType, "context", "component"));
    }

    @Override
    public Fix composeFix(Finding finding, JsNode node, FixContext fixes) {
        Optional<CreatorCall> creator = fixes.handles().creatorCall(node);
        if (creator.isEmpty()) {
            return Fix.none();
        }
        String hookName = HOOK_VARIANTS.get(creator.get().getBaseName());
        if (hookName == null) {
            return Fix.none();
        }

        JsNode callee = node.child(Field.CALLEE).unwrap();
        String group = fixes.newGroup();
        List<Edit> edits = new ArrayList<>();
        if (creator.get().getOrigin() == HandleOrigin.NAMESPACE_QUALIFIED) {
            edits.add(fixes.replace(callee.child(Field.PROPERTY), hookName, group));
        } else {
            edits.addAll(fixes.imports().ensureNamedImport(hookName, fixes.signalModule(), group));
            edits.add(fixes.replace(callee, hookName, group));
        }
        return Fix.suggestions(List.of(new Suggestion("suggestHookVariant",
                "Use " + hookName + " instead of " + creator.get().getBaseName(), edits)));
    }
}

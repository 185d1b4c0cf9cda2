package com.signallint.plugins.react.rules;

import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.provenance.CreatorCall;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Handles belong at module level of their own files or in custom hooks. Component bodies should not
 * create them, and modules should not export them unless they live in an allowed directory.
 */
public class RestrictSignalLocationsRule extends AbstractRule {
    public static final String RULE_ID = "restrict-signal-locations";

    static final FindingKind SIGNAL_IN_COMPONENT = new FindingKind("signalInComponent", Severity.WARN,
            "Avoid creating signals in component bodies. Move to module level or a custom hook.");
    static final FindingKind COMPUTED_IN_COMPONENT = new FindingKind("computedInComponent", Severity.WARN,
            "Avoid creating computed values in component bodies. Consider using useMemo instead.");
    static final FindingKind EXPORTED_SIGNAL = new FindingKind("exportedSignal", Severity.WARN,
            "Exporting signals from a file often leads to circular imports. Keep signals private to the module "
                    + "and export accessors instead.");

    private static final Set<String> CHECKED_CREATORS = Set.of("signal", "computed");

    public RestrictSignalLocationsRule() {
        super(RULE_ID, 5, Set.of(NodeKind.CALL_EXPRESSION, NodeKind.VARIABLE_DECLARATOR),
                SIGNAL_IN_COMPONENT, COMPUTED_IN_COMPONENT, EXPORTED_SIGNAL);
    }

    @Override
    public Optional<Finding> evaluate(JsNode node, PolicyContext context) {
        if (_inAllowedDir(context)) {
            return Optional.empty();
        }
        if (node.kind() == NodeKind.CALL_EXPRESSION) {
            return _creationInComponent(node, context);
        }
        return _exported(node, context);
    }

    private Optional<Finding> _creationInComponent(JsNode call, PolicyContext context) {
        if (!context.context().renderPhase()) {
            return Optional.empty();
        }
        Optional<CreatorCall> creator = _checkedCreator(call, context);
        if (creator.isEmpty()) {
            return Optional.empty();
        }
        if (creator.get().isComputed()) {
            if (context.options().ruleFlag(RULE_ID, "allowComputedInComponents", false)) {
                return Optional.empty();
            }
            return context.report(this, COMPUTED_IN_COMPONENT, call, Map.of());
        }
        return context.report(this, SIGNAL_IN_COMPONENT, call, Map.of());
    }

    private Optional<Finding> _exported(JsNode declarator, PolicyContext context) {
        JsNode declaration = declarator.parent();
        JsNode export = declaration != null ? declaration.parent() : null;
        if (export == null || export.kind() != NodeKind.EXPORT_NAMED_DECLARATION
                || declaration.kind() != NodeKind.VARIABLE_DECLARATION) {
            return Optional.empty();
        }
        if (_checkedCreator(declarator.child(Field.INIT), context).isEmpty()) {
            return Optional.empty();
        }
        return context.report(this, EXPORTED_SIGNAL, declarator, Map.of());
    }

    private static Optional<CreatorCall> _checkedCreator(JsNode expression, PolicyContext context) {
        if (expression == null) {
            return Optional.empty();
        }
        return context.handles().creatorCall(expression)
                .filter(creator -> !creator.isHook() && CHECKED_CREATORS.contains(creator.getBaseName()));
    }

    private static boolean _inAllowedDir(PolicyContext context) {
        List<String> allowedDirs = context.options().ruleStrings(RULE_ID, "allowedDirs");
        if (allowedDirs.isEmpty() || context.filePath() == null) {
            return false;
        }
        String filePath = context.filePath().replace('\\', '/');
        for (String dir : allowedDirs) {
            if (filePath.contains(dir.replace('\\', '/'))) {
                return true;
            }
        }
        return false;
    }
}

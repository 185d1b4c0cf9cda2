package com.signallint.plugins.react.rules;

import com.signallint.api.Fix;
import com.signallint.api.Suggestion;
import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.plugins.react.fix.AccessorForm;
import com.signallint.plugins.react.fix.FixContext;
import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.MessageTemplates;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.provenance.ProvenanceTracker;
import com.signallint.plugins.react.scope.Binding;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A suffix-named variable holding a plain value misleads both readers and the suffix heuristic.
 * Only active while the heuristic itself is.
 */
public class NoNonSignalWithSignalSuffixRule extends AbstractRule {
    public static final String RULE_ID = "no-non-signal-with-signal-suffix";

    static final FindingKind VARIABLE_WITH_SIGNAL_SUFFIX_NOT_SIGNAL = new FindingKind(
            "variableWithSignalSuffixNotSignal", Severity.WARN,
            "Variable '{{ name }}' has '{{ suffix }}' suffix but is not a signal instance. "
                    + "Use a signal or rename to remove '{{ suffix }}' suffix.");

    private static final String RENAME_TEMPLATE = "Rename '{{ name }}' to '{{ newName }}' to remove '{{ suffix }}' suffix";

    public NoNonSignalWithSignalSuffixRule() {
        super(RULE_ID, 5, Set.of(NodeKind.VARIABLE_DECLARATOR), VARIABLE_WITH_SIGNAL_SUFFIX_NOT_SIGNAL);
    }

    @Override
    public Optional<Finding> evaluate(JsNode node, PolicyContext context) {
        if (!context.handles().isHeuristicGateOpen()) {
            return Optional.empty();
        }
        JsNode id = node.child(Field.ID);
        JsNode init = node.child(Field.INIT);
        if (id == null || init == null || id.kind() != NodeKind.IDENTIFIER
                || !context.options().hasSuffix(id.name())) {
            return Optional.empty();
        }
        JsNode value = init.unwrap();
        if (context.handles().creatorCall(value).isPresent() || context.handles().isHandle(value).isPresent()
                || context.handles().containsHandle(value) || !ProvenanceTracker.isPlainValue(value)) {
            return Optional.empty();
        }
        return context.report(this, VARIABLE_WITH_SIGNAL_SUFFIX_NOT_SIGNAL, id,
                Map.of("name", id.name(), "suffix", context.options().getSuffix()));
    }

    @Override
    public Fix composeFix(Finding finding, JsNode node, FixContext fixes) {
        JsNode id = node.child(Field.ID);
        String suffix = fixes.options().getSuffix();
        String newName = id.name().substring(0, id.name().length() - suffix.length());
        if (newName.isEmpty()) {
            return Fix.none();
        }
        Binding binding = fixes.scopes().bindingOf(id);
        if (binding == null || !fixes.scopes().isNameFree(newName, binding)) {
            return Fix.none();
        }
        String description = MessageTemplates.render(RENAME_TEMPLATE,
                Map.of("name", id.name(), "newName", newName, "suffix", suffix));
        return Fix.suggestions(List.of(new Suggestion("suggestRenameWithoutSuffix", description,
                fixes.rewriter().rename(binding, newName, reference -> AccessorForm.BARE, fixes.newGroup()))));
    }
}

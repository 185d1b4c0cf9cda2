package com.signallint.plugins.react.rules;

import com.signallint.api.Fix;
import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.plugins.react.fix.AccessorForm;
import com.signallint.plugins.react.fix.FixContext;
import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.provenance.CreatorCall;
import com.signallint.plugins.react.scope.Binding;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Handles are named in lower camel case with the configured suffix and without a hook-like {@code use} prefix.
 */
public class SignalVariableNameRule extends AbstractRule {
    public static final String RULE_ID = "signal-variable-name";

    private static final String NAMING_HINT = "should end with '{{ suffix }}', start with lowercase, "
            + "and not start with 'use'";

    static final FindingKind INVALID_SIGNAL_NAME = new FindingKind("invalidSignalName", Severity.ERROR,
            "Signal variable '{{ name }}' " + NAMING_HINT);
    static final FindingKind INVALID_COMPUTED_NAME = new FindingKind("invalidComputedName", Severity.ERROR,
            "Computed variable '{{ name }}' " + NAMING_HINT);

    public SignalVariableNameRule() {
        super(RULE_ID, 15, Set.of(NodeKind.VARIABLE_DECLARATOR), INVALID_SIGNAL_NAME, INVALID_COMPUTED_NAME);
    }

    @Override
    public Optional<Finding> evaluate(JsNode node, PolicyContext context) {
        JsNode id = node.child(Field.ID);
        if (id == null || id.kind() != NodeKind.IDENTIFIER) {
            return Optional.empty();
        }
        Optional<CreatorCall> creator = context.handles().creatorCall(node.child(Field.INIT));
        if (creator.isEmpty() || "effect".equals(creator.get().getBaseName())) {
            return Optional.empty();
        }
        String suffix = context.options().getSuffix();
        if (isValidName(id.name(), suffix)) {
            return Optional.empty();
        }
        FindingKind kind = creator.get().isComputed() ? INVALID_COMPUTED_NAME : INVALID_SIGNAL_NAME;
        return context.report(this, kind, id, Map.of("name", id.name(), "suffix", suffix));
    }

    static boolean isValidName(String name, String suffix) {
        return name.endsWith(suffix) && Character.isLowerCase(name.charAt(0)) && !_hasHookPrefix(name);
    }

    /**
     * {@code useCount} becomes {@code countSignal}; {@code Count} becomes {@code countSignal}.
     */
    static String fixedName(String name, String suffix) {
        String fixed = _hasHookPrefix(name) ? name.substring(3) : name;
        if (!fixed.isEmpty()) {
            fixed = Character.toLowerCase(fixed.charAt(0)) + fixed.substring(1);
        }
        if (!fixed.endsWith(suffix)) {
            fixed += suffix;
        }
        return fixed;
    }

    private static boolean _hasHookPrefix(String name) {
        return name.length() > 3 && name.startsWith("use") && Character.isUpperCase(name.charAt(3));
    }

    @Override
    public Fix composeFix(Finding finding, JsNode node, FixContext fixes) {
        JsNode id = node.child(Field.ID);
        String suffix = fixes.options().getSuffix();
        String newName = fixedName(id.name(), suffix);
        // names like _count or $count cannot be repaired by a rename
        if (!isValidName(newName, suffix)) {
            return Fix.none();
        }
        Binding binding = fixes.scopes().bindingOf(id);
        if (binding == null || !fixes.scopes().isNameFree(newName, binding)) {
            return Fix.none();
        }
        return Fix.primary("Rename '" + id.name() + "' to '" + newName + "'",
                fixes.rewriter().rename(binding, newName, reference -> AccessorForm.BARE, fixes.newGroup()));
    }
}

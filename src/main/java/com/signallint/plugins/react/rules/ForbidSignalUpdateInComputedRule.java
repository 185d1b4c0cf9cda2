package com.signallint.plugins.react.rules;

import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.provenance.CreatorCall;
import com.signallint.plugins.react.provenance.HandleResolver;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.plugins.react.tree.Nodes;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A computed callback derives a value and must not write: no {@code h.value} assignments or updates,
 * no {@code h.set(..)}/{@code h.update(..)}, and no {@code batch(..)} anywhere inside it.
 */
public class ForbidSignalUpdateInComputedRule extends AbstractRule {
    public static final String RULE_ID = "forbid-signal-update-in-computed";

    static final FindingKind NO_SIGNAL_WRITE_IN_COMPUTED = new FindingKind("noSignalWriteInComputed",
            Severity.ERROR, "Do not update signal '{{ name }}' inside computed(). Computed functions must be pure "
                    + "and read-only.");
    static final FindingKind NO_BATCHED_WRITES_IN_COMPUTED = new FindingKind("noBatchedWritesInComputed",
            Severity.ERROR, "Do not batch updates inside computed(). Computed functions must be pure and read-only.");

    private static final Set<String> WRITE_METHODS = Set.of("set", "update");
    private static final String BATCH = "batch";

    public ForbidSignalUpdateInComputedRule() {
        super(RULE_ID, 25, Set.of(NodeKind.ASSIGNMENT_EXPRESSION, NodeKind.UPDATE_EXPRESSION,
                NodeKind.CALL_EXPRESSION), NO_SIGNAL_WRITE_IN_COMPUTED, NO_BATCHED_WRITES_IN_COMPUTED);
    }

    @Override
    public Optional<Finding> evaluate(JsNode node, PolicyContext context) {
        if (computedCallOf(node, context.handles()) == null) {
            return Optional.empty();
        }
        switch (node.kind()) {
            case ASSIGNMENT_EXPRESSION:
                return _valueWrite(node, node.child(Field.LEFT), context);
            case UPDATE_EXPRESSION:
                return _valueWrite(node, node.child(Field.ARGUMENT), context);
            default:
                return _call(node, context);
        }
    }

    private Optional<Finding> _valueWrite(JsNode node, JsNode target, PolicyContext context) {
        if (target == null || context.handles().valueAccessTarget(target).isEmpty()) {
            return Optional.empty();
        }
        JsNode object = target.unwrap().child(Field.OBJECT);
        String name = object != null ? context.textOf(object) : context.textOf(target);
        return context.report(this, NO_SIGNAL_WRITE_IN_COMPUTED, node, Map.of("name", name));
    }

    private Optional<Finding> _call(JsNode call, PolicyContext context) {
        if (_isBatchCall(call, context)) {
            return context.report(this, NO_BATCHED_WRITES_IN_COMPUTED, call, Map.of());
        }
        JsNode callee = call.child(Field.CALLEE).unwrap();
        if (callee.kind() != NodeKind.MEMBER_EXPRESSION || !WRITE_METHODS.contains(Nodes.propertyName(callee))) {
            return Optional.empty();
        }
        JsNode object = callee.child(Field.OBJECT);
        if (context.handles().isHandle(object).filter(h -> !h.isContainer()).isEmpty()) {
            return Optional.empty();
        }
        return context.report(this, NO_SIGNAL_WRITE_IN_COMPUTED, call, Map.of("name", context.textOf(object)));
    }

    private static boolean _isBatchCall(JsNode call, PolicyContext context) {
        if (!BATCH.equals(Nodes.calleeName(call))) {
            return false;
        }
        JsNode callee = call.child(Field.CALLEE).unwrap();
        if (callee.kind() == NodeKind.IDENTIFIER) {
            String module = context.handles().getImportFacts().moduleOf(callee.name());
            return module == null ? context.options().isAllowBareNames() : context.options().getModules().contains(module);
        }
        String namespace = Nodes.calleeObjectName(call);
        return namespace != null && context.handles().getImportFacts().isSignalNamespace(namespace);
    }

    /**
     * The {@code computed(..)} or {@code useComputed(..)} call whose callback encloses {@code node}, or null.
     * Nested functions inside the callback count as part of it.
     */
    static JsNode computedCallOf(JsNode node, HandleResolver handles) {
        JsNode current = node.parent();
        while (current != null) {
            if (current.kind().isFunction()) {
                JsNode argument = Nodes.outermostWrapper(current);
                JsNode call = argument.parent();
                if (call != null && call.kind() == NodeKind.CALL_EXPRESSION
                        && argument.parentField() == Field.ARGUMENTS && argument.indexInParent() == 0
                        && handles.creatorCall(call).filter(CreatorCall::isComputed).isPresent()) {
                    return call;
                }
            }
            current = current.parent();
        }
        return null;
    }
}

package com.signallint.plugins.react.rules;

import com.signallint.api.Fix;
import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.plugins.react.context.ScopeKind;
import com.signallint.plugins.react.fix.FixContext;
import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.Phase;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.provenance.HandleResolver;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.Flag;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.plugins.react.tree.Nodes;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Markup already tracks the handles it renders, so opting out with {@code .peek()} or
 * {@code untracked()} there is redundant. Decided once the call's subtree has been seen.
 */
public class WarnOnUnnecessaryUntrackedRule extends AbstractRule {
    public static final String RULE_ID = "warn-on-unnecessary-untracked";

    static final FindingKind UNNECESSARY_PEEK = new FindingKind("unnecessaryPeek", Severity.WARN,
            "Avoid unnecessary '.peek()' in reactive context");
    static final FindingKind UNNECESSARY_UNTRACKED = new FindingKind("unnecessaryUntracked", Severity.WARN,
            "Avoid unnecessary 'untracked()' in reactive context");

    private static final String UNTRACKED = "untracked";

    public WarnOnUnnecessaryUntrackedRule() {
        super(RULE_ID, 25, Set.of(NodeKind.CALL_EXPRESSION), UNNECESSARY_PEEK, UNNECESSARY_UNTRACKED);
    }

    @Override
    public Phase phase() {
        return Phase.EXIT;
    }

    @Override
    public Optional<Finding> evaluate(JsNode node, PolicyContext context) {
        if (context.context().currentKind() != ScopeKind.MARKUP_SUBTREE) {
            return Optional.empty();
        }
        if (_isPeekCall(node, context.handles())) {
            return context.report(this, UNNECESSARY_PEEK, node, Map.of());
        }
        if (_isUntrackedCall(node, context.handles())) {
            JsNode body = _untrackedBody(node);
            if (body != null && _readsHandle(body, context.handles())) {
                return context.report(this, UNNECESSARY_UNTRACKED, node, Map.of());
            }
        }
        return Optional.empty();
    }

    private static boolean _isPeekCall(JsNode call, HandleResolver handles) {
        JsNode callee = call.child(Field.CALLEE).unwrap();
        if (!call.children(Field.ARGUMENTS).isEmpty() || callee.kind() != NodeKind.MEMBER_EXPRESSION
                || !"peek".equals(Nodes.propertyName(callee))) {
            return false;
        }
        return handles.isHandle(callee.child(Field.OBJECT)).filter(h -> !h.isContainer()).isPresent();
    }

    private static boolean _isUntrackedCall(JsNode call, HandleResolver handles) {
        if (!UNTRACKED.equals(Nodes.calleeName(call)) || call.children(Field.ARGUMENTS).size() != 1) {
            return false;
        }
        JsNode callee = call.child(Field.CALLEE).unwrap();
        if (callee.kind() == NodeKind.IDENTIFIER) {
            return true;
        }
        String namespace = Nodes.calleeObjectName(call);
        return namespace != null && handles.getImportFacts().isSignalNamespace(namespace);
    }

    /**
     * Body of {@code untracked(() => expr)} or {@code untracked(() => { return expr; })}, else null.
     */
    private static JsNode _untrackedBody(JsNode call) {
        JsNode callback = call.children(Field.ARGUMENTS).get(0);
        if (callback == null || !callback.kind().isFunction() || !callback.children(Field.PARAMS).isEmpty()) {
            return null;
        }
        JsNode body = callback.child(Field.BODY);
        if (body == null) {
            return null;
        }
        if (body.kind() != NodeKind.BLOCK_STATEMENT) {
            return body;
        }
        List<JsNode> statements = body.children(Field.BODY);
        if (statements.size() == 1 && statements.get(0).kind() == NodeKind.RETURN_STATEMENT) {
            return statements.get(0).child(Field.ARGUMENT);
        }
        return null;
    }

    private static boolean _readsHandle(JsNode body, HandleResolver handles) {
        Deque<JsNode> pending = new ArrayDeque<>();
        pending.push(body);
        while (!pending.isEmpty()) {
            JsNode node = pending.pop();
            if (node.kind().isFunction()) {
                continue;
            }
            if (node.kind() == NodeKind.IDENTIFIER && Nodes.isReference(node) && handles.isHandle(node).isPresent()) {
                return true;
            }
            if (node.kind() == NodeKind.MEMBER_EXPRESSION && handles.isHandle(node).isPresent()) {
                return true;
            }
            for (JsNode child : node.children()) {
                pending.push(child);
            }
        }
        return false;
    }

    @Override
    public Fix composeFix(Finding finding, JsNode node, FixContext fixes) {
        String group = fixes.newGroup();
        Fix fix;
        if (UNNECESSARY_PEEK.getId().equals(finding.getKind())) {
            JsNode object = node.child(Field.CALLEE).unwrap().child(Field.OBJECT);
            String text = fixes.textOf(object);
            fix = Fix.primary("Replace with " + text, List.of(fixes.replace(node, text, group)));
            if (!Nodes.isMarkupChild(node)) {
                return fix.downgrade(finding.getKind());
            }
        } else {
            JsNode body = _untrackedBody(node);
            if (body == null || node.children(Field.ARGUMENTS).get(0).has(Flag.ASYNC)) {
                return Fix.none();
            }
            String text = fixes.textOf(body);
            if (body.kind() == NodeKind.SEQUENCE_EXPRESSION || body.kind() == NodeKind.OBJECT_EXPRESSION) {
                text = "(" + text + ")";
            }
            fix = Fix.primary("Inline the untracked expression", List.of(fixes.replace(node, text, group)));
        }
        return fixes.safety().guard(fix, node, true, finding.getKind());
    }
}

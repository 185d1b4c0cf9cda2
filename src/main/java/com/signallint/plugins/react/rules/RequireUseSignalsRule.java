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
import com.signallint.plugins.react.policy.Phase;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.provenance.HandleResolver;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.plugins.react.tree.Nodes;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Without the signals transform, a component only re-renders on handle changes after calling
 * {@code useSignals()}. Off unless configured, since projects using the transform never call it.
 */
public class RequireUseSignalsRule extends AbstractRule {
    public static final String RULE_ID = "require-use-signals";

    static final FindingKind MISSING_USE_SIGNALS = new FindingKind("missingUseSignals", Severity.OFF,
            "Component '{{ componentName }}' reads signals; call useSignals() to subscribe for updates");

    static final String USE_SIGNALS = "useSignals";
    static final String RUNTIME_MODULE = "@preact/signals-react/runtime";

    public RequireUseSignalsRule() {
        super(RULE_ID, 5, Set.of(NodeKind.FUNCTION_DECLARATION, NodeKind.FUNCTION_EXPRESSION,
                NodeKind.ARROW_FUNCTION_EXPRESSION), MISSING_USE_SIGNALS);
    }

    @Override
    public Phase phase() {
        return Phase.EXIT;
    }

    @Override
    public Optional<Finding> evaluate(JsNode node, PolicyContext context) {
        ScopeFrame frame = context.context().topFrame();
        if (frame == null || frame.getOwner() != node || frame.getKind() != ScopeKind.COMPONENT_RENDER) {
            return Optional.empty();
        }
        String componentName = frame.getLabel();
        if (context.options().ruleStrings(RULE_ID, "ignoreComponents").contains(componentName)) {
            return Optional.empty();
        }
        JsNode body = node.child(Field.BODY);
        JsNode nameNode = _nameNode(node);
        if (body == null || nameNode == null || _callsUseSignals(body) || !_readsHandle(body, context.handles())) {
            return Optional.empty();
        }
        return context.report(this, MISSING_USE_SIGNALS, nameNode, Map.of("componentName", componentName));
    }

    /**
     * The identifier naming a component: its own id, or the variable it is assigned to through wrappers.
     */
    private static JsNode _nameNode(JsNode function) {
        JsNode id = function.child(Field.ID);
        if (id != null) {
            return id;
        }
        JsNode current = Nodes.outermostWrapper(function);
        JsNode parent = current.parent();
        while (parent != null && parent.kind() == NodeKind.CALL_EXPRESSION && current.parentField() == Field.ARGUMENTS) {
            current = Nodes.outermostWrapper(parent);
            parent = current.parent();
        }
        if (parent != null && parent.kind() == NodeKind.VARIABLE_DECLARATOR && current.parentField() == Field.INIT) {
            return parent.child(Field.ID);
        }
        if (parent != null && parent.kind() == NodeKind.ASSIGNMENT_EXPRESSION && current.parentField() == Field.RIGHT) {
            return parent.child(Field.LEFT);
        }
        return null;
    }

    private static boolean _callsUseSignals(JsNode body) {
        for (JsNode call : _descendants(body, NodeKind.CALL_EXPRESSION)) {
            if (USE_SIGNALS.equals(Nodes.calleeName(call))) {
                return true;
            }
        }
        return false;
    }

    private static boolean _readsHandle(JsNode body, HandleResolver handles) {
        for (JsNode identifier : _descendants(body, NodeKind.IDENTIFIER)) {
            if (Nodes.isReference(identifier) && !Nodes.isPatternPosition(identifier)
                    && handles.isHandle(identifier).isPresent()) {
                return true;
            }
        }
        return false;
    }

    private static List<JsNode> _descendants(JsNode root, NodeKind kind) {
        List<JsNode> found = new ArrayList<>();
        Deque<JsNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            JsNode node = pending.pop();
            if (node.kind() == kind) {
                found.add(node);
            }
            for (JsNode child : node.children()) {
                pending.push(child);
            }
        }
        return found;
    }

    @Override
    public Fix composeFix(Finding finding, JsNode node, FixContext fixes) {
        JsNode body = node.child(Field.BODY);
        String group = fixes.newGroup();
        List<Edit> edits = new ArrayList<>();
        if (body.kind() == NodeKind.BLOCK_STATEMENT) {
            edits.add(_insertIntoBlock(body, fixes, group));
        } else {
            String indent = _indentOf(fixes.ast().getSourceCode(), node.start());
            edits.add(fixes.replace(body, "{\n" + indent + "  " + USE_SIGNALS + "();\n" + indent + "  return "
                    + fixes.textOf(body) + ";\n" + indent + "}", group));
        }
        edits.addAll(fixes.imports().ensureNamedImport(USE_SIGNALS, RUNTIME_MODULE, group));
        return Fix.suggestions(List.of(new Suggestion("addUseSignals",
                "Call useSignals() in " + finding.getParams().get("componentName"), edits)));
    }

    private static Edit _insertIntoBlock(JsNode block, FixContext fixes, String group) {
        String source = fixes.ast().getSourceCode();
        JsNode first = null;
        JsNode lastDirective = null;
        for (JsNode statement : block.children(Field.BODY)) {
            if (!_isDirective(statement)) {
                first = statement;
                break;
            }
            lastDirective = statement;
        }
        if (first != null) {
            String indent = _indentOf(source, first.start());
            return fixes.replace(first.start(), first.start(), USE_SIGNALS + "();\n" + indent, group);
        }
        if (lastDirective != null) {
            String indent = _indentOf(source, lastDirective.start());
            return fixes.replace(lastDirective.end(), lastDirective.end(), "\n" + indent + USE_SIGNALS + "();", group);
        }
        int open = block.start() + 1;
        return fixes.replace(open, open, " " + USE_SIGNALS + "(); ", group);
    }

    private static boolean _isDirective(JsNode statement) {
        if (statement.kind() != NodeKind.EXPRESSION_STATEMENT) {
            return false;
        }
        JsNode expression = statement.child(Field.EXPRESSION);
        return expression.kind() == NodeKind.LITERAL && expression.stringValue() != null;
    }

    /**
     * Whitespace between the start of the line and {@code offset}, or nothing if code precedes it.
     */
    private static String _indentOf(String source, int offset) {
        int lineStart = source.lastIndexOf('\n', offset - 1) + 1;
        String prefix = source.substring(lineStart, offset);
        return prefix.isBlank() ? prefix : "";
    }
}

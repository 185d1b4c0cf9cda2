package com.signallint.plugins.react.rules;

import com.signallint.api.Edit;
import com.signallint.api.Fix;
import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.plugins.react.context.ScopeKind;
import com.signallint.plugins.react.fix.FixContext;
import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.PolicyContext;
import com.signallint.plugins.react.scope.Binding;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.plugins.react.tree.Nodes;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Suggests replacing {@code const [x, setX] = useState(v)} with a {@code useSignal} handle and, when every
 * setter use is a plain one-argument call, rewrites reads and setter calls to match.
 */
public class PreferUseSignalOverUseStateRule extends AbstractRule {
    public static final String RULE_ID = "prefer-use-signal-over-use-state";

    static final FindingKind PREFER_USE_SIGNAL = new FindingKind("preferUseSignal", Severity.WARN,
            "Prefer useSignal over useState for {{ type }} values");

    private static final String USE_STATE = "useState";
    private static final String USE_SIGNAL = "useSignal";

    private static final Set<NodeKind> SIMPLE_INITIALIZERS = EnumSet.of(NodeKind.LITERAL, NodeKind.IDENTIFIER,
            NodeKind.MEMBER_EXPRESSION, NodeKind.UNARY_EXPRESSION, NodeKind.BINARY_EXPRESSION,
            NodeKind.CONDITIONAL_EXPRESSION, NodeKind.TEMPLATE_LITERAL);

    public PreferUseSignalOverUseStateRule() {
        super(RULE_ID, 15, Set.of(NodeKind.VARIABLE_DECLARATOR), PREFER_USE_SIGNAL);
    }

    @Override
    public Optional<Finding> evaluate(JsNode node, PolicyContext context) {
        ScopeKind kind = context.context().currentKind();
        if (kind != ScopeKind.COMPONENT_RENDER && kind != ScopeKind.HOOK_BODY) {
            return Optional.empty();
        }
        JsNode call = _useStateCall(node);
        if (call == null || _stateIdentifiers(node) == null) {
            return Optional.empty();
        }

        List<JsNode> arguments = call.children(Field.ARGUMENTS);
        JsNode initial = arguments.isEmpty() ? null : arguments.get(0);
        if (initial != null && context.options().ruleFlag(RULE_ID, "ignoreComplexInitializers", true)
                && !SIMPLE_INITIALIZERS.contains(initial.unwrap().kind())) {
            return Optional.empty();
        }
        return context.report(this, PREFER_USE_SIGNAL, call, Map.of("type", valueType(initial)));
    }

    /**
     * The JavaScript {@code typeof} of a literal initial value, or {@code state} for anything else.
     */
    static String valueType(JsNode initial) {
        if (initial == null) {
            return "state";
        }
        JsNode value = initial.unwrap();
        if (value.kind() == NodeKind.TEMPLATE_LITERAL) {
            return "string";
        }
        if (value.kind() != NodeKind.LITERAL || value.raw() == null) {
            return "state";
        }
        String raw = value.raw();
        if (!raw.isEmpty() && Character.isDigit(raw.charAt(0)) && raw.endsWith("n")) {
            return "bigint";
        }
        if (value.stringValue() != null) {
            return "string";
        }
        switch (value.raw()) {
            case "true":
            case "false":
                return "boolean";
            case "null":
                return "object";
            default:
                if (value.raw().startsWith("/")) {
                    return "object";
                }
                return "number";
        }
    }

    @Override
    public Fix composeFix(Finding finding, JsNode declarator, FixContext fixes) {
        JsNode call = _useStateCall(declarator);
        JsNode[] ids = _stateIdentifiers(declarator);
        if (call == null || ids == null) {
            return Fix.none();
        }
        Binding state = fixes.scopes().bindingOf(ids[0]);
        Binding setter = fixes.scopes().bindingOf(ids[1]);
        if (state == null || setter == null) {
            return Fix.none();
        }
        String newName = ids[0].name() + fixes.options().getSuffix();
        if (!fixes.scopes().isNameFree(newName, state)) {
            return Fix.none();
        }

        List<JsNode> setterCalls = new ArrayList<>();
        for (JsNode reference : setter.getReferences()) {
            JsNode setterCall = _plainSetterCall(reference);
            if (setterCall == null) {
                return Fix.none();
            }
            setterCalls.add(setterCall);
        }
        for (JsNode setterCall : setterCalls) {
            for (JsNode other : setterCalls) {
                if (other != setterCall && other.isDescendantOf(setterCall)) {
                    return Fix.none();
                }
            }
        }

        String group = fixes.newGroup();
        List<Edit> edits = new ArrayList<>();
        edits.addAll(fixes.imports().ensureNamedImport(USE_SIGNAL, fixes.signalModule(), group));
        edits.add(fixes.replace(declarator.child(Field.ID), newName, group));
        edits.add(fixes.replace(call.child(Field.CALLEE).unwrap(), USE_SIGNAL, group));
        Edit importRemoval = _unusedImportRemoval(call, fixes, group);
        if (importRemoval != null) {
            edits.add(importRemoval);
        }

        for (JsNode reference : state.getReferences()) {
            if (_enclosingCall(reference, setterCalls) == null) {
                edits.add(fixes.rewriter().replaceReference(reference,
                        fixes.accessorAt(reference).render(newName), group));
            }
        }
        for (JsNode setterCall : setterCalls) {
            edits.add(fixes.replace(Nodes.outermostWrapper(setterCall),
                    _assignmentText(setterCall, newName, state, fixes, group), group));
        }

        Fix fix = Fix.primary("Convert useState to useSignal", edits);
        for (JsNode setterCall : setterCalls) {
            fix = fixes.safety().guard(fix, setterCall, false, "suggestUseSignal");
        }
        return fix;
    }

    /**
     * {@code xSignal.value = arg}, with reads of the old state inside {@code arg} rewritten.
     */
    private static String _assignmentText(JsNode setterCall, String newName, Binding state, FixContext fixes,
                                          String group) {
        JsNode argument = setterCall.children(Field.ARGUMENTS).get(0);
        String argumentText = fixes.textOf(argument);

        List<Edit> inner = new ArrayList<>();
        for (JsNode reference : state.getReferences()) {
            if (reference.isDescendantOf(argument) || reference == argument) {
                inner.add(fixes.rewriter().replaceReference(reference,
                        fixes.accessorAt(reference).render(newName), group));
            }
        }
        inner.sort(Comparator.comparingInt((Edit edit) -> edit.getRange().getStart()).reversed());
        StringBuilder rewritten = new StringBuilder(argumentText);
        for (Edit edit : inner) {
            rewritten.replace(edit.getRange().getStart() - argument.start(),
                    edit.getRange().getEnd() - argument.start(), edit.getReplacement());
        }

        String assignment = newName + ".value = " + rewritten;
        JsNode outer = Nodes.outermostWrapper(setterCall);
        JsNode parent = outer.parent();
        boolean bare = parent != null && (parent.kind() == NodeKind.EXPRESSION_STATEMENT
                || (parent.kind() == NodeKind.ARROW_FUNCTION_EXPRESSION && outer.parentField() == Field.BODY));
        return bare ? assignment : "(" + assignment + ")";
    }

    /**
     * Removes the {@code useState} import specifier when this call is its only reference.
     */
    private static Edit _unusedImportRemoval(JsNode call, FixContext fixes, String group) {
        JsNode callee = call.child(Field.CALLEE).unwrap();
        if (callee.kind() != NodeKind.IDENTIFIER) {
            return null;
        }
        Binding binding = fixes.scopes().bindingOf(callee);
        if (binding == null || binding.getReferences().size() != 1) {
            return null;
        }
        JsNode specifier = binding.getIdentifier().parent();
        if (specifier == null || specifier.kind() != NodeKind.IMPORT_SPECIFIER) {
            return null;
        }
        JsNode declaration = specifier.parent();
        List<JsNode> specifiers = declaration.children(Field.SPECIFIERS);
        if (specifiers.size() == 1) {
            String source = fixes.ast().getSourceCode();
            int end = declaration.end();
            if (end < source.length() && source.charAt(end) == '\n') {
                end++;
            }
            return fixes.replace(declaration.start(), end, "", group);
        }
        int index = specifiers.indexOf(specifier);
        if (index == specifiers.size() - 1) {
            return fixes.replace(specifiers.get(index - 1).end(), specifier.end(), "", group);
        }
        return fixes.replace(specifier.start(), specifiers.get(index + 1).start(), "", group);
    }

    private static JsNode _useStateCall(JsNode declarator) {
        JsNode init = declarator.child(Field.INIT);
        if (init == null) {
            return null;
        }
        JsNode call = init.unwrap();
        return Nodes.isCallTo(call, USE_STATE, "React") ? call : null;
    }

    /**
     * {@code [state, setter]} identifiers of a two-element pattern whose setter starts with {@code set}.
     */
    private static JsNode[] _stateIdentifiers(JsNode declarator) {
        if (_useStateCall(declarator) == null) {
            return null;
        }
        JsNode pattern = declarator.child(Field.ID);
        if (pattern == null || pattern.kind() != NodeKind.ARRAY_PATTERN) {
            return null;
        }
        List<JsNode> elements = pattern.children(Field.ELEMENTS);
        if (elements.size() != 2 || elements.get(0) == null || elements.get(1) == null) {
            return null;
        }
        JsNode state = elements.get(0);
        JsNode setter = elements.get(1);
        if (state.kind() != NodeKind.IDENTIFIER || setter.kind() != NodeKind.IDENTIFIER
                || !setter.name().startsWith("set")) {
            return null;
        }
        return new JsNode[] {state, setter};
    }

    /**
     * The call when a setter reference is the callee of {@code setX(expr)} with a non-function argument.
     */
    private static JsNode _plainSetterCall(JsNode reference) {
        JsNode callee = Nodes.outermostWrapper(reference);
        JsNode call = callee.parent();
        if (call == null || call.kind() != NodeKind.CALL_EXPRESSION || callee.parentField() != Field.CALLEE) {
            return null;
        }
        List<JsNode> arguments = call.children(Field.ARGUMENTS);
        if (arguments.size() != 1 || arguments.get(0) == null
                || arguments.get(0).kind() == NodeKind.SPREAD_ELEMENT
                || arguments.get(0).unwrap().kind().isFunction()) {
            return null;
        }
        return call;
    }

    private static JsNode _enclosingCall(JsNode reference, List<JsNode> calls) {
        for (JsNode call : calls) {
            if (reference.isDescendantOf(call)) {
                return call;
            }
        }
        return null;
    }
}

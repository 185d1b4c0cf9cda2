package com.signallint.plugins.react.scope;

import com.signallint.plugins.react.traversal.NodeVisitor;
import com.signallint.plugins.react.traversal.TraversalDriver;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.plugins.react.tree.Nodes;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lexical scopes and bindings of one file. Built in two walks: declarations first, so hoisted names
 * resolve regardless of order, then references.
 */
public final class ScopeModel {
    private final Map<JsNode, LexicalScope> scopesByNode = new IdentityHashMap<>();
    private final Map<JsNode, Binding> bindingsByIdentifier = new IdentityHashMap<>();
    private final Map<String, List<JsNode>> referencesByName = new HashMap<>();

    private ScopeModel() {
    }

    public static ScopeModel build(JsNode program) {
        ScopeModel model = new ScopeModel();
        TraversalDriver.traverse(program, model.new DeclarationCollector());
        TraversalDriver.traverse(program, model.new ReferenceCollector());
        return model;
    }

    /**
     * Binding an identifier declares or refers to, or null for globals and non-references.
     */
    public Binding bindingOf(JsNode identifier) {
        return bindingsByIdentifier.get(identifier);
    }

    /**
     * Innermost scope enclosing a node.
     */
    public LexicalScope scopeAt(JsNode node) {
        JsNode current = node;
        while (current != null) {
            LexicalScope scope = scopesByNode.get(current);
            if (scope != null) {
                return scope;
            }
            current = current.parent();
        }
        throw new IllegalStateException("Node " + node + " is outside the modelled program");
    }

    /**
     * Every identifier that refers to {@code name}, resolved or not.
     */
    public List<JsNode> referencesNamed(String name) {
        return referencesByName.getOrDefault(name, Collections.emptyList());
    }

    private static boolean _opensBlockScope(JsNode node) {
        switch (node.kind()) {
            case BLOCK_STATEMENT:
                JsNode parent = node.parent();
                return parent == null || !(parent.kind().isFunction() || parent.kind() == NodeKind.CATCH_CLAUSE)
                        || node.parentField() != Field.BODY;
            case FOR_STATEMENT:
            case FOR_IN_STATEMENT:
            case FOR_OF_STATEMENT:
            case SWITCH_STATEMENT:
            case STATIC_BLOCK:
                return true;
            default:
                return false;
        }
    }

    /**
     * Identifiers a binding pattern declares.
     */
    static List<JsNode> patternIdentifiers(JsNode pattern) {
        List<JsNode> result = new ArrayList<>();
        Deque<JsNode> pending = new ArrayDeque<>();
        if (pattern != null) {
            pending.push(pattern);
        }
        while (!pending.isEmpty()) {
            JsNode node = pending.pop();
            switch (node.kind()) {
                case IDENTIFIER:
                    result.add(node);
                    break;
                case OBJECT_PATTERN:
                case ARRAY_PATTERN:
                    List<JsNode> members = node.children(node.kind() == NodeKind.OBJECT_PATTERN
                            ? Field.PROPERTIES : Field.ELEMENTS);
                    for (int i = members.size() - 1; i >= 0; i--) {
                        if (members.get(i) != null) {
                            pending.push(members.get(i));
                        }
                    }
                    break;
                case PROPERTY:
                    _pushIfPresent(pending, node.child(Field.VALUE));
                    break;
                case REST_ELEMENT:
                    _pushIfPresent(pending, node.child(Field.ARGUMENT));
                    break;
                case ASSIGNMENT_PATTERN:
                    _pushIfPresent(pending, node.child(Field.LEFT));
                    break;
                case TS_PARAMETER_PROPERTY:
                    _pushIfPresent(pending, node.child(Field.PARAMETER));
                    break;
                default:
                    break;
            }
        }
        return result;
    }

    private static void _pushIfPresent(Deque<JsNode> pending, JsNode node) {
        if (node != null) {
            pending.push(node);
        }
    }

    private abstract class ScopeWalker implements NodeVisitor {
        final Deque<LexicalScope> scopes = new ArrayDeque<>();

        @Override
        public void exit(JsNode node) {
            LexicalScope scope = scopesByNode.get(node);
            if (scope != null && scope == scopes.peek()) {
                scopes.pop();
            }
        }
    }

    private final class DeclarationCollector extends ScopeWalker {

        @Override
        public void enter(JsNode node) {
            switch (node.kind()) {
                case PROGRAM:
                    _open(LexicalScope.Kind.MODULE, node);
                    return;
                case FUNCTION_DECLARATION:
                    _declare(scopes.peek(), node.child(Field.ID));
                    _openFunction(node);
                    return;
                case FUNCTION_EXPRESSION:
                case ARROW_FUNCTION_EXPRESSION:
                    LexicalScope own = _openFunction(node);
                    _declare(own, node.child(Field.ID));
                    return;
                case CATCH_CLAUSE:
                    LexicalScope catchScope = _open(LexicalScope.Kind.CATCH, node);
                    for (JsNode id : patternIdentifiers(node.child(Field.PARAM))) {
                        _declare(catchScope, id);
                    }
                    return;
                case CLASS_DECLARATION:
                    _declare(scopes.peek(), node.child(Field.ID));
                    return;
                case VARIABLE_DECLARATOR:
                    JsNode declaration = node.parent();
                    LexicalScope target = declaration != null && "var".equals(declaration.declarationKind())
                            ? scopes.peek().functionScope() : scopes.peek();
                    for (JsNode id : patternIdentifiers(node.child(Field.ID))) {
                        _declare(target, id);
                    }
                    return;
                case IMPORT_SPECIFIER:
                case IMPORT_DEFAULT_SPECIFIER:
                case IMPORT_NAMESPACE_SPECIFIER:
                    _declare(scopes.peekLast(), node.child(Field.LOCAL));
                    return;
                default:
                    if (_opensBlockScope(node)) {
                        _open(LexicalScope.Kind.BLOCK, node);
                    }
            }
        }

        private LexicalScope _openFunction(JsNode function) {
            LexicalScope scope = _open(LexicalScope.Kind.FUNCTION, function);
            for (JsNode param : function.children(Field.PARAMS)) {
                for (JsNode id : patternIdentifiers(param)) {
                    _declare(scope, id);
                }
            }
            return scope;
        }

        private LexicalScope _open(LexicalScope.Kind kind, JsNode node) {
            LexicalScope scope = new LexicalScope(kind, node, scopes.peek());
            scopesByNode.put(node, scope);
            scopes.push(scope);
            return scope;
        }

        private void _declare(LexicalScope scope, JsNode id) {
            if (id == null || id.kind() != NodeKind.IDENTIFIER) {
                return;
            }
            Binding binding = scope.declare(id.name(), id);
            bindingsByIdentifier.put(id, binding);
            if (binding.getIdentifier() != id) {
                binding.addReference(id);
            }
        }
    }

    private final class ReferenceCollector extends ScopeWalker {

        @Override
        public void enter(JsNode node) {
            LexicalScope scope = scopesByNode.get(node);
            if (scope != null) {
                scopes.push(scope);
            }
            if (node.kind() != NodeKind.IDENTIFIER || bindingsByIdentifier.containsKey(node)
                    || !Nodes.isReference(node)) {
                return;
            }
            referencesByName.computeIfAbsent(node.name(), key -> new ArrayList<>()).add(node);
            Binding binding = scopes.peek().lookup(node.name());
            if (binding != null) {
                binding.addReference(node);
                bindingsByIdentifier.put(node, binding);
            }
        }
    }
}

package com.signallint.plugins.react.provenance;

import com.signallint.config.AnalysisOptions;
import com.signallint.plugins.react.traversal.Operation;
import com.signallint.plugins.react.traversal.OperationCounters;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.Flag;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.plugins.react.tree.Nodes;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which bindings hold reactive handles. Handles are tracked by name for the lifetime of one run.
 * <p>
 * Resolution order for a declaration: creator call, then propagation from a known handle or a literal
 * holding handles. Names that match the configured suffix count as heuristic handles once the file
 * imports a creator or has declared one.
 */
public class ProvenanceTracker implements HandleResolver {
    private final AnalysisOptions options;
    private final ImportFacts importFacts;
    private final OperationCounters counters;
    private final Map<String, Handle> handles = new HashMap<>();
    private final Set<String> knownNonHandles = new HashSet<>();
    private final Map<JsNode, Boolean> containsMemo = new IdentityHashMap<>();
    private boolean sawCreatorDeclaration;

    public ProvenanceTracker(AnalysisOptions options, ImportFacts importFacts, OperationCounters counters) {
        this.options = options;
        this.importFacts = importFacts;
        this.counters = counters;
    }

    public void recordCreatorImport(String localName, String importedName) {
        importFacts.addCreatorImport(localName, importedName);
    }

    public void recordNamespaceImport(String localName) {
        importFacts.addNamespaceImport(localName);
    }

    /**
     * Records a declared binding and its initializer, returning the handle it became, if any.
     */
    public Optional<Handle> recordDeclaration(String name, JsNode initializer, JsNode declaration) {
        if (initializer == null) {
            return Optional.empty();
        }

        Optional<CreatorCall> creator = creatorCall(initializer);
        if (creator.isPresent()) {
            sawCreatorDeclaration = true;
            counters.increment(Operation.SIGNAL_CREATION);
            return Optional.of(_record(new Handle(name, creator.get().getOrigin(), Confidence.DEFINITE,
                    creator.get().getBaseName(), declaration)));
        }

        Optional<Handle> source = isHandle(initializer);
        if (source.isPresent()) {
            counters.increment(Operation.HANDLE_PROPAGATED);
            return Optional.of(_record(source.get().propagateTo(name, declaration)));
        }

        JsNode literal = initializer.unwrap();
        if ((literal.kind() == NodeKind.OBJECT_EXPRESSION || literal.kind() == NodeKind.ARRAY_EXPRESSION)
                && containsHandle(literal)) {
            counters.increment(Operation.HANDLE_PROPAGATED);
            return Optional.of(_record(_containerFor(name, literal, declaration)));
        }

        if (isPlainValue(literal) && !handles.containsKey(name)) {
            knownNonHandles.add(name);
        }
        return Optional.empty();
    }

    /**
     * Records {@code name = source} for an existing binding.
     */
    public Optional<Handle> recordAlias(String name, JsNode source, JsNode target) {
        Optional<Handle> handle = isHandle(source);
        if (handle.isPresent()) {
            counters.increment(Operation.HANDLE_PROPAGATED);
            return Optional.of(_record(handle.get().propagateTo(name, target)));
        }
        return Optional.empty();
    }

    /**
     * Records a binding destructured out of a container handle under {@code key}.
     */
    public Optional<Handle> recordDestructured(String name, Handle container, String key, JsNode declaration) {
        Handle contained = container.getContainedHandles().get(key);
        if (contained == null) {
            return Optional.empty();
        }
        counters.increment(Operation.HANDLE_PROPAGATED);
        return Optional.of(_record(contained.propagateTo(name, declaration)));
    }

    private Handle _record(Handle handle) {
        handles.put(handle.getName(), handle);
        knownNonHandles.remove(handle.getName());
        containsMemo.clear();
        return handle;
    }

    private Handle _containerFor(String name, JsNode literal, JsNode declaration) {
        Map<String, Handle> contained = new LinkedHashMap<>();
        Confidence confidence = Confidence.DEFINITE;
        if (literal.kind() == NodeKind.OBJECT_EXPRESSION) {
            for (JsNode property : literal.children(Field.PROPERTIES)) {
                if (property == null || property.kind() != NodeKind.PROPERTY || property.has(Flag.COMPUTED)) {
                    continue;
                }
                String key = _keyName(property.child(Field.KEY));
                Optional<Handle> value = isHandle(property.child(Field.VALUE));
                if (key != null && value.isPresent()) {
                    contained.put(key, value.get());
                    if (!value.get().isDefinite()) {
                        confidence = Confidence.HEURISTIC;
                    }
                }
            }
        } else {
            List<JsNode> elements = literal.children(Field.ELEMENTS);
            for (int i = 0; i < elements.size(); i++) {
                Optional<Handle> value = elements.get(i) != null ? isHandle(elements.get(i)) : Optional.empty();
                if (value.isPresent()) {
                    contained.put(String.valueOf(i), value.get());
                    if (!value.get().isDefinite()) {
                        confidence = Confidence.HEURISTIC;
                    }
                }
            }
        }
        return Handle.container(name, confidence, declaration, contained);
    }

    private static String _keyName(JsNode key) {
        if (key == null) {
            return null;
        }
        if (key.kind() == NodeKind.IDENTIFIER) {
            return key.name();
        }
        if (key.kind() == NodeKind.LITERAL) {
            return key.stringValue() != null ? key.stringValue() : key.raw();
        }
        return null;
    }

    @Override
    public Optional<Handle> isHandle(JsNode reference) {
        if (reference == null) {
            return Optional.empty();
        }
        counters.increment(Operation.SIGNAL_CHECK);
        JsNode node = reference.unwrap();

        if (node.kind() == NodeKind.IDENTIFIER) {
            Handle handle = handles.get(node.name());
            if (handle != null) {
                return Optional.of(handle);
            }
            if (isHeuristicGateOpen() && options.hasSuffix(node.name()) && !knownNonHandles.contains(node.name())) {
                return Optional.of(new Handle(node.name(), HandleOrigin.SUFFIX_HEURISTIC, Confidence.HEURISTIC,
                        null, null));
            }
            return Optional.empty();
        }

        if (node.kind() == NodeKind.MEMBER_EXPRESSION) {
            String property = Nodes.propertyName(node);
            if (property == null) {
                return Optional.empty();
            }
            JsNode object = node.child(Field.OBJECT).unwrap();
            if (object.kind() == NodeKind.IDENTIFIER) {
                Handle container = handles.get(object.name());
                if (container != null && container.getContainedHandles().containsKey(property)) {
                    return Optional.of(container.getContainedHandles().get(property));
                }
            }
            if (!node.has(Flag.COMPUTED) && isHeuristicGateOpen() && options.hasSuffix(property)) {
                return Optional.of(new Handle(property, HandleOrigin.SUFFIX_HEURISTIC, Confidence.HEURISTIC,
                        null, null));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<Handle> valueAccessTarget(JsNode member) {
        if (member == null) {
            return Optional.empty();
        }
        JsNode node = member.unwrap();
        if (!Nodes.isValueAccess(node)) {
            return Optional.empty();
        }
        return isHandle(node.child(Field.OBJECT));
    }

    @Override
    public boolean containsHandle(JsNode expression) {
        if (expression == null) {
            return false;
        }
        return _containsHandle(expression.unwrap(), Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private boolean _containsHandle(JsNode node, Set<JsNode> visited) {
        Boolean cached = containsMemo.get(node);
        if (cached != null) {
            counters.increment(Operation.CACHE_HIT);
            return cached;
        }
        if (!visited.add(node)) {
            return false;
        }
        counters.increment(Operation.CACHE_MISS);

        boolean result = false;
        switch (node.kind()) {
            case IDENTIFIER:
            case MEMBER_EXPRESSION:
                result = isHandle(node).isPresent();
                break;
            case OBJECT_EXPRESSION:
            case ARRAY_EXPRESSION:
                for (JsNode member : node.children()) {
                    JsNode value = _memberValue(member);
                    if (value != null && _containsHandle(value.unwrap(), visited)) {
                        result = true;
                        break;
                    }
                }
                break;
            default:
                break;
        }
        containsMemo.put(node, result);
        return result;
    }

    private static JsNode _memberValue(JsNode member) {
        switch (member.kind()) {
            case PROPERTY:
                return member.child(Field.VALUE);
            case SPREAD_ELEMENT:
                return member.child(Field.ARGUMENT);
            default:
                return member;
        }
    }

    @Override
    public Optional<CreatorCall> creatorCall(JsNode expression) {
        if (expression == null) {
            return Optional.empty();
        }
        JsNode call = expression.unwrap();
        if (call.kind() != NodeKind.CALL_EXPRESSION) {
            return Optional.empty();
        }
        JsNode callee = call.child(Field.CALLEE).unwrap();

        if (callee.kind() == NodeKind.IDENTIFIER) {
            String local = callee.name();
            String imported = importFacts.creatorImportedAs(local);
            if (imported != null) {
                HandleOrigin origin = imported.equals(local) ? HandleOrigin.CREATOR_CALL : HandleOrigin.IMPORT_ALIAS;
                return Optional.of(new CreatorCall(call, imported, origin, _isHookCreator(imported)));
            }
            if (options.isAllowBareNames() && importFacts.moduleOf(local) == null && _isCreatorName(local)) {
                return Optional.of(new CreatorCall(call, local, HandleOrigin.CREATOR_CALL, _isHookCreator(local)));
            }
            return Optional.empty();
        }

        if (callee.kind() == NodeKind.MEMBER_EXPRESSION && !callee.has(Flag.COMPUTED)) {
            JsNode object = callee.child(Field.OBJECT).unwrap();
            String property = Nodes.propertyName(callee);
            if (object.kind() == NodeKind.IDENTIFIER && importFacts.isSignalNamespace(object.name())
                    && _isCreatorName(property)) {
                return Optional.of(new CreatorCall(call, property, HandleOrigin.NAMESPACE_QUALIFIED,
                        _isHookCreator(property)));
            }
        }
        return Optional.empty();
    }

    private boolean _isCreatorName(String name) {
        return name != null && (options.getCreatorNames().contains(name) || _isHookCreator(name));
    }

    private boolean _isHookCreator(String name) {
        return options.getHookCreatorNames().contains(name);
    }

    /**
     * Values that can never be handles: literals, functions, classes, markup, operators.
     */
    public static boolean isPlainValue(JsNode node) {
        switch (node.kind()) {
            case LITERAL:
            case TEMPLATE_LITERAL:
            case ARROW_FUNCTION_EXPRESSION:
            case FUNCTION_EXPRESSION:
            case CLASS_EXPRESSION:
            case JSX_ELEMENT:
            case JSX_FRAGMENT:
            case BINARY_EXPRESSION:
            case UNARY_EXPRESSION:
            case UPDATE_EXPRESSION:
            case NEW_EXPRESSION:
            case OBJECT_EXPRESSION:
            case ARRAY_EXPRESSION:
                return true;
            default:
                return false;
        }
    }

    @Override
    public boolean isHeuristicGateOpen() {
        return options.isEnableSuffixHeuristic() && (importFacts.hasCreatorImport() || sawCreatorDeclaration);
    }

    @Override
    public boolean isKnownNonHandle(String name) {
        return knownNonHandles.contains(name);
    }

    @Override
    public ImportFacts getImportFacts() {
        return importFacts;
    }

    /**
     * Recorded handle for a name, heuristic handles excluded.
     */
    public Optional<Handle> recordedHandle(String name) {
        return Optional.ofNullable(handles.get(name));
    }
}

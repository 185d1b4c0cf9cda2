package com.signallint.plugins.react.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One node of the syntax tree. Children live in the slots declared by the node's {@link NodeKind};
 * list slots keep {@code null} holes (array elisions) so positions stay meaningful.
 * <p>
 * Nodes compare by identity. The tree is immutable once {@link EstreeReader} has finished.
 */
public final class JsNode {
    private final NodeKind kind;
    private final SourceRange range;
    private final Map<Field, JsNode> singles = new EnumMap<>(Field.class);
    private final Map<Field, List<JsNode>> lists = new EnumMap<>(Field.class);
    private final Set<Flag> flags;
    private final String name;
    private final String operator;
    private final String raw;
    private final String stringValue;
    private final String declarationKind;
    private JsNode parent;
    private Field parentSlot;
    private int parentIndex = -1;
    private List<JsNode> orderedChildren;

    JsNode(NodeKind kind, SourceRange range, Set<Flag> flags, String name, String operator,
           String raw, String stringValue, String declarationKind) {
        this.kind = kind;
        this.range = range;
        this.flags = flags.isEmpty() ? EnumSet.noneOf(Flag.class) : EnumSet.copyOf(flags);
        this.name = name;
        this.operator = operator;
        this.raw = raw;
        this.stringValue = stringValue;
        this.declarationKind = declarationKind;
    }

    void setSingle(Field field, JsNode child) {
        if (child != null) {
            child.parent = this;
            child.parentSlot = field;
        }
        singles.put(field, child);
    }

    void setList(Field field, List<JsNode> children) {
        for (int i = 0; i < children.size(); i++) {
            JsNode child = children.get(i);
            if (child != null) {
                child.parent = this;
                child.parentSlot = field;
                child.parentIndex = i;
            }
        }
        lists.put(field, Collections.unmodifiableList(children));
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean is(NodeKind candidate) {
        return kind == candidate;
    }

    public SourceRange range() {
        return range;
    }

    public int start() {
        return range.getStart();
    }

    public int end() {
        return range.getEnd();
    }

    public JsNode parent() {
        return parent;
    }

    /**
     * Child in a single-valued slot, or null when absent.
     */
    public JsNode child(Field field) {
        return singles.get(field);
    }

    /**
     * Children of a list slot, possibly containing null holes; never null itself.
     */
    public List<JsNode> children(Field field) {
        List<JsNode> list = lists.get(field);
        return list != null ? list : Collections.emptyList();
    }

    /**
     * All non-null children, in source order.
     */
    public List<JsNode> children() {
        return orderedChildren != null ? orderedChildren : Collections.emptyList();
    }

    /**
     * Computes the ordered child list once all slots are filled.
     */
    void seal() {
        List<JsNode> result = new ArrayList<>();
        for (Slot slot : kind.getSlots()) {
            if (slot.isMany()) {
                for (JsNode child : children(slot.getField())) {
                    if (child != null) {
                        result.add(child);
                    }
                }
            } else {
                JsNode child = singles.get(slot.getField());
                if (child != null) {
                    result.add(child);
                }
            }
        }
        if (kind.hasInterleavedSlots()) {
            result.sort(Comparator.comparingInt(JsNode::start));
        }
        orderedChildren = Collections.unmodifiableList(result);
    }

    /**
     * The slot under which this node hangs from its parent, or null for the root.
     */
    public Field parentField() {
        return parentSlot;
    }

    /**
     * Position of this node within its parent's list slot, or -1.
     */
    public int indexInParent() {
        return parentIndex;
    }

    public boolean has(Flag flag) {
        return flags.contains(flag);
    }

    /**
     * Identifier-like name (Identifier, PrivateIdentifier, JSXIdentifier), else null.
     */
    public String name() {
        return name;
    }

    public String operator() {
        return operator;
    }

    /**
     * Raw source of a literal.
     */
    public String raw() {
        return raw;
    }

    /**
     * String value of a string literal, JSX text or cooked template element, else null.
     */
    public String stringValue() {
        return stringValue;
    }

    /**
     * {@code var|let|const} for declarations, {@code get|set|init|method|constructor} for members.
     */
    public String declarationKind() {
        return declarationKind;
    }

    /**
     * Strips TypeScript wrappers and chain expressions down to the runtime expression.
     */
    public JsNode unwrap() {
        JsNode current = this;
        while (current.kind.isTypeWrapper() || current.kind == NodeKind.CHAIN_EXPRESSION) {
            JsNode inner = current.child(Field.EXPRESSION);
            if (inner == null) {
                return current;
            }
            current = inner;
        }
        return current;
    }

    /**
     * Nearest ancestor of the given kind, or null.
     */
    public JsNode ancestor(NodeKind ancestorKind) {
        JsNode current = parent;
        while (current != null) {
            if (current.kind == ancestorKind) {
                return current;
            }
            current = current.parent;
        }
        return null;
    }

    public boolean isDescendantOf(JsNode candidate) {
        JsNode current = parent;
        while (current != null) {
            if (current == candidate) {
                return true;
            }
            current = current.parent;
        }
        return false;
    }

    @Override
    public String toString() {
        return kind.getTypeName() + (name != null ? "(" + name + ")" : "") + "@" + range;
    }
}

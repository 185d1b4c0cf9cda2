package com.signallint.plugins.react.tree;

/**
 * Small structural queries shared by the analysis layers.
 */
public final class Nodes {

    private Nodes() {
    }

    /**
     * Static property name of a member expression: a non-computed identifier, or a computed string literal.
     */
    public static String propertyName(JsNode member) {
        if (member == null || (member.kind() != NodeKind.MEMBER_EXPRESSION
                && member.kind() != NodeKind.JSX_MEMBER_EXPRESSION)) {
            return null;
        }
        JsNode property = member.child(Field.PROPERTY);
        if (property == null) {
            return null;
        }
        if (!member.has(Flag.COMPUTED)) {
            return property.name();
        }
        return property.kind() == NodeKind.LITERAL ? property.stringValue() : null;
    }

    /**
     * True for {@code x.value} (also {@code x?.value} and {@code x["value"]}).
     */
    public static boolean isValueAccess(JsNode node) {
        return node != null && node.kind() == NodeKind.MEMBER_EXPRESSION && "value".equals(propertyName(node));
    }

    /**
     * Name of a call's callee: the identifier, or the property of a member callee.
     */
    public static String calleeName(JsNode call) {
        JsNode callee = call.child(Field.CALLEE);
        if (callee == null) {
            return null;
        }
        callee = callee.unwrap();
        if (callee.kind() == NodeKind.IDENTIFIER) {
            return callee.name();
        }
        return propertyName(callee);
    }

    /**
     * Identifier name of the object of a member callee, or null for a bare callee.
     */
    public static String calleeObjectName(JsNode call) {
        JsNode callee = call.child(Field.CALLEE);
        if (callee == null) {
            return null;
        }
        callee = callee.unwrap();
        if (callee.kind() != NodeKind.MEMBER_EXPRESSION) {
            return null;
        }
        JsNode object = callee.child(Field.OBJECT).unwrap();
        return object.kind() == NodeKind.IDENTIFIER ? object.name() : null;
    }

    /**
     * Whether a call targets {@code name} directly or as {@code qualifier.name}.
     */
    public static boolean isCallTo(JsNode call, String name, String qualifier) {
        if (call == null || call.kind() != NodeKind.CALL_EXPRESSION || !name.equals(calleeName(call))) {
            return false;
        }
        String objectName = calleeObjectName(call);
        JsNode callee = call.child(Field.CALLEE).unwrap();
        return callee.kind() == NodeKind.IDENTIFIER || qualifier.equals(objectName);
    }

    /**
     * The node a wrapper chain hangs from: the outermost TS wrapper or chain expression around {@code node}.
     */
    public static JsNode outermostWrapper(JsNode node) {
        JsNode current = node;
        while (current.parent() != null && (current.parent().kind().isTypeWrapper()
                || current.parent().kind() == NodeKind.CHAIN_EXPRESSION)) {
            current = current.parent();
        }
        return current;
    }

    /**
     * Whether an identifier is read or written as a variable, as opposed to a property key,
     * member property, label or declaration name.
     */
    public static boolean isReference(JsNode identifier) {
        if (identifier.kind() != NodeKind.IDENTIFIER) {
            return false;
        }
        JsNode parent = identifier.parent();
        if (parent == null) {
            return false;
        }
        Field field = identifier.parentField();
        switch (parent.kind()) {
            case MEMBER_EXPRESSION:
            case META_PROPERTY:
                return field == Field.OBJECT || parent.has(Flag.COMPUTED);
            case PROPERTY:
                if (field == Field.KEY) {
                    return parent.has(Flag.COMPUTED);
                }
                return parent.parent() != null && (parent.parent().kind() == NodeKind.OBJECT_EXPRESSION
                        || !isPatternPosition(identifier));
            case METHOD_DEFINITION:
            case PROPERTY_DEFINITION:
            case ACCESSOR_PROPERTY:
                return field == Field.VALUE || parent.has(Flag.COMPUTED);
            case LABELED_STATEMENT:
            case BREAK_STATEMENT:
            case CONTINUE_STATEMENT:
            case IMPORT_SPECIFIER:
            case IMPORT_DEFAULT_SPECIFIER:
            case IMPORT_NAMESPACE_SPECIFIER:
                return false;
            case EXPORT_SPECIFIER:
                return field == Field.LOCAL && parent.parent() != null
                        && parent.parent().child(Field.SOURCE) == null;
            case VARIABLE_DECLARATOR:
                return field == Field.INIT;
            case FUNCTION_DECLARATION:
            case FUNCTION_EXPRESSION:
            case ARROW_FUNCTION_EXPRESSION:
            case CLASS_DECLARATION:
            case CLASS_EXPRESSION:
                return field == Field.BODY || field == Field.SUPER_CLASS;
            case CATCH_CLAUSE:
                return false;
            default:
                return !isPatternPosition(identifier);
        }
    }

    /**
     * Whether a node sits in a binding pattern (declaration id, parameter or destructuring target),
     * as opposed to an assignment target of an existing variable.
     */
    public static boolean isPatternPosition(JsNode node) {
        JsNode current = node;
        while (current.parent() != null) {
            JsNode parent = current.parent();
            Field field = current.parentField();
            switch (parent.kind()) {
                case OBJECT_PATTERN:
                case ARRAY_PATTERN:
                case REST_ELEMENT:
                    current = parent;
                    continue;
                case PROPERTY:
                    if (field == Field.VALUE && parent.parent() != null
                            && parent.parent().kind() == NodeKind.OBJECT_PATTERN) {
                        current = parent;
                        continue;
                    }
                    return false;
                case ASSIGNMENT_PATTERN:
                    if (field == Field.LEFT) {
                        current = parent;
                        continue;
                    }
                    return false;
                case VARIABLE_DECLARATOR:
                    return field == Field.ID;
                case FUNCTION_DECLARATION:
                case FUNCTION_EXPRESSION:
                case ARROW_FUNCTION_EXPRESSION:
                    return field == Field.PARAMS;
                case CATCH_CLAUSE:
                    return field == Field.PARAM;
                case TS_PARAMETER_PROPERTY:
                    return true;
                default:
                    return false;
            }
        }
        return false;
    }

    /**
     * Whether an expression is assigned to, updated or deleted.
     */
    public static boolean isWriteTarget(JsNode node) {
        JsNode target = outermostWrapper(node);
        JsNode parent = target.parent();
        if (parent == null) {
            return false;
        }
        Field field = target.parentField();
        switch (parent.kind()) {
            case ASSIGNMENT_EXPRESSION:
            case FOR_IN_STATEMENT:
            case FOR_OF_STATEMENT:
                return field == Field.LEFT;
            case UPDATE_EXPRESSION:
                return true;
            case UNARY_EXPRESSION:
                return "delete".equals(parent.operator());
            case ARRAY_PATTERN:
            case OBJECT_PATTERN:
            case REST_ELEMENT:
            case ASSIGNMENT_PATTERN:
                return field != Field.RIGHT;
            case PROPERTY:
                return field == Field.VALUE && parent.parent() != null
                        && parent.parent().kind() == NodeKind.OBJECT_PATTERN;
            default:
                return false;
        }
    }

    /**
     * Whether an expression sits directly in a markup child slot: {@code <p>{expr}</p>},
     * possibly through the branches of a conditional expression.
     */
    public static boolean isMarkupChild(JsNode expression) {
        JsNode current = outermostWrapper(expression);
        JsNode parent = current.parent();
        while (parent != null && parent.kind() == NodeKind.CONDITIONAL_EXPRESSION
                && current.parentField() != Field.TEST) {
            current = outermostWrapper(parent);
            parent = current.parent();
        }
        if (parent == null || parent.kind() != NodeKind.JSX_EXPRESSION_CONTAINER) {
            return false;
        }
        JsNode holder = parent.parent();
        return holder != null && holder.kind().isMarkup() && parent.parentField() == Field.CHILDREN;
    }

    /**
     * Whether the node is a statement or a declaration.
     */
    public static boolean isStatement(JsNode node) {
        String typeName = node.kind().getTypeName();
        return typeName.endsWith("Statement") || typeName.endsWith("Declaration");
    }
}

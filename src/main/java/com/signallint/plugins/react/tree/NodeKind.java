package com.signallint.plugins.react.tree;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.signallint.plugins.react.tree.Field.*;
import static com.signallint.plugins.react.tree.Slot.many;
import static com.signallint.plugins.react.tree.Slot.one;

/**
 * Closed set of node kinds produced by the parser bridge, each with its typed child slots.
 * Slots are listed in source order.
 */
public enum NodeKind {
    PROGRAM("Program", many(BODY)),

    // Statements
    EXPRESSION_STATEMENT("ExpressionStatement", one(EXPRESSION)),
    BLOCK_STATEMENT("BlockStatement", many(BODY)),
    STATIC_BLOCK("StaticBlock", many(BODY)),
    EMPTY_STATEMENT("EmptyStatement"),
    DEBUGGER_STATEMENT("DebuggerStatement"),
    WITH_STATEMENT("WithStatement", one(OBJECT), one(BODY)),
    RETURN_STATEMENT("ReturnStatement", one(ARGUMENT)),
    LABELED_STATEMENT("LabeledStatement", one(LABEL), one(BODY)),
    BREAK_STATEMENT("BreakStatement", one(LABEL)),
    CONTINUE_STATEMENT("ContinueStatement", one(LABEL)),
    IF_STATEMENT("IfStatement", one(TEST), one(CONSEQUENT), one(ALTERNATE)),
    SWITCH_STATEMENT("SwitchStatement", one(DISCRIMINANT), many(CASES)),
    SWITCH_CASE("SwitchCase", one(TEST), many(CONSEQUENT)),
    THROW_STATEMENT("ThrowStatement", one(ARGUMENT)),
    TRY_STATEMENT("TryStatement", one(BLOCK), one(HANDLER), one(FINALIZER)),
    CATCH_CLAUSE("CatchClause", one(PARAM), one(BODY)),
    WHILE_STATEMENT("WhileStatement", one(TEST), one(BODY)),
    DO_WHILE_STATEMENT("DoWhileStatement", one(BODY), one(TEST)),
    FOR_STATEMENT("ForStatement", one(INIT), one(TEST), one(UPDATE), one(BODY)),
    FOR_IN_STATEMENT("ForInStatement", one(LEFT), one(RIGHT), one(BODY)),
    FOR_OF_STATEMENT("ForOfStatement", one(LEFT), one(RIGHT), one(BODY)),

    // Declarations
    FUNCTION_DECLARATION("FunctionDeclaration", one(ID), many(PARAMS), one(BODY)),
    VARIABLE_DECLARATION("VariableDeclaration", many(DECLARATIONS)),
    VARIABLE_DECLARATOR("VariableDeclarator", one(ID), one(INIT)),
    CLASS_DECLARATION("ClassDeclaration", one(ID), one(SUPER_CLASS), one(BODY)),
    CLASS_EXPRESSION("ClassExpression", one(ID), one(SUPER_CLASS), one(BODY)),
    CLASS_BODY("ClassBody", many(BODY)),
    METHOD_DEFINITION("MethodDefinition", one(KEY), one(VALUE)),
    PROPERTY_DEFINITION("PropertyDefinition", one(KEY), one(VALUE)),
    ACCESSOR_PROPERTY("AccessorProperty", one(KEY), one(VALUE)),

    // Expressions
    THIS_EXPRESSION("ThisExpression"),
    SUPER("Super"),
    ARRAY_EXPRESSION("ArrayExpression", many(ELEMENTS)),
    OBJECT_EXPRESSION("ObjectExpression", many(PROPERTIES)),
    PROPERTY("Property", one(KEY), one(VALUE)),
    FUNCTION_EXPRESSION("FunctionExpression", one(ID), many(PARAMS), one(BODY)),
    ARROW_FUNCTION_EXPRESSION("ArrowFunctionExpression", one(ID), many(PARAMS), one(BODY)),
    UNARY_EXPRESSION("UnaryExpression", one(ARGUMENT)),
    UPDATE_EXPRESSION("UpdateExpression", one(ARGUMENT)),
    BINARY_EXPRESSION("BinaryExpression", one(LEFT), one(RIGHT)),
    LOGICAL_EXPRESSION("LogicalExpression", one(LEFT), one(RIGHT)),
    ASSIGNMENT_EXPRESSION("AssignmentExpression", one(LEFT), one(RIGHT)),
    MEMBER_EXPRESSION("MemberExpression", one(OBJECT), one(Field.PROPERTY)),
    CHAIN_EXPRESSION("ChainExpression", one(EXPRESSION)),
    CONDITIONAL_EXPRESSION("ConditionalExpression", one(TEST), one(CONSEQUENT), one(ALTERNATE)),
    CALL_EXPRESSION("CallExpression", one(CALLEE), many(ARGUMENTS)),
    NEW_EXPRESSION("NewExpression", one(CALLEE), many(ARGUMENTS)),
    SEQUENCE_EXPRESSION("SequenceExpression", many(EXPRESSIONS)),
    YIELD_EXPRESSION("YieldExpression", one(ARGUMENT)),
    AWAIT_EXPRESSION("AwaitExpression", one(ARGUMENT)),
    TEMPLATE_LITERAL("TemplateLiteral", many(QUASIS), many(EXPRESSIONS)),
    TAGGED_TEMPLATE_EXPRESSION("TaggedTemplateExpression", one(TAG), one(QUASI)),
    TEMPLATE_ELEMENT("TemplateElement"),
    META_PROPERTY("MetaProperty", one(META), one(Field.PROPERTY)),
    IMPORT_EXPRESSION("ImportExpression", one(SOURCE)),
    IMPORT("Import"),
    IDENTIFIER("Identifier"),
    PRIVATE_IDENTIFIER("PrivateIdentifier"),
    LITERAL("Literal"),

    // Patterns
    OBJECT_PATTERN("ObjectPattern", many(PROPERTIES)),
    ARRAY_PATTERN("ArrayPattern", many(ELEMENTS)),
    REST_ELEMENT("RestElement", one(ARGUMENT)),
    ASSIGNMENT_PATTERN("AssignmentPattern", one(LEFT), one(RIGHT)),
    SPREAD_ELEMENT("SpreadElement", one(ARGUMENT)),

    // Modules
    IMPORT_DECLARATION("ImportDeclaration", many(SPECIFIERS), one(SOURCE)),
    IMPORT_SPECIFIER("ImportSpecifier", one(IMPORTED), one(LOCAL)),
    IMPORT_DEFAULT_SPECIFIER("ImportDefaultSpecifier", one(LOCAL)),
    IMPORT_NAMESPACE_SPECIFIER("ImportNamespaceSpecifier", one(LOCAL)),
    EXPORT_NAMED_DECLARATION("ExportNamedDeclaration", one(DECLARATION), many(SPECIFIERS), one(SOURCE)),
    EXPORT_SPECIFIER("ExportSpecifier", one(LOCAL), one(EXPORTED)),
    EXPORT_DEFAULT_DECLARATION("ExportDefaultDeclaration", one(DECLARATION)),
    EXPORT_ALL_DECLARATION("ExportAllDeclaration", one(EXPORTED), one(SOURCE)),

    // Markup
    JSX_ELEMENT("JSXElement", one(OPENING_ELEMENT), many(CHILDREN), one(CLOSING_ELEMENT)),
    JSX_OPENING_ELEMENT("JSXOpeningElement", one(NAME), many(ATTRIBUTES)),
    JSX_CLOSING_ELEMENT("JSXClosingElement", one(NAME)),
    JSX_FRAGMENT("JSXFragment", one(OPENING_FRAGMENT), many(CHILDREN), one(CLOSING_FRAGMENT)),
    JSX_OPENING_FRAGMENT("JSXOpeningFragment"),
    JSX_CLOSING_FRAGMENT("JSXClosingFragment"),
    JSX_ATTRIBUTE("JSXAttribute", one(NAME), one(VALUE)),
    JSX_SPREAD_ATTRIBUTE("JSXSpreadAttribute", one(ARGUMENT)),
    JSX_EXPRESSION_CONTAINER("JSXExpressionContainer", one(EXPRESSION)),
    JSX_EMPTY_EXPRESSION("JSXEmptyExpression"),
    JSX_SPREAD_CHILD("JSXSpreadChild", one(EXPRESSION)),
    JSX_TEXT("JSXText"),
    JSX_IDENTIFIER("JSXIdentifier"),
    JSX_MEMBER_EXPRESSION("JSXMemberExpression", one(OBJECT), one(Field.PROPERTY)),
    JSX_NAMESPACED_NAME("JSXNamespacedName", one(NAMESPACE), one(NAME)),

    // TypeScript wrappers around runtime expressions
    TS_AS_EXPRESSION("TSAsExpression", one(EXPRESSION)),
    TS_SATISFIES_EXPRESSION("TSSatisfiesExpression", one(EXPRESSION)),
    TS_NON_NULL_EXPRESSION("TSNonNullExpression", one(EXPRESSION)),
    TS_TYPE_ASSERTION("TSTypeAssertion", one(EXPRESSION)),
    TS_INSTANTIATION_EXPRESSION("TSInstantiationExpression", one(EXPRESSION)),
    TS_PARAMETER_PROPERTY("TSParameterProperty", one(PARAMETER)),
    TS_EXPORT_ASSIGNMENT("TSExportAssignment", one(EXPRESSION)),

    // TypeScript declarations without runtime children worth visiting
    TS_INTERFACE_DECLARATION("TSInterfaceDeclaration"),
    TS_TYPE_ALIAS_DECLARATION("TSTypeAliasDeclaration"),
    TS_ENUM_DECLARATION("TSEnumDeclaration"),
    TS_MODULE_DECLARATION("TSModuleDeclaration"),
    TS_DECLARE_FUNCTION("TSDeclareFunction"),
    TS_DECLARE_METHOD("TSDeclareMethod"),
    TS_IMPORT_EQUALS_DECLARATION("TSImportEqualsDeclaration"),
    TS_NAMESPACE_EXPORT_DECLARATION("TSNamespaceExportDeclaration"),
    TS_INDEX_SIGNATURE("TSIndexSignature"),
    TS_ABSTRACT_METHOD_DEFINITION("TSAbstractMethodDefinition"),
    TS_ABSTRACT_PROPERTY_DEFINITION("TSAbstractPropertyDefinition");

    private static final Map<String, NodeKind> BY_TYPE_NAME = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            BY_TYPE_NAME.put(kind.typeName, kind);
        }
    }

    private final String typeName;
    private final List<Slot> slots;

    NodeKind(String typeName, Slot... slots) {
        this.typeName = typeName;
        this.slots = List.of(slots);
    }

    /**
     * The ESTree {@code type} string.
     */
    public String getTypeName() {
        return typeName;
    }

    public List<Slot> getSlots() {
        return slots;
    }

    /**
     * Looks up a kind by its ESTree type name; returns null for names outside the closed set.
     */
    public static NodeKind fromTypeName(String typeName) {
        return BY_TYPE_NAME.get(typeName);
    }

    public boolean isFunction() {
        return this == FUNCTION_DECLARATION || this == FUNCTION_EXPRESSION || this == ARROW_FUNCTION_EXPRESSION;
    }

    public boolean isMarkup() {
        return this == JSX_ELEMENT || this == JSX_FRAGMENT;
    }

    /**
     * TypeScript expression wrappers whose single child is the runtime expression.
     */
    public boolean isTypeWrapper() {
        return this == TS_AS_EXPRESSION || this == TS_SATISFIES_EXPRESSION || this == TS_NON_NULL_EXPRESSION
                || this == TS_TYPE_ASSERTION || this == TS_INSTANTIATION_EXPRESSION;
    }

    /**
     * Kinds whose list slots interleave in the source, so children must be ordered by offset.
     */
    public boolean hasInterleavedSlots() {
        return this == TEMPLATE_LITERAL;
    }
}

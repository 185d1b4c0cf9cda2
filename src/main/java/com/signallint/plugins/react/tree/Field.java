package com.signallint.plugins.react.tree;

/**
 * Named child slots of ESTree nodes. Each constant carries the JSON property it is read from.
 */
public enum Field {
    BODY("body"),
    EXPRESSION("expression"),
    ID("id"),
    PARAMS("params"),
    INIT("init"),
    DECLARATIONS("declarations"),
    TEST("test"),
    CONSEQUENT("consequent"),
    ALTERNATE("alternate"),
    LEFT("left"),
    RIGHT("right"),
    ARGUMENT("argument"),
    ARGUMENTS("arguments"),
    CALLEE("callee"),
    OBJECT("object"),
    PROPERTY("property"),
    PROPERTIES("properties"),
    KEY("key"),
    VALUE("value"),
    ELEMENTS("elements"),
    EXPRESSIONS("expressions"),
    QUASIS("quasis"),
    TAG("tag"),
    QUASI("quasi"),
    UPDATE("update"),
    BLOCK("block"),
    HANDLER("handler"),
    FINALIZER("finalizer"),
    PARAM("param"),
    DISCRIMINANT("discriminant"),
    CASES("cases"),
    LABEL("label"),
    SOURCE("source"),
    SPECIFIERS("specifiers"),
    DECLARATION("declaration"),
    LOCAL("local"),
    IMPORTED("imported"),
    EXPORTED("exported"),
    SUPER_CLASS("superClass"),
    META("meta"),
    OPENING_ELEMENT("openingElement"),
    CLOSING_ELEMENT("closingElement"),
    OPENING_FRAGMENT("openingFragment"),
    CLOSING_FRAGMENT("closingFragment"),
    CHILDREN("children"),
    ATTRIBUTES("attributes"),
    NAME("name"),
    NAMESPACE("namespace"),
    PARAMETER("parameter");

    private final String jsonKey;

    Field(String jsonKey) {
        this.jsonKey = jsonKey;
    }

    public String getJsonKey() {
        return jsonKey;
    }
}

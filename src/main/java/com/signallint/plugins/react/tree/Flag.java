package com.signallint.plugins.react.tree;

/**
 * Boolean ESTree properties kept on a node.
 */
public enum Flag {
    COMPUTED("computed"),
    OPTIONAL("optional"),
    PREFIX("prefix"),
    SHORTHAND("shorthand"),
    METHOD("method"),
    ASYNC("async"),
    GENERATOR("generator"),
    STATIC("static"),
    DELEGATE("delegate"),
    SELF_CLOSING("selfClosing"),
    EXPRESSION_BODY("expression"),
    /**
     * Import declaration or specifier with {@code importKind} of {@code type} or {@code typeof}.
     */
    TYPE_ONLY("importKind");

    private final String jsonKey;

    Flag(String jsonKey) {
        this.jsonKey = jsonKey;
    }

    public String getJsonKey() {
        return jsonKey;
    }
}

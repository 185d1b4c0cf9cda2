package com.signallint.plugins.react.context;

/**
 * Lexical region a node occupies.
 */
public enum ScopeKind {
    MODULE,
    COMPONENT_RENDER,
    HOOK_BODY,
    EFFECT_CALLBACK,
    MARKUP_SUBTREE
}

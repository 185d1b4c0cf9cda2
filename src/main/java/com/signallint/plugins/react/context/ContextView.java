package com.signallint.plugins.react.context;

import com.signallint.plugins.react.tree.JsNode;

/**
 * Read-only view of the context stack for policies and fixes.
 */
public interface ContextView {

    /**
     * Effective kind of the node being visited.
     */
    ScopeKind currentKind();

    /**
     * True directly inside a component's render body, markup included, nested plain functions excluded.
     */
    boolean renderPhase();

    ScopeFrame topFrame();

    /**
     * Innermost frame of the given kind, or null.
     */
    ScopeFrame innermost(ScopeKind kind);

    /**
     * Effective kind recorded when an identifier was entered, or null if it was never visited.
     */
    ScopeKind kindAt(JsNode identifier);
}

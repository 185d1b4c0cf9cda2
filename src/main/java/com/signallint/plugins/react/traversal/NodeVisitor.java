package com.signallint.plugins.react.traversal;

import com.signallint.plugins.react.tree.JsNode;

/**
 * Callbacks of a depth-first traversal. {@code exit} of a node follows the exits of all its descendants.
 */
public interface NodeVisitor {
    void enter(JsNode node);

    void exit(JsNode node);
}

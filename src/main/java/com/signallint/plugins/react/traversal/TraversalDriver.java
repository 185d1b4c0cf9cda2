package com.signallint.plugins.react.traversal;

import com.signallint.plugins.react.tree.JsNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Walks a tree depth-first without recursion, so deeply nested sources cannot overflow the stack.
 * Children are visited in source order through their typed slots.
 */
public final class TraversalDriver {

    private TraversalDriver() {
    }

    /**
     * Visits every node once on entry and once on exit, in strict nesting order.
     * An exception thrown by the visitor abandons the walk.
     */
    public static void traverse(JsNode root, NodeVisitor visitor) {
        Deque<Cursor> stack = new ArrayDeque<>();
        visitor.enter(root);
        stack.push(new Cursor(root));

        while (!stack.isEmpty()) {
            Cursor top = stack.peek();
            if (top.hasNext()) {
                JsNode child = top.next();
                visitor.enter(child);
                stack.push(new Cursor(child));
            } else {
                stack.pop();
                visitor.exit(top.node);
            }
        }
    }

    private static final class Cursor {
        private final JsNode node;
        private final List<JsNode> children;
        private int index;

        Cursor(JsNode node) {
            this.node = node;
            this.children = node.children();
        }

        boolean hasNext() {
            return index < children.size();
        }

        JsNode next() {
            return children.get(index++);
        }
    }
}

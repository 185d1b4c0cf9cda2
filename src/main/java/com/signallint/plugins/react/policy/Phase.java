package com.signallint.plugins.react.policy;

/**
 * When a policy looks at its trigger nodes.
 */
public enum Phase {
    ENTER,  // Before the node's children
    EXIT    // After the whole subtree
}

package com.signallint.plugins.react.provenance;

/**
 * How a binding came to be known as a handle.
 */
public enum HandleOrigin {
    CREATOR_CALL,        // Initialized by a creator imported under its own name, or a bare creator name
    IMPORT_ALIAS,        // Initialized by a creator imported under another name
    NAMESPACE_QUALIFIED, // Initialized by ns.creator(...) on a recognized module namespace
    SUFFIX_HEURISTIC,    // Only the name's suffix suggests a handle
    PROPAGATED           // Copied from another handle or a literal holding handles
}

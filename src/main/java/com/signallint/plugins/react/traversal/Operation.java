package com.signallint.plugins.react.traversal;

/**
 * What an analysis run counts.
 */
public enum Operation {
    NODE_PROCESSED,        // Node entered by the traversal
    CONTEXT_PUSH,          // Scope frame pushed
    CONTEXT_POP,           // Scope frame popped
    SIGNAL_CHECK,          // Handle lookup for an identifier or member
    SIGNAL_CREATION,       // Creator-producing declaration recorded
    HANDLE_PROPAGATED,     // Handle inherited through an alias or container
    IMPORT_CHECK,          // Import declaration inspected
    CACHE_HIT,             // Contains-handle memo answered
    CACHE_MISS,            // Contains-handle memo computed
    POLICY_EVALUATED,      // Policy asked about a node
    FINDING_REPORTED,      // Finding accepted after suppression
    FINDING_SUPPRESSED,    // Finding dropped by overlap suppression
    FIX_COMPOSED,          // Fix built for an accepted finding
    FIX_DOWNGRADED,        // Primary fix turned into suggestions
    SCOPE_LOOKUP,          // Binding resolved through the scope model
    NODE_BUDGET_EXCEEDED   // Run aborted by its budget
}

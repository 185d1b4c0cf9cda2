package com.signallint.plugins.react.provenance;

import com.signallint.plugins.react.tree.JsNode;

import java.util.Optional;

/**
 * Read-only provenance queries available to policies.
 */
public interface HandleResolver {

    /**
     * The handle an identifier or one-level member expression denotes, if any.
     */
    Optional<Handle> isHandle(JsNode reference);

    /**
     * The handle read through {@code h.value}, if {@code member} is such an access.
     */
    Optional<Handle> valueAccessTarget(JsNode member);

    /**
     * Whether an object or array literal holds a handle reference anywhere outside nested functions.
     */
    boolean containsHandle(JsNode expression);

    /**
     * Resolves a call expression that creates a handle.
     */
    Optional<CreatorCall> creatorCall(JsNode expression);

    /**
     * Whether suffix-named identifiers may be treated as handles in this file.
     */
    boolean isHeuristicGateOpen();

    /**
     * Whether a declared name is known to hold something other than a handle.
     */
    boolean isKnownNonHandle(String name);

    ImportFacts getImportFacts();
}

package com.signallint.plugins.react.provenance;

import com.signallint.plugins.react.tree.JsNode;

/**
 * A call that creates a handle, with the creator it resolved to.
 */
public final class CreatorCall {
    private final JsNode call;
    private final String baseName;
    private final HandleOrigin origin;
    private final boolean hook;

    CreatorCall(JsNode call, String baseName, HandleOrigin origin, boolean hook) {
        this.call = call;
        this.baseName = baseName;
        this.origin = origin;
        this.hook = hook;
    }

    public JsNode getCall() {
        return call;
    }

    /**
     * The creator's exported name, regardless of the local alias used at the call site.
     */
    public String getBaseName() {
        return baseName;
    }

    public HandleOrigin getOrigin() {
        return origin;
    }

    /**
     * Hook creators ({@code useSignal}, {@code useComputed}) are safe to call during render.
     */
    public boolean isHook() {
        return hook;
    }

    public boolean isComputed() {
        return "computed".equals(baseName) || "useComputed".equals(baseName);
    }
}

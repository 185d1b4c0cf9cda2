package com.signallint.plugins.react.context;

import com.signallint.api.error.InternalFaultException;
import com.signallint.plugins.react.tree.JsNode;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * One entry of the context stack. Plain functions and markup inside the frame's owner
 * do not get frames of their own; they only move this frame's counters.
 */
public final class ScopeFrame {
    private final ScopeKind kind;
    private final int depth;
    private final JsNode owner;
    private final String label;
    private int plainDepth;
    private int markupDepth;
    private final Deque<Integer> savedMarkupDepths = new ArrayDeque<>();

    ScopeFrame(ScopeKind kind, int depth, JsNode owner, String label) {
        this.kind = kind;
        this.depth = depth;
        this.owner = owner;
        this.label = label;
    }

    public ScopeKind getKind() {
        return kind;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * The node whose entry pushed this frame.
     */
    public JsNode getOwner() {
        return owner;
    }

    /**
     * Component, hook or effect callee name, when known.
     */
    public String getLabel() {
        return label;
    }

    public int getPlainDepth() {
        return plainDepth;
    }

    public int getMarkupDepth() {
        return markupDepth;
    }

    /**
     * Kind seen by nodes at the current counters.
     */
    public ScopeKind effectiveKind() {
        if (markupDepth > 0) {
            return ScopeKind.MARKUP_SUBTREE;
        }
        if (plainDepth > 0 && (kind == ScopeKind.COMPONENT_RENDER || kind == ScopeKind.HOOK_BODY)) {
            return ScopeKind.MODULE;
        }
        return kind;
    }

    void enterPlainFunction() {
        plainDepth++;
        savedMarkupDepths.push(markupDepth);
        markupDepth = 0;
    }

    void exitPlainFunction() {
        if (plainDepth == 0 || savedMarkupDepths.isEmpty()) {
            throw new InternalFaultException("Plain function counter underflow in " + kind + " frame at depth " + depth);
        }
        plainDepth--;
        markupDepth = savedMarkupDepths.pop();
    }

    void enterMarkup() {
        markupDepth++;
    }

    void exitMarkup() {
        if (markupDepth == 0) {
            throw new InternalFaultException("Markup counter underflow in " + kind + " frame at depth " + depth);
        }
        markupDepth--;
    }

    @Override
    public String toString() {
        return kind + "#" + depth + (label != null ? "(" + label + ")" : "")
                + "[plain=" + plainDepth + ", markup=" + markupDepth + "]";
    }
}

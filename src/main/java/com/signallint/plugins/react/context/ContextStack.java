package com.signallint.plugins.react.context;

import com.signallint.api.error.InternalFaultException;
import com.signallint.plugins.react.traversal.Operation;
import com.signallint.plugins.react.traversal.OperationCounters;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Tracks the lexical region of every node during the single traversal pass of a run.
 * <p>
 * Only the program and classified functions push frames. Plain functions and markup
 * move the counters of the top frame, so the stack depth is bounded by the nesting of components,
 * hooks and effects.
 */
public class ContextStack implements ContextView {
    private final FrameClassifier classifier;
    private final OperationCounters counters;
    private final Deque<ScopeFrame> frames = new ArrayDeque<>();
    private final Set<JsNode> frameOwners = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<JsNode, ScopeKind> identifierKinds = new IdentityHashMap<>();

    public ContextStack(FrameClassifier classifier, OperationCounters counters) {
        this.classifier = classifier;
        this.counters = counters;
    }

    /**
     * Updates the stack for a node being entered.
     */
    public void enter(JsNode node) {
        NodeKind kind = node.kind();
        if (kind == NodeKind.PROGRAM) {
            push(ScopeKind.MODULE, node, null);
        } else if (kind.isFunction()) {
            FrameClassifier.Classification classification = classifier.classify(node);
            if (classification != null) {
                push(classification.getKind(), node, classification.getLabel());
            } else {
                _top().enterPlainFunction();
            }
        } else if (kind.isMarkup()) {
            _top().enterMarkup();
        } else if (kind == NodeKind.IDENTIFIER) {
            identifierKinds.put(node, currentKind());
        }
    }

    /**
     * Restores the stack for a node being left.
     */
    public void exit(JsNode node) {
        NodeKind kind = node.kind();
        if (kind == NodeKind.PROGRAM) {
            pop(node);
        } else if (kind.isFunction()) {
            if (frameOwners.contains(node)) {
                pop(node);
            } else {
                _top().exitPlainFunction();
            }
        } else if (kind.isMarkup()) {
            _top().exitMarkup();
        }
    }

    public ScopeFrame push(ScopeKind kind, JsNode owner, String label) {
        ScopeFrame frame = new ScopeFrame(kind, frames.size(), owner, label);
        frames.push(frame);
        frameOwners.add(owner);
        counters.increment(Operation.CONTEXT_PUSH);
        return frame;
    }

    /**
     * Pops the top frame, which must have been pushed for {@code owner} and have no open counters.
     *
     * @throws InternalFaultException on underflow or a mismatched owner
     */
    public ScopeFrame pop(JsNode owner) {
        if (frames.isEmpty()) {
            throw new InternalFaultException("Context stack underflow when leaving " + owner);
        }
        ScopeFrame top = frames.peek();
        if (top.getOwner() != owner) {
            throw new InternalFaultException("Context frame mismatch: leaving " + owner
                    + " but the top frame belongs to " + top.getOwner());
        }
        if (top.getPlainDepth() != 0 || top.getMarkupDepth() != 0) {
            throw new InternalFaultException("Context frame " + top + " popped with open counters");
        }
        frames.pop();
        frameOwners.remove(owner);
        counters.increment(Operation.CONTEXT_POP);
        return top;
    }

    public int depth() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    @Override
    public ScopeKind currentKind() {
        return frames.isEmpty() ? ScopeKind.MODULE : frames.peek().effectiveKind();
    }

    @Override
    public boolean renderPhase() {
        ScopeFrame top = frames.peek();
        return top != null && top.getKind() == ScopeKind.COMPONENT_RENDER && top.getPlainDepth() == 0;
    }

    @Override
    public ScopeFrame topFrame() {
        return frames.peek();
    }

    @Override
    public ScopeFrame innermost(ScopeKind kind) {
        Iterator<ScopeFrame> iterator = frames.iterator();
        while (iterator.hasNext()) {
            ScopeFrame frame = iterator.next();
            if (frame.getKind() == kind) {
                return frame;
            }
        }
        return null;
    }

    @Override
    public ScopeKind kindAt(JsNode identifier) {
        return identifierKinds.get(identifier);
    }

    private ScopeFrame _top() {
        ScopeFrame top = frames.peek();
        if (top == null) {
            throw new InternalFaultException("No context frame is open");
        }
        return top;
    }
}

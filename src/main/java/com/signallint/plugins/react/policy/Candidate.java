package com.signallint.plugins.react.policy;

import com.signallint.api.error.Finding;
import com.signallint.plugins.react.tree.JsNode;

/**
 * A finding waiting for overlap suppression, with the policy and node that produced it.
 */
public final class Candidate {
    private final Policy policy;
    private final Finding finding;
    private final JsNode node;
    private final FindingKind kind;

    Candidate(Policy policy, Finding finding, JsNode node, FindingKind kind) {
        this.policy = policy;
        this.finding = finding;
        this.node = node;
        this.kind = kind;
    }

    // Getters
    public Policy getPolicy() { return policy; }
    public Finding getFinding() { return finding; }
    public JsNode getNode() { return node; }
    public FindingKind getKind() { return kind; }

    @Override
    public String toString() {
        return finding.toString();
    }
}

package com.signallint.plugins.react.policy;

import com.signallint.api.error.Finding;
import com.signallint.plugins.react.traversal.Operation;
import com.signallint.plugins.react.traversal.OperationCounters;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import com.signallint.util.LoggerUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Dispatches policies on their trigger kinds and decides which findings survive overlap suppression.
 */
public class PolicyEvaluator {
    private static final Logger logger = LoggerUtil.getLogger(PolicyEvaluator.class);

    private final PolicyContext context;
    private final OperationCounters counters;
    private final Map<NodeKind, List<Policy>> onEnter = new EnumMap<>(NodeKind.class);
    private final Map<NodeKind, List<Policy>> onExit = new EnumMap<>(NodeKind.class);
    private final List<Candidate> candidates = new ArrayList<>();

    public PolicyEvaluator(List<Policy> policies, PolicyContext context, OperationCounters counters) {
        this.context = context;
        this.counters = counters;
        for (Policy policy : policies) {
            if (!_hasEnabledKind(policy)) {
                logger.fine("Rule " + policy.ruleId() + " is off");
                continue;
            }
            Map<NodeKind, List<Policy>> table = policy.phase() == Phase.EXIT ? onExit : onEnter;
            for (NodeKind trigger : policy.triggers()) {
                table.computeIfAbsent(trigger, kind -> new ArrayList<>()).add(policy);
            }
        }
    }

    private boolean _hasEnabledKind(Policy policy) {
        for (FindingKind kind : policy.kinds()) {
            if (context.isEnabled(policy, kind)) {
                return true;
            }
        }
        return false;
    }

    public void enter(JsNode node) {
        _dispatch(onEnter.get(node.kind()), node);
    }

    public void exit(JsNode node) {
        _dispatch(onExit.get(node.kind()), node);
    }

    private void _dispatch(List<Policy> policies, JsNode node) {
        if (policies == null) {
            return;
        }
        for (Policy policy : policies) {
            counters.increment(Operation.POLICY_EVALUATED);
            Optional<Finding> finding = policy.evaluate(node, context);
            finding.ifPresent(f -> candidates.add(new Candidate(policy, f, node, _kindOf(policy, f))));
        }
    }

    private static FindingKind _kindOf(Policy policy, Finding finding) {
        for (FindingKind kind : policy.kinds()) {
            if (kind.getId().equals(finding.getKind())) {
                return kind;
            }
        }
        throw new IllegalStateException("Rule " + policy.ruleId() + " reported unknown kind " + finding.getKind());
    }

    /**
     * Candidates seen so far, in evaluation order.
     */
    public List<Candidate> getCandidates() {
        return Collections.unmodifiableList(candidates);
    }

    /**
     * Orders candidates by specificity, then position, and drops any candidate overlapping an
     * accepted finding of another rule. Exact duplicates of one rule are dropped as well.
     */
    public List<Candidate> accept() {
        List<Candidate> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingInt((Candidate c) -> -c.getPolicy().specificity())
                .thenComparingInt(c -> c.getFinding().getLocation().getStart())
                .thenComparingInt(c -> c.getFinding().getLocation().getEnd()));

        List<Candidate> accepted = new ArrayList<>();
        for (Candidate candidate : ordered) {
            if (_isSuppressed(candidate, accepted)) {
                counters.increment(Operation.FINDING_SUPPRESSED);
                logger.finer("Suppressed " + candidate);
                continue;
            }
            accepted.add(candidate);
            counters.increment(Operation.FINDING_REPORTED);
        }
        return accepted;
    }

    private static boolean _isSuppressed(Candidate candidate, List<Candidate> accepted) {
        Finding finding = candidate.getFinding();
        for (Candidate other : accepted) {
            Finding kept = other.getFinding();
            if (!kept.getRuleId().equals(finding.getRuleId())) {
                if (kept.getLocation().overlaps(finding.getLocation())) {
                    return true;
                }
            } else if (kept.getKind().equals(finding.getKind()) && kept.getLocation().equals(finding.getLocation())) {
                return true;
            }
        }
        return false;
    }
}

package com.signallint.plugins.react.policy;

import com.signallint.api.Fix;
import com.signallint.api.error.Finding;
import com.signallint.plugins.react.fix.FixContext;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One check. Policies are stateless; everything they know about a file comes through the
 * {@link PolicyContext} of the run.
 */
public interface Policy {

    String ruleId();

    List<FindingKind> kinds();

    /**
     * Node kinds this policy is dispatched on.
     */
    Set<NodeKind> triggers();

    default Phase phase() {
        return Phase.ENTER;
    }

    /**
     * Higher specificity wins when findings of different rules overlap.
     */
    int specificity();

    Optional<Finding> evaluate(JsNode node, PolicyContext context);

    /**
     * Builds the fix for an accepted finding. Called once, after the traversal.
     */
    default Fix composeFix(Finding finding, JsNode node, FixContext fixes) {
        return Fix.none();
    }
}

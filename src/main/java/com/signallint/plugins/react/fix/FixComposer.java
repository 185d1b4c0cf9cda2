package com.signallint.plugins.react.fix;

import com.signallint.api.Fix;
import com.signallint.plugins.react.policy.Candidate;
import com.signallint.plugins.react.traversal.Operation;
import com.signallint.plugins.react.traversal.OperationCounters;
import com.signallint.util.LoggerUtil;

import java.util.logging.Logger;

/**
 * Composes fixes for accepted findings, in acceptance order, and claims their edits.
 * A primary fix that cannot be claimed becomes a suggestion.
 */
public class FixComposer {
    private static final Logger logger = LoggerUtil.getLogger(FixComposer.class);

    private final FixContext fixContext;
    private final OperationCounters counters;
    private final EditSet editSet = new EditSet();

    public FixComposer(FixContext fixContext, OperationCounters counters) {
        this.fixContext = fixContext;
        this.counters = counters;
    }

    public Fix compose(Candidate candidate) {
        Fix fix = candidate.getPolicy().composeFix(candidate.getFinding(), candidate.getNode(), fixContext);
        if (fix.getType() == Fix.Type.NONE) {
            return fix;
        }
        counters.increment(Operation.FIX_COMPOSED);

        if (fix.isPrimary() && !editSet.tryClaim(fix.getEdits())) {
            logger.fine("Fix for " + candidate + " conflicts with an earlier fix, offering it as a suggestion");
            counters.increment(Operation.FIX_DOWNGRADED);
            return fix.downgrade(candidate.getFinding().getKind());
        }
        return fix;
    }

    public EditSet getEditSet() {
        return editSet;
    }
}

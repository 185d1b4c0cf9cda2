package com.signallint.plugins.react.rules;

import com.signallint.api.Diagnostic;
import com.signallint.api.LintResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.signallint.TestSources.lint;
import static com.signallint.TestSources.ofRule;
import static org.junit.jupiter.api.Assertions.*;

class ForbidSignalReAssignmentRuleTest {

    private static final String RULE = ForbidSignalReAssignmentRule.RULE_ID;
    private static final String HEADER = "import { signal } from '@preact/signals-react';\n"
            + "const countSignal = signal(0);\n";

    @Test
    void testAliasingIsReported() {
        LintResult result = lint("store.ts", HEADER + "const other = countSignal;\nlet later;\nlater = countSignal;\n"
                + "function f(arg = countSignal) { return arg; }\n");

        List<Diagnostic> diagnostics = ofRule(result, RULE);
        assertEquals(3, diagnostics.size(), "Declaration, assignment and default parameter: " + diagnostics);
        assertEquals("reassignSignal", diagnostics.get(0).getFinding().getKind());
        assertEquals("Avoid re-assigning or aliasing signal 'countSignal'. Access its '.value' or pass it directly "
                + "instead.", diagnostics.get(0).getMessage());
    }

    @Test
    void testHeuristicMemberSource() {
        LintResult result = lint("store.ts", HEADER + "const mine = store.totalSignal;\n");
        assertEquals("store.totalSignal", ofRule(result, RULE).get(0).getFinding().getParams().get("name"));
    }

    @Test
    void testValueReadsAndCompoundAssignmentsAreFine() {
        LintResult result = lint("store.ts", HEADER + "const current = countSignal.value;\nlet n = 0;\nn += countSignal;\n"
                + "const creator = signal(1);\n");
        assertTrue(ofRule(result, RULE).isEmpty());
    }
}

package com.signallint.plugins.react.rules;

import com.signallint.api.Diagnostic;
import com.signallint.api.LintResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.signallint.TestSources.lint;
import static com.signallint.TestSources.ofRule;
import static org.junit.jupiter.api.Assertions.*;

class ForbidSignalDestructuringRuleTest {

    private static final String RULE = ForbidSignalDestructuringRule.RULE_ID;
    private static final String HEADER = "import { signal } from '@preact/signals-react';\n"
            + "const countSignal = signal(0);\n";

    private static List<String> names(LintResult result) {
        return ofRule(result, RULE).stream()
                .map(d -> d.getFinding().getParams().get("name"))
                .collect(Collectors.toList());
    }

    @Test
    void testDestructuringSources() {
        LintResult result = lint("store.ts", HEADER
                + "const { value } = countSignal;\n"
                + "const { peek } = signal(2);\n"
                + "const [first] = [countSignal];\n"
                + "const { a } = { a: countSignal };\n");

        assertEquals(List.of("countSignal", "signal()", "[...]", "{...}"), names(result));
        Diagnostic first = ofRule(result, RULE).get(0);
        assertEquals("Avoid destructuring from signal 'countSignal'. Read from '.value' or use direct member access "
                + "instead.", first.getMessage());
    }

    @Test
    void testAssignmentPatterns() {
        LintResult result = lint("store.ts", HEADER + "let value;\n({ value } = countSignal);\n");
        assertEquals(List.of("countSignal"), names(result));
    }

    @Test
    void testPlainDestructuringIsFine() {
        LintResult result = lint("store.ts", HEADER
                + "const { a, b } = props;\nconst [x, y] = [1, 2];\nconst { length } = countSignal.value;\n");
        assertTrue(names(result).isEmpty());
    }
}

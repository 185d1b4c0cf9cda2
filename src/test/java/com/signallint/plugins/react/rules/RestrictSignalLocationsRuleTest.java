package com.signallint.plugins.react.rules;

import com.signallint.api.Diagnostic;
import com.signallint.api.LintResult;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.signallint.TestSources.kinds;
import static com.signallint.TestSources.lint;
import static com.signallint.TestSources.ofRule;
import static com.signallint.TestSources.ruleOption;
import static org.junit.jupiter.api.Assertions.*;

class RestrictSignalLocationsRuleTest {

    private static final String RULE = RestrictSignalLocationsRule.RULE_ID;

    private static final String STORE = """
            import { signal, computed } from '@preact/signals-react';
            export const countSignal = signal(0);
            export const doubledSignal = computed(() => countSignal.value * 2);
            const privateSignal = signal(1);
            export function read() { return privateSignal.value; }
            """;

    private static final String COMPONENT = """
            import { signal, computed } from '@preact/signals-react';
            function Counter() {
              const countSignal = signal(0);
              const doubledSignal = computed(() => countSignal.value * 2);
              return <p>{doubledSignal}</p>;
            }
            """;

    @Test
    void testExportedHandles() {
        List<Diagnostic> diagnostics = ofRule(lint("store.ts", STORE), RULE);

        assertEquals(2, diagnostics.size());
        for (Diagnostic diagnostic : diagnostics) {
            assertEquals("exportedSignal", diagnostic.getFinding().getKind());
        }
    }

    @Test
    void testAllowedDirectoriesAreSkipped() {
        LintResult result = lint("src/store/counter.ts", STORE, ruleOption(RULE, "allowedDirs", List.of("src/store")));
        assertTrue(ofRule(result, RULE).isEmpty());
    }

    @Test
    void testCreationInComponentBody() {
        LintResult result = lint("Counter.tsx", COMPONENT, _withCreationRuleOff(new HashMap<>()));

        List<Diagnostic> diagnostics = ofRule(result, RULE);
        assertEquals(2, diagnostics.size());
        assertTrue(kinds(result).contains("signalInComponent"));
        assertTrue(kinds(result).contains("computedInComponent"));
    }

    @Test
    void testComputedAllowedInComponents() {
        Map<String, Object> rule = new HashMap<>();
        rule.put("allowComputedInComponents", true);
        LintResult result = lint("Counter.tsx", COMPONENT, _withCreationRuleOff(rule));

        List<Diagnostic> diagnostics = ofRule(result, RULE);
        assertEquals(1, diagnostics.size());
        assertEquals("signalInComponent", diagnostics.get(0).getFinding().getKind());
    }

    @Test
    void testCreationCheckYieldsToMoreSpecificRule() {
        LintResult result = lint(COMPONENT);

        assertTrue(ofRule(result, RULE).isEmpty());
        assertEquals(2, ofRule(result, NoSignalCreationInComponentRule.RULE_ID).size());
    }

    private static Map<String, Object> _withCreationRuleOff(Map<String, Object> rule) {
        Map<String, Object> creation = new HashMap<>();
        creation.put("severity", "off");
        Map<String, Object> rules = new HashMap<>();
        rules.put(NoSignalCreationInComponentRule.RULE_ID, creation);
        rules.put(RULE, rule);
        Map<String, Object> config = new HashMap<>();
        config.put("rules", rules);
        return config;
    }
}

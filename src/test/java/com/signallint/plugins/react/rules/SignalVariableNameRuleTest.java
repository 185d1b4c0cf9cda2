package com.signallint.plugins.react.rules;

import com.signallint.api.Diagnostic;
import com.signallint.api.Fix;
import com.signallint.api.LintResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.signallint.TestSources.analysisOption;
import static com.signallint.TestSources.lint;
import static com.signallint.TestSources.ofRule;
import static org.junit.jupiter.api.Assertions.*;

class SignalVariableNameRuleTest {

    private static final String RULE = SignalVariableNameRule.RULE_ID;

    @Test
    void testNameRules() {
        assertTrue(SignalVariableNameRule.isValidName("countSignal", "Signal"));
        assertFalse(SignalVariableNameRule.isValidName("count", "Signal"));
        assertFalse(SignalVariableNameRule.isValidName("CountSignal", "Signal"));
        assertFalse(SignalVariableNameRule.isValidName("useCountSignal", "Signal"));
        assertTrue(SignalVariableNameRule.isValidName("userSignal", "Signal"), "'user' is not a hook prefix");

        assertEquals("countSignal", SignalVariableNameRule.fixedName("useCount", "Signal"));
        assertEquals("countSignal", SignalVariableNameRule.fixedName("Count", "Signal"));
        assertEquals("countSignal", SignalVariableNameRule.fixedName("CountSignal", "Signal"));
    }

    @Test
    void testRenamesDeclarationAndReferences() {
        String source = """
                import { signal } from '@preact/signals-react';
                const count = signal(0);
                export function read() { return count.value; }
                const holder = { count };
                """;
        LintResult result = lint("store.ts", source);

        List<Diagnostic> diagnostics = ofRule(result, RULE);
        assertEquals(1, diagnostics.size());
        assertEquals("invalidSignalName", diagnostics.get(0).getFinding().getKind());
        assertEquals("Signal variable 'count' should end with 'Signal', start with lowercase, and not start with 'use'",
                diagnostics.get(0).getMessage());
        assertEquals("""
                import { signal } from '@preact/signals-react';
                const countSignal = signal(0);
                export function read() { return countSignal.value; }
                const holder = { count: countSignal };
                """, result.getFixedCode());
    }

    @Test
    void testComputedKind() {
        LintResult result = lint("store.ts", "const useTotal = computed(() => 1);\n");
        Diagnostic diagnostic = ofRule(result, RULE).get(0);
        assertEquals("invalidComputedName", diagnostic.getFinding().getKind());
        assertEquals("const totalSignal = computed(() => 1);\n", result.getFixedCode());
    }

    @Test
    void testTakenNameGetsNoFix() {
        String source = "const count = signal(0);\nfunction f() { const countSignal = 1; return count.value + countSignal; }\n";
        Diagnostic diagnostic = ofRule(lint("store.ts", source), RULE).get(0);
        assertEquals(Fix.Type.NONE, diagnostic.getFix().getType(), "Renaming would be captured by the inner binding");
    }

    @Test
    void testNonLetterStartIsReportedWithoutFix() {
        String source = "const _count = signal(0);\nconst $total = computed(() => _count.value);\n";
        LintResult result = lint("store.ts", source);

        List<Diagnostic> diagnostics = ofRule(result, RULE);
        assertEquals(2, diagnostics.size());
        for (Diagnostic diagnostic : diagnostics) {
            assertEquals(Fix.Type.NONE, diagnostic.getFix().getType(), diagnostic.getMessage());
        }
        assertEquals(source, result.getFixedCode());
        assertFalse(SignalVariableNameRule.isValidName(SignalVariableNameRule.fixedName("_count", "Signal"), "Signal"));
    }

    @Test
    void testEffectsAndPlainValuesAreIgnored() {
        String source = "const dispose = effect(() => {});\nconst count = 1;\nconst total = compute();\n";
        assertTrue(ofRule(lint("store.ts", source), RULE).isEmpty());
    }

    @Test
    void testCustomSuffix() {
        LintResult result = lint("store.ts", "const count = signal(0);\nconst total$ = signal(1);\n",
                analysisOption("suffix", "$"));
        List<Diagnostic> diagnostics = ofRule(result, RULE);
        assertEquals(1, diagnostics.size());
        assertEquals("count", diagnostics.get(0).getFinding().getParams().get("name"));
        assertTrue(result.getFixedCode().startsWith("const count$ = signal(0);"));
    }
}

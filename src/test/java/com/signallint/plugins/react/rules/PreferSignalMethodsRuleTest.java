package com.signallint.plugins.react.rules;

import com.signallint.api.Diagnostic;
import com.signallint.api.Fix;
import com.signallint.api.LintResult;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.signallint.TestSources.lint;
import static com.signallint.TestSources.ofRule;
import static com.signallint.TestSources.ruleOption;
import static org.junit.jupiter.api.Assertions.*;

class PreferSignalMethodsRuleTest {

    private static final String RULE = PreferSignalMethodsRule.RULE_ID;

    private static String effect(String body) {
        return "import { signal } from '@preact/signals-react';\n"
                + "const countSignal = signal(0);\n"
                + "function Counter() {\n"
                + "  useEffect(() => {\n" + body + "\n  }, [countSignal.value]);\n"
                + "  return null;\n"
                + "}\n";
    }

    @Test
    void testValueReadInEffectBecomesPeek() {
        String source = effect("    console.log(countSignal.value);");
        LintResult result = lint(source);

        List<Diagnostic> diagnostics = ofRule(result, RULE);
        assertEquals(1, diagnostics.size(), "The dependency array read is not reported");
        assertEquals("preferPeekInEffect", diagnostics.get(0).getFinding().getKind());
        assertTrue(diagnostics.get(0).getFix().isPrimary());
        assertEquals(source.replace("console.log(countSignal.value)", "console.log(countSignal.peek())"),
                result.getFixedCode());
    }

    @Test
    void testOptionalChainGetsOnlyASuggestion() {
        String source = effect("    console.log(countSignal?.value);");
        LintResult result = lint(source);

        Fix fix = ofRule(result, RULE).get(0).getFix();
        assertEquals(Fix.Type.SUGGESTIONS, fix.getType());
        assertEquals("countSignal?.peek()", fix.getSuggestions().get(0).getEdits().get(0).getReplacement());
        assertEquals(source, result.getFixedCode());
    }

    @Test
    void testConditionalReadGetsOnlyASuggestion() {
        String source = effect("    const n = ready && countSignal.value;");
        Fix fix = ofRule(lint(source), RULE).get(0).getFix();
        assertEquals(Fix.Type.SUGGESTIONS, fix.getType(), "Adding a call under && changes evaluation");
    }

    @Test
    void testBareOperand() {
        String source = effect("    const next = countSignal + 1;");
        LintResult result = lint(source);

        List<Diagnostic> diagnostics = ofRule(result, RULE);
        assertEquals(1, diagnostics.size());
        assertEquals("usePeekInEffect", diagnostics.get(0).getFinding().getKind());
        assertTrue(result.getFixedCode().contains("const next = countSignal.peek() + 1;"));
    }

    @Test
    void testWritesAndMutationsAreNotReads() {
        String source = effect("    countSignal.value.push(1);\n    countSignal.value.x = 2;");
        assertTrue(ofRule(lint(source), RULE).isEmpty());
    }

    @Test
    void testOutsideEffectsNothingIsReported() {
        String source = "const countSignal = signal(0);\nfunction App() { const n = countSignal.value + 1; return n; }";
        assertTrue(ofRule(lint(source), RULE).isEmpty());
    }

    @Test
    void testEffectsSuggestionOnly() {
        String source = effect("    console.log(countSignal.value);");
        LintResult result = lint("Counter.tsx", source, ruleOption(RULE, "effectsSuggestionOnly", true));
        assertEquals(Fix.Type.SUGGESTIONS, ofRule(result, RULE).get(0).getFix().getType());
        assertEquals(source, result.getFixedCode());
    }

    @Test
    void testKindCanBeSwitchedOff() {
        Map<String, Object> kinds = new HashMap<>();
        kinds.put("usePeekInEffect", "off");
        Map<String, Object> rule = new HashMap<>();
        rule.put("severity", kinds);
        Map<String, Object> rules = new HashMap<>();
        rules.put(RULE, rule);
        Map<String, Object> config = new HashMap<>();
        config.put("rules", rules);

        String source = effect("    const next = countSignal + 1;\n    console.log(countSignal.value);");
        LintResult result = lint("Counter.tsx", source, config);
        List<Diagnostic> diagnostics = ofRule(result, RULE);
        assertEquals(1, diagnostics.size());
        assertEquals("preferPeekInEffect", diagnostics.get(0).getFinding().getKind());
    }
}

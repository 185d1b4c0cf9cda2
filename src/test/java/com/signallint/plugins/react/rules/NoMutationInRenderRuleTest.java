package com.signallint.plugins.react.rules;

import com.signallint.api.Diagnostic;
import com.signallint.api.Fix;
import com.signallint.api.LintResult;
import com.signallint.api.error.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.signallint.TestSources.analysisOption;
import static com.signallint.TestSources.kinds;
import static com.signallint.TestSources.lint;
import static com.signallint.TestSources.ofRule;
import static com.signallint.TestSources.ruleOption;
import static org.junit.jupiter.api.Assertions.*;

class NoMutationInRenderRuleTest {

    private static final String RULE = NoMutationInRenderRule.RULE_ID;

    private static String component(String body) {
        return "import { signal } from '@preact/signals-react';\n"
                + "const countSignal = signal(0);\n"
                + "const itemsSignal = signal([]);\n"
                + "const userSignal = signal({ name: 'a' });\n"
                + "function Counter() {\n" + body + "\n  return null;\n}\n";
    }

    @Test
    void testValueAssignmentInRenderIsTheOnlyFinding() {
        LintResult result = lint("Foo.jsx", "const countSignal = signal(0); function Foo() { countSignal.value = 1; }");

        assertEquals(1, result.getDiagnostics().size(), "Expected exactly one diagnostic: " + result.getDiagnostics());
        Diagnostic diagnostic = result.getDiagnostics().get(0);
        assertEquals(RULE, diagnostic.getRuleId());
        assertEquals("signalValueAssignment", diagnostic.getFinding().getKind());
        assertEquals(Severity.ERROR, diagnostic.getSeverity());
        assertEquals(Fix.Type.NONE, diagnostic.getFix().getType(), "Render mutations get no fix by default");
        assertFalse(result.isSuccessful());
    }

    @Test
    void testMutationKinds() {
        LintResult result = lint(component("""
                  countSignal.value++;
                  countSignal.value += 2;
                  itemsSignal.value.push(1);
                  itemsSignal.value[0] = 3;
                  userSignal.value.name = 'b';
                """));

        assertEquals(List.of("signalValueUpdate", "signalValueUpdate", "signalPropertyAssignment",
                "signalArrayIndexAssignment", "signalNestedPropertyAssignment"), kinds(result));
    }

    @Test
    void testHandlersAndEffectsAreNotRender() {
        LintResult result = lint(component("""
                  const onClick = () => { countSignal.value++; };
                  function reset() { countSignal.value = 0; }
                  useEffect(() => { countSignal.value = 1; });
                """));

        assertTrue(ofRule(result, RULE).isEmpty(), "Nothing in a handler or an effect is a render mutation");
    }

    @Test
    void testReadsAreNotMutations() {
        LintResult result = lint(component("  const n = countSignal.value + itemsSignal.value.length;"));
        assertTrue(ofRule(result, RULE).isEmpty());
    }

    @Test
    void testAllowedFilesAreSkipped() {
        String source = component("  countSignal.value = 5;");
        LintResult result = lint("Counter.test.jsx", source,
                analysisOption("allowedPatterns", List.of("\\.test\\.jsx$")));
        assertTrue(ofRule(result, RULE).isEmpty());
        assertFalse(ofRule(lint("Counter.jsx", source), RULE).isEmpty());
    }

    @Test
    void testUnsafeAutofixOffersSuggestions() {
        String source = component("  countSignal.value = 5;");
        LintResult result = lint("Counter.jsx", source, ruleOption(RULE, "unsafeAutofix", true));

        Fix fix = ofRule(result, RULE).get(0).getFix();
        assertEquals(Fix.Type.SUGGESTIONS, fix.getType());
        assertEquals(2, fix.getSuggestions().size());
        assertEquals("suggestUseEffect", fix.getSuggestions().get(0).getKind());
        assertEquals("suggestEventHandler", fix.getSuggestions().get(1).getKind());
        assertEquals(source, result.getFixedCode(), "Suggestions are never applied");
    }
}

package com.signallint.plugins.react.rules;

import com.signallint.api.Diagnostic;
import com.signallint.api.Fix;
import com.signallint.api.LintResult;
import com.signallint.api.Suggestion;
import com.signallint.plugins.react.fix.EditSet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.signallint.TestSources.lint;
import static com.signallint.TestSources.ofRule;
import static org.junit.jupiter.api.Assertions.*;

class NoSignalAssignmentInEffectRuleTest {

    private static final String RULE = NoSignalAssignmentInEffectRule.RULE_ID;

    @Test
    void testAssignmentInEffectSuggestsSignalEffect() {
        String source = """
                import { signal } from '@preact/signals-react';
                import { useEffect } from 'react';
                const countSignal = signal(0);
                function App() {
                  useEffect(() => {
                    countSignal.value = 1;
                  }, []);
                  return null;
                }
                """;
        LintResult result = lint(source);

        List<Diagnostic> diagnostics = ofRule(result, RULE);
        assertEquals(1, diagnostics.size());
        assertTrue(diagnostics.get(0).getMessage().startsWith("Avoid direct signal assignments in useEffect."));
        assertEquals(source, result.getFixedCode(), "Switching the effect hook is only ever suggested");

        Fix fix = diagnostics.get(0).getFix();
        assertEquals(Fix.Type.SUGGESTIONS, fix.getType());
        Suggestion suggestion = fix.getSuggestions().get(0);
        assertEquals("suggestUseSignalEffect", suggestion.getKind());
        assertEquals("""
                import { signal, useSignalEffect } from '@preact/signals-react';
                import { useEffect } from 'react';
                const countSignal = signal(0);
                function App() {
                  useSignalEffect(() => {
                    countSignal.value = 1;
                  });
                  return null;
                }
                """, EditSet.apply(source, suggestion.getEdits()));
    }

    @Test
    void testUpdatesInNestedFunctionsOfTheEffect() {
        String source = """
                const countSignal = signal(0);
                function App() {
                  React.useLayoutEffect(() => {
                    const id = setInterval(() => { countSignal.value++; }, 100);
                    return () => clearInterval(id);
                  });
                  return null;
                }
                """;
        List<Diagnostic> diagnostics = ofRule(lint(source), RULE);
        assertEquals(1, diagnostics.size());
        assertEquals("useLayoutEffect", diagnostics.get(0).getFinding().getParams().get("hookName"));

        String suggested = EditSet.apply(source, diagnostics.get(0).getFix().getSuggestions().get(0).getEdits());
        assertTrue(suggested.startsWith("import { useSignalEffect } from '@preact/signals-react';\n"), suggested);
        assertTrue(suggested.contains("  useSignalEffect(() => {\n"), suggested);
    }

    @Test
    void testLocalWritesAreFine() {
        String source = """
                function App() {
                  useEffect(() => {
                    let local = 0;
                    local = 1;
                    ref.current = 2;
                  });
                  return null;
                }
                """;
        assertTrue(ofRule(lint(source), RULE).isEmpty());
    }
}

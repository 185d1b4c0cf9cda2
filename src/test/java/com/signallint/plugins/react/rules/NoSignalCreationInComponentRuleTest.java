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

class NoSignalCreationInComponentRuleTest {

    private static final String RULE = NoSignalCreationInComponentRule.RULE_ID;

    @Test
    void testCreationInRenderSuggestsHook() {
        String source = """
                import { signal } from '@preact/signals-react';
                function Counter() {
                  const countSignal = signal(0);
                  return <p>{countSignal}</p>;
                }
                """;
        LintResult result = lint(source);

        List<Diagnostic> diagnostics = ofRule(result, RULE);
        assertEquals(1, diagnostics.size());
        assertEquals("Avoid creating reactive signals inside component. "
                + "Move signal creation to module level or a custom hook.", diagnostics.get(0).getMessage());
        assertFalse(result.isSuccessful());

        Fix fix = diagnostics.get(0).getFix();
        assertEquals(Fix.Type.SUGGESTIONS, fix.getType());
        Suggestion suggestion = fix.getSuggestions().get(0);
        assertEquals("Use useSignal instead of signal", suggestion.getDescription());
        assertEquals(source.replace("{ signal }", "{ signal, useSignal }").replace("= signal(0)", "= useSignal(0)"),
                EditSet.apply(source, suggestion.getEdits()));
    }

    @Test
    void testNamespaceCreator() {
        String source = """
                import * as S from '@preact/signals-react';
                const Total = () => {
                  const totalSignal = S.computed(() => 1);
                  return null;
                };
                """;
        Diagnostic diagnostic = ofRule(lint(source), RULE).get(0);
        assertTrue(diagnostic.getMessage().startsWith("Avoid creating computed signals"));
        Suggestion suggestion = diagnostic.getFix().getSuggestions().get(0);
        assertEquals(source.replace("S.computed", "S.useComputed"), EditSet.apply(source, suggestion.getEdits()));
    }

    @Test
    void testHooksModulesAndHandlersAreFine() {
        String source = """
                import { signal, useSignal, effect } from '@preact/signals-react';
                const sharedSignal = signal(0);
                function useThing() { return signal(0); }
                function Counter() {
                  const localSignal = useSignal(1);
                  const onClick = () => { const tempSignal = signal(2); };
                  effect(() => {});
                  return null;
                }
                """;
        assertTrue(ofRule(lint(source), RULE).isEmpty());
    }
}

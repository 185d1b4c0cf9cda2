package com.signallint.plugins.react.rules;

import com.signallint.api.LintResult;
import org.junit.jupiter.api.Test;

import static com.signallint.TestSources.lint;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Linting the output of an autofix must find nothing further to fix.
 */
class FixIdempotenceTest {

    private static void assertStableAfterOneFix(String fileName, String source, String rule) {
        LintResult first = lint(fileName, source);
        assertNotEquals(source, first.getFixedCode(), rule + " should fix the source");
        assertTrue(first.getAppliedFixes().stream().anyMatch(fix -> rule.equals(fix.getRuleId())),
                rule + " should contribute a fix");

        LintResult second = lint(fileName, first.getFixedCode());
        assertTrue(second.getAppliedFixes().isEmpty(), "Fixed code should need no further fixes:\n"
                + first.getFixedCode());
        assertEquals(first.getFixedCode(), second.getFixedCode());
    }

    @Test
    void testSignalVariableName() {
        String source = """
                const count = signal(0);
                const useTotal = computed(() => count.value * 2);
                export function read() { return useTotal.value; }
                """;
        assertStableAfterOneFix("store.ts", source, SignalVariableNameRule.RULE_ID);
    }

    @Test
    void testPreferUseSignalOverUseState() {
        String source = """
                import { useState } from 'react';
                function Counter() {
                  const [count, setCount] = useState(0);
                  return <button onClick={() => setCount(count + 1)}>{count}</button>;
                }
                """;
        assertStableAfterOneFix("Counter.tsx", source, PreferUseSignalOverUseStateRule.RULE_ID);
    }

    @Test
    void testPreferSignalMethods() {
        String source = """
                import { signal } from '@preact/signals-react';
                const countSignal = signal(0);
                function Counter() {
                  useEffect(() => {
                    console.log(countSignal.value);
                  }, [countSignal.value]);
                  return null;
                }
                """;
        assertStableAfterOneFix("Counter.tsx", source, PreferSignalMethodsRule.RULE_ID);
    }

    @Test
    void testWarnOnUnnecessaryUntracked() {
        String source = """
                import { signal } from '@preact/signals-react';
                const countSignal = signal(0);
                function Counter() {
                  return <p>{countSignal.peek()}</p>;
                }
                """;
        assertStableAfterOneFix("Counter.tsx", source, WarnOnUnnecessaryUntrackedRule.RULE_ID);
    }

    @Test
    void testPreferSignalInJsx() {
        String source = """
                const countSignal = signal(0);
                const App = () => <span>{countSignal.value}</span>;
                """;
        assertStableAfterOneFix("App.tsx", source, PreferSignalInJsxRule.RULE_ID);
    }

    @Test
    void testUntrackedUnwrapConvergesInTwoPasses() {
        String source = """
                import { signal, untracked } from '@preact/signals-react';
                const countSignal = signal(0);
                function Counter() {
                  return <p>{untracked(() => countSignal.value)}</p>;
                }
                """;
        LintResult first = lint(source);
        LintResult second = lint(first.getFixedCode());
        assertTrue(second.getFixedCode().contains("<p>{countSignal}</p>"));

        LintResult third = lint(second.getFixedCode());
        assertTrue(third.getAppliedFixes().isEmpty());
        assertEquals(second.getFixedCode(), third.getFixedCode());
    }
}

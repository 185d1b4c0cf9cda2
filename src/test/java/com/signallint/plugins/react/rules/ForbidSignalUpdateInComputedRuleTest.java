package com.signallint.plugins.react.rules;

import com.signallint.api.Diagnostic;
import com.signallint.api.Fix;
import com.signallint.api.LintResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.signallint.TestSources.lint;
import static com.signallint.TestSources.ofRule;
import static org.junit.jupiter.api.Assertions.*;

class ForbidSignalUpdateInComputedRuleTest {

    private static final String RULE = ForbidSignalUpdateInComputedRule.RULE_ID;

    @Test
    void testWritesInsideComputed() {
        String source = """
                import { computed, signal, batch } from '@preact/signals-react';
                const countSignal = signal(0);
                const otherSignal = signal(0);
                const doubledSignal = computed(() => {
                  countSignal.value = 1;
                  otherSignal.value++;
                  otherSignal.set(2);
                  batch(() => {});
                  return countSignal.value * 2;
                });
                """;
        LintResult result = lint("store.ts", source);

        List<Diagnostic> diagnostics = ofRule(result, RULE);
        assertEquals(4, diagnostics.size());
        assertEquals(3, diagnostics.stream().filter(d -> "noSignalWriteInComputed".equals(d.getFinding().getKind())).count());
        assertEquals(1, diagnostics.stream().filter(d -> "noBatchedWritesInComputed".equals(d.getFinding().getKind())).count());
        assertTrue(diagnostics.stream().anyMatch(d -> d.getMessage().equals(
                "Do not update signal 'countSignal' inside computed(). Computed functions must be pure and read-only.")));
        for (Diagnostic diagnostic : diagnostics) {
            assertEquals(Fix.Type.NONE, diagnostic.getFix().getType());
        }
        assertFalse(result.isSuccessful());
    }

    @Test
    void testNestedCallbacksCount() {
        String source = """
                const countSignal = signal(0);
                const totalSignal = computed(() => {
                  [1, 2].forEach(n => { countSignal.value += n; });
                  return 0;
                });
                """;
        List<Diagnostic> diagnostics = ofRule(lint("store.ts", source), RULE);
        assertEquals(1, diagnostics.size());
        assertEquals("countSignal", diagnostics.get(0).getFinding().getParams().get("name"));
    }

    @Test
    void testWritesOutsideComputedAndPlainObjectsAreFine() {
        String source = """
                import { computed, signal } from '@preact/signals-react';
                const countSignal = signal(0);
                export function reset() { countSignal.value = 0; }
                const doubledSignal = computed(() => {
                  const box = { value: 1 };
                  box.value = 2;
                  return countSignal.value * box.value;
                });
                """;
        assertTrue(ofRule(lint("store.ts", source), RULE).isEmpty());
    }

    @Test
    void testUseComputedCallback() {
        String source = """
                import { useComputed, useSignal } from '@preact/signals-react';
                function Counter() {
                  const countSignal = useSignal(0);
                  const nextSignal = useComputed(() => countSignal.value++);
                  return <p>{nextSignal}</p>;
                }
                """;
        List<Diagnostic> diagnostics = ofRule(lint(source), RULE);
        assertEquals(1, diagnostics.size());
        assertEquals("noSignalWriteInComputed", diagnostics.get(0).getFinding().getKind());
    }
}

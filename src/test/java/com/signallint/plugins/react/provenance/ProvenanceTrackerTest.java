package com.signallint.plugins.react.provenance;

import com.signallint.config.AnalysisOptions;
import com.signallint.config.ConfigurationLoader;
import com.signallint.plugins.react.JsAst;
import com.signallint.plugins.react.traversal.Operation;
import com.signallint.plugins.react.traversal.OperationCounters;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static com.signallint.TestSources.analysisOption;
import static com.signallint.TestSources.declarator;
import static com.signallint.TestSources.identifier;
import static com.signallint.TestSources.parse;
import static org.junit.jupiter.api.Assertions.*;

class ProvenanceTrackerTest {

    private final OperationCounters counters = new OperationCounters();

    private ProvenanceTracker tracker(JsAst ast, AnalysisOptions options) {
        return new ProvenanceTracker(options, ImportFacts.collect(ast.getRoot(), options, counters), counters);
    }

    private static Optional<Handle> declare(ProvenanceTracker tracker, JsAst ast, String name) {
        JsNode declarator = declarator(ast.getRoot(), name);
        return tracker.recordDeclaration(name, declarator.child(Field.INIT), declarator);
    }

    private static AnalysisOptions options(Map<String, Object> config) {
        return AnalysisOptions.from(ConfigurationLoader.fromMap(config));
    }

    @Test
    void testAliasedCreatorImportIsDefinite() {
        JsAst ast = parse("import { signal as s } from 'signals';\nconst x = s(0);");
        ProvenanceTracker tracker = tracker(ast, options(analysisOption("enableSuffixHeuristic", false)));

        Handle handle = declare(tracker, ast, "x").orElseThrow();
        assertEquals(HandleOrigin.IMPORT_ALIAS, handle.getOrigin());
        assertEquals(Confidence.DEFINITE, handle.getConfidence());
        assertEquals("signal", handle.getCreatorName());
        assertEquals(1, counters.get(Operation.SIGNAL_CREATION));
    }

    @Test
    void testImportsRegisteredByHost() {
        JsAst ast = parse("const x = make(0);\nconst y = Signals.signal(1);\nconst z = other(2);");
        ProvenanceTracker tracker = tracker(ast, options(analysisOption("enableSuffixHeuristic", false)));
        tracker.recordCreatorImport("make", "signal");
        tracker.recordNamespaceImport("Signals");

        assertEquals(HandleOrigin.IMPORT_ALIAS, declare(tracker, ast, "x").orElseThrow().getOrigin());
        assertEquals(HandleOrigin.NAMESPACE_QUALIFIED, declare(tracker, ast, "y").orElseThrow().getOrigin());
        assertTrue(declare(tracker, ast, "z").isEmpty());
    }

    @Test
    void testNamespaceCreator() {
        JsAst ast = parse("import * as S from '@preact/signals-react';\nconst total = S.computed(() => 1);");
        ProvenanceTracker tracker = tracker(ast, AnalysisOptions.defaults());

        Handle handle = declare(tracker, ast, "total").orElseThrow();
        assertEquals(HandleOrigin.NAMESPACE_QUALIFIED, handle.getOrigin());
        assertEquals("computed", handle.getCreatorName());
    }

    @Test
    void testShadowedBareNameIsNotACreator() {
        JsAst ast = parse("import { signal } from './my-own-signal-lib';\nimport { computed as c } from 'x';\n"
                + "const a = c(1);");
        ProvenanceTracker tracker = tracker(ast, AnalysisOptions.defaults());
        assertTrue(declare(tracker, ast, "a").isPresent(), "Named creator imports count from any module");

        JsAst other = parse("import signal from 'lib';\nconst b = signal(1);");
        ProvenanceTracker otherTracker = tracker(other, AnalysisOptions.defaults());
        assertTrue(declare(otherTracker, other, "b").isEmpty(),
                "A default import named like a creator is not the creator");
    }

    @Test
    void testBareCreatorNames() {
        JsAst ast = parse("const a = signal(1);");
        assertTrue(declare(tracker(ast, AnalysisOptions.defaults()), ast, "a").isPresent());

        ProvenanceTracker strict = tracker(ast, options(analysisOption("allowBareNames", false)));
        assertTrue(declare(strict, ast, "a").isEmpty(), "Bare names are ignored when disabled");
    }

    @Test
    void testPropagationThroughAliasAndContainer() {
        JsAst ast = parse("""
                const countSignal = signal(0);
                const alias = countSignal;
                const store = { count: countSignal, label: 'x' };
                const plain = 5;
                """);
        ProvenanceTracker tracker = tracker(ast, AnalysisOptions.defaults());
        declare(tracker, ast, "countSignal");

        Handle alias = declare(tracker, ast, "alias").orElseThrow();
        assertEquals(HandleOrigin.PROPAGATED, alias.getOrigin());
        assertTrue(alias.isDefinite());

        Handle store = declare(tracker, ast, "store").orElseThrow();
        assertTrue(store.isContainer());
        assertEquals(1, store.getContainedHandles().size());
        assertTrue(store.getContainedHandles().containsKey("count"));

        Handle count = tracker.recordDestructured("count", store, "count", declarator(ast.getRoot(), "store"))
                .orElseThrow();
        assertEquals("count", count.getName());
        assertTrue(tracker.recordDestructured("label", store, "label", null).isEmpty());

        assertTrue(declare(tracker, ast, "plain").isEmpty());
        assertTrue(tracker.isKnownNonHandle("plain"));
    }

    @Test
    void testMemberAccessOfContainedHandle() {
        JsAst ast = parse("""
                const countSignal = signal(0);
                const store = { count: countSignal };
                store.count.value;
                """);
        ProvenanceTracker tracker = tracker(ast, AnalysisOptions.defaults());
        declare(tracker, ast, "countSignal");
        declare(tracker, ast, "store");

        JsNode statement = ast.getRoot().children().get(2);
        JsNode valueAccess = statement.child(Field.EXPRESSION);
        assertTrue(tracker.valueAccessTarget(valueAccess).isPresent(), "store.count.value reads a handle");
    }

    @Test
    void testSuffixHeuristicNeedsACreatorInTheFile() {
        JsAst withoutCreators = parse("const total = itemsSignal;");
        ProvenanceTracker closed = tracker(withoutCreators, AnalysisOptions.defaults());
        assertFalse(closed.isHeuristicGateOpen());
        assertTrue(closed.isHandle(identifier(withoutCreators.getRoot(), "itemsSignal", 0)).isEmpty(),
                "Without a creator in the file the suffix means nothing");

        JsAst withImport = parse("import { signal } from '@preact/signals-react';\nconst total = itemsSignal;");
        ProvenanceTracker open = tracker(withImport, AnalysisOptions.defaults());
        assertTrue(open.isHeuristicGateOpen());
        Handle heuristic = open.isHandle(identifier(withImport.getRoot(), "itemsSignal", 0)).orElseThrow();
        assertEquals(HandleOrigin.SUFFIX_HEURISTIC, heuristic.getOrigin());
        assertFalse(heuristic.isDefinite());

        ProvenanceTracker disabled = tracker(withImport, options(analysisOption("enableSuffixHeuristic", false)));
        assertFalse(disabled.isHeuristicGateOpen());
    }

    @Test
    void testGateOpensOnCreatorDeclaration() {
        JsAst ast = parse("const aSignal = signal(1);\nconst total = itemsSignal;");
        ProvenanceTracker tracker = tracker(ast, AnalysisOptions.defaults());
        assertFalse(tracker.isHeuristicGateOpen());
        declare(tracker, ast, "aSignal");
        assertTrue(tracker.isHeuristicGateOpen());
    }

    @Test
    void testPlainValueDeclarationBlocksTheHeuristic() {
        JsAst ast = parse("import { signal } from '@preact/signals-react';\nconst fakeSignal = 42;\nfakeSignal;");
        ProvenanceTracker tracker = tracker(ast, AnalysisOptions.defaults());
        declare(tracker, ast, "fakeSignal");

        JsNode use = identifier(ast.getRoot(), "fakeSignal", ast.getSourceCode().lastIndexOf("fakeSignal"));
        assertTrue(tracker.isHandle(use).isEmpty(), "A name known to hold a number is not a handle");
    }

    @Test
    void testContainsHandleIsMemoized() {
        JsAst ast = parse("const countSignal = signal(0);\nconst list = [1, { nested: [countSignal] }];");
        ProvenanceTracker tracker = tracker(ast, AnalysisOptions.defaults());
        declare(tracker, ast, "countSignal");

        JsNode literal = declarator(ast.getRoot(), "list").child(Field.INIT);
        assertTrue(tracker.containsHandle(literal));
        long misses = counters.get(Operation.CACHE_MISS);
        assertTrue(tracker.containsHandle(literal));
        assertEquals(misses, counters.get(Operation.CACHE_MISS), "The second query is answered from the memo");
        assertTrue(counters.get(Operation.CACHE_HIT) > 0);
    }
}

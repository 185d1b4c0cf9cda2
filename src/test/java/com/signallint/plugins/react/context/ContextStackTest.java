package com.signallint.plugins.react.context;

import com.signallint.api.error.InternalFaultException;
import com.signallint.config.AnalysisOptions;
import com.signallint.plugins.react.JsAst;
import com.signallint.plugins.react.traversal.NodeVisitor;
import com.signallint.plugins.react.traversal.Operation;
import com.signallint.plugins.react.traversal.OperationCounters;
import com.signallint.plugins.react.traversal.TraversalDriver;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.signallint.TestSources.parse;
import static org.junit.jupiter.api.Assertions.*;

class ContextStackTest {

    private static final String SOURCE = """
            const outer = 1;
            function Counter() {
              const inRender = 1;
              const handler = () => { const inHandler = 1; };
              useEffect(() => {
                const inEffect = 1;
                function helper() { const inHelper = 1; }
              });
              return <div onClick={handler}>{inMarkup}</div>;
            }
            const useThing = () => { const inHook = 1; };
            const Wrapped = memo(() => { const inMemo = 1; return null; });
            """;

    private final OperationCounters counters = new OperationCounters();
    private final ContextStack stack = new ContextStack(new FrameClassifier(AnalysisOptions.defaults()), counters);
    private final Map<String, ScopeKind> kinds = new HashMap<>();
    private final Map<String, Boolean> renderPhases = new HashMap<>();

    private void walk(JsNode root) {
        TraversalDriver.traverse(root, new NodeVisitor() {
            @Override
            public void enter(JsNode node) {
                stack.enter(node);
                if (node.kind() == NodeKind.IDENTIFIER) {
                    kinds.putIfAbsent(node.name(), stack.currentKind());
                    renderPhases.putIfAbsent(node.name(), stack.renderPhase());
                }
            }

            @Override
            public void exit(JsNode node) {
                stack.exit(node);
            }
        });
    }

    @Test
    void testClassifiesRegions() {
        JsAst ast = parse(SOURCE);
        walk(ast.getRoot());

        assertEquals(ScopeKind.MODULE, kinds.get("outer"));
        assertEquals(ScopeKind.COMPONENT_RENDER, kinds.get("inRender"));
        assertEquals(ScopeKind.MODULE, kinds.get("inHandler"), "A handler inside a component is not render code");
        assertEquals(ScopeKind.EFFECT_CALLBACK, kinds.get("inEffect"));
        assertEquals(ScopeKind.EFFECT_CALLBACK, kinds.get("inHelper"), "Plain functions inside an effect stay in it");
        assertEquals(ScopeKind.MARKUP_SUBTREE, kinds.get("inMarkup"));
        assertEquals(ScopeKind.HOOK_BODY, kinds.get("inHook"));
        assertEquals(ScopeKind.COMPONENT_RENDER, kinds.get("inMemo"), "memo() keeps the component's name");

        assertTrue(renderPhases.get("inRender"));
        assertFalse(renderPhases.get("inHandler"));
    }

    @Test
    void testStackIsRestoredAfterTraversal() {
        walk(parse(SOURCE).getRoot());

        assertTrue(stack.isEmpty(), "Every pushed frame must be popped");
        assertEquals(ScopeKind.MODULE, stack.currentKind());
        assertEquals(counters.get(Operation.CONTEXT_PUSH), counters.get(Operation.CONTEXT_POP));
        assertEquals(5, counters.get(Operation.CONTEXT_PUSH), "Program, Counter, effect, useThing and Wrapped");
    }

    @Test
    void testKindAtRemembersIdentifiers() {
        JsAst ast = parse("function App() { return <p>{label}</p>; }");
        walk(ast.getRoot());

        JsNode label = com.signallint.TestSources.identifier(ast.getRoot(), "label", 0);
        assertEquals(ScopeKind.MARKUP_SUBTREE, stack.kindAt(label));
    }

    @Test
    void testInnermostFrame() {
        JsAst ast = parse("function App() { useEffect(() => { tick(); }); }");
        JsNode root = ast.getRoot();
        Map<String, String> labels = new HashMap<>();
        TraversalDriver.traverse(root, new NodeVisitor() {
            @Override
            public void enter(JsNode node) {
                stack.enter(node);
                if (node.kind() == NodeKind.IDENTIFIER && "tick".equals(node.name())) {
                    labels.put("effect", stack.innermost(ScopeKind.EFFECT_CALLBACK).getLabel());
                    labels.put("component", stack.innermost(ScopeKind.COMPONENT_RENDER).getLabel());
                }
            }

            @Override
            public void exit(JsNode node) {
                stack.exit(node);
            }
        });

        assertEquals("useEffect", labels.get("effect"));
        assertEquals("App", labels.get("component"));
        assertNull(stack.innermost(ScopeKind.HOOK_BODY));
    }

    @Test
    void testUnderflowIsAnInternalFault() {
        JsNode root = parse("let a = 1;").getRoot();
        assertThrows(InternalFaultException.class, () -> stack.pop(root));
    }

    @Test
    void testMismatchedOwnerIsAnInternalFault() {
        JsNode root = parse("function App() {}").getRoot();
        stack.push(ScopeKind.MODULE, root, null);
        JsNode function = root.children().get(0);
        assertThrows(InternalFaultException.class, () -> stack.pop(function));
        assertEquals(1, stack.depth(), "A failed pop leaves the stack untouched");
    }
}

package com.signallint.plugins.react.scope;

import com.signallint.plugins.react.JsAst;
import com.signallint.plugins.react.traversal.OperationCounters;
import com.signallint.plugins.react.tree.JsNode;
import org.junit.jupiter.api.Test;

import static com.signallint.TestSources.identifier;
import static com.signallint.TestSources.parse;
import static org.junit.jupiter.api.Assertions.*;

class ScopeModelTest {

    private static final String SOURCE = """
            let count = 1;
            function f(count) { return count; }
            function g() { return count + 1; }
            { let inner = count; }
            go();
            function go() {}
            """;

    @Test
    void testResolvesShadowing() {
        JsAst ast = parse(SOURCE);
        ScopeModel model = ScopeModel.build(ast.getRoot());

        Binding outer = model.bindingOf(identifier(ast.getRoot(), "count", 0));
        assertNotNull(outer);
        assertEquals(2, outer.getReferences().size(), "Only g and the block refer to the outer count");

        int fStart = SOURCE.indexOf("function f");
        Binding parameter = model.bindingOf(identifier(ast.getRoot(), "count", fStart));
        assertNotSame(outer, parameter);
        assertEquals(1, parameter.getReferences().size());
    }

    @Test
    void testFunctionDeclarationsAreHoisted() {
        JsAst ast = parse(SOURCE);
        ScopeModel model = ScopeModel.build(ast.getRoot());

        JsNode call = identifier(ast.getRoot(), "go", 0);
        Binding binding = model.bindingOf(call);
        assertNotNull(binding, "A call before the declaration still resolves");
        assertTrue(binding.getIdentifier().start() > call.start());
    }

    @Test
    void testGlobalsHaveNoBinding() {
        JsAst ast = parse("console.log(1);");
        assertNull(ScopeModel.build(ast.getRoot()).bindingOf(identifier(ast.getRoot(), "console", 0)));
    }

    @Test
    void testNameFreeForRename() {
        JsAst ast = parse(SOURCE);
        ScopeResolver resolver = new ScopeResolver(ast.getRoot(), new OperationCounters());
        Binding outer = resolver.bindingOf(identifier(ast.getRoot(), "count", 0));

        assertFalse(resolver.isNameFree("inner", outer), "A reference inside the block would be captured");
        assertFalse(resolver.isNameFree("g", outer), "Already declared at the top level");
        assertTrue(resolver.isNameFree("countSignal", outer));
    }
}

package com.signallint.plugins.react;

import com.signallint.TestSources;
import com.signallint.plugins.FileType;
import com.signallint.plugins.react.tree.NodeKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsEngineTest {

    @Test
    void testParsesTsxIntoProgram() {
        JsEngine engine = TestSources.engine();
        int before = engine.getOperationCount();

        JsAst ast = engine.parse("const App = (p: { n: number }) => <div>{p.n}</div>;\n", FileType.TSX);

        assertTrue(ast.isValid(), ast.getError());
        assertEquals(NodeKind.PROGRAM, ast.getRoot().kind());
        assertEquals(1, ast.getRoot().children().size());
        assertEquals(before + 1, engine.getOperationCount());
    }

    @Test
    void testGrammarFollowsFileType() {
        JsEngine engine = TestSources.engine();
        assertFalse(engine.parse("let a: number = 1;\n", FileType.JAVASCRIPT).isValid(),
                "Type annotations need the TypeScript grammar");
        assertTrue(engine.parse("let a: number = 1;\n", FileType.TYPESCRIPT).isValid());
        assertFalse(engine.parse("const a = <div />;\n", FileType.TYPESCRIPT).isValid(),
                "Plain .ts files have no markup");
    }

    @Test
    void testSyntaxErrorCarriesPosition() {
        JsAst ast = TestSources.engine().parse("const a = 1;\nconst = ;\n", FileType.JAVASCRIPT);

        assertFalse(ast.isValid());
        assertNull(ast.getRoot());
        assertEquals(2, ast.getErrorLine());
        assertTrue(ast.getErrorColumn() >= 1);
        assertNotNull(ast.getError());
    }

    @Test
    void testNullSource() {
        JsAst ast = TestSources.engine().parse(null, FileType.JSX);
        assertFalse(ast.isValid());
        assertEquals("No source code provided", ast.getError());
    }

    @Test
    void testClosedEngineRefusesWork() {
        JsEngine engine = new JsEngine();
        assertTrue(engine.parse("let x = 1;\n", FileType.JAVASCRIPT).isValid());

        engine.close();
        assertTrue(engine.isClosed());
        engine.close();

        JsAst ast = engine.parse("let x = 1;\n", FileType.JAVASCRIPT);
        assertFalse(ast.isValid());
        assertEquals("JavaScript engine has been closed", ast.getError());
    }
}

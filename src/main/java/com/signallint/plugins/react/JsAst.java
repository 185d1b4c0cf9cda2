package com.signallint.plugins.react;

import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.LineIndex;
import com.signallint.plugins.react.tree.SourceRange;

/**
 * A parsed source file: the original text, its typed tree and a line index,
 * or the parser's error and position when parsing failed.
 */
public class JsAst {
    private final String sourceCode;
    private final boolean valid;
    private final String error;
    private final int errorLine;
    private final int errorColumn;
    private final JsNode root;
    private final LineIndex lineIndex;

    private JsAst(String sourceCode, boolean valid, String error, int errorLine, int errorColumn, JsNode root,
                  LineIndex lineIndex) {
        this.sourceCode = sourceCode;
        this.valid = valid;
        this.error = error;
        this.errorLine = errorLine;
        this.errorColumn = errorColumn;
        this.root = root;
        this.lineIndex = lineIndex != null ? lineIndex : new LineIndex(sourceCode != null ? sourceCode : "");
    }

    public static JsAst parsed(String sourceCode, JsNode root, LineIndex lineIndex) {
        return new JsAst(sourceCode, true, null, 0, 0, root, lineIndex);
    }

    /**
     * A failed parse; line is 1-based and column 1-based, or 1:1 when unknown.
     */
    public static JsAst failed(String sourceCode, String error, int line, int column) {
        return new JsAst(sourceCode, false, error, Math.max(1, line), Math.max(1, column), null, null);
    }

    public static JsAst failed(String sourceCode, String error) {
        return failed(sourceCode, error, 1, 1);
    }

    public String getSourceCode() {
        return sourceCode;
    }

    public boolean isValid() {
        return valid;
    }

    public String getError() {
        return error;
    }

    public int getErrorLine() {
        return errorLine;
    }

    public int getErrorColumn() {
        return errorColumn;
    }

    /**
     * The Program node, or null for a failed parse.
     */
    public JsNode getRoot() {
        return root;
    }

    public LineIndex getLineIndex() {
        return lineIndex;
    }

    /**
     * Source text covered by a node.
     */
    public String textOf(JsNode node) {
        return textOf(node.range());
    }

    public String textOf(SourceRange range) {
        return sourceCode.substring(range.getStart(), range.getEnd());
    }
}

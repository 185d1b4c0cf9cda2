package com.signallint.plugins.react.fix;

import com.signallint.api.Edit;
import com.signallint.plugins.react.JsAst;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.Flag;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Adds named imports, merging into an existing import of the same module where its shape allows.
 * Quote and semicolon style follow the file.
 */
public class ImportFixer {
    private final JsAst ast;

    public ImportFixer(JsAst ast) {
        this.ast = ast;
    }

    /**
     * Edits that make {@code name} importable from {@code module}; empty when the name is already imported.
     */
    public List<Edit> ensureNamedImport(String name, String module, String groupId) {
        List<JsNode> imports = _imports();
        for (JsNode declaration : imports) {
            if (declaration.has(Flag.TYPE_ONLY)) {
                continue;
            }
            for (JsNode specifier : declaration.children(Field.SPECIFIERS)) {
                if (!name.equals(specifier.child(Field.LOCAL).name())) {
                    continue;
                }
                if (specifier.has(Flag.TYPE_ONLY)) {
                    // import { type useSignal } becomes a value import in place
                    String text = ast.textOf(specifier).replaceFirst("^type\\s+", "");
                    return List.of(new Edit(specifier.range(), text, groupId));
                }
                return Collections.emptyList();
            }
        }

        // type-only imports cannot carry a value binding
        JsNode existing = null;
        for (JsNode declaration : imports) {
            if (!declaration.has(Flag.TYPE_ONLY) && module.equals(declaration.child(Field.SOURCE).stringValue())) {
                existing = declaration;
                break;
            }
        }
        if (existing != null) {
            return List.of(_mergeInto(existing, name, module, groupId));
        }

        if (!imports.isEmpty()) {
            int at = imports.get(0).start();
            return List.of(_insert(at, importStatement(name, module) + "\n", groupId));
        }
        return List.of(_insertAtTop(importStatement(name, module), groupId));
    }

    /**
     * Module that already provides signal creators in this file, or {@code fallback}.
     */
    public String signalModuleOr(List<String> candidates, String fallback) {
        for (JsNode declaration : _imports()) {
            String module = declaration.child(Field.SOURCE).stringValue();
            if (candidates.contains(module)) {
                return module;
            }
        }
        return fallback;
    }

    public String importStatement(String name, String module) {
        String quote = _quote();
        return "import { " + name + " } from " + quote + module + quote + (_usesSemicolons() ? ";" : "");
    }

    private Edit _mergeInto(JsNode declaration, String name, String module, String groupId) {
        List<JsNode> specifiers = declaration.children(Field.SPECIFIERS);
        JsNode lastNamed = null;
        JsNode defaultSpecifier = null;
        boolean namespace = false;
        for (JsNode specifier : specifiers) {
            switch (specifier.kind()) {
                case IMPORT_SPECIFIER:
                    lastNamed = specifier;
                    break;
                case IMPORT_DEFAULT_SPECIFIER:
                    defaultSpecifier = specifier;
                    break;
                case IMPORT_NAMESPACE_SPECIFIER:
                    namespace = true;
                    break;
                default:
                    break;
            }
        }

        if (namespace) {
            return _insert(declaration.end(), "\n" + importStatement(name, module), groupId);
        }
        if (lastNamed != null) {
            return _insert(lastNamed.end(), ", " + name, groupId);
        }

        String text = ast.textOf(declaration);
        String quote = _quote();
        String semicolon = text.trim().endsWith(";") ? ";" : "";
        if (defaultSpecifier != null) {
            String replacement = "import " + defaultSpecifier.child(Field.LOCAL).name() + ", { " + name + " } from "
                    + quote + module + quote + semicolon;
            return new Edit(declaration.range(), replacement, groupId);
        }
        if (text.contains("{")) {
            return new Edit(declaration.range(), "import { " + name + " } from " + quote + module + quote + semicolon,
                    groupId);
        }
        // side-effect import: keep it and add a named one after
        return _insert(declaration.end(), "\n" + importStatement(name, module), groupId);
    }

    private Edit _insertAtTop(String statement, String groupId) {
        JsNode lastDirective = null;
        for (JsNode node : ast.getRoot().children(Field.BODY)) {
            if (!_isDirective(node)) {
                break;
            }
            lastDirective = node;
        }
        if (lastDirective != null) {
            return _insert(lastDirective.end(), "\n" + statement, groupId);
        }

        String source = ast.getSourceCode();
        if (source.startsWith("#!")) {
            int lineEnd = source.indexOf('\n');
            int at = lineEnd < 0 ? source.length() : lineEnd + 1;
            return _insert(at, (lineEnd < 0 ? "\n" : "") + statement + "\n", groupId);
        }
        return _insert(0, statement + "\n", groupId);
    }

    private static boolean _isDirective(JsNode node) {
        if (node.kind() != NodeKind.EXPRESSION_STATEMENT) {
            return false;
        }
        JsNode expression = node.child(Field.EXPRESSION);
        return expression != null && expression.kind() == NodeKind.LITERAL && expression.stringValue() != null;
    }

    private Edit _insert(int offset, String text, String groupId) {
        return new Edit(ast.getLineIndex().range(offset, offset), text, groupId);
    }

    private List<JsNode> _imports() {
        List<JsNode> imports = new ArrayList<>();
        for (JsNode statement : ast.getRoot().children(Field.BODY)) {
            if (statement.kind() == NodeKind.IMPORT_DECLARATION) {
                imports.add(statement);
            }
        }
        return imports;
    }

    private String _quote() {
        List<JsNode> imports = _imports();
        if (!imports.isEmpty()) {
            String raw = imports.get(0).child(Field.SOURCE).raw();
            if (raw != null && raw.startsWith("\"")) {
                return "\"";
            }
        }
        return "'";
    }

    private boolean _usesSemicolons() {
        List<JsNode> body = ast.getRoot().children(Field.BODY);
        List<JsNode> imports = _imports();
        JsNode sample = !imports.isEmpty() ? imports.get(0) : (!body.isEmpty() ? body.get(0) : null);
        if (sample == null) {
            return true;
        }
        return ast.textOf(sample).trim().endsWith(";") || _endsWithBlock(sample);
    }

    private static boolean _endsWithBlock(JsNode statement) {
        // declarations that end in a block say nothing about semicolons
        JsNode declaration = statement;
        if (statement.kind() == NodeKind.EXPORT_NAMED_DECLARATION
                || statement.kind() == NodeKind.EXPORT_DEFAULT_DECLARATION) {
            declaration = statement.child(Field.DECLARATION) != null ? statement.child(Field.DECLARATION) : statement;
        }
        return declaration.kind() == NodeKind.FUNCTION_DECLARATION || declaration.kind() == NodeKind.CLASS_DECLARATION;
    }
}

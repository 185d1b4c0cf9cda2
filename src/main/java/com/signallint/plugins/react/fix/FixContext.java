package com.signallint.plugins.react.fix;

import com.signallint.api.Edit;
import com.signallint.config.AnalysisOptions;
import com.signallint.plugins.react.JsAst;
import com.signallint.plugins.react.context.ContextView;
import com.signallint.plugins.react.context.ScopeKind;
import com.signallint.plugins.react.provenance.HandleResolver;
import com.signallint.plugins.react.scope.ScopeResolver;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.Nodes;
import com.signallint.plugins.react.tree.SourceRange;

import java.util.ArrayList;

/**
 * Everything a policy needs to build its fix after the traversal.
 */
public final class FixContext {
    public static final String DEFAULT_SIGNAL_MODULE = "@preact/signals-react";
    public static final String REACT_MODULE = "react";

    private final JsAst ast;
    private final HandleResolver handles;
    private final ContextView context;
    private final AnalysisOptions options;
    private final ScopeResolver scopes;
    private final ImportFixer imports;
    private final ReferenceRewriter rewriter;
    private final FixSafety safety;
    private int groups;

    public FixContext(JsAst ast, HandleResolver handles, ContextView context, AnalysisOptions options,
                      ScopeResolver scopes, FixSafety safety) {
        this.ast = ast;
        this.handles = handles;
        this.context = context;
        this.options = options;
        this.scopes = scopes;
        this.imports = new ImportFixer(ast);
        this.rewriter = new ReferenceRewriter(ast.getLineIndex());
        this.safety = safety;
    }

    // Getters
    public JsAst ast() { return ast; }
    public HandleResolver handles() { return handles; }
    public ContextView context() { return context; }
    public AnalysisOptions options() { return options; }
    public ScopeResolver scopes() { return scopes; }
    public ImportFixer imports() { return imports; }
    public ReferenceRewriter rewriter() { return rewriter; }
    public FixSafety safety() { return safety; }

    /**
     * A fresh edit group id.
     */
    public String newGroup() {
        groups++;
        return "fix-" + groups;
    }

    public SourceRange range(int start, int end) {
        return ast.getLineIndex().range(start, end);
    }

    public Edit replace(JsNode node, String replacement, String groupId) {
        return new Edit(node.range(), replacement, groupId);
    }

    public Edit replace(int start, int end, String replacement, String groupId) {
        return new Edit(range(start, end), replacement, groupId);
    }

    public String textOf(JsNode node) {
        return ast.textOf(node);
    }

    /**
     * Module to import signal hooks from: the one the file already uses, else the React binding.
     */
    public String signalModule() {
        return imports.signalModuleOr(new ArrayList<>(options.getModules()), DEFAULT_SIGNAL_MODULE);
    }

    /**
     * Accessor a handle reference needs at an identifier: bare as a markup child, {@code .peek()} in an
     * effect, {@code .value} everywhere else.
     */
    public AccessorForm accessorAt(JsNode identifier) {
        if (Nodes.isWriteTarget(identifier)) {
            return AccessorForm.VALUE;
        }
        ScopeKind kind = context.kindAt(identifier);
        if (kind == ScopeKind.MARKUP_SUBTREE && Nodes.isMarkupChild(identifier)) {
            return AccessorForm.BARE;
        }
        if (kind == ScopeKind.EFFECT_CALLBACK) {
            return AccessorForm.PEEK;
        }
        return AccessorForm.VALUE;
    }
}

package com.signallint.plugins.react.policy;

import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.config.AnalysisOptions;
import com.signallint.plugins.react.JsAst;
import com.signallint.plugins.react.context.ContextView;
import com.signallint.plugins.react.provenance.HandleResolver;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.SourceRange;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * What a policy may see of a run: provenance and context as read-only views, the options and the source.
 */
public final class PolicyContext {
    private final HandleResolver handles;
    private final ContextView context;
    private final AnalysisOptions options;
    private final JsAst ast;
    private final String filePath;

    public PolicyContext(HandleResolver handles, ContextView context, AnalysisOptions options, JsAst ast,
                         String filePath) {
        this.handles = handles;
        this.context = context;
        this.options = options;
        this.ast = ast;
        this.filePath = filePath;
    }

    // Getters
    public HandleResolver handles() { return handles; }
    public ContextView context() { return context; }
    public AnalysisOptions options() { return options; }
    public JsAst ast() { return ast; }
    public String filePath() { return filePath; }

    /**
     * Last segment of the file path.
     */
    public String fileName() {
        if (filePath == null) {
            return null;
        }
        String normalized = filePath.replace('\\', '/');
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }

    public Severity severityOf(Policy policy, FindingKind kind) {
        return options.severityFor(policy.ruleId(), kind.getId(), kind.getDefaultSeverity());
    }

    public boolean isEnabled(Policy policy, FindingKind kind) {
        return severityOf(policy, kind) != Severity.OFF;
    }

    /**
     * Builds a finding at a node, or nothing when the kind is switched off.
     */
    public Optional<Finding> report(Policy policy, FindingKind kind, JsNode at, Map<String, String> params) {
        return report(policy, kind, at.range(), params);
    }

    public Optional<Finding> report(Policy policy, FindingKind kind, JsNode at) {
        return report(policy, kind, at.range(), Collections.emptyMap());
    }

    public Optional<Finding> report(Policy policy, FindingKind kind, SourceRange at, Map<String, String> params) {
        Severity severity = severityOf(policy, kind);
        if (severity == Severity.OFF) {
            return Optional.empty();
        }
        return Optional.of(new Finding(at, policy.ruleId(), kind.getId(), severity, params));
    }

    public String textOf(JsNode node) {
        return ast.textOf(node);
    }
}

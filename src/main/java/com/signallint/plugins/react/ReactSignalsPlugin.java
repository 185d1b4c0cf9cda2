package com.signallint.plugins.react;

import com.signallint.api.CollectingSink;
import com.signallint.api.Diagnostic;
import com.signallint.api.DiagnosticSink;
import com.signallint.api.LintPlugin;
import com.signallint.api.LintResult;
import com.signallint.api.error.Finding;
import com.signallint.api.error.InternalFaultException;
import com.signallint.api.error.Severity;
import com.signallint.config.AnalysisOptions;
import com.signallint.config.LinterConfig;
import com.signallint.plugins.FileType;
import com.signallint.plugins.react.rules.RuleCatalog;
import com.signallint.plugins.react.tree.SourceRange;
import com.signallint.util.LoggerUtil;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lints JavaScript and TypeScript sources, with or without JSX, for misuse of reactive signal handles.
 * Parsing goes through a shared {@link JsEngine}; parsed trees are cached per path and content.
 */
public class ReactSignalsPlugin implements LintPlugin, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(ReactSignalsPlugin.class);

    static final int AST_CACHE_SIZE = 100;
    static final String PARSER_RULE_ID = "parser";
    static final String INTERNAL_RULE_ID = "internal";

    private AnalysisOptions options;
    private JsEngine jsEngine;
    private boolean ownsEngine;

    private final Map<String, JsAst> astCache = new LinkedHashMap<String, JsAst>(AST_CACHE_SIZE, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, JsAst> eldest) {
            return size() > AST_CACHE_SIZE;
        }
    };

    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = cacheLock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = cacheLock.writeLock();

    public ReactSignalsPlugin() {
    }

    /**
     * Uses an existing engine instead of starting one; the caller keeps ownership of it.
     */
    public ReactSignalsPlugin(JsEngine jsEngine) {
        this.jsEngine = jsEngine;
    }

    @Override
    public void initialize(LinterConfig config) {
        this.options = AnalysisOptions.from(config);
        if (jsEngine == null) {
            this.jsEngine = new JsEngine();
            this.ownsEngine = true;
        }
    }

    @Override
    public LintResult lint(Path filePath, String sourceCode) {
        return lint(filePath, sourceCode, new CollectingSink());
    }

    /**
     * Lints one file, streaming diagnostics to {@code sink} as the run finishes.
     */
    public LintResult lint(Path filePath, String sourceCode, DiagnosticSink sink) {
        if (options == null) {
            throw new IllegalStateException("Plugin used before initialize()");
        }
        FileType fileType = FileType.detect(filePath);
        if (!fileType.isLintable()) {
            fileType = FileType.detectByContent(sourceCode);
        }
        if (!fileType.isLintable()) {
            logger.fine("Skipping file of unknown type: " + filePath);
            return LintResult.builder().successful(true).fixedCode(sourceCode).build();
        }

        JsAst ast = _parse(filePath, sourceCode, fileType);
        if (!ast.isValid()) {
            return _handleParseError(ast, sink);
        }

        try {
            return new AnalysisRun(ast, filePath.toString(), options, RuleCatalog.createAll()).execute(sink);
        } catch (InternalFaultException e) {
            logger.log(Level.SEVERE, "Internal fault while analyzing " + filePath, e);
            return _fatal(ast, INTERNAL_RULE_ID, "Internal error: " + e.getMessage(), 1, 1, sink);
        }
    }

    private JsAst _parse(Path filePath, String sourceCode, FileType fileType) {
        String cacheKey = filePath.toString() + ":" + sourceCode.hashCode();
        JsAst ast;

        // an access-ordered get relinks entries, so lookups need the write lock too
        writeLock.lock();
        try {
            ast = astCache.get(cacheKey);
        } finally {
            writeLock.unlock();
        }
        if (ast != null && ast.getSourceCode().equals(sourceCode)) {
            return ast;
        }

        ast = jsEngine.parse(sourceCode, fileType);
        if (ast.isValid()) {
            writeLock.lock();
            try {
                astCache.put(cacheKey, ast);
            } finally {
                writeLock.unlock();
            }
        }
        return ast;
    }

    private LintResult _handleParseError(JsAst ast, DiagnosticSink sink) {
        return _fatal(ast, PARSER_RULE_ID, "Failed to parse source code: " + ast.getError(),
                ast.getErrorLine(), ast.getErrorColumn(), sink);
    }

    private static LintResult _fatal(JsAst ast, String ruleId, String message, int line, int column,
                                     DiagnosticSink sink) {
        SourceRange location = new SourceRange(0, 0, line, column - 1);
        Diagnostic diagnostic = new Diagnostic(new Finding(location, ruleId, ruleId, Severity.FATAL, Map.of()),
                message, null);
        sink.report(diagnostic);
        return LintResult.builder()
                .successful(false)
                .fixedCode(null)
                .addDiagnostic(diagnostic)
                .build();
    }

    int getCacheSize() {
        readLock.lock();
        try {
            return astCache.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Closes the engine this plugin started and clears the tree cache.
     */
    @Override
    public void close() {
        if (jsEngine != null && ownsEngine) {
            jsEngine.close();
        }

        writeLock.lock();
        try {
            astCache.clear();
        } finally {
            writeLock.unlock();
        }
    }
}

package com.signallint.plugins.react;

import com.fasterxml.jackson.databind.JsonNode;
import com.signallint.plugins.FileType;
import com.signallint.plugins.react.tree.EstreeReadException;
import com.signallint.plugins.react.tree.EstreeReader;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.LineIndex;
import com.signallint.util.LoggerUtil;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hosts the Babel parser inside GraalJS and turns its ESTree output into typed trees.
 * One engine may be shared by several threads; access to the JavaScript context is serialized.
 */
public class JsEngine implements AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(JsEngine.class);

    private static final String BABEL_PARSER_RESOURCE =
            "/META-INF/resources/webjars/babel__parser/7.22.5/lib/index.js";
    private static final String BRIDGE_RESOURCE = "/js/estree-bridge.js";
    private static final int LOCK_TIMEOUT_SEC = 30;

    private final Context context;
    private final Lock contextLock = new ReentrantLock();
    private final AtomicInteger operationCount = new AtomicInteger(0);
    private final EstreeReader reader = new EstreeReader();
    private Value parseFunction;
    private volatile boolean closed = false;

    /**
     * Creates an engine and loads the parser.
     *
     * @throws IllegalStateException if the parser resources cannot be loaded
     */
    public JsEngine() {
        context = Context.newBuilder("js")
                .allowAllAccess(true)
                .option("engine.WarnInterpreterOnly", "false")
                .build();

        try {
            _initializeEngine();
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to initialize JavaScript engine", e);
            context.close(true);
            throw new IllegalStateException("Failed to initialize JavaScript engine: " + e.getMessage(), e);
        }
    }

    private void _initializeEngine() throws IOException {
        String babel = _loadResource(BABEL_PARSER_RESOURCE);
        _evaluate("var babelParser = (function () { var module = { exports: {} }; var exports = module.exports;\n"
                + babel + "\nreturn module.exports; })();", BABEL_PARSER_RESOURCE);
        _evaluate(_loadResource(BRIDGE_RESOURCE), BRIDGE_RESOURCE);

        parseFunction = context.getBindings("js").getMember("parseToEstreeJson");
        if (parseFunction == null || !parseFunction.canExecute()) {
            throw new IOException("Parser bridge did not define parseToEstreeJson");
        }
        logger.info("JavaScript engine initialized successfully");
    }

    private String _loadResource(String resourcePath) throws IOException {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private void _evaluate(String script, String name) throws IOException {
        try {
            context.eval(Source.newBuilder("js", script, name).build());
        } catch (PolyglotException e) {
            throw new IOException("Error loading JavaScript resource " + name + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a source file. Never throws for bad input; failures come back as an invalid {@link JsAst}
     * carrying the parser's message and position.
     */
    public JsAst parse(String sourceCode, FileType fileType) {
        if (sourceCode == null) {
            return JsAst.failed("", "No source code provided");
        }
        if (closed) {
            return JsAst.failed(sourceCode, "JavaScript engine has been closed");
        }
        if (!_acquireLock()) {
            return JsAst.failed(sourceCode, "Timed out waiting for JavaScript engine access");
        }

        String json;
        operationCount.incrementAndGet();
        try {
            if (closed) {
                return JsAst.failed(sourceCode, "JavaScript engine has been closed");
            }
            json = parseFunction.execute(sourceCode, fileType.isTypeScript(), fileType.allowsJsx()).asString();
        } catch (PolyglotException e) {
            logger.log(Level.WARNING, "Parser crashed", e);
            return JsAst.failed(sourceCode, "Error parsing code: " + e.getMessage());
        } finally {
            contextLock.unlock();
        }

        return _toAst(sourceCode, json);
    }

    private JsAst _toAst(String sourceCode, String json) {
        try {
            JsonNode envelope = reader.readEnvelope(json);
            if (envelope.hasNonNull("error")) {
                return JsAst.failed(sourceCode, envelope.get("error").asText(),
                        envelope.path("line").asInt(1), envelope.path("column").asInt(0) + 1);
            }
            LineIndex lineIndex = new LineIndex(sourceCode);
            JsNode root = reader.toTree(envelope.path("ast"), lineIndex);
            return JsAst.parsed(sourceCode, root, lineIndex);
        } catch (EstreeReadException e) {
            logger.log(Level.FINE, "Unreadable parser output", e);
            return JsAst.failed(sourceCode, e.getMessage());
        }
    }

    private boolean _acquireLock() {
        try {
            return contextLock.tryLock(LOCK_TIMEOUT_SEC, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public int getOperationCount() {
        return operationCount.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }

        if (_acquireLock()) {
            try {
                closed = true;
                context.close(true);
                logger.info("JavaScript engine closed after " + operationCount.get() + " operations");
            } catch (PolyglotException e) {
                logger.log(Level.WARNING, "Error closing JavaScript engine", e);
            } finally {
                contextLock.unlock();
            }
        } else {
            logger.warning("Could not acquire lock to close JavaScript engine");
        }
    }
}

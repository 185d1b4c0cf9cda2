package com.signallint;

import com.signallint.api.Diagnostic;
import com.signallint.api.LintResult;
import com.signallint.config.ConfigurationLoader;
import com.signallint.plugins.FileType;
import com.signallint.plugins.react.JsAst;
import com.signallint.plugins.react.JsEngine;
import com.signallint.plugins.react.ReactSignalsPlugin;
import com.signallint.plugins.react.tree.Field;
import com.signallint.plugins.react.tree.JsNode;
import com.signallint.plugins.react.tree.NodeKind;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shared parser engine and lint shortcuts for tests. Starting the JavaScript engine is slow, so one
 * instance serves every test class in the run.
 */
public final class TestSources {
    private static JsEngine engine;

    private TestSources() {
    }

    public static synchronized JsEngine engine() {
        if (engine == null || engine.isClosed()) {
            engine = new JsEngine();
        }
        return engine;
    }

    public static JsAst parse(String source, FileType fileType) {
        JsAst ast = engine().parse(source, fileType);
        if (!ast.isValid()) {
            throw new IllegalArgumentException("Test source does not parse: " + ast.getError());
        }
        return ast;
    }

    public static JsAst parse(String source) {
        return parse(source, FileType.TSX);
    }

    public static ReactSignalsPlugin plugin(Map<String, Object> config) {
        ReactSignalsPlugin plugin = new ReactSignalsPlugin(engine());
        plugin.initialize(ConfigurationLoader.fromMap(config));
        return plugin;
    }

    public static LintResult lint(String fileName, String source, Map<String, Object> config) {
        return plugin(config).lint(Path.of(fileName), source);
    }

    public static LintResult lint(String fileName, String source) {
        return lint(fileName, source, new HashMap<>());
    }

    public static LintResult lint(String source) {
        return lint("Component.tsx", source);
    }

    /**
     * Config map with a single rule option set.
     */
    public static Map<String, Object> ruleOption(String ruleId, String option, Object value) {
        Map<String, Object> rule = new HashMap<>();
        rule.put(option, value);
        Map<String, Object> rules = new HashMap<>();
        rules.put(ruleId, rule);
        Map<String, Object> config = new HashMap<>();
        config.put("rules", rules);
        return config;
    }

    public static Map<String, Object> analysisOption(String key, Object value) {
        Map<String, Object> analysis = new HashMap<>();
        analysis.put(key, value);
        Map<String, Object> config = new HashMap<>();
        config.put("analysis", analysis);
        return config;
    }

    public static List<Diagnostic> ofRule(LintResult result, String ruleId) {
        return result.getDiagnostics().stream()
                .filter(d -> ruleId.equals(d.getRuleId()))
                .collect(Collectors.toList());
    }

    public static List<String> kinds(LintResult result) {
        return result.getDiagnostics().stream()
                .map(d -> d.getFinding().getKind())
                .collect(Collectors.toList());
    }

    /**
     * Nodes of one kind in source order.
     */
    public static List<JsNode> findAll(JsNode root, NodeKind kind) {
        List<JsNode> found = new ArrayList<>();
        Deque<JsNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            JsNode node = pending.pop();
            if (node.kind() == kind) {
                found.add(node);
            }
            List<JsNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        found.sort((a, b) -> Integer.compare(a.start(), b.start()));
        return found;
    }

    /**
     * The declarator of a variable named {@code name}.
     */
    public static JsNode declarator(JsNode root, String name) {
        for (JsNode declarator : findAll(root, NodeKind.VARIABLE_DECLARATOR)) {
            JsNode id = declarator.child(Field.ID);
            if (id.kind() == NodeKind.IDENTIFIER && name.equals(id.name())) {
                return declarator;
            }
        }
        throw new IllegalArgumentException("No declarator for " + name);
    }

    /**
     * First identifier named {@code name} after the given offset.
     */
    public static JsNode identifier(JsNode root, String name, int fromOffset) {
        for (JsNode identifier : findAll(root, NodeKind.IDENTIFIER)) {
            if (name.equals(identifier.name()) && identifier.start() >= fromOffset) {
                return identifier;
            }
        }
        throw new IllegalArgumentException("No identifier " + name);
    }
}

package com.signallint.cli;

import com.signallint.api.Diagnostic;
import com.signallint.api.LintResult;
import com.signallint.api.error.Severity;
import com.signallint.config.ConfigurationLoader;
import com.signallint.config.LinterConfig;
import com.signallint.core.SignalLintEngine;
import com.signallint.plugins.FileType;
import com.signallint.plugins.react.ReactSignalsPlugin;
import com.signallint.plugins.react.policy.FindingKind;
import com.signallint.plugins.react.policy.Policy;
import com.signallint.plugins.react.rules.RuleCatalog;
import com.signallint.util.DiagnosticFormatter;
import com.signallint.util.LoggerUtil;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line interface: {@code check}, {@code fix}, {@code init} and {@code rules}.
 * Exits with 1 when errors remain.
 */
public class LinterCli {
    private static final Logger logger = LoggerUtil.getLogger(LinterCli.class);
    private static final String VERSION = "1.0.0";

    private final PrintStream out;
    private DiagnosticFormatter formatter = new DiagnosticFormatter(false);

    public LinterCli(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new LinterCli(System.out).run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public int run(String[] args) {
        if (args.length < 1) {
            _printUsage();
            return 1;
        }

        formatter = new DiagnosticFormatter(!_hasOption(args, "--no-color"));
        LoggerUtil.setConsoleLevel(_hasOption(args, "--verbose") ? Level.FINE : Level.WARNING);

        String command = args[0];
        try {
            switch (command) {
                case "check":
                    return _lint(args, false);
                case "fix":
                    return _lint(args, true);
                case "init":
                    return _initializeConfig(args);
                case "rules":
                    _printRules();
                    return 0;
                case "--version":
                case "-v":
                    out.println("signal-lint version " + VERSION);
                    return 0;
                case "--help":
                case "-h":
                    _printUsage();
                    return 0;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return 1;
            }
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!_hasOption(args, "--verbose")) {
                _printInfo("Use --verbose for details");
            }
            return 1;
        }
    }

    private void _printUsage() {
        out.println(formatter.colorize(DiagnosticFormatter.ANSI_BOLD, "signal-lint v" + VERSION));
        out.println("Usage:");
        out.println("  signal-lint check <path>          - Report problems without changing files");
        out.println("  signal-lint fix <path>            - Apply safe fixes and report what remains");
        out.println("  signal-lint init [dir] [--force]  - Write " + ConfigurationLoader.PROJECT_CONFIG_FILE);
        out.println("  signal-lint rules                 - List checks and their finding kinds");
        out.println("  signal-lint --help|-h             - Show this help");
        out.println("  signal-lint --version|-v          - Show version information");
        out.println();
        out.println("Options:");
        out.println("  --config=<file>                   - Use a specific config file");
        out.println("  --verbose                         - Show detailed output");
        out.println("  --ci                              - One-line summary for CI logs");
        out.println("  --no-color                        - Disable colored output");
        out.println("  --include=<glob>                  - Only lint files matching the glob");
        out.println("  --threads=<num>                   - Worker threads (default: available processors)");
    }

    private int _lint(String[] args, boolean applyFixes) throws Exception {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Missing path argument");
            _printUsage();
            return 1;
        }
        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Path does not exist: " + path);
            return 1;
        }

        boolean ciMode = _hasOption(args, "--ci");
        LinterConfig config = _withInclude(_loadConfig(args, path), _getOptionValue(args, "--include"));
        int threads = _threads(_getOptionValue(args, "--threads"));

        Instant start = Instant.now();
        Map<Path, LintResult> results = new TreeMap<>();
        try (SignalLintEngine engine = _createEngine(config)) {
            if (Files.isRegularFile(path)) {
                results.put(path, engine.lintFile(path, Files.readString(path, StandardCharsets.UTF_8)));
            } else {
                results.putAll(engine.lintDirectory(path, threads));
            }
        }

        int fixedFiles = applyFixes ? _writeFixes(results) : 0;
        int remainingErrors = 0;
        for (Map.Entry<Path, LintResult> entry : results.entrySet()) {
            List<Diagnostic> remaining = _remaining(entry.getValue(), applyFixes);
            remainingErrors += (int) remaining.stream()
                    .filter(d -> d.getSeverity() == Severity.FATAL || d.getSeverity() == Severity.ERROR)
                    .count();
            if (!ciMode) {
                String text = formatter.formatFile(entry.getKey(), entry.getValue());
                if (!text.isEmpty()) {
                    out.print(text);
                }
            }
        }

        Duration duration = Duration.between(start, Instant.now());
        if (ciMode) {
            out.println("RESULT:" + formatter.formatCiSummary(results));
        } else {
            out.println();
            out.println(formatter.formatSummary(results));
            if (applyFixes) {
                _printSuccess("Fixed " + fixedFiles + " file" + (fixedFiles == 1 ? "" : "s"));
            }
            out.println("Linted " + results.size() + " files in " + _formatDuration(duration));
        }
        return remainingErrors > 0 ? 1 : 0;
    }

    /**
     * Diagnostics still standing: in fix mode, those whose primary fix was written are gone.
     */
    private static List<Diagnostic> _remaining(LintResult result, boolean applyFixes) {
        List<Diagnostic> remaining = new ArrayList<>();
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            if (!applyFixes || !diagnostic.getFix().isPrimary()) {
                remaining.add(diagnostic);
            }
        }
        return remaining;
    }

    private int _writeFixes(Map<Path, LintResult> results) throws IOException {
        int fixed = 0;
        for (Map.Entry<Path, LintResult> entry : results.entrySet()) {
            LintResult result = entry.getValue();
            if (result.getFixedCode() == null || result.getAppliedFixes().isEmpty()) {
                continue;
            }
            String original = Files.readString(entry.getKey(), StandardCharsets.UTF_8);
            if (!original.equals(result.getFixedCode())) {
                Files.writeString(entry.getKey(), result.getFixedCode(), StandardCharsets.UTF_8);
                logger.fine("Wrote " + result.getAppliedFixes().size() + " fixes to " + entry.getKey());
                fixed++;
            }
        }
        return fixed;
    }

    private LinterConfig _loadConfig(String[] args, Path target) {
        String configFile = _getOptionValue(args, "--config");
        if (configFile != null) {
            _printInfo("Using config file: " + configFile);
            return ConfigurationLoader.loadConfig(Paths.get(configFile));
        }
        Path directory = Files.isDirectory(target) ? target : target.toAbsolutePath().getParent();
        return ConfigurationLoader.loadProjectConfig(directory != null ? directory : Paths.get("."));
    }

    private static LinterConfig _withInclude(LinterConfig config, String include) {
        if (include == null || include.isEmpty()) {
            return config;
        }
        Map<String, Object> general = new HashMap<>(config.getGeneralConfigMap());
        general.put("includeFiles", List.of(include));
        return new LinterConfig(general, config.getAnalysisConfigMap(), config.getRuleConfigsMap());
    }

    private int _threads(String value) {
        int threads = Runtime.getRuntime().availableProcessors();
        if (value != null) {
            try {
                threads = Math.max(1, Integer.parseInt(value));
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + value + ", using " + threads);
            }
        }
        return threads;
    }

    private static SignalLintEngine _createEngine(LinterConfig config) {
        SignalLintEngine engine = new SignalLintEngine(config);
        engine.registerPlugin(new ReactSignalsPlugin(),
                FileType.JAVASCRIPT, FileType.JSX, FileType.TYPESCRIPT, FileType.TSX);
        return engine;
    }

    private int _initializeConfig(String[] args) throws IOException {
        Path directory = args.length > 1 && !args[1].startsWith("--") ? Paths.get(args[1]) : Paths.get(".");
        if (!Files.isDirectory(directory)) {
            _printError("Not a directory: " + directory);
            return 1;
        }
        Path configPath = directory.resolve(ConfigurationLoader.PROJECT_CONFIG_FILE);
        if (Files.exists(configPath) && !_hasOption(args, "--force")) {
            _printWarning("Configuration file already exists: " + configPath);
            out.println("Use --force to overwrite it");
            return 1;
        }
        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), configPath);
        _printSuccess("Created configuration file: " + configPath);
        return 0;
    }

    private void _printRules() {
        for (Policy policy : RuleCatalog.createAll()) {
            out.println(formatter.colorize(DiagnosticFormatter.ANSI_BOLD, policy.ruleId()));
            for (FindingKind kind : policy.kinds()) {
                out.println("  " + kind.getId() + " (" + kind.getDefaultSeverity().configName() + ")");
            }
        }
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        }
        return String.format("%d min %d sec", seconds / 60, seconds % 60);
    }

    private void _printSuccess(String message) {
        out.println(formatter.colorize(DiagnosticFormatter.ANSI_GREEN, message));
    }

    private void _printError(String message) {
        out.println(formatter.colorize(DiagnosticFormatter.ANSI_RED, message));
    }

    private void _printWarning(String message) {
        out.println(formatter.colorize(DiagnosticFormatter.ANSI_YELLOW, message));
    }

    private void _printInfo(String message) {
        out.println(formatter.colorize(DiagnosticFormatter.ANSI_BLUE, message));
    }
}

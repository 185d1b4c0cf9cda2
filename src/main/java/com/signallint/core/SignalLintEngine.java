package com.signallint.core;

import com.signallint.api.Diagnostic;
import com.signallint.api.LintPlugin;
import com.signallint.api.LintResult;
import com.signallint.api.SignalLinter;
import com.signallint.api.error.Finding;
import com.signallint.api.error.Severity;
import com.signallint.config.LinterConfig;
import com.signallint.plugins.FileType;
import com.signallint.plugins.react.tree.SourceRange;
import com.signallint.util.LoggerUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Thread-safe entry point of the linter. Routes each file to the plugin registered for its type
 * and lints directory trees on a fixed thread pool.
 */
public class SignalLintEngine implements SignalLinter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(SignalLintEngine.class);

    static final String IO_RULE_ID = "io";

    private final Map<FileType, LintPlugin> plugins = new ConcurrentHashMap<>();
    private final LinterConfig config;
    private final List<PathMatcher> ignoreMatchers;
    private final List<PathMatcher> includeMatchers;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public SignalLintEngine(LinterConfig config) {
        this.config = config;
        this.ignoreMatchers = _matchers(config.getGeneralList("ignoreFiles"));
        this.includeMatchers = _matchers(config.getGeneralList("includeFiles"));
        logger.fine("Lint engine created with " + ignoreMatchers.size() + " ignore patterns");
    }

    /**
     * Registers one plugin instance for several file types; it is initialized once.
     */
    public void registerPlugin(LintPlugin plugin, FileType... fileTypes) {
        plugin.initialize(config);
        for (FileType fileType : fileTypes) {
            plugins.put(fileType, plugin);
            logger.fine("Registered plugin for file type: " + fileType.getDescription());
        }
    }

    @Override
    public LintResult lintFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        LintPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.fine("No plugin for file type " + fileType + ", skipping " + filePath);
            return LintResult.builder()
                    .successful(true)
                    .fixedCode(sourceCode)
                    .build();
        }

        try {
            processedFileCount.incrementAndGet();
            LintResult result = plugin.lint(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("Linted without errors: " + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.fine("Problems in " + filePath + ": " + result.getDiagnostics().stream()
                        .map(d -> d.getSeverity() + ": " + d.getMessage())
                        .collect(Collectors.joining(", ")));
            }
            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error linting file: " + filePath, e);
            return fatalResult("internal", "Unexpected error: " + e.getMessage());
        }
    }

    @Override
    public Map<Path, LintResult> lintDirectory(Path directory) {
        return lintDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Lints every eligible file under {@code directory} with {@code threadCount} workers.
     */
    public Map<Path, LintResult> lintDirectory(Path directory, int threadCount) {
        ConcurrentHashMap<Path, LintResult> results = new ConcurrentHashMap<>();

        if (!Files.isDirectory(directory)) {
            logger.warning("Not a directory: " + directory);
            return results;
        }

        List<Path> filesToProcess;
        try {
            filesToProcess = collectFiles(directory);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return results;
        }
        logger.info("Found " + filesToProcess.size() + " files to lint in " + directory);
        if (filesToProcess.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Path file : filesToProcess) {
                executor.submit(() -> {
                    try {
                        String content = Files.readString(file, StandardCharsets.UTF_8);
                        results.put(file, lintFile(file, content));
                    } catch (IOException e) {
                        logger.log(Level.WARNING, "Failed to read " + file, e);
                        results.put(file, fatalResult(IO_RULE_ID, "Failed to read file: " + e.getMessage()));
                    }
                });
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                    logger.warning("Timeout waiting for linting to complete");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Linting interrupted", e);
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }

        logger.info("Linted " + results.size() + " files");
        return results;
    }

    /**
     * Files under {@code directory} with a registered type, honoring the ignore and include globs.
     * Globs match paths relative to the directory, with forward slashes.
     */
    List<Path> collectFiles(Path directory) throws IOException {
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                    .filter(path -> _isSelected(directory.relativize(path)))
                    .filter(path -> plugins.containsKey(FileType.detectByExtension(path)))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean _isSelected(Path relative) {
        Path normalized = Path.of(relative.toString().replace('\\', '/'));
        for (PathMatcher matcher : ignoreMatchers) {
            if (matcher.matches(normalized)) {
                return false;
            }
        }
        if (includeMatchers.isEmpty()) {
            return true;
        }
        for (PathMatcher matcher : includeMatchers) {
            if (matcher.matches(normalized)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> _matchers(List<String> globs) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String glob : globs) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
            if (glob.startsWith("**/")) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3)));
            }
        }
        return matchers;
    }

    static LintResult fatalResult(String ruleId, String message) {
        Finding finding = new Finding(new SourceRange(0, 0, 1, 0), ruleId, ruleId, Severity.FATAL, Map.of());
        return LintResult.builder()
                .successful(false)
                .fixedCode(null)
                .addDiagnostic(new Diagnostic(finding, message, null))
                .build();
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    /**
     * Closes every distinct plugin that holds resources.
     */
    @Override
    public void close() throws Exception {
        logger.fine("Closing engine: processed=" + processedFileCount.get()
                + ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;
        for (LintPlugin plugin : plugins.values().stream().distinct().collect(Collectors.toList())) {
            if (plugin instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) plugin).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin " + plugin.getClass().getSimpleName(), e);
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }
        plugins.clear();

        if (firstException != null) {
            throw firstException;
        }
    }
}

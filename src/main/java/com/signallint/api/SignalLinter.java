package com.signallint.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Entry point for linting files and directory trees.
 */
public interface SignalLinter {
    LintResult lintFile(Path filePath, String sourceCode);
    Map<Path, LintResult> lintDirectory(Path directory);
}

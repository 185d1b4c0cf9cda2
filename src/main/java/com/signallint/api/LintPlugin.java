package com.signallint.api;

import com.signallint.config.LinterConfig;

import java.nio.file.Path;

/**
 * Interface for language-specific lint plugins.
 */
public interface LintPlugin {
    /**
     * Initialize the plugin with the configuration.
     */
    void initialize(LinterConfig config);

    /**
     * Analyze one file and compose fixes for what it finds.
     */
    LintResult lint(Path filePath, String sourceCode);
}

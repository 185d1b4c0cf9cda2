package com.signallint.core;

import com.signallint.TestSources;
import com.signallint.api.LintPlugin;
import com.signallint.api.LintResult;
import com.signallint.api.error.Severity;
import com.signallint.config.ConfigurationLoader;
import com.signallint.config.LinterConfig;
import com.signallint.plugins.FileType;
import com.signallint.plugins.react.ReactSignalsPlugin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SignalLintEngineTest {

    private static final String APP = """
            import { signal } from '@preact/signals-react';
            const countSignal = signal(0);
            export function App() {
              return <div>{countSignal.value}</div>;
            }
            """;

    @TempDir
    Path tempDir;

    private SignalLintEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        _write("src/App.tsx", APP);
        _write("src/util.js", "export const answer = 42;\n");
        _write("src/Broken.jsx", "const = ;\n");
        _write("node_modules/lib/index.js", "module.exports = {};\n");
        _write("dist/bundle.js", "var a = 1;\n");
        _write("README.md", "# App\n");

        Map<String, Object> general = new HashMap<>();
        general.put("ignoreFiles", List.of("**/node_modules/**", "dist/**"));
        Map<String, Object> config = new HashMap<>();
        config.put("general", general);
        engine = _engine(ConfigurationLoader.fromMap(config));
    }

    @AfterEach
    void tearDown() throws Exception {
        engine.close();
    }

    @Test
    void testCollectFilesHonorsIgnoreGlobs() throws IOException {
        List<String> files = _relative(engine.collectFiles(tempDir));
        assertEquals(List.of("src/App.tsx", "src/Broken.jsx", "src/util.js"), files);
    }

    @Test
    void testIncludeGlobsNarrowSelection() throws Exception {
        Map<String, Object> general = new HashMap<>();
        general.put("includeFiles", List.of("**/*.tsx"));
        Map<String, Object> config = new HashMap<>();
        config.put("general", general);

        try (SignalLintEngine narrowed = _engine(ConfigurationLoader.fromMap(config))) {
            List<String> files = _relative(narrowed.collectFiles(tempDir));
            assertEquals(List.of("src/App.tsx"), files);
        }
    }

    @Test
    void testLintDirectory() {
        Map<Path, LintResult> results = engine.lintDirectory(tempDir, 2);

        assertEquals(3, results.size());
        LintResult app = results.get(tempDir.resolve("src/App.tsx"));
        assertTrue(app.isSuccessful());
        assertEquals(1, app.getDiagnostics().size());
        assertTrue(app.getFixedCode().contains("{countSignal}"));

        LintResult broken = results.get(tempDir.resolve("src/Broken.jsx"));
        assertFalse(broken.isSuccessful());
        assertEquals(Severity.FATAL, broken.getDiagnostics().get(0).getSeverity());

        assertEquals(3, engine.getProcessedFileCount());
        assertEquals(2, engine.getSuccessCount());
        assertEquals(1, engine.getErrorCount());
    }

    @Test
    void testLintDirectoryOnMissingPath() {
        assertTrue(engine.lintDirectory(tempDir.resolve("missing")).isEmpty());
    }

    @Test
    void testUnregisteredTypeIsPassedThrough() {
        LintResult result = engine.lintFile(Path.of("notes.md"), "# notes");

        assertTrue(result.isSuccessful());
        assertEquals("# notes", result.getFixedCode());
        assertEquals(0, engine.getProcessedFileCount());
    }

    @Test
    void testPluginFailureBecomesFatalResult() throws Exception {
        LintPlugin failing = mock(LintPlugin.class);
        when(failing.lint(any(), any())).thenThrow(new IllegalStateException("boom"));

        try (SignalLintEngine isolated = new SignalLintEngine(ConfigurationLoader.fromMap(new HashMap<>()))) {
            isolated.registerPlugin(failing, FileType.JAVASCRIPT);
            verify(failing).initialize(any(LinterConfig.class));

            LintResult result = isolated.lintFile(Path.of("a.js"), "const a = 1;");
            assertFalse(result.isSuccessful());
            assertNull(result.getFixedCode());
            assertEquals("internal", result.getDiagnostics().get(0).getRuleId());
            assertTrue(result.getDiagnostics().get(0).getMessage().contains("boom"));
            assertEquals(1, isolated.getErrorCount());
        }
    }

    @Test
    void testRegisteredTypes() {
        assertTrue(engine.hasPluginFor(FileType.TSX));
        assertTrue(engine.hasPluginFor(FileType.JAVASCRIPT));
        assertFalse(engine.hasPluginFor(FileType.UNKNOWN));
    }

    private SignalLintEngine _engine(LinterConfig config) {
        SignalLintEngine created = new SignalLintEngine(config);
        created.registerPlugin(new ReactSignalsPlugin(TestSources.engine()),
                FileType.JAVASCRIPT, FileType.JSX, FileType.TYPESCRIPT, FileType.TSX);
        return created;
    }

    private void _write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private List<String> _relative(List<Path> files) {
        return files.stream()
                .map(path -> tempDir.relativize(path).toString().replace('\\', '/'))
                .collect(Collectors.toList());
    }
}

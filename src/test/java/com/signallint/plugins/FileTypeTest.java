package com.signallint.plugins;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileTypeTest {

    @TempDir
    Path tempDir;

    @Test
    void testDetectByExtension() {
        assertEquals(FileType.TSX, FileType.detectByExtension(Path.of("src/App.tsx")));
        assertEquals(FileType.JSX, FileType.detectByExtension(Path.of("App.JSX")));
        assertEquals(FileType.TYPESCRIPT, FileType.detectByExtension(Path.of("store.mts")));
        assertEquals(FileType.JAVASCRIPT, FileType.detectByExtension(Path.of("index.cjs")));
        assertEquals(FileType.UNKNOWN, FileType.detectByExtension(Path.of("README.md")));
        assertEquals(FileType.UNKNOWN, FileType.detectByExtension(Path.of("Makefile")));
    }

    @Test
    void testDetectByContent() {
        assertEquals(FileType.TSX, FileType.detectByContent("const x: number = 1; const y = <div/>;"));
        assertEquals(FileType.TYPESCRIPT, FileType.detectByContent("interface Props { a: string }"));
        assertEquals(FileType.JSX, FileType.detectByContent("const y = <App />;"));
        assertEquals(FileType.JAVASCRIPT, FileType.detectByContent("const x = 1;"));
        assertEquals(FileType.UNKNOWN, FileType.detectByContent("hello world"));
        assertEquals(FileType.UNKNOWN, FileType.detectByContent(""));
    }

    @Test
    void testDetectSniffsFilesWithoutExtension() throws IOException {
        Path script = tempDir.resolve("tool");
        Files.writeString(script, "#!/usr/bin/env node\nconst a = 1;\n");
        assertEquals(FileType.JAVASCRIPT, FileType.detect(script));
        assertEquals(FileType.UNKNOWN, FileType.detect(tempDir.resolve("missing")));
    }

    @Test
    void testParserFlags() {
        assertTrue(FileType.JAVASCRIPT.allowsJsx(), "Plain .js files may contain markup");
        assertFalse(FileType.TYPESCRIPT.allowsJsx());
        assertTrue(FileType.TSX.isTypeScript());
        assertFalse(FileType.UNKNOWN.isLintable());
    }
}

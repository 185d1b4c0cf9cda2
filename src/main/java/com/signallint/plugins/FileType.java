package com.signallint.plugins;

import com.signallint.util.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Source file types the linter understands, detected by extension with a content sniff as fallback.
 */
public enum FileType {
    JAVASCRIPT("js", true, false),
    JSX("jsx", true, false),
    TYPESCRIPT("ts", false, true),
    TSX("tsx", true, true),
    UNKNOWN("", false, false);

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private static final int SNIFF_BYTES = 4096;

    private static final Pattern TYPESCRIPT_PATTERN = Pattern.compile(
            "(?:\\binterface\\s+\\w+\\s*\\{|\\btype\\s+\\w+\\s*=|:\\s*(?:string|number|boolean)\\b)");

    private static final Pattern JSX_PATTERN = Pattern.compile(
            "(?:<[A-Za-z][\\w.]*(?:\\s[^<>]*)?/?>|<>)");

    private static final Pattern SCRIPT_PATTERN = Pattern.compile(
            "(?:^#!.*\\bnode\\b|\\bimport\\s|\\bexport\\s|\\bfunction\\s|\\bconst\\s|\\blet\\s|\\brequire\\()",
            Pattern.MULTILINE);

    private final String extension;
    private final boolean jsx;
    private final boolean typeScript;

    FileType(String extension, boolean jsx, boolean typeScript) {
        this.extension = extension;
        this.jsx = jsx;
        this.typeScript = typeScript;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Whether the parser should accept markup syntax for this type.
     */
    public boolean allowsJsx() {
        return jsx;
    }

    /**
     * Whether the parser should accept type annotations for this type.
     */
    public boolean isTypeScript() {
        return typeScript;
    }

    public boolean isLintable() {
        return this != UNKNOWN;
    }

    /**
     * Detects the type of a file on disk.
     */
    public static FileType detect(Path filePath) {
        FileType byExtension = detectByExtension(filePath);
        if (byExtension != UNKNOWN) {
            return byExtension;
        }
        return detectByContent(filePath);
    }

    /**
     * Detects the type from the file name alone.
     */
    public static FileType detectByExtension(Path filePath) {
        Path name = filePath.getFileName();
        if (name == null) {
            return UNKNOWN;
        }
        String fileName = name.toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }

        return switch (fileName.substring(dot + 1)) {
            case "js", "mjs", "cjs" -> JAVASCRIPT;
            case "jsx" -> JSX;
            case "ts", "mts", "cts" -> TYPESCRIPT;
            case "tsx" -> TSX;
            default -> UNKNOWN;
        };
    }

    /**
     * Classifies source text that has no recognizable extension.
     */
    public static FileType detectByContent(String content) {
        if (content == null || content.isBlank()) {
            return UNKNOWN;
        }
        boolean typed = TYPESCRIPT_PATTERN.matcher(content).find();
        boolean markup = JSX_PATTERN.matcher(content).find();
        if (typed) {
            return markup ? TSX : TYPESCRIPT;
        }
        if (markup) {
            return JSX;
        }
        return SCRIPT_PATTERN.matcher(content).find() ? JAVASCRIPT : UNKNOWN;
    }

    private static FileType detectByContent(Path filePath) {
        if (!Files.isRegularFile(filePath)) {
            return UNKNOWN;
        }
        try (InputStream in = Files.newInputStream(filePath)) {
            byte[] head = in.readNBytes(SNIFF_BYTES);
            return detectByContent(new String(head, StandardCharsets.UTF_8));
        } catch (IOException e) {
            logger.log(Level.FINE, "Could not read file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    public String getDescription() {
        return switch (this) {
            case JAVASCRIPT -> "JavaScript source file";
            case JSX -> "React JSX source file";
            case TYPESCRIPT -> "TypeScript source file";
            case TSX -> "React TypeScript (TSX) source file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}

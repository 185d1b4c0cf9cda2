package com.signallint.api.error;

import java.util.Locale;

public enum Severity {
    FATAL,   // Parse, I/O or internal failures; the file could not be analyzed
    ERROR,   // Misuse that changes runtime behavior
    WARN,    // Likely mistakes and style problems
    OFF;     // Finding kind disabled; never evaluated

    /**
     * Parses a configured severity ({@code error|warn|off}); returns null for anything else.
     */
    public static Severity fromConfig(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "error" -> ERROR;
            case "warn", "warning" -> WARN;
            case "off" -> OFF;
            default -> null;
        };
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

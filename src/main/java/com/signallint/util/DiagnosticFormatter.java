package com.signallint.util;

import com.signallint.api.Diagnostic;
import com.signallint.api.Fix;
import com.signallint.api.LintResult;
import com.signallint.api.Suggestion;
import com.signallint.api.error.Severity;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders diagnostics and summaries for the terminal.
 */
public class DiagnosticFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";
    public static final String ANSI_DIM = "\u001B[2m";

    private final boolean useColors;

    public DiagnosticFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * One diagnostic as {@code line:col  severity  message  rule}, plus its fix hint.
     */
    public String formatDiagnostic(Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder();
        sb.append("  ").append(diagnostic.getLine()).append(':').append(diagnostic.getColumn()).append("  ");
        sb.append(_severityLabel(diagnostic.getSeverity())).append("  ");
        sb.append(diagnostic.getMessage());
        sb.append("  ").append(colorize(ANSI_DIM, diagnostic.getRuleId()));

        Fix fix = diagnostic.getFix();
        if (fix.isPrimary()) {
            sb.append("\n    ").append(colorize(ANSI_GREEN, "Fixable: ")).append(fix.getDescription());
        } else {
            for (Suggestion suggestion : fix.getSuggestions()) {
                sb.append("\n    ").append(colorize(ANSI_GREEN, "Suggestion: ")).append(suggestion.getDescription());
            }
        }
        return sb.toString();
    }

    /**
     * All diagnostics of one file under a file header; empty when there are none.
     */
    public String formatFile(Path file, LintResult result) {
        if (result.getDiagnostics().isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, file.toString())).append('\n');
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            sb.append(formatDiagnostic(diagnostic)).append('\n');
        }
        if (result.isBudgetExceeded()) {
            sb.append("  ").append(colorize(ANSI_YELLOW, "Analysis stopped early: budget exceeded, fixes withheld"))
                    .append('\n');
        }
        return sb.toString();
    }

    /**
     * Totals per severity across files, with per-file counts for files that have diagnostics.
     */
    public String formatSummary(Map<Path, LintResult> results) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, "Summary:\n"));

        Map<Severity, Long> totals = new EnumMap<>(Severity.class);
        for (Map.Entry<Path, LintResult> entry : results.entrySet()) {
            List<Diagnostic> diagnostics = entry.getValue().getDiagnostics();
            if (diagnostics.isEmpty()) {
                continue;
            }
            Map<Severity, Long> counts = countBySeverity(diagnostics);
            counts.forEach((severity, count) -> totals.merge(severity, count, Long::sum));
            sb.append(entry.getKey().getFileName()).append(": ").append(_counts(counts)).append('\n');
        }

        sb.append("\nTotal: ");
        sb.append(totals.isEmpty() ? colorize(ANSI_GREEN, "no problems") : _counts(totals));
        return sb.toString();
    }

    /**
     * One-line summary for CI logs.
     */
    public String formatCiSummary(Map<Path, LintResult> results) {
        Map<Severity, Long> totals = new EnumMap<>(Severity.class);
        long fixes = 0;
        for (LintResult result : results.values()) {
            countBySeverity(result.getDiagnostics()).forEach((severity, count) -> totals.merge(severity, count, Long::sum));
            fixes += result.getAppliedFixes().size();
        }
        return "files=" + results.size()
                + " fatal=" + totals.getOrDefault(Severity.FATAL, 0L)
                + " errors=" + totals.getOrDefault(Severity.ERROR, 0L)
                + " warnings=" + totals.getOrDefault(Severity.WARN, 0L)
                + " fixed=" + fixes;
    }

    public Map<Severity, Long> countBySeverity(List<Diagnostic> diagnostics) {
        return diagnostics.stream().collect(Collectors.groupingBy(Diagnostic::getSeverity,
                () -> new EnumMap<>(Severity.class), Collectors.counting()));
    }

    private String _counts(Map<Severity, Long> counts) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Severity, Long> entry : counts.entrySet()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            String text = entry.getValue() + " " + _plural(entry.getKey(), entry.getValue());
            sb.append(colorize(_color(entry.getKey()), text));
        }
        return sb.toString();
    }

    private static String _plural(Severity severity, long count) {
        return switch (severity) {
            case FATAL -> "fatal";
            case ERROR -> count == 1 ? "error" : "errors";
            case WARN -> count == 1 ? "warning" : "warnings";
            case OFF -> "disabled";
        };
    }

    private String _severityLabel(Severity severity) {
        return switch (severity) {
            case FATAL -> colorize(ANSI_RED, "fatal");
            case ERROR -> colorize(ANSI_RED, "error");
            case WARN -> colorize(ANSI_YELLOW, "warning");
            case OFF -> colorize(ANSI_BLUE, "off");
        };
    }

    private static String _color(Severity severity) {
        return severity == Severity.WARN ? ANSI_YELLOW : severity == Severity.OFF ? ANSI_BLUE : ANSI_RED;
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}

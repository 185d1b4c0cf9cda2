package com.signallint.api;

import com.signallint.api.error.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of linting one file.
 */
public class LintResult {
    private final boolean successful;
    private final String fixedCode;
    private final List<Diagnostic> diagnostics;
    private final List<AppliedFix> appliedFixes;
    private final boolean budgetExceeded;
    private final Map<String, Long> counters;

    private LintResult(Builder builder) {
        this.successful = builder.successful;
        this.fixedCode = builder.fixedCode;
        this.diagnostics = Collections.unmodifiableList(builder.diagnostics);
        this.appliedFixes = Collections.unmodifiableList(builder.appliedFixes);
        this.budgetExceeded = builder.budgetExceeded;
        this.counters = Collections.unmodifiableMap(builder.counters);
    }

    /**
     * False when any diagnostic is {@link Severity#FATAL} or {@link Severity#ERROR}.
     */
    public boolean isSuccessful() {
        return successful;
    }

    /**
     * Source with every primary fix applied; null when the file could not be analyzed.
     */
    public String getFixedCode() {
        return fixedCode;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<AppliedFix> getAppliedFixes() {
        return appliedFixes;
    }

    public boolean isBudgetExceeded() {
        return budgetExceeded;
    }

    /**
     * Operation counters of the run, keyed by operation name.
     */
    public Map<String, Long> getCounters() {
        return counters;
    }

    public boolean hasFatal() {
        return diagnostics.stream().anyMatch(d -> d.getSeverity() == Severity.FATAL);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String fixedCode;
        private List<Diagnostic> diagnostics = new ArrayList<>();
        private List<AppliedFix> appliedFixes = new ArrayList<>();
        private boolean budgetExceeded;
        private Map<String, Long> counters = new LinkedHashMap<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder fixedCode(String fixedCode) {
            this.fixedCode = fixedCode;
            return this;
        }

        public Builder addDiagnostic(Diagnostic diagnostic) {
            this.diagnostics.add(diagnostic);
            return this;
        }

        public Builder diagnostics(List<Diagnostic> diagnostics) {
            this.diagnostics = new ArrayList<>(diagnostics);
            return this;
        }

        public Builder addAppliedFix(AppliedFix appliedFix) {
            this.appliedFixes.add(appliedFix);
            return this;
        }

        public Builder appliedFixes(List<AppliedFix> appliedFixes) {
            this.appliedFixes = new ArrayList<>(appliedFixes);
            return this;
        }

        public Builder budgetExceeded(boolean budgetExceeded) {
            this.budgetExceeded = budgetExceeded;
            return this;
        }

        public Builder counters(Map<String, Long> counters) {
            this.counters = new LinkedHashMap<>(counters);
            return this;
        }

        /**
         * Sets {@code successful} from the diagnostics collected so far.
         */
        public Builder successFromDiagnostics() {
            this.successful = diagnostics.stream()
                    .noneMatch(d -> d.getSeverity() == Severity.FATAL || d.getSeverity() == Severity.ERROR);
            return this;
        }

        public LintResult build() {
            return new LintResult(this);
        }
    }
}

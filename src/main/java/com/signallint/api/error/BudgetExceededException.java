package com.signallint.api.error;

/**
 * Raised when a file's analysis runs past its node, time or memory budget.
 */
public class BudgetExceededException extends RuntimeException {
    private final String limit;

    public BudgetExceededException(String limit, String message) {
        super(message);
        this.limit = limit;
    }

    /**
     * Which limit tripped: {@code maxNodes}, {@code maxTime} or {@code maxMemory}.
     */
    public String getLimit() {
        return limit;
    }
}

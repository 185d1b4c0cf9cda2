package com.signallint.plugins.react.traversal;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-run operation counts. Not thread-safe; each run owns one.
 */
public class OperationCounters {
    private final EnumMap<Operation, Long> counts = new EnumMap<>(Operation.class);

    public void increment(Operation operation) {
        add(operation, 1);
    }

    public void add(Operation operation, long amount) {
        counts.merge(operation, amount, Long::sum);
    }

    public long get(Operation operation) {
        return counts.getOrDefault(operation, 0L);
    }

    /**
     * Non-zero counts keyed by operation name, in declaration order.
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> result = new LinkedHashMap<>();
        counts.forEach((operation, count) -> result.put(operation.name(), count));
        return result;
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}

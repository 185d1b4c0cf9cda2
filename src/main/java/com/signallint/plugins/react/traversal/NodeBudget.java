package com.signallint.plugins.react.traversal;

import com.signallint.api.error.BudgetExceededException;

/**
 * Limits the work one file may cost: nodes entered, wall-clock time and heap growth.
 * Memory is sampled every {@value #MEMORY_SAMPLE_INTERVAL} nodes.
 */
public class NodeBudget {
    static final int MEMORY_SAMPLE_INTERVAL = 256;
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final long maxNodes;
    private final long maxTimeMillis;
    private final long maxMemoryMb;
    private long nodes;
    private long startNanos;
    private long baselineBytes;

    /**
     * @param maxMemoryMb heap growth limit in megabytes; 0 disables the memory check
     */
    public NodeBudget(long maxNodes, long maxTimeMillis, long maxMemoryMb) {
        this.maxNodes = maxNodes;
        this.maxTimeMillis = maxTimeMillis;
        this.maxMemoryMb = maxMemoryMb;
        start();
    }

    /**
     * Resets the clock and the memory baseline.
     */
    public void start() {
        nodes = 0;
        startNanos = System.nanoTime();
        baselineBytes = maxMemoryMb > 0 ? _usedHeap() : 0;
    }

    /**
     * Charges one node.
     *
     * @throws BudgetExceededException when any limit is passed
     */
    public void tick() {
        nodes++;
        if (nodes > maxNodes) {
            throw new BudgetExceededException("maxNodes", "Node budget of " + maxNodes + " exceeded");
        }
        long elapsedMillis = (System.nanoTime() - startNanos) / 1_000_000L;
        if (elapsedMillis > maxTimeMillis) {
            throw new BudgetExceededException("maxTime",
                    "Time budget of " + maxTimeMillis + " ms exceeded after " + nodes + " nodes");
        }
        if (maxMemoryMb > 0 && nodes % MEMORY_SAMPLE_INTERVAL == 0) {
            long grownMb = (_usedHeap() - baselineBytes) / BYTES_PER_MB;
            if (grownMb > maxMemoryMb) {
                throw new BudgetExceededException("maxMemory",
                        "Memory budget of " + maxMemoryMb + " MB exceeded (" + grownMb + " MB)");
            }
        }
    }

    public long getNodes() {
        return nodes;
    }

    private static long _usedHeap() {
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    }
}

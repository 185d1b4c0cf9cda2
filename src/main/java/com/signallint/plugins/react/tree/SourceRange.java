package com.signallint.plugins.react.tree;

/**
 * Half-open span of source text in UTF-16 offsets, with the 1-based line and 0-based column of its start.
 */
public final class SourceRange {
    private final int start;
    private final int end;
    private final int line;
    private final int column;

    public SourceRange(int start, int end, int line, int column) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.line = line;
        this.column = column;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Two ranges overlap when they share at least one offset. Two empty ranges at the same
     * offset also overlap, since the order of two insertions there would be ambiguous.
     */
    public boolean overlaps(SourceRange other) {
        if (isEmpty() && other.isEmpty()) {
            return start == other.start;
        }
        if (isEmpty()) {
            return start > other.start && start < other.end;
        }
        if (other.isEmpty()) {
            return other.start > start && other.start < end;
        }
        return start < other.end && other.start < end;
    }

    public boolean contains(SourceRange other) {
        return start <= other.start && other.end <= end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceRange)) {
            return false;
        }
        SourceRange that = (SourceRange) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return line + ":" + (column + 1) + " [" + start + ", " + end + ")";
    }
}

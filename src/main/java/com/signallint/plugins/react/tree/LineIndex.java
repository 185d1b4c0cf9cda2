package com.signallint.plugins.react.tree;

import java.util.Arrays;

/**
 * Maps UTF-16 offsets of one source text to line and column positions.
 */
public final class LineIndex {
    private final int[] lineStarts;
    private final int length;

    public LineIndex(String source) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            boolean lineBreak = c == '\n'
                    || (c == '\r' && (i + 1 >= source.length() || source.charAt(i + 1) != '\n'))
                    || c == '\u2028' || c == '\u2029';
            if (lineBreak) {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
        this.length = source.length();
    }

    /**
     * 1-based line containing the offset.
     */
    public int lineOf(int offset) {
        int index = Arrays.binarySearch(lineStarts, Math.min(Math.max(offset, 0), length));
        return index >= 0 ? index + 1 : -index - 1;
    }

    /**
     * 0-based column of the offset within its line.
     */
    public int columnOf(int offset) {
        int clamped = Math.min(Math.max(offset, 0), length);
        return clamped - lineStarts[lineOf(clamped) - 1];
    }

    public SourceRange range(int start, int end) {
        return new SourceRange(start, end, lineOf(start), columnOf(start));
    }

    public int getLineCount() {
        return lineStarts.length;
    }
}

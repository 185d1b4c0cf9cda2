package com.signallint.plugins.react.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceRangeTest {

    private static SourceRange range(int start, int end) {
        return new SourceRange(start, end, 1, start);
    }

    @Test
    void testOverlap() {
        assertTrue(range(0, 5).overlaps(range(4, 8)));
        assertFalse(range(0, 5).overlaps(range(5, 8)), "Adjacent ranges do not overlap");
        assertTrue(range(3, 3).overlaps(range(3, 3)), "Two insertions at one offset conflict");
        assertFalse(range(3, 3).overlaps(range(3, 6)), "Insertion at the start of a replacement is allowed");
        assertTrue(range(4, 4).overlaps(range(3, 6)), "Insertion inside a replacement conflicts");
    }

    @Test
    void testContains() {
        assertTrue(range(0, 10).contains(range(2, 4)));
        assertFalse(range(2, 4).contains(range(0, 10)));
    }

    @Test
    void testLineIndex() {
        LineIndex index = new LineIndex("ab\ncd\r\nef");
        assertEquals(3, index.getLineCount());
        assertEquals(1, index.lineOf(1));
        assertEquals(2, index.lineOf(3));
        assertEquals(0, index.columnOf(3));
        assertEquals(3, index.lineOf(7));
        assertEquals(1, index.columnOf(8));
    }
}

package com.signallint.plugins.react.fix;

import com.signallint.api.Edit;
import com.signallint.api.error.InternalFaultException;
import com.signallint.plugins.react.tree.SourceRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EditSetTest {

    private static Edit edit(int start, int end, String text, String group) {
        return new Edit(new SourceRange(start, end, 1, start), text, group);
    }

    @Test
    void testClaimsDisjointGroups() {
        EditSet set = new EditSet();
        assertTrue(set.tryClaim(List.of(edit(0, 1, "a", "g1"), edit(5, 6, "b", "g1"))));
        assertTrue(set.tryClaim(List.of(edit(2, 3, "c", "g2"))));
        assertEquals(3, set.getEdits().size());
    }

    @Test
    void testRejectsWholeGroupOnOverlap() {
        EditSet set = new EditSet();
        assertTrue(set.tryClaim(List.of(edit(0, 4, "x", "g1"))));
        assertFalse(set.tryClaim(List.of(edit(10, 12, "y", "g2"), edit(2, 3, "z", "g2"))),
                "A group with one conflicting edit must be rejected");
        assertEquals(1, set.getEdits().size(), "Nothing of the rejected group may be claimed");
    }

    @Test
    void testSharesIdenticalEdits() {
        EditSet set = new EditSet();
        assertTrue(set.tryClaim(List.of(edit(0, 0, "import x;\n", "g1"), edit(5, 6, "a", "g1"))));
        assertTrue(set.tryClaim(List.of(edit(0, 0, "import x;\n", "g2"), edit(8, 9, "b", "g2"))),
                "The same import added twice should be shared");
        assertEquals(3, set.getEdits().size());
    }

    @Test
    void testApply() {
        String source = "let a = b;";
        String result = EditSet.apply(source, List.of(edit(8, 9, "c.value", "g"), edit(4, 5, "z", "g")));
        assertEquals("let z = c.value;", result);
    }

    @Test
    void testApplyRejectsOverlap() {
        assertThrows(InternalFaultException.class,
                () -> EditSet.apply("abcdef", List.of(edit(0, 3, "x", "g"), edit(2, 4, "y", "g"))));
    }
}

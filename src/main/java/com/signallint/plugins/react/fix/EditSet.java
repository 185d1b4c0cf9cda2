package com.signallint.plugins.react.fix;

import com.signallint.api.Edit;
import com.signallint.api.error.InternalFaultException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Ledger of the primary edits claimed in one pass. Edit groups are claimed whole or not at all,
 * and a claimed edit never overlaps another one.
 */
public class EditSet {
    private final List<Edit> claimed = new ArrayList<>();

    /**
     * Claims a group of edits. Edits identical to one already claimed (same range, same text) are shared
     * rather than applied twice.
     *
     * @return false, claiming nothing, when any edit overlaps a claimed or sibling edit
     */
    public boolean tryClaim(List<Edit> edits) {
        List<Edit> fresh = new ArrayList<>();
        for (Edit edit : edits) {
            if (_isDuplicate(edit, claimed) || _isDuplicate(edit, fresh)) {
                continue;
            }
            if (_overlapsAny(edit, claimed) || _overlapsAny(edit, fresh)) {
                return false;
            }
            fresh.add(edit);
        }
        claimed.addAll(fresh);
        return true;
    }

    public List<Edit> getEdits() {
        return Collections.unmodifiableList(claimed);
    }

    public boolean isEmpty() {
        return claimed.isEmpty();
    }

    private static boolean _isDuplicate(Edit edit, List<Edit> existing) {
        for (Edit other : existing) {
            if (other.getRange().equals(edit.getRange()) && other.getReplacement().equals(edit.getReplacement())) {
                return true;
            }
        }
        return false;
    }

    private static boolean _overlapsAny(Edit edit, List<Edit> existing) {
        for (Edit other : existing) {
            if (other.getRange().overlaps(edit.getRange())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Applies non-overlapping edits to a source text.
     *
     * @throws InternalFaultException when two edits overlap
     */
    public static String apply(String source, List<Edit> edits) {
        List<Edit> ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparingInt((Edit e) -> e.getRange().getStart())
                .thenComparingInt(e -> e.getRange().getEnd()));

        StringBuilder result = new StringBuilder(source.length());
        int position = 0;
        Edit previous = null;
        for (Edit edit : ordered) {
            if (previous != null && previous.getRange().overlaps(edit.getRange())) {
                throw new InternalFaultException("Overlapping edits " + previous + " and " + edit);
            }
            if (edit.getRange().getEnd() > source.length()) {
                throw new InternalFaultException("Edit " + edit + " lies outside the source");
            }
            result.append(source, position, edit.getRange().getStart());
            result.append(edit.getReplacement());
            position = edit.getRange().getEnd();
            previous = edit;
        }
        result.append(source.substring(position));
        return result.toString();
    }
}

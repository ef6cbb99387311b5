package com.raditha.jarl.model;

import com.raditha.jarl.syntax.TextRange;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One or more edits that must be applied together.
 *
 * @param edits edits sorted by start offset; never overlapping
 */
public record Fix(List<TextEdit> edits) {

    public Fix {
        if (edits == null || edits.isEmpty()) {
            throw new IllegalArgumentException("A fix needs at least one edit");
        }
        List<TextEdit> sorted = new ArrayList<>(edits);
        sorted.sort(Comparator.comparing(TextEdit::range));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i - 1).conflictsWith(sorted.get(i))) {
                throw new IllegalArgumentException("Edits of a fix overlap: " + sorted.get(i - 1).range()
                        + " and " + sorted.get(i).range());
            }
        }
        edits = List.copyOf(sorted);
    }

    public static Fix replace(TextRange range, String replacement) {
        return new Fix(List.of(new TextEdit(range, replacement)));
    }

    public static Fix delete(TextRange range) {
        return replace(range, "");
    }

    public static Fix insert(int offset, String text) {
        return replace(TextRange.empty(offset), text);
    }

    /**
     * True when any edit of this fix conflicts with any edit of {@code other}.
     */
    public boolean conflictsWith(Fix other) {
        for (TextEdit mine : edits) {
            for (TextEdit theirs : other.edits) {
                if (mine.conflictsWith(theirs)) {
                    return true;
                }
            }
        }
        return false;
    }
}

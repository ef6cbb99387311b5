package com.raditha.jarl.model;

import com.raditha.jarl.syntax.TextRange;

/**
 * Replace the text in {@code range} with {@code replacement}. An empty range
 * is an insertion, an empty replacement a deletion.
 */
public record TextEdit(TextRange range, String replacement) {

    public TextEdit {
        if (range == null || replacement == null) {
            throw new IllegalArgumentException("range and replacement are required");
        }
    }

    /**
     * True when applying both edits would touch the same text. Two insertions
     * at the same offset also conflict because their order would be ambiguous.
     */
    public boolean conflictsWith(TextEdit other) {
        if (range.isEmpty() && other.range.isEmpty()) {
            return range.start() == other.range.start();
        }
        if (range.isEmpty()) {
            return other.range.start() < range.start() && range.start() < other.range.end();
        }
        if (other.range.isEmpty()) {
            return range.start() < other.range.start() && other.range.start() < range.end();
        }
        return range.intersects(other.range);
    }
}

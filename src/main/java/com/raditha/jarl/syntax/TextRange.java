package com.raditha.jarl.syntax;

/**
 * Half-open character range {@code [start, end)} into a source text.
 *
 * @param start first offset covered by the range
 * @param end   offset one past the last covered character
 */
public record TextRange(int start, int end) implements Comparable<TextRange> {

    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
    }

    public static TextRange empty(int offset) {
        return new TextRange(offset, offset);
    }

    /**
     * Smallest range covering both ranges.
     */
    public TextRange cover(TextRange other) {
        return new TextRange(Math.min(start, other.start), Math.max(end, other.end));
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(TextRange other) {
        return start <= other.start && other.end <= end;
    }

    public boolean contains(int offset) {
        return start <= offset && offset < end;
    }

    /**
     * True when the ranges share at least one character. Touching ranges
     * ({@code a.end == b.start}) do not intersect.
     */
    public boolean intersects(TextRange other) {
        return start < other.end && other.start < end;
    }

    public String slice(String text) {
        return text.substring(start, end);
    }

    @Override
    public int compareTo(TextRange other) {
        int cmp = Integer.compare(start, other.start);
        return cmp != 0 ? cmp : Integer.compare(end, other.end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}

package com.raditha.jarl.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Maps character offsets to 1-based line and column numbers.
 */
public final class LineIndex {

    private final int[] lineStarts;
    private final int length;

    private LineIndex(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    public static LineIndex of(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return new LineIndex(starts.stream().mapToInt(Integer::intValue).toArray(), text.length());
    }

    /**
     * Line (1-based) containing the given offset.
     */
    public int line(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        int index = Arrays.binarySearch(lineStarts, clamped);
        if (index < 0) {
            index = -index - 2;
        }
        return index + 1;
    }

    /**
     * Column (1-based) of the given offset within its line.
     */
    public int column(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        return clamped - lineStart(line(clamped)) + 1;
    }

    /**
     * Offset of the first character of a 1-based line.
     */
    public int lineStart(int line) {
        return lineStarts[line - 1];
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public SourceLocation location(int offset) {
        return new SourceLocation(line(offset), column(offset));
    }

    /**
     * A 1-based line/column pair.
     */
    public record SourceLocation(int line, int column) {
    }
}

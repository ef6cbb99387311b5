package com.raditha.jarl.syntax;

/**
 * A source comment, from {@code #} to the end of its line.
 *
 * @param text  comment text including the leading {@code #}
 * @param range location in the source
 */
public record Comment(String text, TextRange range) {

    public int start() {
        return range.start();
    }

    public int end() {
        return range.end();
    }
}

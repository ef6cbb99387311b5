package com.raditha.jarl.syntax;

import java.util.List;

/**
 * Result of parsing one R source unit.
 *
 * @param source   the text that was parsed
 * @param root     PROGRAM node holding the top-level statements
 * @param comments every comment in source order
 */
public record SyntaxTree(String source, SyntaxNode root, List<Comment> comments) {

    public SyntaxTree {
        comments = List.copyOf(comments);
    }

    public String text(SyntaxNode node) {
        return node.range().slice(source);
    }

    public String text(TextRange range) {
        return range.slice(source);
    }

    /**
     * True when at least one comment lies inside the range.
     */
    public boolean hasCommentsIn(TextRange range) {
        for (Comment comment : comments) {
            if (range.contains(comment.range())) {
                return true;
            }
            if (comment.start() >= range.end()) {
                return false;
            }
        }
        return false;
    }
}

package com.raditha.jarl.syntax;

/**
 * A lexical token.
 *
 * @param type  token category
 * @param text  token text; for backticked names the text between the backticks
 * @param start offset of the first character
 * @param end   offset one past the last character
 */
public record Token(TokenType type, String text, int start, int end) {

    public TextRange range() {
        return new TextRange(start, end);
    }

    public boolean isOperator(String spelling) {
        return type == TokenType.OPERATOR && text.equals(spelling);
    }
}

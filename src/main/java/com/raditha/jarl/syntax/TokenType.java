package com.raditha.jarl.syntax;

/**
 * Lexical token categories of R source.
 */
public enum TokenType {
    IDENTIFIER,
    NUMBER,
    STRING,
    DOTS,

    /** {@code TRUE}, {@code FALSE}, {@code NULL} and the NA family */
    TRUE,
    FALSE,
    NULL,
    NA,

    IF,
    ELSE,
    FOR,
    IN,
    WHILE,
    REPEAT,
    FUNCTION,
    LAMBDA,
    BREAK,
    NEXT,

    /** Any infix or prefix operator; the spelling is the token text */
    OPERATOR,

    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    DOUBLE_LBRACKET,
    RBRACKET,
    COMMA,
    SEMICOLON,
    NEWLINE,
    EOF
}

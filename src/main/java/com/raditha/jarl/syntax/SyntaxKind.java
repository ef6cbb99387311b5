package com.raditha.jarl.syntax;

/**
 * Node kinds of the R syntax tree.
 */
public enum SyntaxKind {
    PROGRAM,
    BRACED_EXPRESSIONS,
    PARENTHESIZED,

    IF_STATEMENT,
    FOR_STATEMENT,
    WHILE_STATEMENT,
    REPEAT_STATEMENT,
    FUNCTION_DEFINITION,
    PARAMETERS,
    PARAMETER,

    CALL,
    SUBSET,
    SUBSET2,
    ARGUMENTS,
    ARGUMENT,

    BINARY_EXPRESSION,
    UNARY_EXPRESSION,
    NAMESPACE_EXPRESSION,

    IDENTIFIER,
    STRING,
    NUMBER,
    TRUE,
    FALSE,
    NULL,
    NA,
    DOTS,
    BREAK,
    NEXT
}

package com.tagfilter.config.expression;

/**
 * Token types for filter expression parsing.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    STRING,
    NUMBER,

    // Delimiters
    LPAREN,
    RPAREN,
    COMMA,

    // Keywords
    WITH,
    AND,
    OR,

    // Tag operators
    BANG,
    EQ,
    NE,
    LIKE,
    NOT_LIKE,
    GT,
    GTE,
    LT,
    LTE,

    // Special
    EOF
}

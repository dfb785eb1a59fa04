package com.janitor.predicate;

/**
 * Token types for predicate parsing.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    QUOTED_IDENT,
    RAW_STRING,
    JSON_LITERAL,
    NUMBER,

    // Delimiters
    DOT,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    STAR,
    AT,

    // Logical operators
    AND,
    OR,
    NOT,

    // Comparison operators
    EQ,
    NE,
    GT,
    GTE,
    LT,
    LTE,

    // Special
    EOF
}

package com.copilot.config.expression;

/**
 * Token types for expression parsing.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    STRING,
    NUMBER,
    BOOLEAN,

    // Graph predicate name directly followed by '('
    FUNCTION,

    // Delimiters
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,

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

    // Set membership
    IN,

    // Special
    EOF
}

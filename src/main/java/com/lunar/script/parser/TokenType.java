package com.lunar.script.parser;

public enum TokenType {
    // Single-character tokens
    LEFT_PAREN, RIGHT_PAREN, COMMA,
    PLUS, MINUS, STAR, SLASH,

    // One or two character tokens
    EQUAL, EQUAL_EQUAL, TILDE_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    DOT_DOT,

    // Literals
    IDENTIFIER, STRING, NUMBER,

    // Keywords
    LOCAL, FUNCTION, RETURN, END, IF, THEN, ELSE,
    TRUE, FALSE, NIL, AND, OR, NOT,

    EOF
}

package com.lunar.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;

    public Token(TokenType type, String lexeme, Object literal) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
    }

    @Override
    public String toString() {
        return literal == null ? type + " '" + lexeme + "'" : type + " '" + lexeme + "' " + literal;
    }
}

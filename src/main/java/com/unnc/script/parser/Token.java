package com.unnc.script.parser;

public class Token {
    final TokenType type;
    public final String lexeme;
    final Object literal;
    /** 0-based offset into the normalized expression text. */
    public final int position;

    Token(TokenType type, String lexeme, Object literal, int position) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.position = position;
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "'";
    }
}

package com.unnc.script.parser;

public enum TokenType {
    // single-character tokens
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, COMMA,
    PLUS, MINUS, STAR, SLASH, PERCENT,

    // one or two character tokens
    BANG, BANG_EQUAL, EQUAL_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    AND_AND, OR_OR,

    // literals
    IDENTIFIER, INTEGER, FLOAT, STRING,

    // keywords
    TRUE, FALSE, NIL, LEAF,

    EOF
}

package com.oxlang.script.parser;

public enum TokenType {
    // Single-character punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, DOT, COLON, SEMICOLON,

    // Operators
    PLUS, MINUS, STAR, SLASH, CARET,
    BANG, BANG_EQUAL,
    EQUAL, EQUAL_EQUAL,
    PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL, CARET_EQUAL,
    GREATER, GREATER_EQUAL,
    LESS, LESS_EQUAL,
    AND_AND, OR_OR,

    // Literals
    IDENTIFIER, STRING, NUMBER,

    // Keywords
    FUNC, STRUCT, INHERITS, IF, ELSE, WHILE, FOR, IN, RETURN, BREAK, CONTINUE,
    TRUE, FALSE, NIL, IMPORT,

    EOF
}

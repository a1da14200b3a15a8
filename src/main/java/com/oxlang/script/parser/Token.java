package com.oxlang.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    public final int line;
    public final int column;

    public Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token t = (Token) o;
        return type == t.type && line == t.line && column == t.column
                && lexeme.equals(t.lexeme)
                && (literal == null ? t.literal == null : literal.equals(t.literal));
    }

    @Override
    public int hashCode() {
        return ((type.hashCode() * 31 + lexeme.hashCode()) * 31 + line) * 31 + column;
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' " + line + ":" + column;
    }
}

package com.oxlang.script;

import com.oxlang.script.parser.Token;

/** Malformed grammar. Parsing stops at the first one and yields no tree. */
public class ParseError extends OxError {
    private static final long serialVersionUID = 1L;

    private final String found;

    public ParseError(Token found, String detail) {
        super(ErrorKind.PARSE, detail + " Found " + describe(found) + ".", found.line, found.column);
        this.found = found.lexeme;
    }

    /** Lexeme of the token the parser stopped at ("" at end of input). */
    public String found() {
        return found;
    }

    private static String describe(Token t) {
        return t.lexeme.isEmpty() ? "end of input" : "'" + t.lexeme + "'";
    }
}

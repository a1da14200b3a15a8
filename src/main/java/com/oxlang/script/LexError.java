package com.oxlang.script;

/** Unrecognized input while tokenizing. Nothing is evaluated after one. */
public class LexError extends OxError {
    private static final long serialVersionUID = 1L;

    private final char offending;

    public LexError(char offending, String detail, int line, int column) {
        super(ErrorKind.LEX, detail, line, column);
        this.offending = offending;
    }

    public char offending() {
        return offending;
    }
}

package com.oxlang.script;

/** Failure categories reported by the engine. */
public enum ErrorKind {
    LEX("LexError"),
    PARSE("ParseError"),
    NAME("NameError"),
    TYPE("TypeError"),
    ARITY("ArityError"),
    INDEX("IndexError"),
    STACK_OVERFLOW("StackOverflowError");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}

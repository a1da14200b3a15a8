package com.oxlang.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.oxlang.script.parser.Token;

/**
 * Every failure raised by the lexer, parser or evaluator.
 *
 * Carries the {@link ErrorKind}, the bare detail message, the source position
 * (line/column are 0 when unknown) and the ox-level call trace, innermost
 * frame first. Runtime errors unwind through every call frame to the host;
 * there is no catch construct in the language.
 */
public class OxError extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private static final int MAX_TRACE = 64;

    private final ErrorKind kind;
    private final String detail;
    private int line;
    private int column;
    private final List<String> callTrace = new ArrayList<>();

    public OxError(ErrorKind kind, String detail, int line, int column) {
        this(kind, detail, line, column, null);
    }

    public OxError(ErrorKind kind, String detail, int line, int column, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
        this.detail = detail;
        this.line = line;
        this.column = column;
    }

    public static OxError at(ErrorKind kind, Token token, String detail) {
        if (token == null) return new OxError(kind, detail, 0, 0);
        return new OxError(kind, detail, token.line, token.column);
    }

    public static OxError name(Token token, String detail) { return at(ErrorKind.NAME, token, detail); }
    public static OxError type(Token token, String detail) { return at(ErrorKind.TYPE, token, detail); }
    public static OxError arity(Token token, String detail) { return at(ErrorKind.ARITY, token, detail); }
    public static OxError index(Token token, String detail) { return at(ErrorKind.INDEX, token, detail); }

    public ErrorKind kind() { return kind; }
    public String detail() { return detail; }
    public int line() { return line; }
    public int column() { return column; }
    public boolean hasPosition() { return line > 0; }

    /** Fills in the position when the raising site had none. */
    public OxError locateIfUnknown(Token token) {
        if (!hasPosition() && token != null) {
            this.line = token.line;
            this.column = token.column;
        }
        return this;
    }

    /** Appends an outer frame; deep traces keep only the innermost {@value #MAX_TRACE}. */
    public void addFrame(String frame) {
        if (callTrace.size() < MAX_TRACE) callTrace.add(frame);
    }

    public List<String> callTrace() {
        return Collections.unmodifiableList(callTrace);
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (hasPosition()) {
            sb.append("[line ").append(line).append(", col ").append(column).append("] ");
        }
        sb.append(kind.displayName()).append(": ").append(detail);
        return sb.toString();
    }
}

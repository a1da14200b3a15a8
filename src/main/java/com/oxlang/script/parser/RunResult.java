package com.oxlang.script.parser;

import java.util.Map;

public class RunResult {
    private final Map<String, Value> globals;
    private final Value value;

    public RunResult(Map<String, Value> globals, Value value) {
        this.globals = globals;
        this.value = value;
    }

    /** Snapshot of the global scope after the run. */
    public Map<String, Value> globals() { return globals; }

    /** Value of the last top-level expression statement, or nil. */
    public Value value() { return value; }
}

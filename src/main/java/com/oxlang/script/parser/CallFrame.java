package com.oxlang.script.parser;

public class CallFrame {
    final String functionName;
    final Token site;

    CallFrame(String functionName, Token site) {
        this.functionName = functionName;
        this.site = site;
    }

    /** "name (line L)" as it appears in an error's call trace. */
    String describe() {
        if (site == null) return functionName;
        return functionName + " (line " + site.line + ")";
    }
}

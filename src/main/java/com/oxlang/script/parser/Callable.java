package com.oxlang.script.parser;

import java.util.List;

/** Anything a call expression can invoke: closures, bound methods and host natives. */
public interface Callable {

    String name();

    Value call(Interpreter interpreter, List<Value> args);

    static Callable ofNative(String name, NativeFunction fn) {
        return new Callable() {
            @Override public String name() { return name; }
            @Override public Value call(Interpreter interpreter, List<Value> args) {
                Value out = fn.call(args);
                return out == null ? Value.nil() : out;
            }
            @Override public String toString() { return "<native " + name + ">"; }
        };
    }
}

package com.oxlang.script.parser;

import java.util.ArrayList;
import java.util.List;

/** An instance method paired with its receiver, produced by {@code inst.method}. */
public class BoundMethod implements Callable {
    final Value receiver;
    final Callable method;

    BoundMethod(Value receiver, Callable method) {
        this.receiver = receiver;
        this.method = method;
    }

    @Override
    public String name() { return method.name(); }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        List<Value> full = new ArrayList<>(args.size() + 1);
        full.add(receiver);
        full.addAll(args);
        return method.call(interpreter, full);
    }

    @Override
    public String toString() {
        return "<bound " + method.name() + ">";
    }
}

package com.oxlang.script.parser;

import java.util.List;

import com.oxlang.script.ErrorKind;
import com.oxlang.script.OxError;
import com.oxlang.script.parser.Interpreter.ReturnSignal;
import com.oxlang.script.parser.Statement.Stmt;

public class Closure implements Callable {
    final String name;
    final List<Token> params;
    final List<Stmt> body;
    final Environment closure;

    Closure(String name, List<Token> params, List<Stmt> body, Environment closure) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
    }

    @Override
    public String name() { return name; }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw new OxError(ErrorKind.ARITY,
                    name + "() expects " + params.size() + " arguments, got " + args.size(), 0, 0);
        }

        Environment previous = interpreter.env;

        // The call frame is a child of the defining scope, not of the caller's.
        interpreter.env = closure.child();

        try {
            for (int i = 0; i < params.size(); i++) {
                interpreter.env.declare(params.get(i).lexeme, args.get(i));
            }

            try {
                for (Stmt s : body) s.accept(interpreter);
            } catch (ReturnSignal rs) {
                return rs.value;
            }

            return Value.nil();
        } finally {
            interpreter.env = previous;
        }
    }

    @Override
    public String toString() {
        return "<func " + name + ">";
    }
}

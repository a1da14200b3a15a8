package com.oxlang.script.plugins;

import java.io.PrintWriter;
import java.util.List;

import com.oxlang.script.ErrorKind;
import com.oxlang.script.OxError;
import com.oxlang.script.OxScript;
import com.oxlang.script.parser.Value;

/**
 * OxCorePlugin
 *
 * Host functions most scripts want: print, len, str, type, push, pop.
 * Kept out of the core engine so the evaluator stays free of I/O.
 *
 * Usage:
 *   OxCorePlugin.register(engine, new PrintWriter(System.out, true));
 */
public final class OxCorePlugin {

    private OxCorePlugin() {}

    public static void register(OxScript engine, PrintWriter out) {
        if (out == null) throw new IllegalArgumentException("out is null");

        engine.registerFunction("print", args -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(args.get(i).display());
            }
            out.println(sb);
            out.flush();
            return Value.nil();
        });

        engine.registerFunction("len", args -> {
            requireArgs("len", args, 1);
            Value v = args.get(0);
            switch (v.type) {
                case STRING: return Value.number(v.asString().length());
                case ARRAY: return Value.number(v.asArray().size());
                default:
                    throw new OxError(ErrorKind.TYPE, "len() expects a string or array, got " + v.typeName(), 0, 0);
            }
        });

        engine.registerFunction("str", args -> {
            requireArgs("str", args, 1);
            return Value.string(args.get(0).display());
        });

        engine.registerFunction("type", args -> {
            requireArgs("type", args, 1);
            return Value.string(args.get(0).typeName());
        });

        engine.registerFunction("push", args -> {
            requireArgs("push", args, 2);
            array("push", args.get(0)).add(args.get(1));
            return args.get(0);
        });

        engine.registerFunction("pop", args -> {
            requireArgs("pop", args, 1);
            List<Value> a = array("pop", args.get(0));
            if (a.isEmpty()) throw new OxError(ErrorKind.INDEX, "pop() from empty array", 0, 0);
            return a.remove(a.size() - 1);
        });
    }

    private static List<Value> array(String fn, Value v) {
        if (v.type != Value.Type.ARRAY) {
            throw new OxError(ErrorKind.TYPE, fn + "() expects an array, got " + v.typeName(), 0, 0);
        }
        return v.asArray();
    }

    private static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) {
            throw new OxError(ErrorKind.ARITY, fn + "() expects " + n + " arguments, got " + args.size(), 0, 0);
        }
    }
}

package com.oxlang.script;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.oxlang.debug.Debug;
import com.oxlang.script.parser.Callable;
import com.oxlang.script.parser.Environment;
import com.oxlang.script.parser.Interpreter;
import com.oxlang.script.parser.NativeFunction;
import com.oxlang.script.parser.Parser;
import com.oxlang.script.parser.RunResult;
import com.oxlang.script.parser.Statement.Stmt;
import com.oxlang.script.parser.Value;

/**
 * Engine facade: one persistent global scope, a module registry and the host
 * functions registered on it. Not thread-safe; use one engine per thread.
 *
 * <pre>
 * OxScript engine = new OxScript();
 * engine.run("import std.math\n x = round(2.6)");
 * double x = engine.get("x").asNumber();
 * </pre>
 */
public class OxScript {
    public static final String STDLIB_MATH = "std.math";
    private static final String TAG = "ox.engine";

    private EngineConfig config;
    private final ModuleRegistry modules;
    private final Map<String, NativeFunction> natives = new LinkedHashMap<>();
    private Environment globals;
    private Interpreter interpreter;

    public OxScript() {
        this(EngineConfig.defaults());
    }

    public OxScript(EngineConfig config) {
        this(config, ModuleLoader.classpath(config.modulePrefix()));
    }

    public OxScript(EngineConfig config, ModuleLoader loader) {
        if (config == null) throw new IllegalArgumentException("config is null");
        this.config = config;
        this.modules = new ModuleRegistry(loader);
        init();
    }

    private void init() {
        this.globals = new Environment();
        this.interpreter = new Interpreter(globals, config.maxRecursionDepth(), config.traceCalls(), modules);
        for (Map.Entry<String, NativeFunction> e : natives.entrySet()) {
            bindNative(e.getKey(), e.getValue());
        }
        if (config.preloadStdlib()) {
            guarded(() -> {
                modules.importModule(STDLIB_MATH, interpreter);
                return null;
            });
        }
    }

    public EngineConfig config() { return config; }

    public ModuleRegistry modules() { return modules; }

    public void setMaxRecursionDepth(int depth) {
        this.config = config.toBuilder().maxRecursionDepth(depth).build();
        interpreter.setMaxDepth(depth);
    }

    public void setTraceCalls(boolean trace) {
        this.config = config.toBuilder().traceCalls(trace).build();
        interpreter.setTraceCalls(trace);
    }

    /** Binds a host function in the global scope; it survives {@link #reset()}. */
    public void registerFunction(String name, NativeFunction fn) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("name is empty");
        if (fn == null) throw new IllegalArgumentException("fn is null");
        natives.put(name, fn);
        bindNative(name, fn);
    }

    private void bindNative(String name, NativeFunction fn) {
        globals.declare(name, Value.function(Callable.ofNative(name, fn)));
    }

    // ===================== RUN =====================

    /** Runs {@code source} against the persistent globals. */
    public RunResult run(String source) {
        if (source == null) throw new IllegalArgumentException("source is null");
        return guarded(() -> {
            List<Stmt> program = Parser.parse(source);
            Value last = interpreter.execute(program);
            return new RunResult(globals.snapshot(), last);
        });
    }

    public Value eval(String source) {
        return run(source).value();
    }

    public Value call(String name, Value... args) {
        return call(name, Arrays.asList(args));
    }

    public Value call(String name, List<Value> args) {
        if (name == null) throw new IllegalArgumentException("name is null");
        final List<Value> copy = (args == null) ? new ArrayList<>() : new ArrayList<>(args);
        return guarded(() -> interpreter.callGlobal(name, copy));
    }

    /** Global binding by name; NameError when unbound. */
    public Value get(String name) {
        return guarded(() -> globals.get(name));
    }

    public boolean has(String name) {
        return globals.isDefined(name);
    }

    public Map<String, Value> globals() {
        return globals.snapshot();
    }

    /** Drops every global and forgets loaded modules; registered host functions are rebound. */
    public void reset() {
        Debug.get().d(TAG, "reset");
        modules.reset();
        init();
    }

    private interface Action<T> {
        T run();
    }

    private <T> T guarded(Action<T> action) {
        try {
            return action.run();
        } catch (OxError e) {
            Debug.get().e(TAG, e.getMessage());
            throw e;
        } catch (StackOverflowError so) {
            OxError e = new OxError(ErrorKind.STACK_OVERFLOW, "Host stack exhausted", 0, 0, so);
            Debug.get().e(TAG, e.getMessage());
            throw e;
        }
    }
}

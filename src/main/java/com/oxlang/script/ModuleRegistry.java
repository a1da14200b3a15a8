package com.oxlang.script;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.oxlang.debug.Debug;
import com.oxlang.script.parser.Environment;
import com.oxlang.script.parser.Interpreter;
import com.oxlang.script.parser.Parser;
import com.oxlang.script.parser.Statement.Stmt;
import com.oxlang.script.parser.Value;

/**
 * Loads each module at most once per engine.
 *
 * A module runs in its own scope (a child of the globals); afterwards every
 * function and struct it declared is copied into the global scope. Later
 * imports overwrite earlier ones on name clashes.
 */
public final class ModuleRegistry implements Interpreter.ModuleImporter {
    private static final String TAG = "ox.modules";

    private final ModuleLoader loader;
    private final Set<String> loaded = new LinkedHashSet<>();
    private final Deque<String> loading = new ArrayDeque<>();

    public ModuleRegistry(ModuleLoader loader) {
        if (loader == null) throw new IllegalArgumentException("loader is null");
        this.loader = loader;
    }

    @Override
    public void importModule(String module, Interpreter interpreter) {
        if (loaded.contains(module)) {
            Debug.get().t(TAG, "already loaded: " + module);
            return;
        }
        if (loading.contains(module)) {
            throw new OxError(ErrorKind.NAME, "Circular import: " + cycle(module), 0, 0);
        }

        String source = read(module);
        Debug.get().d(TAG, "loading module " + module + " (" + source.length() + " chars)");

        loading.push(module);
        try {
            List<Stmt> program = Parser.parse(source);
            Environment scope = interpreter.globals().child();
            interpreter.executeIn(program, scope);
            merge(module, scope, interpreter.globals());
            loaded.add(module);
        } finally {
            loading.pop();
        }
    }

    private String read(String module) {
        String source;
        try {
            source = loader.load(module);
        } catch (IOException e) {
            throw new OxError(ErrorKind.NAME, "Cannot read module '" + module + "': " + e.getMessage(), 0, 0, e);
        }
        if (source == null) {
            throw new OxError(ErrorKind.NAME, "Unknown module '" + module + "'", 0, 0);
        }
        return source;
    }

    private static void merge(String module, Environment scope, Environment globals) {
        for (Map.Entry<String, Value> e : scope.snapshot().entrySet()) {
            Value v = e.getValue();
            if (v.type == Value.Type.FUNCTION || v.type == Value.Type.STRUCT_TYPE) {
                if (globals.isDefinedLocally(e.getKey())) {
                    Debug.get().t(TAG, module + " overwrites global " + e.getKey());
                }
                globals.declare(e.getKey(), v);
                Debug.get().t(TAG, "merged " + module + "." + e.getKey());
            }
        }
    }

    private String cycle(String module) {
        List<String> chain = new ArrayList<>(loading);
        Collections.reverse(chain);
        chain.add(module);
        return String.join(" -> ", chain);
    }

    public boolean isLoaded(String module) {
        return loaded.contains(module);
    }

    /** Loaded module names in load order. */
    public Set<String> loadedModules() {
        return Collections.unmodifiableSet(loaded);
    }

    public void reset() {
        loaded.clear();
        loading.clear();
    }
}

package com.oxlang.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.oxlang.script.ErrorKind;
import com.oxlang.script.OxError;

/**
 * One lexical scope. Lookups walk outward through {@link #parent} to the
 * global scope (the one with no parent); the first binding found wins.
 */
public class Environment {
    public final Environment parent;
    private final Map<String, Value> values = new LinkedHashMap<>();

    /** Creates a global (root) scope. */
    public Environment() {
        this(null);
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment child() {
        return new Environment(this);
    }

    public boolean isGlobal() {
        return parent == null;
    }

    public Environment global() {
        Environment e = this;
        while (e.parent != null) e = e.parent;
        return e;
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Binds in this scope, shadowing any outer binding of the same name. */
    public void declare(String name, Value value) {
        values.put(name, value);
    }

    public Value get(String name) {
        Environment e = find(name);
        if (e == null) {
            throw new OxError(ErrorKind.NAME, "Undefined name '" + name + "'", 0, 0);
        }
        return e.values.get(name);
    }

    /** Rebinds in the nearest scope that defines {@code name}. */
    public void set(String name, Value value) {
        Environment e = find(name);
        if (e == null) {
            throw new OxError(ErrorKind.NAME, "Cannot assign to undefined name '" + name + "'", 0, 0);
        }
        e.values.put(name, value);
    }

    public boolean isDefined(String name) {
        return find(name) != null;
    }

    /** True when {@code name} is bound in some scope of this chain other than the global one. */
    public boolean isDefinedBelowGlobal(String name) {
        Environment e = find(name);
        return e != null && !e.isGlobal();
    }

    public boolean isDefinedLocally(String name) {
        return values.containsKey(name);
    }

    public Set<String> localNames() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /** Read-only view of this scope's own bindings, in insertion order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }


    private Environment find(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) return e;
        }
        return null;
    }
}

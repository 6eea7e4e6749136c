package com.ethica.lang.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One scope: a name-to-value map plus a non-owning link to the enclosing scope.
 * The root of every chain is the global environment.
 */
public class Environment {
    public final Environment parent;
    private final Map<String, Value> values = new LinkedHashMap<>();

    public Environment() {
        this.parent = null;
    }

    public Environment(Environment parent) {
        this.parent = parent;
    }

    /** Binds in this scope, shadowing any outer binding. */
    public void define(String name, Value value) {
        values.put(name, value);
    }

    public Value get(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.values.get(name);
            if (v != null) return v;
        }
        throw new ExecutionException("Undefined variable '" + name + "'");
    }

    /** Rebinds the nearest existing binding. */
    public void assign(String name, Value value) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) {
                e.values.put(name, value);
                return;
            }
        }
        throw new ExecutionException("Undefined variable '" + name + "'");
    }

    public boolean exists(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) return true;
        }
        return false;
    }
}

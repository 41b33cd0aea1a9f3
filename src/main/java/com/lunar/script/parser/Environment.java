package com.lunar.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One lexical scope: a name to value map plus an optional parent.
 *
 * Function values keep their defining Environment alive as their closure; every
 * call gets a fresh child of that closure. Not thread-safe: one root per
 * concurrently running script.
 */
public class Environment {
    public final Environment parent;

    private final Map<String, Value> values = new LinkedHashMap<>();

    /** Root scope, empty. */
    public Environment() {
        this.parent = null;
    }

    /** Root scope seeded with the given bindings (typically the built-in registry). */
    public Environment(Map<String, Value> initial) {
        this.parent = null;
        if (initial != null) values.putAll(initial);
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment childScope() {
        return new Environment(this);
    }

    /** Inserts or overwrites in this scope only. */
    public void define(String name, Value value) {
        values.put(name, value == null ? Value.nil() : value);
    }

    /** Nearest binding in the chain, or nil when the name is bound nowhere. */
    public Value get(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.values.get(name);
            if (v != null) return v;
        }
        return Value.nil();
    }

    public boolean exists(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) return true;
        }
        return false;
    }

    public boolean existsInCurrentScope(String name) {
        return values.containsKey(name);
    }

    /** Mutates the nearest existing binding; fails if the name is bound nowhere in the chain. */
    public void assign(String name, Value value) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) {
                e.values.put(name, value == null ? Value.nil() : value);
                return;
            }
        }
        throw new ScriptError(ScriptError.Kind.UNDEFINED_MUTATION, "Undefined variable '" + name + "'.");
    }

    /** Read-only view of this scope's own bindings, in definition order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Environment root() {
        Environment e = this;
        while (e.parent != null) e = e.parent;
        return e;
    }
}

package com.lox.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One scope in the runtime chain. Blocks and calls get a fresh child; the
 * global scope is the root. Closures keep their defining scope reachable.
 */
public class Environment {
    public final Environment enclosing; // null for the global scope
    private final Map<String, Value> values = new LinkedHashMap<>();

    public Environment() {
        this.enclosing = null;
    }

    private Environment(Environment enclosing) {
        this.enclosing = enclosing;
    }

    public Environment childScope() {
        return new Environment(this);
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Defines or redefines a name in this scope. */
    public void define(String name, Value value) {
        values.put(name, value);
    }

    /** True when the name is bound in this scope or any enclosing one. */
    public boolean exists(String name) {
        for (Environment e = this; e != null; e = e.enclosing) {
            if (e.values.containsKey(name)) return true;
        }
        return false;
    }

    public Value get(Token name) {
        for (Environment e = this; e != null; e = e.enclosing) {
            Value v = e.values.get(name.lexeme);
            if (v != null) return v;
        }
        throw new RuntimeError(name, "Undefined variable '" + name.lexeme + "'.");
    }

    public void assign(Token name, Value value) {
        for (Environment e = this; e != null; e = e.enclosing) {
            if (e.values.containsKey(name.lexeme)) {
                e.values.put(name.lexeme, value);
                return;
            }
        }
        throw new RuntimeError(name, "Undefined variable '" + name.lexeme + "'.");
    }

    // -------------------------
    // Resolved access (hop counts from the resolver)
    // -------------------------

    Environment ancestor(int distance) {
        Environment env = this;
        for (int i = 0; i < distance; i++) {
            env = env.enclosing;
            if (env == null) {
                throw new IllegalStateException("Scope chain shorter than resolved distance " + distance);
            }
        }
        return env;
    }

    Value getAt(int distance, String name) {
        Value v = ancestor(distance).values.get(name);
        if (v == null) {
            throw new IllegalStateException("Resolved variable '" + name + "' missing at distance " + distance);
        }
        return v;
    }

    void assignAt(int distance, Token name, Value value) {
        ancestor(distance).values.put(name.lexeme, value);
    }

    /** Bindings of this scope only, in definition order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}

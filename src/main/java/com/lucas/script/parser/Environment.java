package com.lucas.script.parser;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import com.lucas.script.errors.LucasError;

/**
 * One lexical scope. Blocks and function calls push a child scope whose
 * parent is the enclosing (or captured) one.
 */
public class Environment {
    public final Environment parent;
    private final Map<String, Value> values = new HashMap<>();

    public Environment() {
        this.parent = null;
    }

    public Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment childScope() {
        return new Environment(this);
    }

    public Environment root() {
        Environment env = this;
        while (env.parent != null) env = env.parent;
        return env;
    }

    /** Inserts or overwrites in this scope. */
    public void define(String name, Value value) {
        values.put(name, value);
    }

    public Value get(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            Value v = env.values.get(name);
            if (v != null) return v;
        }
        throw LucasError.runtime(undefinedMessage(name));
    }

    /** Mutates the innermost scope that binds {@code name}; never creates a binding. */
    public void assign(String name, Value value) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.values.containsKey(name)) {
                env.values.put(name, value);
                return;
            }
        }
        throw LucasError.runtime(undefinedMessage(name));
    }

    public boolean exists(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.values.containsKey(name)) return true;
        }
        return false;
    }

    public boolean existsInCurrentScope(String name) {
        return values.containsKey(name);
    }

    /** Every name reachable from this scope, innermost first. */
    public Set<String> visibleNames() {
        Set<String> out = new LinkedHashSet<>();
        for (Environment env = this; env != null; env = env.parent) {
            out.addAll(env.values.keySet());
        }
        return out;
    }

    /** This scope's own bindings, sorted by name. */
    public SortedMap<String, Value> snapshot() {
        return new TreeMap<>(values);
    }

    public static String undefinedMessage(String name) {
        return "Variável '" + name + "' não definida";
    }
}

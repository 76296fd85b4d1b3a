package com.quill.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.quill.debug.Debug;
import com.quill.script.errors.NameError;

/**
 * Chain of lexical scopes.
 *
 * Scopes live in an arena and are addressed by index; each one records the index of its
 * enclosing scope. Entering a block appends a scope whose parent is the current one,
 * leaving it drops that scope again and makes the parent current. Lookups walk parent
 * links from the current scope to the root (index 0).
 */
public class Environment {
    private static final String TAG = "Environment";
    private static final int ROOT = 0;
    private static final int NO_PARENT = -1;

    private static final class Scope {
        final int parent;
        final Map<String, Value> vars = new LinkedHashMap<>();

        Scope(int parent) {
            this.parent = parent;
        }
    }

    private final List<Scope> arena = new ArrayList<>();
    private int current;

    public Environment() {
        arena.add(new Scope(NO_PARENT));
        current = ROOT;
    }

    /** Root environment pre-populated with the given bindings (copied). */
    public Environment(Map<String, Value> initial) {
        this();
        if (initial != null) {
            for (Map.Entry<String, Value> e : initial.entrySet()) {
                declare(e.getKey(), e.getValue());
            }
        }
    }

    // -------------------------
    // Block scoping
    // -------------------------
    public void pushBlock() {
        arena.add(new Scope(current));
        current = arena.size() - 1;
        Debug.get().t(TAG, "enter scope " + current);
    }

    public void popBlock() {
        if (current == ROOT) {
            throw new IllegalStateException("Cannot pop the root scope");
        }
        int left = current;
        current = arena.get(left).parent;
        // Blocks nest strictly, so the scope being left is always the newest one.
        arena.remove(left);
        Debug.get().t(TAG, "leave scope " + left);
    }

    /** Number of scopes between the current one and the root; 0 at top level. */
    public int depth() {
        int d = 0;
        for (int i = current; arena.get(i).parent != NO_PARENT; i = arena.get(i).parent) d++;
        return d;
    }

    // -------------------------
    // Vars API
    // -------------------------
    public void declare(String name, Value value) {
        requireValue(value);
        Map<String, Value> vars = arena.get(current).vars;
        if (vars.containsKey(name)) {
            throw new NameError("Variable already declared in this scope: " + name);
        }
        vars.put(name, value);
    }

    public void assign(String name, Value value) {
        requireValue(value);
        Scope owner = find(name);
        if (owner == null) {
            throw new NameError("Cannot assign undeclared variable: " + name);
        }
        owner.vars.put(name, value);
    }

    public Value resolve(String name) {
        Scope owner = find(name);
        if (owner == null) {
            throw new NameError("Undefined variable: " + name);
        }
        return owner.vars.get(name);
    }

    public boolean exists(String name) {
        return find(name) != null;
    }

    public boolean existsInCurrentScope(String name) {
        return arena.get(current).vars.containsKey(name);
    }

    /**
     * Merged view of every binding visible from the current scope, outermost first, with
     * inner bindings shadowing outer ones.
     */
    public Map<String, Value> snapshot() {
        List<Scope> chain = new ArrayList<>();
        for (int i = current; i != NO_PARENT; i = arena.get(i).parent) chain.add(arena.get(i));
        Collections.reverse(chain);

        Map<String, Value> out = new LinkedHashMap<>();
        for (Scope s : chain) out.putAll(s.vars);
        return Collections.unmodifiableMap(out);
    }

    private Scope find(String name) {
        for (int i = current; i != NO_PARENT; i = arena.get(i).parent) {
            Scope s = arena.get(i);
            if (s.vars.containsKey(name)) return s;
        }
        return null;
    }

    private static void requireValue(Value value) {
        if (value == null) throw new IllegalArgumentException("value must not be null; use Value.nil()");
    }
}

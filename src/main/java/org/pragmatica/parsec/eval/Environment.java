package org.pragmatica.parsec.eval;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Variable scope: name to integer value, optionally linked to an enclosing scope.
 *
 * <p>Scopes inside one function activation are parent-linked: {@link #assign(String, int)} writes
 * through to the nearest scope that already binds the name and otherwise binds it locally, so a
 * block can update outer variables while its own new variables vanish when the block exits.
 * A call starts from a {@link #snapshot()} of the caller, so nothing the callee writes reaches
 * the caller.
 */
public final class Environment {
    private final Environment parent;
    private final Map<String, Integer> bindings;

    private Environment(Environment parent, Map<String, Integer> bindings) {
        this.parent = parent;
        this.bindings = bindings;
    }

    public static Environment root() {
        return new Environment(null, new HashMap<>());
    }

    /**
     * New innermost scope for a block.
     */
    public Environment child() {
        return new Environment(this, new HashMap<>());
    }

    /**
     * Unlinked copy of every visible binding (inner bindings shadow outer ones).
     */
    public Environment snapshot() {
        return new Environment(null, new HashMap<>(visibleBindings()));
    }

    public Optional<Integer> lookup(String name) {
        for (var scope = this; scope != null; scope = scope.parent) {
            var value = scope.bindings.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Update the nearest existing binding of {@code name}, or bind it in this scope.
     */
    public void assign(String name, int value) {
        for (var scope = this; scope != null; scope = scope.parent) {
            if (scope.bindings.containsKey(name)) {
                scope.bindings.put(name, value);
                return;
            }
        }
        bindings.put(name, value);
    }

    /**
     * Bind {@code name} in this scope, shadowing any outer binding.
     */
    public void define(String name, int value) {
        bindings.put(name, value);
    }

    public boolean isBoundLocally(String name) {
        return bindings.containsKey(name);
    }

    /**
     * Every visible binding, outermost first so inner scopes overwrite shadowed names.
     */
    public Map<String, Integer> visibleBindings() {
        var result = parent == null
                     ? new LinkedHashMap<String, Integer>()
                     : new LinkedHashMap<>(parent.visibleBindings());
        result.putAll(bindings);
        return result;
    }

    @Override
    public String toString() {
        return "Environment" + visibleBindings();
    }
}

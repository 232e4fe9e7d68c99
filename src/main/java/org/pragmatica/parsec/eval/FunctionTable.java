package org.pragmatica.parsec.eval;

import org.pragmatica.parsec.error.EvalError;
import org.pragmatica.parsec.lang.Outcome;
import org.pragmatica.parsec.tree.Expression.Identifier;
import org.pragmatica.parsec.tree.FunctionDeclaration;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Functions of a program by name. Built once before execution and never changed afterwards.
 */
public final class FunctionTable {
    public static final FunctionTable EMPTY = new FunctionTable(Map.of());

    private final Map<Identifier, FunctionDeclaration> functions;

    private FunctionTable(Map<Identifier, FunctionDeclaration> functions) {
        this.functions = functions;
    }

    /**
     * Register declarations in order; a later declaration replaces an earlier one with the same name.
     * Fails if a declaration repeats a parameter name.
     */
    public static Outcome<FunctionTable, EvalError> register(List<FunctionDeclaration> declarations) {
        var functions = new HashMap<Identifier, FunctionDeclaration>();
        for (var declaration : declarations) {
            var seen = new HashSet<Identifier>();
            for (var parameter : declaration.parameters()) {
                if (!seen.add(parameter)) {
                    return Outcome.failure(new EvalError.DuplicateParameter(declaration.name().name(),
                                                                            parameter.name()));
                }
            }
            functions.put(declaration.name(), declaration);
        }
        return Outcome.success(new FunctionTable(Map.copyOf(functions)));
    }

    public Optional<FunctionDeclaration> lookup(Identifier name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Set<Identifier> names() {
        return functions.keySet();
    }

    public int size() {
        return functions.size();
    }
}

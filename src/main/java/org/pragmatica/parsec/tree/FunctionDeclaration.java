package org.pragmatica.parsec.tree;

import org.pragmatica.parsec.tree.Expression.Identifier;
import org.pragmatica.parsec.tree.Statement.Block;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Function declaration: fn name(param, ...) { ... }
 */
public record FunctionDeclaration(Identifier name, List<Identifier> parameters, Block body) {

    public FunctionDeclaration {
        parameters = List.copyOf(parameters);
    }

    public int arity() {
        return parameters.size();
    }

    @Override
    public String toString() {
        return "fn " + name + parameters.stream()
                                        .map(Identifier::name)
                                        .collect(Collectors.joining(", ", "(", ")")) + " " + body;
    }
}

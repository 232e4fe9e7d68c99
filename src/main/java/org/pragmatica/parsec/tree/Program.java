package org.pragmatica.parsec.tree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A parsed program - function declarations in source order.
 * Duplicate names are kept; the last declaration wins when the functions are registered.
 */
public record Program(List<FunctionDeclaration> functions) {

    public Program {
        functions = List.copyOf(functions);
    }

    @Override
    public String toString() {
        return functions.stream()
                        .map(FunctionDeclaration::toString)
                        .collect(Collectors.joining("\n"));
    }
}

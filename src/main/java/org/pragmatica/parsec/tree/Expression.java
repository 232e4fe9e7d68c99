package org.pragmatica.parsec.tree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Expression nodes of the language AST.
 *
 * <p>{@code toString()} renders a fully parenthesised form, e.g. {@code (2 + (3 * 4))}.
 */
public sealed interface Expression {

    /**
     * Integer literal: 42
     */
    record NumberLiteral(int value) implements Expression {
        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    /**
     * Variable or function name. Equal by name, usable as a map key.
     */
    record Identifier(String name) implements Expression {
        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Binary operation: left op right
     */
    record BinaryExpression(Expression left, String operator, Expression right) implements Expression {
        @Override
        public String toString() {
            return "(" + left + " " + operator + " " + right + ")";
        }
    }

    /**
     * Call: callee(arg, ...)
     */
    record CallExpression(Expression callee, List<Expression> arguments) implements Expression {
        public CallExpression {
            arguments = List.copyOf(arguments);
        }

        @Override
        public String toString() {
            return callee + arguments.stream()
                                     .map(Expression::toString)
                                     .collect(Collectors.joining(", ", "(", ")"));
        }
    }
}

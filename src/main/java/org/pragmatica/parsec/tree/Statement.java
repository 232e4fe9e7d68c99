package org.pragmatica.parsec.tree;

import org.pragmatica.parsec.tree.Expression.Identifier;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Statement nodes of the language AST.
 */
public sealed interface Statement {

    // === Simple statements ===

    /**
     * Assignment: name = rhs;
     */
    record VarSet(Identifier name, Expression rhs) implements Statement {
        @Override
        public String toString() {
            return name + " = " + rhs + ";";
        }
    }

    /**
     * return expr;
     */
    record Return(Expression expression) implements Statement {
        @Override
        public String toString() {
            return "return " + expression + ";";
        }
    }

    /**
     * Expression evaluated for its side effects: expr;
     */
    record ExpressionStatement(Expression expression) implements Statement {
        @Override
        public String toString() {
            return expression + ";";
        }
    }

    // === Compound statements ===

    /**
     * { statement* }
     */
    record Block(List<Statement> statements) implements Statement {
        public static final Block EMPTY = new Block(List.of());

        public Block {
            statements = List.copyOf(statements);
        }

        public boolean isEmpty() {
            return statements.isEmpty();
        }

        @Override
        public String toString() {
            return statements.stream()
                             .map(Statement::toString)
                             .collect(Collectors.joining(" ", "{ ", isEmpty() ? "}" : " }"));
        }
    }

    /**
     * if condition { ... } else { ... }
     * <p>
     * The else block is never absent; a missing else is {@link Block#EMPTY}.
     */
    record If(Expression condition, Block thenBlock, Block elseBlock) implements Statement {
        @Override
        public String toString() {
            return "if " + condition + " " + thenBlock + " else " + elseBlock + ";";
        }
    }

    /**
     * while condition { ... }
     */
    record While(Expression condition, Block block) implements Statement {
        @Override
        public String toString() {
            return "while " + condition + " " + block + ";";
        }
    }
}

package org.pragmatica.parsec.error;

import org.pragmatica.parsec.lang.Cause;
import org.pragmatica.parsec.parser.Input;
import org.pragmatica.parsec.tree.SourceLocation;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Parse error with location and context information.
 *
 * <p>Every error carries two positions: {@link #input()} is where the failing parser was invoked
 * (a failure never consumes input, so this is also the input "remaining" after the failure), while
 * {@link #position()} is where the mismatch was actually detected and is what diagnostics report.
 */
public sealed interface ParseError extends Cause {

    Input input();

    Input position();

    /**
     * What the parser expected at {@link #position()}.
     */
    String expected();

    /**
     * The same failure reported by a parser invoked at {@code input}.
     */
    ParseError anchoredAt(Input input);

    /**
     * The same failure with a different expectation.
     */
    ParseError expecting(String expected);

    default SourceLocation location() {
        return position().location();
    }

    static ParseError expected(Input position, String expected) {
        return position.isAtEnd()
               ? new UnexpectedEof(position, position, expected)
               : new UnexpectedInput(position, position, expected);
    }

    static ParseError semantic(Input position, String reason) {
        return new SemanticError(position, position, reason);
    }

    /**
     * Combine the failures of two alternatives tried at the same input.
     * The failure detected further into the input wins; failures detected at the
     * same offset are merged into one listing both expectations, unless one of them is a
     * {@link SemanticError}, which is reported on its own.
     */
    default ParseError merge(ParseError other) {
        var mine = position().offset();
        var theirs = other.position().offset();

        if (mine > theirs) {
            return this;
        }
        if (theirs > mine) {
            return other.anchoredAt(input());
        }
        if (this instanceof SemanticError) {
            return this;
        }
        if (other instanceof SemanticError) {
            return other.anchoredAt(input());
        }
        return other.anchoredAt(input())
                    .expecting(joinExpectations(expected(), other.expected()));
    }

    private static String joinExpectations(String first, String second) {
        var all = new LinkedHashSet<String>();
        all.addAll(List.of(first.split(" or ")));
        all.addAll(List.of(second.split(" or ")));
        return String.join(" or ", all);
    }

    /**
     * Unexpected input error.
     */
    record UnexpectedInput(
    Input input,
    Input position,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found() + "' at " + location() + ", expected " + expected;
        }

        public String found() {
            return position.preview(10);
        }

        @Override
        public ParseError anchoredAt(Input input) {
            return input.equals(this.input) ? this : new UnexpectedInput(input, position, expected);
        }

        @Override
        public ParseError expecting(String expected) {
            return new UnexpectedInput(input, position, expected);
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(
    Input input,
    Input position,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location() + ", expected " + expected;
        }

        @Override
        public ParseError anchoredAt(Input input) {
            return input.equals(this.input) ? this : new UnexpectedEof(input, position, expected);
        }

        @Override
        public ParseError expecting(String expected) {
            return new UnexpectedEof(input, position, expected);
        }
    }

    /**
     * Input matched syntactically but was rejected, e.g. an out-of-range literal.
     */
    record SemanticError(
    Input input,
    Input position,
    String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location();
        }

        @Override
        public String expected() {
            return reason;
        }

        @Override
        public ParseError anchoredAt(Input input) {
            return input.equals(this.input) ? this : new SemanticError(input, position, reason);
        }

        @Override
        public ParseError expecting(String expected) {
            return new SemanticError(input, position, expected);
        }
    }
}

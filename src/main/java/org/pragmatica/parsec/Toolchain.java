package org.pragmatica.parsec;

import org.pragmatica.parsec.eval.Interpreter;
import org.pragmatica.parsec.eval.InterpreterConfig;
import org.pragmatica.parsec.grammar.LanguageGrammar;
import org.pragmatica.parsec.lang.Cause;
import org.pragmatica.parsec.lang.Outcome;
import org.pragmatica.parsec.parser.ParserTrace;
import org.pragmatica.parsec.tree.Expression;
import org.pragmatica.parsec.tree.Program;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Entry point: parse and run programs from source text.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = Toolchain.run("""
 *     fn main() { return 1 + 2; }
 *     """).unwrap();
 *
 * var lines = new ArrayList<String>();
 * var toolchain = Toolchain.builder()
 *                          .output(lines::add)
 *                          .build();
 * toolchain.execute("fn main() { print(42); }");
 * }</pre>
 *
 * <p>Both parse errors and evaluation errors are reported through the failure side of the outcome.
 */
public final class Toolchain {
    private static final LanguageGrammar GRAMMAR = LanguageGrammar.create();
    private static final Toolchain DEFAULT = new Toolchain(Interpreter.create());

    private final Interpreter interpreter;

    private Toolchain(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    /**
     * Parse a program.
     */
    public static Outcome<Program, Cause> parse(String source) {
        return GRAMMAR.parseProgram(source)
                      .mapFailure(error -> error);
    }

    /**
     * Parse and evaluate a single expression without variables or user functions.
     */
    public static Outcome<Integer, Cause> evaluate(String expressionSource) {
        return DEFAULT.evaluateExpression(expressionSource);
    }

    /**
     * Parse and run a program with the default configuration.
     *
     * @return the value returned by {@code main}, empty if it returned nothing
     */
    public static Outcome<Optional<Integer>, Cause> run(String source) {
        return DEFAULT.execute(source);
    }

    public Outcome<Integer, Cause> evaluateExpression(String expressionSource) {
        return GRAMMAR.parseExpression(expressionSource)
                      .<Cause>mapFailure(error -> error)
                      .flatMap(this::evaluateParsed);
    }

    public Outcome<Optional<Integer>, Cause> execute(String source) {
        return parse(source).flatMap(this::runParsed);
    }

    private Outcome<Integer, Cause> evaluateParsed(Expression expression) {
        return interpreter.evaluate(expression)
                          .mapFailure(error -> error);
    }

    private Outcome<Optional<Integer>, Cause> runParsed(Program program) {
        return interpreter.run(program)
                          .mapFailure(error -> error);
    }

    /**
     * Create a builder for more complex configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String entryPoint = InterpreterConfig.DEFAULT.entryPoint();
        private int maxCallDepth = InterpreterConfig.DEFAULT.maxCallDepth();
        private Consumer<String> output = InterpreterConfig.DEFAULT.output();
        private boolean trace = false;

        private Builder() {}

        public Builder entryPoint(String entryPoint) {
            this.entryPoint = entryPoint;
            return this;
        }

        public Builder maxCallDepth(int maxCallDepth) {
            this.maxCallDepth = maxCallDepth;
            return this;
        }

        public Builder output(Consumer<String> output) {
            this.output = output;
            return this;
        }

        /**
         * Switch the process-wide parser trace on when the toolchain is built.
         * Use {@link ParserTrace#disable()} to switch it off again.
         */
        public Builder trace(boolean enabled) {
            this.trace = enabled;
            return this;
        }

        public Toolchain build() {
            if (trace) {
                ParserTrace.enable();
            }
            var config = new InterpreterConfig(entryPoint, maxCallDepth, output);
            return new Toolchain(Interpreter.create(config));
        }
    }
}

package org.pragmatica.parsec.eval;

import java.util.function.Consumer;

/**
 * Interpreter configuration options.
 *
 * @param entryPoint   zero-argument function invoked to run a program
 * @param maxCallDepth deepest allowed nesting of calls; the default fits the default JVM thread stack
 * @param output       receives one line per {@code print} call
 */
public record InterpreterConfig(
    String entryPoint,
    int maxCallDepth,
    Consumer<String> output
) {
    public static final InterpreterConfig DEFAULT = new InterpreterConfig(
        "main",
        200,
        System.out::println
    );

    public InterpreterConfig {
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("maxCallDepth must be positive, got " + maxCallDepth);
        }
    }

    public InterpreterConfig withOutput(Consumer<String> output) {
        return new InterpreterConfig(entryPoint, maxCallDepth, output);
    }
}

package org.pragmatica.parsec.eval;

/**
 * How a statement finished: normally, or by a {@code return} that must unwind to the enclosing call.
 */
public sealed interface Completion {
    Completion NORMAL = new Normal();

    static Completion returning(int value) {
        return new Returning(value);
    }

    default boolean isReturning() {
        return this instanceof Returning;
    }

    record Normal() implements Completion {}

    record Returning(int value) implements Completion {}
}

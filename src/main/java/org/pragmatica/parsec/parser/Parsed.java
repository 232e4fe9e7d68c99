package org.pragmatica.parsec.parser;

import java.util.function.Function;

/**
 * Successful parse: the produced value and the input left after it.
 */
public record Parsed<T>(T value, Input rest) {

    public static <T> Parsed<T> of(T value, Input rest) {
        return new Parsed<>(value, rest);
    }

    public <U> Parsed<U> map(Function<? super T, ? extends U> mapper) {
        return new Parsed<>(mapper.apply(value), rest);
    }
}

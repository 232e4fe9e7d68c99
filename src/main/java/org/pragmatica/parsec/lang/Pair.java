package org.pragmatica.parsec.lang;

/**
 * Two values produced side by side, e.g. by sequencing two parsers.
 */
public record Pair<A, B>(A first, B second) {

    public static <A, B> Pair<A, B> of(A first, B second) {
        return new Pair<>(first, second);
    }
}

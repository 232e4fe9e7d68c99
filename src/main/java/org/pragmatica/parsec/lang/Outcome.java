package org.pragmatica.parsec.lang;

import java.util.function.Function;

/**
 * Result of an operation - either a success carrying a value or a failure carrying an error.
 *
 * <p>Failures are ordinary values: they are returned, mapped and folded, never thrown.
 *
 * @param <T> success value type
 * @param <E> error type
 */
public sealed interface Outcome<T, E> {

    static <T, E> Outcome<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Outcome<T, E> failure(E error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Transform the success value. Failures pass through unchanged.
     */
    <U> Outcome<U, E> map(Function<? super T, ? extends U> mapper);

    /**
     * Transform the error. Successes pass through unchanged.
     */
    <F> Outcome<T, F> mapFailure(Function<? super E, ? extends F> mapper);

    /**
     * Chain another outcome-producing step onto a success.
     */
    <U> Outcome<U, E> flatMap(Function<? super T, Outcome<U, E>> mapper);

    /**
     * Collapse both variants into a single value.
     */
    <R> R fold(Function<? super E, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    /**
     * Get the success value.
     *
     * @throws IllegalStateException if this is a failure
     */
    T unwrap();

    /**
     * Get the error.
     *
     * @throws IllegalStateException if this is a success
     */
    E error();

    record Success<T, E>(T value) implements Outcome<T, E> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <U> Outcome<U, E> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        @SuppressWarnings("unchecked")
        public <F> Outcome<T, F> mapFailure(Function<? super E, ? extends F> mapper) {
            return (Outcome<T, F>) this;
        }

        @Override
        public <U> Outcome<U, E> flatMap(Function<? super T, Outcome<U, E>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public <R> R fold(Function<? super E, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public E error() {
            throw new IllegalStateException("Outcome is a success: " + value);
        }
    }

    record Failure<T, E>(E cause) implements Outcome<T, E> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> Outcome<U, E> map(Function<? super T, ? extends U> mapper) {
            return (Outcome<U, E>) this;
        }

        @Override
        public <F> Outcome<T, F> mapFailure(Function<? super E, ? extends F> mapper) {
            return new Failure<>(mapper.apply(cause));
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> Outcome<U, E> flatMap(Function<? super T, Outcome<U, E>> mapper) {
            return (Outcome<U, E>) this;
        }

        @Override
        public <R> R fold(Function<? super E, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Outcome is a failure: " + describe(cause));
        }

        @Override
        public E error() {
            return cause;
        }

        private static String describe(Object cause) {
            return cause instanceof Cause c ? c.message() : String.valueOf(cause);
        }
    }
}

package org.pragmatica.parsec.parser;

import org.pragmatica.parsec.error.ParseError;
import org.pragmatica.parsec.lang.Outcome;
import org.pragmatica.parsec.lang.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Parser combinator - a named function from an {@link Input} to either the parsed value with the
 * remaining input, or a {@link ParseError}.
 *
 * <p>Parsers are immutable values. Combinators never modify the parsers they are built from.
 * A failing parser never consumes input: the error it reports is always anchored at the input
 * it was invoked with, which is what makes {@link #orElse(Parser)} backtracking safe.
 *
 * <p>Example usage:
 * <pre>{@code
 * var pair = Parser.number().padded()
 *                  .thenIgnore(Parser.just(",").padded())
 *                  .then(Parser.number().padded());
 *
 * var result = pair.parse("  1 , 2");
 * }</pre>
 */
public final class Parser<T> {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    /**
     * The raw parsing function wrapped by a {@link Parser}.
     */
    @FunctionalInterface
    public interface ParseFunction<T> {
        Outcome<Parsed<T>, ParseError> apply(Input input);
    }

    private final String name;
    private final ParseFunction<T> function;

    private Parser(String name, ParseFunction<T> function) {
        this.name = name;
        this.function = function;
    }

    public static <T> Parser<T> of(String name, ParseFunction<T> function) {
        return new Parser<>(name, function);
    }

    public String name() {
        return name;
    }

    /**
     * Parse from the start of the given text.
     */
    public Outcome<Parsed<T>, ParseError> parse(String source) {
        return parse(Input.of(source));
    }

    public Outcome<Parsed<T>, ParseError> parse(Input input) {
        if (!ParserTrace.isEnabled()) {
            return invoke(input);
        }
        ParserTrace.enter(name, input);
        var outcome = invoke(input);
        ParserTrace.exit(name, outcome);
        return outcome;
    }

    private Outcome<Parsed<T>, ParseError> invoke(Input input) {
        return function.apply(input)
                       .mapFailure(error -> error.anchoredAt(input));
    }

    /**
     * Same parser under a different name (used in diagnostics and trace output).
     */
    public Parser<T> label(String name) {
        return new Parser<>(name, function);
    }

    @Override
    public String toString() {
        return "Parser[" + name + "]";
    }

    // === Combinators ===

    /**
     * Transform the parsed value. Failures are left untouched.
     */
    public <U> Parser<U> map(Function<? super T, ? extends U> mapper) {
        return of(name + ".map", input -> parse(input).map(parsed -> parsed.map(mapper)));
    }

    /**
     * Run this parser, then {@code next} on the remaining input. Produces both values.
     */
    public <U> Parser<Pair<T, U>> then(Parser<U> next) {
        return of(name + ".then(" + next.name + ")", input -> {
            var first = parse(input);
            if (first.isFailure()) {
                return Outcome.failure(first.error());
            }
            var head = first.unwrap();
            var second = next.parse(head.rest());
            if (second.isFailure()) {
                return Outcome.failure(second.error());
            }
            var tail = second.unwrap();
            return Outcome.success(Parsed.of(Pair.of(head.value(), tail.value()), tail.rest()));
        });
    }

    /**
     * Sequence, keeping only the value of {@code next}.
     */
    public <U> Parser<U> ignoreThen(Parser<U> next) {
        return then(next).<U>map(Pair::second)
                         .label(name + ".ignoreThen(" + next.name + ")");
    }

    /**
     * Sequence, keeping only the value of this parser.
     */
    public <U> Parser<T> thenIgnore(Parser<U> next) {
        return then(next).<T>map(Pair::first)
                         .label(name + ".thenIgnore(" + next.name + ")");
    }

    /**
     * Try this parser; if it fails, try {@code other} from the same position.
     * When both fail the errors are merged (see {@link ParseError#merge(ParseError)}).
     */
    public Parser<T> orElse(Parser<? extends T> other) {
        return of(name + ".orElse(" + other.name + ")", input -> {
            var first = parse(input);
            if (first.isSuccess()) {
                return first;
            }
            var second = other.parse(input);
            if (second.isSuccess()) {
                var parsed = second.unwrap();
                return Outcome.success(Parsed.<T>of(parsed.value(), parsed.rest()));
            }
            return Outcome.failure(first.error()
                                        .merge(second.error()));
        });
    }

    /**
     * Skip leading whitespace, then run this parser. Trailing whitespace is left in place.
     */
    public Parser<T> padded() {
        return of(name + ".padded()", input -> parse(input.skipWhitespace()));
    }

    /**
     * {@code open}, then this parser, then {@code close}; keeps only this parser's value.
     */
    public Parser<T> between(Parser<?> open, Parser<?> close) {
        return open.ignoreThen(this)
                   .thenIgnore(close)
                   .label(name + ".between(" + open.name + ", " + close.name + ")");
    }

    /**
     * Zero or more occurrences separated by {@code delimiter}. Never fails.
     * A trailing delimiter without an item after it is left unconsumed.
     */
    public Parser<List<T>> sepBy(Parser<?> delimiter) {
        var subsequent = delimiter.ignoreThen(this);
        return of(name + ".sepBy(" + delimiter.name + ")",
                  input -> collect(input, this, subsequent));
    }

    /**
     * Zero or more occurrences. Never fails.
     */
    public Parser<List<T>> repeated() {
        return of(name + ".repeated()", input -> collect(input, this, this));
    }

    /**
     * Zero or more occurrences followed by {@code terminator}.
     * When the terminator is missing, the error also accounts for why the next occurrence failed,
     * so a broken item is reported where it broke rather than as a missing terminator.
     */
    public Parser<List<T>> repeatedUntil(Parser<?> terminator) {
        var items = repeated();
        return of(name + ".repeatedUntil(" + terminator.name + ")", input -> {
            var collected = items.parse(input)
                                 .unwrap();
            var end = terminator.parse(collected.rest());
            if (end.isSuccess()) {
                return Outcome.success(Parsed.of(collected.value(), end.unwrap()
                                                                      .rest()));
            }
            var attempt = parse(collected.rest());
            return Outcome.failure(attempt.isFailure()
                                   ? end.error()
                                        .merge(attempt.error())
                                   : end.error());
        });
    }

    /**
     * Loop shared by {@link #repeated()} and {@link #sepBy(Parser)}.
     * An iteration that succeeds without consuming input ends the loop; its value is dropped.
     */
    private Outcome<Parsed<List<T>>, ParseError> collect(Input input, Parser<T> first, Parser<T> subsequent) {
        var values = new ArrayList<T>();
        var rest = input;
        var outcome = first.parse(rest);

        while (outcome.isSuccess()) {
            var parsed = outcome.unwrap();
            if (parsed.rest().offset() == rest.offset()) {
                log.debug("{} stopped on a zero-width match at {}", name, rest.location());
                break;
            }
            values.add(parsed.value());
            rest = parsed.rest();
            outcome = subsequent.parse(rest);
        }
        return Outcome.success(Parsed.of(List.copyOf(values), rest));
    }

    /**
     * This parser's value, or an empty {@link Optional} without consuming input. Never fails.
     */
    public Parser<Optional<T>> orNot() {
        return of("orNot(" + name + ")", input -> {
            var outcome = parse(input);
            if (outcome.isSuccess()) {
                return Outcome.success(outcome.unwrap()
                                              .map(value -> Optional.<T>ofNullable(value)));
            }
            return Outcome.success(Parsed.of(Optional.<T>empty(), input));
        });
    }

    /**
     * Succeeds only if this parser succeeds and no input remains after it.
     */
    public Parser<T> eof() {
        return of(name + ".eof()", input -> {
            var outcome = parse(input);
            if (outcome.isFailure()) {
                return outcome;
            }
            var rest = outcome.unwrap()
                              .rest();
            return rest.isAtEnd()
                   ? outcome
                   : Outcome.failure(ParseError.expected(rest, "end of input"));
        });
    }

    /**
     * Reject a successful parse whose value does not satisfy {@code predicate}.
     */
    public Parser<T> filter(Predicate<? super T> predicate, String expected) {
        return of(name + ".filter(" + expected + ")", input -> {
            var outcome = parse(input);
            if (outcome.isSuccess() && !predicate.test(outcome.unwrap()
                                                              .value())) {
                return Outcome.failure(ParseError.expected(input, expected));
            }
            return outcome;
        });
    }

    /**
     * Reject a successful parse when the next character satisfies {@code predicate}.
     * Used to give keywords a word boundary.
     */
    public Parser<T> notFollowedBy(Predicate<Character> predicate, String expected) {
        return of(name + ".notFollowedBy(" + expected + ")", input -> {
            var outcome = parse(input);
            if (outcome.isFailure()) {
                return outcome;
            }
            var rest = outcome.unwrap()
                              .rest();
            if (!rest.isAtEnd() && predicate.test(rest.peek())) {
                return Outcome.failure(ParseError.expected(rest, expected));
            }
            return outcome;
        });
    }

    /**
     * Try each alternative in order from the same position; the first success wins.
     */
    @SafeVarargs
    public static <T> Parser<T> choice(Parser<? extends T>... alternatives) {
        return choice(List.of(alternatives));
    }

    public static <T> Parser<T> choice(List<Parser<? extends T>> alternatives) {
        if (alternatives.isEmpty()) {
            throw new IllegalArgumentException("choice requires at least one alternative");
        }
        var names = new ArrayList<String>();
        alternatives.forEach(alternative -> names.add(alternative.name));

        return of("choice(" + String.join(", ", names) + ")", input -> {
            ParseError error = null;
            for (var alternative : alternatives) {
                var outcome = alternative.parse(input);
                if (outcome.isSuccess()) {
                    var parsed = outcome.unwrap();
                    return Outcome.success(Parsed.<T>of(parsed.value(), parsed.rest()));
                }
                error = error == null
                        ? outcome.error()
                        : error.merge(outcome.error());
            }
            return Outcome.failure(error);
        });
    }

    // === Leaf parsers ===

    /**
     * A single character satisfying {@code predicate}.
     */
    public static Parser<Character> character(Predicate<Character> predicate, String name) {
        return of(name, input -> {
            if (!input.isAtEnd() && predicate.test(input.peek())) {
                return Outcome.success(Parsed.of(input.peek(), input.advance(1)));
            }
            return Outcome.failure(ParseError.expected(input, name));
        });
    }

    /**
     * Exactly the given token.
     */
    public static Parser<String> just(String token) {
        var name = "just('" + token + "')";
        return of(name, input -> input.startsWith(token)
                                 ? Outcome.success(Parsed.of(token, input.advance(token.length())))
                                 : Outcome.failure(ParseError.expected(input, "'" + token + "'")));
    }

    /**
     * The longest run of characters satisfying {@code predicate}, possibly empty. Never fails.
     */
    public static Parser<String> accumulateWhile(Predicate<Character> predicate) {
        return of("accumulateWhile", input -> {
            var source = input.source();
            int end = input.offset();
            while (end < source.length() && predicate.test(source.charAt(end))) {
                end++;
            }
            var collected = source.substring(input.offset(), end);
            return Outcome.success(Parsed.of(collected, input.advance(collected.length())));
        });
    }

    /**
     * Zero or more whitespace characters. Never fails.
     */
    public static Parser<String> whitespace() {
        return accumulateWhile(Character::isWhitespace).label("whitespace");
    }

    /**
     * A run of ASCII digits as a 32-bit signed integer. Fails on an empty run or an out-of-range value.
     */
    public static Parser<Integer> number() {
        var digits = accumulateWhile(c -> c >= '0' && c <= '9');
        return of("number", input -> {
            var text = digits.parse(input)
                             .unwrap()
                             .value();
            if (text.isEmpty()) {
                return Outcome.failure(ParseError.expected(input, "number"));
            }
            try {
                return Outcome.success(Parsed.of(Integer.parseInt(text), input.advance(text.length())));
            } catch (NumberFormatException e) {
                return Outcome.failure(ParseError.semantic(input, "Integer literal " + text + " is out of range"));
            }
        });
    }

    /**
     * A letter followed by letters or digits.
     */
    public static Parser<String> ident() {
        return of("ident", input -> {
            if (input.isAtEnd() || !Character.isLetter(input.peek())) {
                return Outcome.failure(ParseError.expected(input, "identifier"));
            }
            var source = input.source();
            int end = input.offset() + 1;
            while (end < source.length() && Character.isLetterOrDigit(source.charAt(end))) {
                end++;
            }
            return Outcome.success(Parsed.of(source.substring(input.offset(), end), input.advance(end - input.offset())));
        });
    }

    /**
     * Build a self-referential parser.
     *
     * <p>{@code definition} receives a forward reference to the parser being defined and returns the
     * real definition. The reference is bound before this method returns, so no input is ever processed
     * through an unbound reference.
     */
    public static <T> Parser<T> recursive(Function<Parser<T>, Parser<T>> definition) {
        var target = new AtomicReference<Parser<T>>();
        var reference = Parser.<T>of("recursive", input -> {
            var parser = target.get();
            if (parser == null) {
                throw new IllegalStateException("Recursive parser used before its definition was bound");
            }
            return parser.parse(input);
        });
        var defined = definition.apply(reference);
        if (!target.compareAndSet(null, defined)) {
            throw new IllegalStateException("Recursive parser bound twice");
        }
        return reference;
    }
}

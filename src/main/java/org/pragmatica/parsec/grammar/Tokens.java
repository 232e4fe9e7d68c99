package org.pragmatica.parsec.grammar;

import org.pragmatica.parsec.parser.Parser;
import org.pragmatica.parsec.tree.Expression.Identifier;

import java.util.Set;

/**
 * Lexical building blocks of the language. Every token skips leading whitespace.
 */
public final class Tokens {
    public static final Set<String> KEYWORDS = Set.of("fn", "return", "if", "else", "while");

    private Tokens() {}

    /**
     * Punctuation or operator.
     */
    public static Parser<String> token(String text) {
        return Parser.just(text)
                     .padded()
                     .label("'" + text + "'");
    }

    /**
     * Keyword that must not run into a following letter or digit: {@code returnx} is not {@code return x}.
     */
    public static Parser<String> keyword(String word) {
        return Parser.just(word)
                     .notFollowedBy(Character::isLetterOrDigit, "end of keyword '" + word + "'")
                     .padded()
                     .label(word);
    }

    /**
     * Name of a variable, parameter or function. Keywords are not names.
     */
    public static Parser<Identifier> identifier() {
        return Parser.ident()
                     .filter(name -> !KEYWORDS.contains(name), "identifier")
                     .padded()
                     .map(Identifier::new)
                     .label("identifier");
    }
}

package org.pragmatica.parsec.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.parsec.parser.Input;

import static org.junit.jupiter.api.Assertions.*;

class ParseErrorTest {

    private static final Input SOURCE = Input.of("x = 1\ny = ;");

    @Test
    void expected_beforeEnd_isUnexpectedInput() {
        var error = ParseError.expected(SOURCE.advance(10), "expression");

        assertInstanceOf(ParseError.UnexpectedInput.class, error);
        assertEquals("Unexpected ';' at 2:5, expected expression", error.message());
    }

    @Test
    void expected_atEnd_isUnexpectedEof() {
        var error = ParseError.expected(SOURCE.advance(11), "'}'");

        assertInstanceOf(ParseError.UnexpectedEof.class, error);
        assertEquals("Unexpected end of input at 2:6, expected '}'", error.message());
    }

    @Test
    void semantic_reportsReason() {
        var error = ParseError.semantic(SOURCE.advance(4), "Integer literal 1 is out of range");

        assertEquals("Integer literal 1 is out of range at 1:5", error.message());
        assertEquals("Integer literal 1 is out of range", error.expected());
    }

    @Test
    void merge_furtherFailureWins() {
        var near = ParseError.expected(SOURCE.advance(2), "'('");
        var far = ParseError.expected(SOURCE.advance(4), "';'").anchoredAt(SOURCE);

        assertEquals(far, near.anchoredAt(SOURCE).merge(far));
        assertEquals(far, far.merge(near.anchoredAt(SOURCE)));
    }

    @Test
    void merge_samePosition_listsExpectationsOnce() {
        var position = SOURCE.advance(2);
        var first = ParseError.expected(position, "'a' or 'b'");
        var second = ParseError.expected(position, "'b' or 'c'");

        var merged = first.merge(second);

        assertEquals("'a' or 'b' or 'c'", merged.expected());
        assertEquals(position, merged.position());
    }

    @Test
    void merge_semanticErrorAtSamePosition_isReportedAlone() {
        var position = SOURCE.advance(4);
        var semantic = ParseError.semantic(position, "Integer literal 1 is out of range");
        var syntactic = ParseError.expected(position, "identifier");

        assertEquals(semantic, semantic.merge(syntactic));
        assertEquals(semantic, syntactic.merge(semantic));
    }

    @Test
    void anchoredAt_keepsDetectionPosition() {
        var error = ParseError.expected(SOURCE.advance(10), "expression").anchoredAt(SOURCE);

        assertEquals(SOURCE, error.input());
        assertEquals(10, error.position().offset());
        assertEquals(2, error.location().line());
    }
}

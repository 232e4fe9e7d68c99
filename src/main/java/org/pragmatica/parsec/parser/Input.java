package org.pragmatica.parsec.parser;

import org.pragmatica.parsec.tree.SourceLocation;

/**
 * Immutable position in source text. Parsers consume an {@code Input} and hand back the remainder.
 */
public record Input(String source, int offset) {

    public Input {
        if (offset < 0 || offset > source.length()) {
            throw new IllegalArgumentException("Offset " + offset + " outside of input of length " + source.length());
        }
    }

    public static Input of(String source) {
        return new Input(source, 0);
    }

    public boolean isAtEnd() {
        return offset >= source.length();
    }

    public String remaining() {
        return source.substring(offset);
    }

    public char peek() {
        return source.charAt(offset);
    }

    public boolean startsWith(String token) {
        return source.startsWith(token, offset);
    }

    public Input advance(int count) {
        return count == 0 ? this : new Input(source, offset + count);
    }

    public Input skipWhitespace() {
        int pos = offset;
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
        return advance(pos - offset);
    }

    /**
     * Line and column of this position. Computed on demand.
     */
    public SourceLocation location() {
        return SourceLocation.of(source, offset);
    }

    /**
     * At most {@code length} characters of the remaining input, with line breaks escaped.
     */
    public String preview(int length) {
        var end = Math.min(source.length(), offset + length);
        var text = source.substring(offset, end)
                         .replace("\n", "\\n")
                         .replace("\r", "\\r")
                         .replace("\t", "\\t");
        return end < source.length() ? text + "..." : text;
    }

    @Override
    public String toString() {
        return "Input[" + offset + ", '" + preview(20) + "']";
    }
}

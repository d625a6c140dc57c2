package org.perlfront.recovery;

import org.perlfront.lexer.SourceText;
import org.perlfront.lexer.Span;

import java.util.List;

/**
 * A diagnostic produced while parsing. Immutable; the {@code with*} methods return copies.
 */
public class ParseError {
    private final String message;
    private final Span location;
    private final List<String> expected;
    private final String found;
    private final String hint;

    public ParseError(String message, Span location) {
        this(message, location, List.of(), null, null);
    }

    private ParseError(String message, Span location, List<String> expected, String found, String hint) {
        this.message = message;
        this.location = location;
        this.expected = List.copyOf(expected);
        this.found = found;
        this.hint = hint;
    }

    /**
     * Error for a closing delimiter that did not show up.
     */
    public static ParseError unmatchedDelimiter(String expected, String found, Span location) {
        String message = found == null
                ? "Expected '" + expected + "', found end of file"
                : "Expected '" + expected + "', found '" + found + "'";
        return new ParseError(message, location)
                .withExpected(List.of(expected))
                .withFound(found == null ? "EOF" : found)
                .withHint("Add '" + expected + "' to match the opening delimiter");
    }

    public ParseError withExpected(List<String> expected) {
        return new ParseError(message, location, expected, found, hint);
    }

    public ParseError withFound(String found) {
        return new ParseError(message, location, expected, found, hint);
    }

    public ParseError withHint(String hint) {
        return new ParseError(message, location, expected, found, hint);
    }

    public String getMessage() {
        return message;
    }

    public Span getLocation() {
        return location;
    }

    public List<String> getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    public String getHint() {
        return hint;
    }

    /**
     * Renders the error the way perl reports compile errors:
     * {@code message at FILE line N, near "text"}.
     */
    public String format(SourceText source, String fileName) {
        int line = source.lineNumber(location.start());
        StringBuilder sb = new StringBuilder(message).append(" at ").append(fileName).append(" line ").append(line);
        String text = source.text();
        int start = source.charIndex(location.start());
        if (start < text.length()) {
            int end = text.indexOf('\n', start);
            String near = text.substring(start, end < 0 ? text.length() : end);
            sb.append(", near \"").append(near).append('"');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return message + " at " + location;
    }
}

package org.perlfront.lexer;

/**
 * A half-open range {@code [start, end)} of UTF-8 byte offsets into the source text.
 *
 * @param start offset of the first byte covered by the span
 * @param end   offset just past the last byte covered by the span
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /**
     * Creates a zero-width span at the given offset.
     */
    public static Span at(int offset) {
        return new Span(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Returns the smallest span covering both this span and {@code other}.
     */
    public Span merge(Span other) {
        if (other == null) {
            return this;
        }
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}

package org.perlfront.lexer;

import java.util.Arrays;

/**
 * Immutable view of a Perl source file.
 * <p>
 * The lexer walks the text by UTF-16 char index, but every {@link Span} handed out
 * is expressed in UTF-8 byte offsets. This class owns the mapping between the two.
 * For pure ASCII input the mapping is the identity and no table is built.
 */
public class SourceText {

    private final String text;
    // byteOffsets[i] is the UTF-8 offset of char index i; byteOffsets[length] is the total size
    private final int[] byteOffsets;
    private int[] lineStarts;

    public SourceText(String text) {
        this.text = text;
        this.byteOffsets = buildOffsets(text);
    }

    private static int[] buildOffsets(String text) {
        int length = text.length();
        boolean ascii = true;
        for (int i = 0; i < length; i++) {
            if (text.charAt(i) >= 0x80) {
                ascii = false;
                break;
            }
        }
        if (ascii) {
            return null;
        }
        int[] offsets = new int[length + 1];
        int offset = 0;
        for (int i = 0; i < length; i++) {
            offsets[i] = offset;
            char c = text.charAt(i);
            if (c < 0x80) {
                offset += 1;
            } else if (c < 0x800) {
                offset += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < length && Character.isLowSurrogate(text.charAt(i + 1))) {
                // the whole pair encodes as four bytes; the low half adds nothing
                offset += 4;
                offsets[++i] = offset;
                continue;
            } else {
                offset += 3;
            }
        }
        offsets[length] = offset;
        return offsets;
    }

    public String text() {
        return text;
    }

    /**
     * Size of the source in UTF-8 bytes.
     */
    public int byteLength() {
        return byteOffset(text.length());
    }

    public int byteOffset(int charIndex) {
        return byteOffsets == null ? charIndex : byteOffsets[charIndex];
    }

    /**
     * Maps a byte offset back to a char index. Offsets inside a multi-byte sequence
     * resolve to the char that starts the sequence.
     */
    public int charIndex(int byteOffset) {
        if (byteOffsets == null) {
            return Math.min(byteOffset, text.length());
        }
        int index = Arrays.binarySearch(byteOffsets, byteOffset);
        if (index >= 0) {
            // the low half of a surrogate pair shares an offset with the char after the pair
            while (index < text.length() && byteOffsets[index + 1] == byteOffset) {
                index++;
            }
            return index;
        }
        return Math.max(0, -index - 2);
    }

    public Span span(int startChar, int endChar) {
        return new Span(byteOffset(startChar), byteOffset(endChar));
    }

    /**
     * Returns the source text covered by the span.
     */
    public String slice(Span span) {
        return text.substring(charIndex(span.start()), charIndex(span.end()));
    }

    /**
     * One-based line number of the given byte offset.
     */
    public int lineNumber(int byteOffset) {
        int[] starts = lineStarts();
        int index = Arrays.binarySearch(starts, byteOffset);
        return index >= 0 ? index + 1 : -index - 1;
    }

    private int[] lineStarts() {
        if (lineStarts == null) {
            int count = 1;
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    count++;
                }
            }
            int[] starts = new int[count];
            int line = 1;
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    starts[line++] = byteOffset(i + 1);
                }
            }
            lineStarts = starts;
        }
        return lineStarts;
    }
}

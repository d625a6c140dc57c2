package org.perlfront.lexer;

/**
 * Observer for identifier statistics gathered while lexing.
 * The lexer reports to {@link #NONE} unless a collector is supplied.
 */
public interface LexerStatistics {

    LexerStatistics NONE = new LexerStatistics() {
        @Override
        public void unicodeIdentifier(String identifier) {
        }

        @Override
        public void emojiIdentifier(String identifier) {
        }
    };

    /**
     * Called once for each identifier that contains a non-ASCII code point.
     */
    void unicodeIdentifier(String identifier);

    /**
     * Called once for each identifier that contains an emoji code point.
     */
    void emojiIdentifier(String identifier);
}

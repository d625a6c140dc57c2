package org.perlfront.lexer;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Counts Unicode and emoji identifiers, keeping the distinct names seen.
 */
public class CountingLexerStatistics implements LexerStatistics {
    private int unicodeCount;
    private int emojiCount;
    private final Set<String> distinct = new LinkedHashSet<>();

    @Override
    public void unicodeIdentifier(String identifier) {
        unicodeCount++;
        distinct.add(identifier);
    }

    @Override
    public void emojiIdentifier(String identifier) {
        emojiCount++;
    }

    public int getUnicodeCount() {
        return unicodeCount;
    }

    public int getEmojiCount() {
        return emojiCount;
    }

    public Set<String> getDistinctIdentifiers() {
        return distinct;
    }
}

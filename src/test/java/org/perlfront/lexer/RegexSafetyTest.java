package org.perlfront.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RegexSafetyTest {

    private static String nestedLookbehind(int depth) {
        return "(?<=a".repeat(depth) + ")".repeat(depth);
    }

    @Test
    public void testPlainPatternHasNoLookbehind() {
        assertEquals(0, RegexSafety.lookbehindDepth("a(b|c)+d"));
    }

    @Test
    public void testSiblingLookbehindsDoNotNest() {
        assertEquals(1, RegexSafety.lookbehindDepth("(?<=a)b(?<!c)d"));
    }

    @Test
    public void testNestedLookbehinds() {
        assertEquals(2, RegexSafety.lookbehindDepth("(?<=a(?<!b))"));
        assertEquals(11, RegexSafety.lookbehindDepth(nestedLookbehind(11)));
    }

    @Test
    public void testOtherGroupsDoNotCount() {
        assertEquals(1, RegexSafety.lookbehindDepth("(?:(?=x)(?<=a(b)))"));
    }

    @Test
    public void testEscapesAndClassesAreSkipped() {
        assertEquals(0, RegexSafety.lookbehindDepth("\\(?<=a"));
        assertEquals(0, RegexSafety.lookbehindDepth("[(?<=]x"));
        assertEquals(0, RegexSafety.lookbehindDepth("[]](?"));
    }

    @Test
    public void testLexerRejectsDeepLookbehind() {
        List<LexerToken> tokens = new Lexer("$s =~ /" + nestedLookbehind(RegexSafety.MAX_LOOKBEHIND_DEPTH + 1) + "/;")
                .tokenize();
        LexerToken match = tokens.get(2);
        assertEquals(LexerTokenType.ERROR, match.type);
        assertEquals("Regex lookbehind nesting exceeds 10 levels", match.errorMessage);
    }

    @Test
    public void testLexerAcceptsLookbehindAtLimit() {
        List<LexerToken> tokens = new Lexer("$s =~ /" + nestedLookbehind(RegexSafety.MAX_LOOKBEHIND_DEPTH) + "/;")
                .tokenize();
        assertEquals(LexerTokenType.MATCH, tokens.get(2).type);
    }
}

package org.perlfront.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class QuoteModifiersTest {

    @ParameterizedTest(name = "{0} on {1} is {2}")
    @CsvSource({
            "gi, s, ig",
            "ig, s, ig",
            "xx, m, xx",
            "ee, s, e",
            "gcm, /, mgc",
            "aa, qr, aa",
            "r, tr, r",
            "cds, y, cds",
    })
    public void testCanonicalForm(String raw, String operator, String expected) {
        assertEquals(expected, QuoteModifiers.canonicalize(raw, QuoteModifiers.forOperator(operator)));
    }

    @Test
    public void testEmptyModifiers() {
        assertEquals("", QuoteModifiers.canonicalize("", QuoteModifiers.MATCH));
    }

    @Test
    public void testUnknownLetter() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> QuoteModifiers.canonicalize("iz", QuoteModifiers.MATCH));
        assertEquals("Unknown modifier \"/z\"", e.getMessage());
    }

    @Test
    public void testTransliterationRejectsRegexFlags() {
        assertThrows(IllegalArgumentException.class,
                () -> QuoteModifiers.canonicalize("g", QuoteModifiers.TRANSLITERATION));
        assertThrows(IllegalArgumentException.class,
                () -> QuoteModifiers.canonicalize("u", QuoteModifiers.TRANSLITERATION));
    }

    @Test
    public void testQrRejectsGlobal() {
        assertThrows(IllegalArgumentException.class,
                () -> QuoteModifiers.canonicalize("g", QuoteModifiers.QUOTE_REGEX));
    }

    @Test
    public void testCharsetsAreMutuallyExclusive() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> QuoteModifiers.canonicalize("au", QuoteModifiers.MATCH));
        assertEquals("Regexp modifiers \"/a\" and \"/u\" are mutually exclusive", e.getMessage());
    }

    @Test
    public void testRepeatedCharsetIsAccepted() {
        assertEquals("iu", QuoteModifiers.canonicalize("uiu", QuoteModifiers.MATCH));
    }

    @Test
    public void testOperatorsWithoutModifiers() {
        assertSame(QuoteModifiers.NONE, QuoteModifiers.forOperator("q"));
        assertSame(QuoteModifiers.NONE, QuoteModifiers.forOperator("qw"));
    }
}

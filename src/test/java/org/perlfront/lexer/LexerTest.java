package org.perlfront.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<LexerToken> tokens(String code) {
        List<LexerToken> tokens = new Lexer(code).tokenize();
        assertEquals(LexerTokenType.EOF, tokens.get(tokens.size() - 1).type);
        return tokens.subList(0, tokens.size() - 1);
    }

    private static List<LexerTokenType> types(String code) {
        return tokens(code).stream().map(t -> t.type).collect(Collectors.toList());
    }

    @Test
    public void testSlashAfterOperandIsDivision() {
        List<LexerToken> tokens = tokens("$a / $b");
        assertEquals(List.of(LexerTokenType.SCALAR, LexerTokenType.OPERATOR, LexerTokenType.SCALAR),
                tokens.stream().map(t -> t.type).collect(Collectors.toList()));
        assertEquals("/", tokens.get(1).text);
    }

    @Test
    public void testSlashAfterBindingIsMatch() {
        List<LexerToken> tokens = tokens("$a =~ /x+/i");
        assertEquals(3, tokens.size());
        LexerToken match = tokens.get(2);
        assertEquals(LexerTokenType.MATCH, match.type);
        assertEquals("x+", match.quote.body());
        assertEquals("i", match.quote.modifiers());
    }

    @Test
    public void testSlashAtStatementStartIsMatch() {
        assertEquals(List.of(LexerTokenType.MATCH, LexerTokenType.OPERATOR), types("/x/;"));
    }

    @Test
    public void testChainedDivision() {
        List<LexerToken> tokens = tokens("$x / $y / $z");
        assertEquals(5, tokens.size());
        assertTrue(tokens.get(1).isOperator("/"));
        assertTrue(tokens.get(3).isOperator("/"));
    }

    @Test
    public void testSlashAfterClosingParenIsDivision() {
        List<LexerToken> tokens = tokens("foo(1) / 2");
        assertTrue(tokens.get(4).isOperator("/"));
        assertEquals(SlashContext.EXPECT_OPERATOR, contextAfter("foo(1)"));
    }

    @Test
    public void testSlashAfterListOperatorIsMatch() {
        List<LexerToken> tokens = tokens("split /,/, $s");
        assertEquals(LexerTokenType.KEYWORD, tokens.get(0).type);
        assertEquals(LexerTokenType.MATCH, tokens.get(1).type);
        assertEquals(",", tokens.get(1).quote.body());
    }

    @Test
    public void testDefinedOrIsOperator() {
        List<LexerToken> tokens = tokens("$x // 0");
        assertTrue(tokens.get(1).isOperator("//"));
    }

    private static SlashContext contextAfter(String code) {
        Lexer lexer = new Lexer(code);
        while (lexer.nextToken().type != LexerTokenType.EOF) {
            // drain
        }
        return lexer.getContext();
    }

    @Test
    public void testQuoteLikeOperators() {
        LexerToken q = tokens("q{a{b}c}").get(0);
        assertEquals(LexerTokenType.QUOTE, q.type);
        assertEquals("a{b}c", q.quote.body());

        assertEquals(LexerTokenType.QUOTE_DOUBLE, tokens("qq(x)").get(0).type);
        assertEquals(LexerTokenType.QUOTE_WORDS, tokens("qw(a b c)").get(0).type);
        assertEquals(LexerTokenType.STRING, tokens("'x'").get(0).type);
        assertEquals(LexerTokenType.INTERPOLATED_STRING, tokens("\"x $y\"").get(0).type);
    }

    @Test
    public void testSubstitutionWithBracketedParts() {
        LexerToken token = tokens("s{a} {b}g").get(0);
        assertEquals(LexerTokenType.SUBSTITUTION, token.type);
        assertEquals("a", token.quote.body());
        assertEquals("b", token.quote.replacement());
        assertEquals("g", token.quote.modifiers());
    }

    @Test
    public void testTransliteration() {
        LexerToken token = tokens("tr/a-z/A-Z/").get(0);
        assertEquals(LexerTokenType.TRANSLITERATION, token.type);
        assertEquals("a-z", token.quote.body());
        assertEquals("A-Z", token.quote.replacement());
    }

    @Test
    public void testModifierOrderIsCanonical() {
        assertEquals(tokens("s/a/b/gi").get(0).quote.modifiers(), tokens("s/a/b/ig").get(0).quote.modifiers());
    }

    @Test
    public void testUnknownModifierIsError() {
        LexerToken token = tokens("s/a/b/q").get(0);
        assertEquals(LexerTokenType.ERROR, token.type);
        assertTrue(token.errorMessage.contains("Unknown modifier"), token.errorMessage);
    }

    @Test
    public void testUnterminatedQuote() {
        LexerToken token = tokens("q{abc").get(0);
        assertEquals(LexerTokenType.ERROR, token.type);
        assertTrue(token.errorMessage.startsWith("Can't find string terminator"), token.errorMessage);
    }

    @Test
    public void testNumbers() {
        assertEquals(List.of(LexerTokenType.INTEGER, LexerTokenType.OPERATOR, LexerTokenType.INTEGER,
                        LexerTokenType.OPERATOR, LexerTokenType.FLOAT),
                types("0x1F + 1_000 + 1.5e3"));
        assertEquals(LexerTokenType.VERSION, tokens("1.2.3").get(0).type);
        assertEquals(LexerTokenType.INTEGER, tokens("0b101").get(0).type);
    }

    @Test
    public void testIllegalBinaryDigit() {
        LexerToken token = tokens("0b12").get(0);
        assertEquals(LexerTokenType.ERROR, token.type);
        assertTrue(token.errorMessage.contains("Illegal binary digit"), token.errorMessage);
    }

    @Test
    public void testSpansCoverTokenText() {
        String code = "my $x = foo(1, \"a\", q{b}) + 0x1F;";
        SourceText source = new SourceText(code);
        List<LexerToken> tokens = new Lexer(source, LexerStatistics.NONE).tokenize();
        for (LexerToken token : tokens.subList(0, tokens.size() - 1)) {
            assertEquals(token.text, source.slice(token.span), token.toString());
        }
        String rebuilt = tokens.stream().map(t -> t.text).collect(Collectors.joining());
        assertEquals(code.replace(" ", ""), rebuilt);
    }

    @Test
    public void testSpansAreByteOffsets() {
        SourceText source = new SourceText("my $café = 1;");
        List<LexerToken> tokens = new Lexer(source, LexerStatistics.NONE).tokenize();
        LexerToken variable = tokens.get(1);
        assertEquals("$café", variable.text);
        // é takes two bytes in UTF-8
        assertEquals(6, variable.span.length());
        assertTrue(tokens.get(2).isOperator("="));
        assertEquals(10, tokens.get(2).span.start());
    }

    @Test
    public void testUnicodeAndEmojiStatistics() {
        CountingLexerStatistics statistics = new CountingLexerStatistics();
        new Lexer(new SourceText("my $café = 1; my $🐪 = 2; my $plain = 3;"), statistics).tokenize();
        assertEquals(2, statistics.getUnicodeCount());
        assertEquals(1, statistics.getEmojiCount());
        assertTrue(statistics.getDistinctIdentifiers().contains("café"));
    }

    @Test
    public void testWordOperatorsAndKeywords() {
        List<LexerToken> tokens = tokens("print $a eq $b and foo");
        assertEquals(LexerTokenType.KEYWORD, tokens.get(0).type);
        assertTrue(tokens.get(2).isOperator("eq"));
        assertTrue(tokens.get(4).isOperator("and"));
        assertEquals(LexerTokenType.IDENTIFIER, tokens.get(5).type);
    }

    @Test
    public void testPrototypeToken() {
        List<LexerToken> tokens = tokens("sub max($$) { }");
        assertEquals(LexerTokenType.PROTOTYPE, tokens.get(2).type);
        assertEquals("($$)", tokens.get(2).text);
    }

    @Test
    public void testSignatureIsNotPrototype() {
        List<LexerToken> tokens = tokens("sub add($x, $y) { }");
        assertTrue(tokens.get(2).isOperator("("));
        assertEquals(LexerTokenType.SCALAR, tokens.get(3).type);
    }

    @Test
    public void testSignaturePlaceholder() {
        List<LexerToken> tokens = tokens("sub f($x, $, @) { }");
        assertEquals(LexerTokenType.SIGIL, tokens.get(6).type);
        assertEquals("$", tokens.get(6).text);
        assertEquals(LexerTokenType.SIGIL, tokens.get(8).type);
        assertEquals("@", tokens.get(8).text);
    }

    @Test
    public void testAttributesAreReadRaw() {
        List<LexerToken> tokens = tokens("sub f :lvalue :prototype($;$) { }");
        assertTrue(tokens.get(2).isOperator(":"));
        assertEquals(LexerTokenType.ATTRIBUTE, tokens.get(3).type);
        assertEquals("lvalue", tokens.get(3).text);
        assertEquals(LexerTokenType.ATTRIBUTE, tokens.get(5).type);
        assertEquals("prototype($;$)", tokens.get(5).text);
    }

    @Test
    public void testNewlineBefore() {
        List<LexerToken> tokens = tokens("$a\n$b $c");
        assertFalse(tokens.get(0).newlineBefore);
        assertTrue(tokens.get(1).newlineBefore);
        assertFalse(tokens.get(2).newlineBefore);
    }

    @Test
    public void testPodIsSkipped() {
        assertEquals(List.of(LexerTokenType.SCALAR, LexerTokenType.OPERATOR),
                types("=head1 NAME\n\nstuff\n\n=cut\n$x;"));
    }

    @Test
    public void testDataSection() {
        List<LexerToken> tokens = tokens("1;\n__END__\nanything $goes /here");
        assertEquals(LexerTokenType.DATA_SECTION, tokens.get(tokens.size() - 1).type);
    }

    @Test
    public void testPeekDoesNotConsume() {
        Lexer lexer = new Lexer("$a;");
        LexerToken peeked = lexer.peekToken();
        assertSame(peeked, lexer.nextToken());
        assertTrue(lexer.nextToken().isOperator(";"));
        assertEquals(LexerTokenType.EOF, lexer.nextToken().type);
        assertEquals(LexerTokenType.EOF, lexer.nextToken().type);
    }
}

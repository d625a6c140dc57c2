package org.perlfront.heredoc;

import org.junit.jupiter.api.Test;
import org.perlfront.lexer.Lexer;
import org.perlfront.lexer.LexerStatistics;
import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.LexerTokenType;
import org.perlfront.lexer.SourceText;
import org.perlfront.lexer.Span;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class HeredocCollectorTest {

    private static PendingHeredoc pending(String label, boolean indent) {
        return new PendingHeredoc(label, indent, PendingHeredoc.QuoteKind.UNQUOTED, Span.at(0));
    }

    private static List<String> lines(SourceText source, HeredocContent content) {
        return content.segments().stream().map(source::slice).collect(Collectors.toList());
    }

    @Test
    public void testCollectsLinesUpToTerminator() {
        SourceText source = new SourceText("line1\nline2\nEOF\nrest;\n");
        HeredocCollector.Result result = HeredocCollector.collectAll(source, 0, List.of(pending("EOF", false)));
        HeredocContent content = result.contents().get(0);
        assertTrue(content.terminated());
        assertEquals(List.of("line1", "line2"), lines(source, content));
        assertEquals("line1\nline2\n", content.text(source));
        assertEquals(source.text().indexOf("rest"), result.nextOffset());
    }

    @Test
    public void testIndentedTerminatorStripsCommonIndent() {
        SourceText source = new SourceText("    a\n      b\n    EOF\n");
        HeredocContent content = HeredocCollector.collectAll(source, 0, List.of(pending("EOF", true)))
                .contents().get(0);
        assertEquals(List.of("a", "  b"), lines(source, content));
    }

    @Test
    public void testIndentedTerminatorNeedsTildeForm() {
        SourceText source = new SourceText("a\n  EOF\n");
        HeredocContent content = HeredocCollector.collectAll(source, 0, List.of(pending("EOF", false)))
                .contents().get(0);
        assertFalse(content.terminated());
        assertEquals(List.of("a", "  EOF"), lines(source, content));
    }

    @Test
    public void testSeveralHeredocsAreReadInOrder() {
        SourceText source = new SourceText("first\nA\nsecond\nB\n");
        HeredocCollector.Result result = HeredocCollector.collectAll(source, 0,
                List.of(pending("A", false), pending("B", false)));
        assertEquals(List.of("first"), lines(source, result.contents().get(0)));
        assertEquals(List.of("second"), lines(source, result.contents().get(1)));
        assertEquals(source.byteLength(), result.nextOffset());
    }

    @Test
    public void testUnterminatedKeepsLinesSoFar() {
        SourceText source = new SourceText("abc\ndef\n");
        HeredocContent content = HeredocCollector.collectAll(source, 0, List.of(pending("EOF", false)))
                .contents().get(0);
        assertFalse(content.terminated());
        assertEquals(List.of("abc", "def"), lines(source, content));
    }

    @Test
    public void testCrlfLineEndings() {
        SourceText source = new SourceText("abc\r\nEOF\r\nx");
        HeredocCollector.Result result = HeredocCollector.collectAll(source, 0, List.of(pending("EOF", false)));
        HeredocContent content = result.contents().get(0);
        assertTrue(content.terminated());
        assertEquals(List.of("abc"), lines(source, content));
        assertEquals(source.byteLength() - 1, result.nextOffset());
    }

    @Test
    public void testEmptyBody() {
        SourceText source = new SourceText("EOF\n");
        HeredocContent content = HeredocCollector.collectAll(source, 0, List.of(pending("EOF", false)))
                .contents().get(0);
        assertTrue(content.terminated());
        assertTrue(content.segments().isEmpty());
        assertEquals("", content.text(source));
    }

    @Test
    public void testLexerResolvesHeredocAtEndOfLine() {
        SourceText source = new SourceText("print <<A, <<'B';\na $x\nA\nb $y\nB\nprint 1;\n");
        List<LexerToken> tokens = new Lexer(source, LexerStatistics.NONE).tokenize();
        LexerToken a = tokens.get(1);
        LexerToken b = tokens.get(3);
        assertEquals(LexerTokenType.HEREDOC, a.type);
        assertEquals(LexerTokenType.HEREDOC, b.type);
        assertEquals("A", a.heredoc.getLabel());
        assertEquals(PendingHeredoc.QuoteKind.UNQUOTED, a.heredoc.getQuoteKind());
        assertEquals(PendingHeredoc.QuoteKind.SINGLE, b.heredoc.getQuoteKind());
        assertTrue(a.heredoc.isResolved());
        assertEquals("a $x\n", a.heredoc.getContent().text(source));
        assertEquals("b $y\n", b.heredoc.getContent().text(source));

        // lexing resumes after the bodies
        LexerToken next = tokens.get(5);
        assertTrue(next.isWord("print"), next.toString());
    }

    @Test
    public void testLexerIndentedHeredoc() {
        SourceText source = new SourceText("my $s = <<~EOT;\n    one\n    two\n    EOT\n");
        List<LexerToken> tokens = new Lexer(source, LexerStatistics.NONE).tokenize();
        LexerToken heredoc = tokens.get(3);
        assertTrue(heredoc.heredoc.isAllowIndent());
        assertEquals("one\ntwo\n", heredoc.heredoc.getContent().text(source));
    }
}

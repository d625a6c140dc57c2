package org.perlfront.astvisitor;

import org.junit.jupiter.api.Test;
import org.perlfront.astnode.ErrorNode;
import org.perlfront.astnode.NodeKind;
import org.perlfront.astnode.NumberNode;
import org.perlfront.astnode.SyntheticNode;
import org.perlfront.lexer.Span;
import org.perlfront.parser.ParseResult;
import org.perlfront.parser.Parser;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class PrintVisitorTest {

    @Test
    public void testBinaryExpression() {
        String expected = ""
                + "Program:  pos:0..6\n"
                + "  BinaryOperatorNode: +  pos:0..5\n"
                + "    NumberNode: 1  pos:0..1\n"
                + "    NumberNode: 2  pos:4..5\n";
        assertEquals(expected, new Parser("1 + 2;").parse().program().toString());
    }

    @Test
    public void testVariableAndString() {
        String dump = new Parser("my $s = \"a\\tb\";").parse().program().toString();
        assertTrue(dump.contains("OperatorNode: my"), dump);
        assertTrue(dump.contains("IdentifierNode: s"), dump);
        assertTrue(dump.contains("StringNode: 'a\\tb' interpolated"), dump);
    }

    @Test
    public void testLongSubscriptChainPrintsWithoutRecursion() throws InterruptedException {
        ParseResult result = new Parser("$x" + "->[0]".repeat(5000) + ";").parse();
        assertFalse(result.hasErrors());

        // a small stack that a recursive walk over 5000 levels would overflow
        AtomicReference<String> dump = new AtomicReference<>();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread printer = new Thread(null, () -> {
            try {
                dump.set(result.program().toString());
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "print-visitor", 256 * 1024);
        printer.start();
        printer.join();

        assertNull(failure.get(), () -> String.valueOf(failure.get()));
        assertTrue(dump.get().startsWith("Program:"));
        int count = 0;
        for (int at = dump.get().indexOf("BinaryOperatorNode: ->["); at >= 0;
             at = dump.get().indexOf("BinaryOperatorNode: ->[", at + 1)) {
            count++;
        }
        assertEquals(5000, count);
    }

    @Test
    public void testHeredocQuoteKinds() {
        String dump = new Parser("print <<'RAW', <<~EOT;\n$a\nRAW\n  $b\n  EOT\n").parse().program().toString();
        assertTrue(dump.contains("HeredocNode: RAW SINGLE  pos:"), dump);
        assertTrue(dump.contains("HeredocNode: EOT UNQUOTED indent interpolated  pos:"), dump);
    }

    @Test
    public void testErrorNodeShowsPartial() {
        ErrorNode node = new ErrorNode("Missing semicolon", List.of(";"),
                new NumberNode("1", new Span(0, 1)), new Span(0, 1));
        String expected = ""
                + "ErrorNode: Missing semicolon  pos:0..1\n"
                + "  Partial:\n"
                + "    NumberNode: 1  pos:0..1\n";
        assertEquals(expected, node.toString());
    }

    @Test
    public void testSyntheticNode() {
        SyntheticNode node = new SyntheticNode(NodeKind.MISSING_EXPRESSION, "", Span.at(3));
        assertEquals("SyntheticNode: MISSING_EXPRESSION  pos:3..3\n", node.toString());
    }
}

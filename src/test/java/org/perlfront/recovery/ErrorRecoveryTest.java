package org.perlfront.recovery;

import org.junit.jupiter.api.Test;
import org.perlfront.astnode.BlockNode;
import org.perlfront.astnode.ErrorNode;
import org.perlfront.astnode.Node;
import org.perlfront.astnode.NodeKind;
import org.perlfront.astnode.SubroutineNode;
import org.perlfront.astnode.SyntheticNode;
import org.perlfront.astvisitor.ParentMap;
import org.perlfront.lexer.Lexer;
import org.perlfront.lexer.LexerStatistics;
import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.Span;
import org.perlfront.lexer.SourceText;
import org.perlfront.parser.ParseResult;
import org.perlfront.parser.Parser;
import org.perlfront.parser.ParserOptions;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorRecoveryTest {

    private static ParseResult parse(String code, ParseBudget budget) {
        ParserOptions options = new ParserOptions();
        options.budget = budget;
        return new Parser(code, options).parse();
    }

    /**
     * Drives an ErrorRecovery directly over the lexer's tokens.
     */
    private static ErrorRecovery recoveryOver(String code, ParseBudget budget, List<String> log) {
        SourceText source = new SourceText(code);
        Lexer lexer = new Lexer(source, LexerStatistics.NONE);
        ErrorRecovery.TokenCursor cursor = new ErrorRecovery.TokenCursor() {
            @Override
            public LexerToken current() {
                return lexer.peekToken();
            }

            @Override
            public void advance() {
                lexer.nextToken();
            }
        };
        return new ErrorRecovery(cursor, source, budget, log::add);
    }

    @Test
    public void testMissingSemicolonKeepsStatement() {
        ParseResult result = parse("my $x = 1;\nmy $y = 2\nmy $z = 3;\n", ParseBudget.defaults());
        assertEquals(1, result.errors().size());
        assertEquals("Missing semicolon", result.errors().get(0).getMessage());
        List<Node> statements = result.program().elements;
        assertEquals(3, statements.size());
        ErrorNode error = assertInstanceOf(ErrorNode.class, statements.get(1));
        assertNotNull(error.partial);
        assertEquals(NodeKind.ERROR, error.getKind());
        assertEquals(0, result.budgetUsage().getTokensSkipped());
    }

    @Test
    public void testUnexpectedTokenSkipsToSemicolon() {
        ParseResult result = parse("print 1 print 2;\nmy $ok = 1;\n", ParseBudget.defaults());
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).getMessage().startsWith("syntax error: expected ';'"));
        List<Node> statements = result.program().elements;
        assertEquals(2, statements.size());
        assertInstanceOf(ErrorNode.class, statements.get(0));
        assertEquals(2, result.budgetUsage().getTokensSkipped());
    }

    @Test
    public void testErrorsInsideBlocksRecoverAtClosingBrace() {
        ParseResult result = parse("sub f { 1 + ) }\nsub g { 2 }\n", ParseBudget.defaults());
        assertTrue(result.hasErrors());
        assertEquals(2, result.program().elements.size());
        assertEquals(NodeKind.SUBROUTINE, result.program().elements.get(1).getKind());
    }

    private static int syntheticNodes(BlockNode program) {
        ParentMap parents = ParentMap.build(program);
        int count = 0;
        for (int id = 1; id <= parents.size(); id++) {
            if (parents.nodeById(id).getKind().isSynthetic()) {
                count++;
            }
        }
        return count;
    }

    @Test
    public void testStrayClosingBraceLeavesErrorNode() {
        ParseResult result = parse("my $x = 1;\n}\nmy $y = 2;\n", ParseBudget.defaults());
        assertEquals(1, result.errors().size());
        assertEquals("Unmatched right curly bracket", result.errors().get(0).getMessage());
        List<Node> statements = result.program().elements;
        assertEquals(3, statements.size());
        ErrorNode error = assertInstanceOf(ErrorNode.class, statements.get(1));
        assertEquals(new Span(11, 12), error.getLocation());
        assertEquals(1, syntheticNodes(result.program()));
    }

    @Test
    public void testUnclosedBlockEndsWithErrorNode() {
        ParseResult result = parse("sub f { 1;\n", ParseBudget.defaults());
        assertEquals(1, result.errors().size());
        assertEquals("Expected '}', found end of file", result.errors().get(0).getMessage());
        SubroutineNode sub = assertInstanceOf(SubroutineNode.class, result.program().elements.get(0));
        List<Node> body = ((BlockNode) sub.block).elements;
        ErrorNode error = assertInstanceOf(ErrorNode.class, body.get(body.size() - 1));
        assertEquals(Span.at(11), error.getLocation());
        assertEquals(1, syntheticNodes(result.program()));
    }

    @Test
    public void testSkipBudgetExhaustionStopsParsing() {
        ParseResult result = parse(") ) ) ) ) ) ) ) ) )", ParseBudget.defaults().withMaxTokensSkipped(5));
        List<Node> statements = result.program().elements;
        assertEquals(2, statements.size());
        assertInstanceOf(ErrorNode.class, statements.get(0));
        SyntheticNode rest = assertInstanceOf(SyntheticNode.class, statements.get(1));
        assertEquals(NodeKind.UNKNOWN_REST, rest.getKind());
        assertEquals(") ) ) ) )", rest.text);
        assertEquals(5, result.budgetUsage().getTokensSkipped());
        assertEquals(1, result.errors().size());
    }

    @Test
    public void testRecoveryBudgetExhaustion() {
        StringBuilder code = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            code.append("1 2 3;\n");
        }
        ParseResult result = parse(code.toString(), ParseBudget.defaults().withMaxRecoveries(3));
        assertEquals(3, result.budgetUsage().getRecoveriesAttempted());
        List<Node> statements = result.program().elements;
        assertEquals(NodeKind.UNKNOWN_REST, statements.get(statements.size() - 1).getKind());
    }

    @Test
    public void testStoredErrorsAreCapped() {
        StringBuilder code = new StringBuilder();
        for (int i = 0; i < 30; i++) {
            code.append("1 +;\n");
        }
        ParseResult result = parse(code.toString(), ParseBudget.defaults().withMaxErrors(10));
        assertEquals(10, result.errors().size());
        assertEquals(30, result.budgetUsage().getErrorsEmitted());
    }

    @Test
    public void testDeepNestingFailsGracefully() {
        String code = "(".repeat(10000) + "1" + ")".repeat(10000) + ";\n";
        ParseResult result = parse(code, ParseBudget.defaults());
        assertTrue(result.hasErrors());
        assertTrue(result.errors().get(0).getMessage().startsWith("Nesting depth limit exceeded"),
                result.errors().get(0).getMessage());
        assertTrue(result.budgetUsage().getMaxDepthReached() <= ParseBudget.defaults().maxDepth());
        assertEquals(0, result.budgetUsage().getCurrentDepth());
    }

    @Test
    public void testUnlimitedBudgetStillCapsDepth() {
        assertEquals(ParseBudget.DEPTH_CEILING, ParseBudget.unlimited().maxDepth());
        String code = "(".repeat(50000) + "1" + ")".repeat(50000) + ";\n";
        ParseResult result = assertDoesNotThrow(() -> parse(code, ParseBudget.unlimited()));
        assertTrue(result.errors().get(0).getMessage().startsWith("Nesting depth limit exceeded"),
                result.errors().get(0).getMessage());
        assertTrue(result.budgetUsage().getMaxDepthReached() <= ParseBudget.DEPTH_CEILING);
        assertEquals(0, result.budgetUsage().getCurrentDepth());
    }

    @Test
    public void testBudgetPresets() {
        assertEquals(ParseBudget.defaults(), ParseBudget.forIde());
        assertEquals(ParseBudget.DEPTH_CEILING, ParseBudget.defaults().withMaxDepth(Integer.MAX_VALUE).maxDepth());
        ParseResult result = parse("sub f { 1 + ) }\nsub g { 2 }\n", ParseBudget.forIde());
        assertEquals(1, result.errors().size());
        assertEquals(NodeKind.SUBROUTINE, result.program().elements.get(1).getKind());
    }

    @Test
    public void testDeepBlockNesting() {
        String code = "{".repeat(5000) + "}".repeat(5000);
        ParseResult result = parse(code, ParseBudget.strict());
        assertTrue(result.hasErrors());
        assertTrue(result.budgetUsage().getMaxDepthReached() <= ParseBudget.strict().maxDepth());
    }

    @Test
    public void testSynchronizeAtSyncPoint() {
        ErrorRecovery recovery = recoveryOver("; 1", ParseBudget.defaults(), new ArrayList<>());
        RecoveryResult result = recovery.synchronize(SyncPoint.SEMICOLON);
        assertEquals(RecoveryResult.Status.AT_SYNC_POINT, result.status());
        assertEquals(0, result.skipped());
        assertEquals(ErrorRecovery.State.AT_SYNC_POINT, recovery.getState());
    }

    @Test
    public void testSynchronizeSkipsToKeyword() {
        ErrorRecovery recovery = recoveryOver("1 2 3 my $x", ParseBudget.defaults(), new ArrayList<>());
        RecoveryResult result = recovery.synchronize(SyncPoint.KEYWORD);
        assertEquals(RecoveryResult.Status.RECOVERED, result.status());
        assertEquals(3, result.skipped());
        assertEquals(3, recovery.getTracker().getTokensSkipped());
        assertEquals(1, recovery.getTracker().getRecoveriesAttempted());
    }

    @Test
    public void testSynchronizeReachesEof() {
        ErrorRecovery recovery = recoveryOver("1 2 3", ParseBudget.defaults(), new ArrayList<>());
        RecoveryResult result = recovery.synchronize(SyncPoint.SEMICOLON);
        assertEquals(RecoveryResult.Status.REACHED_EOF, result.status());
        assertEquals(3, result.skipped());
    }

    @Test
    public void testSynchronizeWithoutSyncPointsAlwaysAdvances() {
        List<String> log = new ArrayList<>();
        ErrorRecovery recovery = recoveryOver("a b c d e f", ParseBudget.defaults().withMaxTokensSkipped(4), log);
        RecoveryResult result = recovery.synchronize();
        assertTrue(result.isBudgetExhausted());
        assertEquals(4, result.skipped());
        assertFalse(log.isEmpty());

        // the ceiling is cumulative: the next call cannot skip anything
        RecoveryResult again = recovery.synchronize();
        assertTrue(again.isBudgetExhausted());
        assertEquals(0, again.skipped());
    }

    @Test
    public void testRecoverWithNodeAtEofHasEmptySpan() {
        ErrorRecovery recovery = recoveryOver("", ParseBudget.defaults(), new ArrayList<>());
        ErrorNode node = recovery.recoverWithNode(new ParseError("oops", Span.at(0)));
        assertTrue(node.getLocation().isEmpty());
        assertEquals(RecoveryResult.Status.REACHED_EOF, recovery.getLastResult().status());
        assertEquals(1, recovery.getErrors().size());
    }

    @Test
    public void testMissingNodeFactories() {
        ErrorRecovery recovery = recoveryOver("}", ParseBudget.defaults(), new ArrayList<>());
        SyntheticNode expression = recovery.missingExpression();
        assertEquals(NodeKind.MISSING_EXPRESSION, expression.getKind());
        assertTrue(expression.getKind().isSynthetic());
        assertEquals(NodeKind.MISSING_BLOCK, recovery.missingBlock().getKind());
        assertEquals(NodeKind.MISSING_IDENTIFIER, recovery.missingIdentifier().getKind());
        assertEquals(NodeKind.MISSING_STATEMENT, recovery.missingStatement().getKind());
        assertEquals(4, recovery.getErrors().size());
        assertEquals("Expected expression, found '}'", recovery.getErrors().get(0).getMessage());
    }

    @Test
    public void testUnknownRestDropsLaterErrors() {
        ErrorRecovery recovery = recoveryOver("a b c", ParseBudget.defaults(), new ArrayList<>());
        SyntheticNode rest = recovery.unknownRest();
        assertEquals("a b c", rest.text);
        assertTrue(recovery.isAbandoned());
        recovery.recordError(new ParseError("late", rest.getLocation()));
        assertTrue(recovery.getErrors().isEmpty());
    }

    @Test
    public void testMalformedInputNeverThrows() {
        String[] inputs = {
                "}}}}", "((((", "sub {", "if (", "my $x = ;", "print <<A, <<B;\n", "s/a/", "q{", "=", "->",
                "foo(1,,,2", "%{", "sub f($x, @y, $z) {}", "format =\n", "use ;", "1 ? 2", "$x{", "@{[",
        };
        for (String input : inputs) {
            ParseResult result = assertDoesNotThrow(() -> parse(input, ParseBudget.strict()), input);
            assertTrue(result.hasErrors(), input);
        }
    }
}

package org.perlfront.parser;

import org.perlfront.astnode.BlockNode;
import org.perlfront.astnode.Node;
import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.LexerTokenType;
import org.perlfront.lexer.Span;
import org.perlfront.recovery.ParseError;
import org.perlfront.recovery.PerlSyntaxException;

import java.util.ArrayList;
import java.util.List;

import static org.perlfront.parser.TokenUtils.consume;
import static org.perlfront.parser.TokenUtils.peek;

/**
 * ParseBlock handles the parsing of code blocks and of the program as a whole.
 * A block represents a sequence of statements enclosed in curly braces.
 * <p>
 * The statement loop here is where syntax errors are caught: a failing statement is
 * replaced by an error node and parsing resumes at the next sync point.
 */
public class ParseBlock {

    /**
     * Parses the whole input into the root node.
     */
    public static BlockNode parseProgram(Parser parser) {
        List<Node> statements = new ArrayList<>();
        parseStatements(parser, statements, true);
        return new BlockNode(statements, true, new Span(0, parser.source.byteLength()));
    }

    /**
     * Parses {@code { statements }}. A block left open at the end of input is reported
     * and still returned, with an error node as its last statement.
     *
     * @param parser The parser instance containing the current parsing state
     * @return BlockNode representing the parsed block in the AST
     */
    public static BlockNode parseBlock(Parser parser) {
        int start = parser.nextStart();
        List<Node> statements = new ArrayList<>();
        parser.enterDepth();
        try {
            consume(parser, LexerTokenType.OPERATOR, "{");
            parseStatements(parser, statements, false);
            LexerToken close = peek(parser);
            if (close.isOperator("}")) {
                consume(parser);
            } else if (!parser.recovery.isAbandoned()) {
                statements.add(parser.recovery.errorNode(
                        ParseError.unmatchedDelimiter("}", null, Span.at(close.span.start()))));
            }
        } finally {
            parser.exitDepth();
        }
        return new BlockNode(statements, false, parser.spanFrom(start));
    }

    /**
     * Parses a block where one is required; when the next token is not {@code {} a
     * missing-block node is returned and nothing is consumed.
     */
    public static Node parseRequiredBlock(Parser parser) {
        if (peek(parser).isOperator("{")) {
            return parseBlock(parser);
        }
        return parser.recovery.missingBlock();
    }

    private static void parseStatements(Parser parser, List<Node> statements, boolean topLevel) {
        while (!parser.recovery.isAbandoned()) {
            LexerToken token = peek(parser);
            if (token.type == LexerTokenType.EOF) {
                return;
            }
            if (token.isOperator("}")) {
                if (!topLevel) {
                    return;
                }
                consume(parser);
                statements.add(parser.recovery.errorNode(new ParseError("Unmatched right curly bracket", token.span)
                        .withFound("}")));
                continue;
            }
            if (token.isOperator(";")) {
                // empty statement
                consume(parser);
                continue;
            }
            parseStatementInto(parser, statements);
        }
    }

    /**
     * Parses one statement and appends it, or the nodes that replace it after an error.
     * Always consumes at least one token.
     */
    private static void parseStatementInto(Parser parser, List<Node> statements) {
        int before = parser.getConsumedCount();
        try {
            statements.add(ParseStatement.parseStatement(parser));
        } catch (PerlSyntaxException e) {
            statements.add(parser.recovery.recoverWithNode(e.getError(), e.getPartial()));
            if (parser.recovery.getLastResult().isBudgetExhausted()) {
                statements.add(parser.recovery.unknownRest());
                return;
            }
        }
        LexerToken next = peek(parser);
        if (parser.getConsumedCount() == before && next.type != LexerTokenType.EOF && !next.isOperator("}")) {
            parser.options.logDebug("no progress at " + next.span + ", skipping " + TokenUtils.describe(next));
            parser.recovery.getTracker().recordSkip(1);
            consume(parser);
        }
    }
}

package org.perlfront.parser;

import org.perlfront.astnode.BlockNode;
import org.perlfront.astnode.LabelNode;
import org.perlfront.astnode.Node;
import org.perlfront.astnode.OperatorNode;
import org.perlfront.astnode.StatementModifierNode;
import org.perlfront.astnode.StringNode;
import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.LexerTokenType;
import org.perlfront.lexer.Span;
import org.perlfront.recovery.ParseError;
import org.perlfront.recovery.PerlSyntaxException;
import org.perlfront.recovery.SyncPoint;

import java.util.List;
import java.util.Set;

import static org.perlfront.parser.TokenUtils.consume;
import static org.perlfront.parser.TokenUtils.peek;

/**
 * Dispatches a statement on its first token.
 * <p>
 * Compound statements (blocks, loops, declarations with a body) end at their closing
 * brace; simple statements are expressions, optionally followed by one statement
 * modifier, and end at a semicolon, a closing brace or the end of input.
 */
public class ParseStatement {

    private static final Set<String> MODIFIERS = Set.of("if", "unless", "while", "until", "for", "foreach", "when");
    private static final Set<String> PHASES = Set.of("BEGIN", "END", "INIT", "CHECK", "UNITCHECK");

    public static Node parseStatement(Parser parser) {
        LexerToken token = peek(parser);
        parser.options.logDebug("parseStatement " + token);

        if (token.type == LexerTokenType.IDENTIFIER && peek(parser, 1).isOperator(":")
                && !peek(parser, 2).isOperator(":")) {
            return parseLabeledStatement(parser);
        }
        if (token.type == LexerTokenType.DATA_SECTION) {
            return parseDataSection(parser);
        }
        if (token.type == LexerTokenType.OPERATOR) {
            switch (token.text) {
                case "{":
                    if (!looksLikeAnonHash(parser)) {
                        return parseBareBlock(parser);
                    }
                    break;
                case ")":
                case "]":
                    throw new PerlSyntaxException(new ParseError("Unmatched right bracket", token.span)
                            .withFound(token.text));
                default:
                    break;
            }
        }
        if (token.type == LexerTokenType.KEYWORD) {
            LexerToken next = peek(parser, 1);
            switch (token.text) {
                case "if":
                case "unless":
                    return StatementParser.parseIfStatement(parser);
                case "while":
                case "until":
                    return StatementParser.parseWhileStatement(parser);
                case "for":
                case "foreach":
                    return StatementParser.parseForStatement(parser);
                case "sub":
                    if (next.type == LexerTokenType.IDENTIFIER) {
                        return SubroutineParser.parseSubroutine(parser, null, false);
                    }
                    break;
                case "method":
                    if (next.type == LexerTokenType.IDENTIFIER) {
                        return SubroutineParser.parseSubroutine(parser, null, true);
                    }
                    break;
                case "my":
                case "our":
                case "state":
                    if (next.isWord("sub")) {
                        return SubroutineParser.parseSubroutine(parser, consume(parser).text, false);
                    }
                    break;
                case "package":
                case "class":
                    return StatementParser.parsePackageDeclaration(parser);
                case "use":
                case "no":
                    return StatementParser.parseUseDeclaration(parser);
                case "format":
                    if (next.type == LexerTokenType.IDENTIFIER || next.isOperator("=")) {
                        return FormatParser.parseFormat(parser);
                    }
                    break;
                case "try":
                    return StatementParser.parseTryStatement(parser);
                case "given":
                case "when":
                    if (next.isOperator("(")) {
                        return StatementParser.parseGivenWhen(parser);
                    }
                    break;
                case "default":
                    if (next.isOperator("{")) {
                        return StatementParser.parseGivenWhen(parser);
                    }
                    break;
                case "defer":
                    if (next.isOperator("{")) {
                        return parseDefer(parser);
                    }
                    break;
                default:
                    if (PHASES.contains(token.text) && next.isOperator("{")) {
                        return SpecialBlockParser.parseSpecialBlock(parser);
                    }
                    break;
            }
        }
        return parseSimpleStatement(parser);
    }

    /**
     * An expression statement with an optional trailing modifier:
     * {@code EXPR if COND;}, {@code do BLOCK while COND;}.
     */
    static Node parseSimpleStatement(Parser parser) {
        int start = parser.nextStart();
        Node expression = parser.parseExpression(0);
        LexerToken token = peek(parser);
        if (token.type == LexerTokenType.KEYWORD && MODIFIERS.contains(token.text)) {
            consume(parser);
            Node condition;
            try {
                condition = ListParser.looksLikeArgument(peek(parser))
                        ? parser.parseExpression(0)
                        : parser.recovery.missingExpression();
            } catch (PerlSyntaxException e) {
                throw new PerlSyntaxException(e.getError(), expression);
            }
            expression = new StatementModifierNode(token.text, expression, condition, parser.spanFrom(start));
        }
        return finishSimpleStatement(parser, expression);
    }

    /**
     * Consumes the semicolon after a simple statement. A statement directly followed
     * by the start of a new line or a statement keyword is kept, wrapped in a
     * missing-semicolon error node; anything else is a syntax error.
     */
    static Node finishSimpleStatement(Parser parser, Node statement) {
        LexerToken token = peek(parser);
        if (token.isOperator(";")) {
            consume(parser);
            return statement;
        }
        if (token.isOperator("}") || token.type == LexerTokenType.EOF) {
            return statement;
        }
        if (token.newlineBefore || SyncPoint.KEYWORD.matches(token)) {
            return parser.recovery.recoverMissingSemicolon(statement);
        }
        if (token.type == LexerTokenType.ERROR) {
            throw new PerlSyntaxException(new ParseError(token.errorMessage, token.span)
                    .withFound(TokenUtils.describe(token)), statement);
        }
        throw new PerlSyntaxException(new ParseError("syntax error: expected ';', found "
                + TokenUtils.describe(token), token.span)
                .withExpected(List.of(";"))
                .withFound(TokenUtils.describe(token)), statement);
    }

    private static Node parseLabeledStatement(Parser parser) {
        LexerToken label = consume(parser);
        consume(parser, LexerTokenType.OPERATOR, ":");
        LexerToken next = peek(parser);
        Node statement;
        if (next.type == LexerTokenType.EOF || next.isOperator("}")) {
            statement = parser.recovery.missingStatement();
        } else if (next.isOperator(";")) {
            // LABEL: ;
            consume(parser);
            statement = new BlockNode(List.of(), false, Span.at(next.span.start()));
        } else {
            parser.enterDepth();
            try {
                statement = parseStatement(parser);
            } finally {
                parser.exitDepth();
            }
        }
        return new LabelNode(label.text, statement, parser.spanFrom(label.span.start()));
    }

    /**
     * A bare block is a loop that runs once; it may carry a continue block.
     */
    private static Node parseBareBlock(Parser parser) {
        BlockNode block = ParseBlock.parseBlock(parser);
        if (peek(parser).isWord("continue")) {
            int start = block.location.start();
            consume(parser);
            Node continueBlock = ParseBlock.parseRequiredBlock(parser);
            Node loop = new org.perlfront.astnode.For3Node("for", null, null, null, block, continueBlock,
                    parser.spanFrom(start));
            TokenUtils.consumeIf(parser, ";");
            return loop;
        }
        TokenUtils.consumeIf(parser, ";");
        return block;
    }

    private static Node parseDefer(Parser parser) {
        LexerToken keyword = consume(parser);
        Node block = ParseBlock.parseBlock(parser);
        return new OperatorNode("defer", block, parser.spanFrom(keyword.span.start()));
    }

    private static Node parseDataSection(Parser parser) {
        LexerToken token = consume(parser);
        String marker = token.text.startsWith("__END__") ? "__END__" : "__DATA__";
        String content = token.text.substring(marker.length());
        return new OperatorNode(marker, new StringNode(content, "", false, token.span), token.span);
    }

    /**
     * At statement start {@code {} opens a block unless the first tokens read like a hash:
     * {@code { WORD =>}, {@code { 'key' ,} or {@code { $x =>}.
     */
    static boolean looksLikeAnonHash(Parser parser) {
        LexerToken first = peek(parser, 1);
        LexerToken second = peek(parser, 2);
        if (first.isOperator("}")) {
            return false;
        }
        if (first.isWord() && second.isOperator("=>")) {
            return true;
        }
        boolean literal = first.type == LexerTokenType.STRING || first.type == LexerTokenType.INTERPOLATED_STRING
                || first.type == LexerTokenType.SCALAR;
        return literal && (second.isOperator(",") || second.isOperator("=>"));
    }
}

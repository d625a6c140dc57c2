package org.perlfront.parser;

import org.perlfront.astnode.BinaryOperatorNode;
import org.perlfront.astnode.IdentifierNode;
import org.perlfront.astnode.ListNode;
import org.perlfront.astnode.Node;
import org.perlfront.astnode.OperatorNode;
import org.perlfront.astnode.StringNode;
import org.perlfront.astnode.TernaryOperatorNode;
import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.LexerTokenType;
import org.perlfront.recovery.ParseError;
import org.perlfront.recovery.PerlSyntaxException;

import java.util.List;
import java.util.Set;

import static org.perlfront.parser.TokenUtils.consume;
import static org.perlfront.parser.TokenUtils.peek;

/**
 * The ParseInfix class is responsible for parsing infix operations in the source code.
 * It handles binary operators, ternary operators, and special cases like method calls and subscripts.
 */
public class ParseInfix {

    private static final Set<String> SPECIAL_INFIX = Set.of(",", "=>", "?", "->", "++", "--");

    public static boolean isInfixOperator(LexerToken token) {
        return token.type == LexerTokenType.OPERATOR
                && (ParserTables.INFIX_OP.contains(token.text) || SPECIAL_INFIX.contains(token.text));
    }

    /**
     * Parses infix operators and their right-hand operands.
     *
     * @param parser     The parser instance used for parsing.
     * @param left       The left-hand operand of the infix operation.
     * @param precedence The current precedence level for parsing.
     * @return A node representing the parsed infix operation.
     */
    public static Node parseInfixOperation(Parser parser, Node left, int precedence) {
        LexerToken token = consume(parser);
        int start = left.getLocation().start();
        Node right;

        if (ParserTables.INFIX_OP.contains(token.text)) {
            right = parser.parseExpression(precedence);
            return new BinaryOperatorNode(token.text, left, right, parser.spanFrom(start));
        }

        switch (token.text) {
            case ",":
            case "=>":
                if (token.text.equals("=>") && left instanceof IdentifierNode identifier) {
                    // Autoquote - Convert IdentifierNode to StringNode
                    left = new StringNode(identifier.name, "", false, identifier.location);
                }
                token = peek(parser);
                if (Parser.isExpressionTerminator(token)
                        || token.type == LexerTokenType.OPERATOR && ParserTables.LIST_TERMINATORS.contains(token.text)
                        || token.isOperator(",") || token.isOperator("=>")) {
                    // "postfix" comma
                    return ListNode.makeList(left, null, parser.spanFrom(start));
                }
                right = parser.parseExpression(precedence);
                return ListNode.makeList(left, right, parser.spanFrom(start));
            case "?":
                // The middle operand may hold an assignment but not a bare comma list
                Node middle = parser.parseExpression(ParserTables.COMMA_PRECEDENCE);
                consume(parser, LexerTokenType.OPERATOR, ":");
                right = parser.parseExpression(precedence);
                return new TernaryOperatorNode(left, middle, right, parser.spanFrom(start));
            case "->":
                return parseArrow(parser, left, start);
            case "++":
            case "--":
                return new OperatorNode("postfix" + token.text, left, parser.spanFrom(start));
            default:
                throw new PerlSyntaxException(new ParseError("Unexpected infix operator: " + token.text, token.span));
        }
    }

    /**
     * Parses what follows {@code ->}: a subscript, a call, a method call or a postfix
     * dereference.
     */
    private static Node parseArrow(Parser parser, Node left, int start) {
        LexerToken next = peek(parser);
        Node result;
        switch (next.type) {
            case OPERATOR -> {
                switch (next.text) {
                    case "[" -> result = new BinaryOperatorNode("->[", left,
                            ListParser.parseDelimitedList(parser, "[", "]"), parser.spanFrom(start));
                    case "{" -> result = new BinaryOperatorNode("->{", left,
                            parseHashSubscript(parser), parser.spanFrom(start));
                    case "(" -> result = new BinaryOperatorNode("->(", left,
                            ListParser.parseParenList(parser), parser.spanFrom(start));
                    default -> throw arrowError(next);
                }
            }
            case POSTFIX_DEREF -> {
                consume(parser);
                // ->@* ->%* ->$* ->&* ->** ->$#*
                return new OperatorNode("->" + next.text, left, parser.spanFrom(start));
            }
            case SIGIL -> {
                // ->@[ ... ] and ->@{ ... } slices
                consume(parser);
                Node deref = new OperatorNode(next.text, left, parser.spanFrom(start));
                LexerToken open = peek(parser);
                if (open.isOperator("[")) {
                    result = new BinaryOperatorNode("[", deref,
                            ListParser.parseDelimitedList(parser, "[", "]"), parser.spanFrom(start));
                } else if (open.isOperator("{")) {
                    result = new BinaryOperatorNode("{", deref, parseHashSubscript(parser), parser.spanFrom(start));
                } else {
                    throw arrowError(open);
                }
            }
            case IDENTIFIER, KEYWORD -> {
                consume(parser);
                Node method = new IdentifierNode(next.text, next.span);
                return methodCall(parser, left, method, start);
            }
            case SCALAR -> {
                // $obj->$method(...)
                Node method = ParsePrimary.parseSimpleVariable(parser);
                return methodCall(parser, left, method, start);
            }
            default -> throw arrowError(next);
        }
        return parseSubscriptChain(parser, result, start);
    }

    private static Node methodCall(Parser parser, Node invocant, Node method, int start) {
        int callStart = method.getLocation().start();
        ListNode arguments;
        if (peek(parser).isOperator("(")) {
            arguments = ListParser.parseParenList(parser);
        } else {
            arguments = new ListNode(List.of(), parser.spanFrom(callStart));
        }
        Node call = new BinaryOperatorNode("(", method, arguments, parser.spanFrom(callStart));
        return new BinaryOperatorNode("->", invocant, call, parser.spanFrom(start));
    }

    private static PerlSyntaxException arrowError(LexerToken token) {
        return new PerlSyntaxException(new ParseError(
                "syntax error: expected method name or subscript after '->', found " + TokenUtils.describe(token),
                token.span).withExpected(List.of("method name", "[", "{", "(")).withFound(TokenUtils.describe(token)));
    }

    /**
     * Parses the implicit-arrow subscripts that may follow a subscript:
     * {@code $x->[0]{key}[1]} and {@code $h{code}->()(1)}.
     */
    static Node parseSubscriptChain(Parser parser, Node node, int start) {
        while (true) {
            LexerToken next = peek(parser);
            if (next.isOperator("[")) {
                node = new BinaryOperatorNode("->[", node,
                        ListParser.parseDelimitedList(parser, "[", "]"), parser.spanFrom(start));
            } else if (next.isOperator("{")) {
                node = new BinaryOperatorNode("->{", node, parseHashSubscript(parser), parser.spanFrom(start));
            } else if (next.isOperator("(") && isAdjacent(parser)) {
                node = new BinaryOperatorNode("->(", node, ListParser.parseParenList(parser), parser.spanFrom(start));
            } else {
                return node;
            }
        }
    }

    /**
     * Parses {@code { KEY }}. A lone bareword, or a bareword with a leading minus, is
     * autoquoted.
     */
    static ListNode parseHashSubscript(Parser parser) {
        parser.options.logDebug("parseHashSubscript start");
        LexerToken first = peek(parser, 1);
        LexerToken second = peek(parser, 2);
        if (first.isWord() && second.isOperator("}")) {
            int start = parser.nextStart();
            consume(parser);
            consume(parser);
            consume(parser);
            return new ListNode(List.of(new StringNode(first.text, "", false, first.span)), parser.spanFrom(start));
        }
        if (first.isOperator("-") && second.isWord() && peek(parser, 3).isOperator("}")) {
            int start = parser.nextStart();
            consume(parser);
            consume(parser);
            consume(parser);
            consume(parser);
            return new ListNode(List.of(new StringNode("-" + second.text, "", false, first.span.merge(second.span))),
                    parser.spanFrom(start));
        }
        return ListParser.parseDelimitedList(parser, "{", "}");
    }

    /**
     * True when the next token touches the previous one, with no whitespace between.
     */
    static boolean isAdjacent(Parser parser) {
        LexerToken last = parser.getLastConsumed();
        return last != null && last.span.end() == peek(parser).span.start();
    }
}

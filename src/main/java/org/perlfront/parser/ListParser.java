package org.perlfront.parser;

import org.perlfront.astnode.ListNode;
import org.perlfront.astnode.Node;
import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.perlfront.parser.TokenUtils.consume;
import static org.perlfront.parser.TokenUtils.peek;

/**
 * Parses comma separated lists between delimiters and the argument lists of list operators.
 */
public class ListParser {

    /**
     * Parses {@code ( LIST )}. The result is marked with the "parens" annotation so that
     * an enclosing comma does not flatten it.
     */
    public static ListNode parseParenList(Parser parser) {
        ListNode list = parseDelimitedList(parser, "(", ")");
        list.setAnnotation("parens", true);
        return list;
    }

    /**
     * Parses a list between {@code open} and {@code close}, consuming both. An empty list
     * is allowed.
     */
    public static ListNode parseDelimitedList(Parser parser, String open, String close) {
        int start = parser.nextStart();
        parser.enterDepth();
        try {
            consume(parser, LexerTokenType.OPERATOR, open);
            List<Node> elements = new ArrayList<>();
            if (!peek(parser).isOperator(close)) {
                addElements(elements, parser.parseExpression(0));
            }
            consume(parser, LexerTokenType.OPERATOR, close);
            return new ListNode(elements, parser.spanFrom(start));
        } finally {
            parser.exitDepth();
        }
    }

    /**
     * Parses the arguments of a list operator called without parentheses, as in
     * {@code push @a, 1, 2}. Stops before the low precedence word operators.
     */
    public static ListNode parseBareArguments(Parser parser) {
        int start = parser.nextStart();
        List<Node> elements = new ArrayList<>();
        if (looksLikeArgument(peek(parser))) {
            addElements(elements, parser.parseExpression(ParserTables.LIST_OPERATOR_PRECEDENCE));
        }
        return new ListNode(elements, parser.spanFrom(start));
    }

    /**
     * True when the token can begin the argument list of a list operator.
     */
    static boolean looksLikeArgument(LexerToken token) {
        if (Parser.isExpressionTerminator(token)) {
            return false;
        }
        if (token.type == LexerTokenType.OPERATOR) {
            return !ParserTables.LIST_TERMINATORS.contains(token.text)
                    && !token.text.equals(",") && !token.text.equals("=>")
                    && (!ParseInfix.isInfixOperator(token) || ParsePrimary.PREFIX_OPERATORS.contains(token.text));
        }
        return true;
    }

    static void addElements(List<Node> elements, Node expression) {
        if (expression instanceof ListNode list && list.handle == null && !list.getBooleanAnnotation("parens")) {
            elements.addAll(list.elements);
        } else {
            elements.add(expression);
        }
    }
}

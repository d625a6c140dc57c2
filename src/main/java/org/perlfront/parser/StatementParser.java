package org.perlfront.parser;

import org.perlfront.astnode.For1Node;
import org.perlfront.astnode.For3Node;
import org.perlfront.astnode.GivenWhenNode;
import org.perlfront.astnode.IfNode;
import org.perlfront.astnode.ListNode;
import org.perlfront.astnode.Node;
import org.perlfront.astnode.OperatorNode;
import org.perlfront.astnode.PackageNode;
import org.perlfront.astnode.TryNode;
import org.perlfront.astnode.UseNode;
import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.LexerTokenType;
import org.perlfront.recovery.ParseError;
import org.perlfront.recovery.PerlSyntaxException;

import java.util.ArrayList;
import java.util.List;

import static org.perlfront.parser.TokenUtils.consume;
import static org.perlfront.parser.TokenUtils.peek;

/**
 * The StatementParser class is responsible for parsing the compound statements:
 * conditionals, loops, package and class declarations, use and no, try and the
 * given/when forms.
 */
public class StatementParser {

    /**
     * Parses a while or until statement.
     *
     * @param parser The Parser instance
     * @return A For3Node with only a condition; {@code while ()} has a null condition
     */
    public static Node parseWhileStatement(Parser parser) {
        LexerToken operator = consume(parser); // "while" "until"
        int start = operator.span.start();

        Node condition = parseCondition(parser, true);
        Node body = ParseBlock.parseRequiredBlock(parser);
        Node continueNode = parseContinueBlock(parser);

        return new For3Node(operator.text, null, condition, null, body, continueNode, parser.spanFrom(start));
    }

    /**
     * Parses a for or foreach statement, in either the list form or the C-style form.
     *
     * @param parser The Parser instance
     * @return A For1Node or For3Node representing the loop
     */
    public static Node parseForStatement(Parser parser) {
        LexerToken keyword = consume(parser); // "for" or "foreach"
        int start = keyword.span.start();

        // Parse optional loop variable
        Node variable = parseLoopVariable(parser);

        consume(parser, LexerTokenType.OPERATOR, "(");
        Node initialization = null;
        LexerToken token = peek(parser);
        if (token.isOperator(")")) {
            initialization = new ListNode(List.of(), parser.spanFrom(token.span.start()));
        } else if (!token.isOperator(";")) {
            initialization = parser.parseExpression(0);
        }

        if (peek(parser).isOperator(")")) {
            consume(parser);
            Node body = ParseBlock.parseRequiredBlock(parser);
            Node continueNode = parseContinueBlock(parser);
            return new For1Node(variable, initialization, body, continueNode, parser.spanFrom(start));
        }

        // C-style loop
        if (variable != null) {
            throw new PerlSyntaxException(new ParseError("syntax error: a C-style for loop has no loop variable",
                    variable.getLocation()));
        }
        consume(parser, LexerTokenType.OPERATOR, ";");
        Node condition = null;
        if (!peek(parser).isOperator(";")) {
            condition = parser.parseExpression(0);
        }
        consume(parser, LexerTokenType.OPERATOR, ";");
        Node increment = null;
        if (!peek(parser).isOperator(")")) {
            increment = parser.parseExpression(0);
        }
        consume(parser, LexerTokenType.OPERATOR, ")");
        Node body = ParseBlock.parseRequiredBlock(parser);

        // 3-argument for doesn't have a continue block
        return new For3Node("for", initialization, condition, increment, body, null, parser.spanFrom(start));
    }

    /**
     * {@code my $x}, {@code our $x}, {@code state $x}, {@code $x} or the multi-variable
     * {@code my ($k, $v)}. Returns null when the loop uses {@code $_}.
     */
    private static Node parseLoopVariable(Parser parser) {
        LexerToken token = peek(parser);
        if (token.isWord("my") || token.isWord("our") || token.isWord("state")) {
            consume(parser);
            LexerToken next = peek(parser);
            Node variable;
            if (next.type == LexerTokenType.SCALAR) {
                variable = ParsePrimary.parseSimpleVariable(parser);
            } else if (next.isOperator("(")) {
                variable = ListParser.parseParenList(parser);
            } else {
                variable = parser.recovery.missingIdentifier();
            }
            return new OperatorNode(token.text, variable, parser.spanFrom(token.span.start()));
        }
        if (token.type == LexerTokenType.SCALAR) {
            return ParsePrimary.parseSimpleVariable(parser);
        }
        return null;
    }

    /**
     * Parses an if, unless, or elsif statement.
     *
     * @param parser The Parser instance
     * @return An IfNode representing the if/unless/elsif statement
     */
    public static Node parseIfStatement(Parser parser) {
        LexerToken operator = consume(parser); // "if", "unless", "elsif"
        int start = operator.span.start();
        Node condition = parseCondition(parser, false);
        Node thenBranch = ParseBlock.parseRequiredBlock(parser);
        Node elseBranch = null;
        LexerToken token = peek(parser);
        if (token.isWord("else")) {
            consume(parser);
            elseBranch = ParseBlock.parseRequiredBlock(parser);
        } else if (token.isWord("elsif")) {
            parser.enterDepth();
            try {
                elseBranch = parseIfStatement(parser);
            } finally {
                parser.exitDepth();
            }
        }
        return new IfNode(operator.text, condition, thenBranch, elseBranch, parser.spanFrom(start));
    }

    /**
     * Parses {@code ( EXPR )}. An empty condition is null where {@code allowEmpty} is set
     * and a missing expression otherwise.
     */
    private static Node parseCondition(Parser parser, boolean allowEmpty) {
        consume(parser, LexerTokenType.OPERATOR, "(");
        Node condition;
        if (peek(parser).isOperator(")")) {
            condition = allowEmpty ? null : parser.recovery.missingExpression();
        } else {
            condition = parser.parseExpression(0);
        }
        consume(parser, LexerTokenType.OPERATOR, ")");
        return condition;
    }

    private static Node parseContinueBlock(Parser parser) {
        if (peek(parser).isWord("continue")) {
            consume(parser);
            return ParseBlock.parseRequiredBlock(parser);
        }
        return null;
    }

    /**
     * Parses a try statement. Both {@code catch ($e) BLOCK} and {@code finally BLOCK}
     * are optional; a catch without a parameter, as Try::Tiny writes it, is accepted too.
     *
     * @param parser The Parser instance
     * @return A TryNode representing the try-catch-finally statement
     */
    public static Node parseTryStatement(Parser parser) {
        LexerToken keyword = consume(parser); // "try"
        int start = keyword.span.start();

        Node tryBlock = ParseBlock.parseRequiredBlock(parser);

        Node catchParameter = null;
        Node catchBlock = null;
        if (peek(parser).isWord("catch")) {
            consume(parser);
            if (peek(parser).isOperator("(")) {
                consume(parser);
                catchParameter = peek(parser).type == LexerTokenType.SCALAR
                        ? ParsePrimary.parseSimpleVariable(parser)
                        : parser.recovery.missingIdentifier();
                consume(parser, LexerTokenType.OPERATOR, ")");
            }
            catchBlock = ParseBlock.parseRequiredBlock(parser);
        }

        Node finallyBlock = null;
        if (peek(parser).isWord("finally")) {
            consume(parser);
            finallyBlock = ParseBlock.parseRequiredBlock(parser);
        }
        TokenUtils.consumeIf(parser, ";");
        return new TryNode(tryBlock, catchParameter, catchBlock, finallyBlock, parser.spanFrom(start));
    }

    /**
     * Parses {@code given (EXPR) BLOCK}, {@code when (EXPR) BLOCK} and {@code default BLOCK}.
     */
    public static Node parseGivenWhen(Parser parser) {
        LexerToken keyword = consume(parser);
        int start = keyword.span.start();
        Node expression = null;
        if (!keyword.text.equals("default")) {
            expression = parseCondition(parser, false);
        }
        Node block = ParseBlock.parseRequiredBlock(parser);
        return new GivenWhenNode(keyword.text, expression, block, parser.spanFrom(start));
    }

    /**
     * Parses a use or no declaration.
     * <p>
     * {@code use VERSION}, {@code use Module}, {@code use Module VERSION} and
     * {@code use Module VERSION LIST} are recognized; {@code use Module ()} keeps its
     * empty list so that it can be told apart from {@code use Module}.
     *
     * @param parser The Parser instance
     * @return A UseNode representing the use/no declaration
     */
    public static Node parseUseDeclaration(Parser parser) {
        LexerToken keyword = consume(parser); // "use" "no"
        int start = keyword.span.start();
        parser.options.logDebug("use: " + keyword.text);

        String module = null;
        String version = null;
        Node arguments = null;

        LexerToken token = peek(parser);
        if (isVersion(token)) {
            // use 5.036; use v5.36;
            version = consume(parser).text;
        } else if (token.isWord()) {
            module = consume(parser).text;
            token = peek(parser);
            if (isVersion(token) && !peek(parser, 1).isOperator(",") && !peek(parser, 1).isOperator("=>")) {
                version = consume(parser).text;
            }
            if (!Parser.isExpressionTerminator(peek(parser))) {
                arguments = parser.parseExpression(0);
            }
        } else {
            throw TokenUtils.syntaxError(parser, "syntax error: expected module name or version after '"
                    + keyword.text + "', found " + TokenUtils.describe(token));
        }
        Node node = new UseNode(keyword.text, module, version, arguments, parser.spanFrom(start));
        return ParseStatement.finishSimpleStatement(parser, node);
    }

    private static boolean isVersion(LexerToken token) {
        return token.type == LexerTokenType.VERSION || token.type == LexerTokenType.INTEGER
                || token.type == LexerTokenType.FLOAT;
    }

    /**
     * Parses a package or class declaration, with an optional version, class attributes
     * and an optional block.
     *
     * @param parser The Parser instance
     * @return A PackageNode
     */
    public static Node parsePackageDeclaration(Parser parser) {
        LexerToken keyword = consume(parser); // "package" "class"
        int start = keyword.span.start();

        LexerToken nameToken = peek(parser);
        if (!nameToken.isWord()) {
            throw TokenUtils.syntaxError(parser, "syntax error: expected package name after '" + keyword.text
                    + "', found " + TokenUtils.describe(nameToken));
        }
        consume(parser);
        String name = nameToken.text;

        String version = null;
        if (isVersion(peek(parser))) {
            version = consume(parser).text;
        }

        List<String> attributes = new ArrayList<>();
        if (keyword.text.equals("class") && (peek(parser).isOperator(":")
                || peek(parser).type == LexerTokenType.ATTRIBUTE)) {
            attributes = SubroutineParser.parseAttributes(parser);
        }

        if (peek(parser).isOperator("{")) {
            Node block = ParseBlock.parseBlock(parser);
            return new PackageNode(keyword.text, name, version, attributes, block, parser.spanFrom(start));
        }
        Node node = new PackageNode(keyword.text, name, version, attributes, null, parser.spanFrom(start));
        return ParseStatement.finishSimpleStatement(parser, node);
    }
}

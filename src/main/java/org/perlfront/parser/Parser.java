package org.perlfront.parser;

import org.perlfront.astnode.BlockNode;
import org.perlfront.astnode.HeredocNode;
import org.perlfront.astnode.Node;
import org.perlfront.astnode.NodeIdGenerator;
import org.perlfront.astvisitor.ChildCollector;
import org.perlfront.lexer.Lexer;
import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.LexerTokenType;
import org.perlfront.lexer.SourceText;
import org.perlfront.lexer.Span;
import org.perlfront.recovery.BudgetTracker;
import org.perlfront.recovery.ErrorRecovery;
import org.perlfront.recovery.ParseError;
import org.perlfront.recovery.PerlSyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.perlfront.parser.TokenUtils.peek;

/**
 * The Parser class turns the token stream of one source text into a syntax tree.
 * It handles operator precedence, associativity, and error recovery.
 * <p>
 * Tokens are pulled from the {@link Lexer} on demand and held in a small lookahead
 * buffer, so the lexer keeps tracking slash context and heredoc bodies as it goes.
 * A Parser instance parses its input once.
 */
public class Parser {

    public final ParserOptions options;
    public final SourceText source;
    public final ErrorRecovery recovery;

    private final Lexer lexer;
    // Tokens produced by the lexer but not consumed yet
    private final List<LexerToken> lookahead = new ArrayList<>();
    // Heredocs seen so far, checked for a terminator once the input is exhausted
    private final List<HeredocNode> heredocNodes = new ArrayList<>();
    private LexerToken lastConsumed;
    private int consumedCount;
    private boolean parsed;

    public Parser(String code) {
        this(code, new ParserOptions());
    }

    public Parser(String code, ParserOptions options) {
        this(new SourceText(code), options);
    }

    public Parser(SourceText source, ParserOptions options) {
        this.options = options;
        this.source = source;
        this.lexer = new Lexer(source, options.statistics);
        this.recovery = new ErrorRecovery(new ErrorRecovery.TokenCursor() {
            @Override
            public LexerToken current() {
                return peekToken(0);
            }

            @Override
            public void advance() {
                nextToken();
            }
        }, source, options.budget, options::logDebug);
    }

    public static boolean isExpressionTerminator(LexerToken token) {
        return token.type == LexerTokenType.EOF
                || (token.type == LexerTokenType.OPERATOR || token.type == LexerTokenType.KEYWORD)
                && ParserTables.TERMINATORS.contains(token.text);
    }

    /**
     * Parses the whole input.
     *
     * @return the program tree and the errors found; never throws on malformed input
     */
    public ParseResult parse() {
        if (parsed) {
            throw new IllegalStateException("Parser instances parse their input once");
        }
        parsed = true;
        BlockNode program = ParseBlock.parseProgram(this);
        ParseHeredoc.reportUnterminated(this);
        int count = assignIds(program);
        options.logDebug("parse finished: " + count + " nodes, " + recovery.getTracker());
        return new ParseResult(program, recovery.getErrors(), recovery.getTracker(), source, options.fileName);
    }

    /**
     * Retrieves the precedence of the given operator.
     *
     * @param operator The operator to check.
     * @return The precedence level of the operator.
     */
    public int getPrecedence(String operator) {
        return ParserTables.precedenceMap.getOrDefault(operator, 24);
    }

    /**
     * Parses an expression based on operator precedence.
     * <p>
     * Higher precedence means tighter: `*` has higher precedence than `+`
     * <p>
     * Explanation of the  <a href="https://en.wikipedia.org/wiki/Operator-precedence_parser">precedence climbing method</a>
     * can be found in Wikipedia.
     * </p>
     *
     * @param precedence The precedence level of the current expression.
     * @return The root node of the parsed expression.
     */
    public Node parseExpression(int precedence) {
        enterDepth();
        try {
            // First, parse the primary expression (like a number or a variable).
            Node left = ParsePrimary.parsePrimary(this);

            while (true) {
                LexerToken token = peek(this);
                if (isExpressionTerminator(token) || !ParseInfix.isInfixOperator(token)) {
                    break;
                }

                int tokenPrecedence = getPrecedence(token.text);
                if (tokenPrecedence <= precedence) {
                    break;
                }

                // Right associative operators (like exponentiation) parse their right side with lower precedence.
                if (ParserTables.RIGHT_ASSOC_OP.contains(token.text)) {
                    options.logDebug("parseExpression `" + token.text + "` precedence: " + tokenPrecedence + " right assoc");
                    left = ParseInfix.parseInfixOperation(this, left, tokenPrecedence - 1);
                } else {
                    options.logDebug("parseExpression `" + token.text + "` precedence: " + tokenPrecedence + " left assoc");
                    left = ParseInfix.parseInfixOperation(this, left, tokenPrecedence);
                }
            }
            return left;
        } finally {
            exitDepth();
        }
    }

    /**
     * Enters one nesting level. Throws once the level would pass the budget's maximum
     * depth; callers must pair a successful call with {@link #exitDepth()}.
     */
    void enterDepth() {
        BudgetTracker tracker = recovery.getTracker();
        if (tracker.depthWouldExceed(options.budget)) {
            LexerToken token = peek(this);
            options.logDebug("depth limit reached at " + token.span);
            throw new PerlSyntaxException(new ParseError("Nesting depth limit exceeded: "
                    + (tracker.getCurrentDepth() + 1) + " > " + options.budget.maxDepth(), token.span));
        }
        tracker.enterDepth();
    }

    void exitDepth() {
        recovery.getTracker().exitDepth();
    }

    // ------------------------------------------------------------------
    // Token stream

    LexerToken peekToken(int offset) {
        while (lookahead.size() <= offset) {
            lookahead.add(lexer.nextToken());
        }
        return lookahead.get(offset);
    }

    /**
     * Consumes the next token. At the end of input the EOF token is returned again
     * and again without being consumed.
     */
    LexerToken nextToken() {
        LexerToken token = peekToken(0);
        if (token.type != LexerTokenType.EOF) {
            lookahead.remove(0);
            lastConsumed = token;
            consumedCount++;
        }
        return token;
    }

    int getConsumedCount() {
        return consumedCount;
    }

    LexerToken getLastConsumed() {
        return lastConsumed;
    }

    /**
     * Span from {@code start} to the end of the last consumed token.
     */
    Span spanFrom(int start) {
        int end = lastConsumed == null ? start : lastConsumed.span.end();
        return new Span(start, Math.max(start, end));
    }

    int nextStart() {
        return peek(this).span.start();
    }

    void registerHeredoc(HeredocNode node) {
        heredocNodes.add(node);
    }

    List<HeredocNode> getHeredocNodes() {
        return heredocNodes;
    }

    // Pre-order numbering; iterative so deep trees cannot exhaust the stack
    private static int assignIds(Node root) {
        NodeIdGenerator ids = new NodeIdGenerator();
        Deque<Node> work = new ArrayDeque<>();
        work.push(root);
        while (!work.isEmpty()) {
            Node node = work.pop();
            node.setId(ids.next());
            List<Node> children = ChildCollector.childrenOf(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                work.push(children.get(i));
            }
        }
        return ids.count();
    }
}

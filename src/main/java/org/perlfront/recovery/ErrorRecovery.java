package org.perlfront.recovery;

import org.perlfront.astnode.ErrorNode;
import org.perlfront.astnode.Node;
import org.perlfront.astnode.NodeKind;
import org.perlfront.astnode.SyntheticNode;
import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.LexerTokenType;
import org.perlfront.lexer.SourceText;
import org.perlfront.lexer.Span;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Turns grammar failures into tree nodes and moves the token cursor to a point
 * where parsing can resume.
 *
 * <p>Every skip is charged against one {@link BudgetTracker}, so no sequence of
 * recoveries can consume more than {@link ParseBudget#maxTokensSkipped()} tokens
 * or run more than {@link ParseBudget#maxRecoveries()} times.</p>
 */
public class ErrorRecovery {

    /**
     * The view of the token stream recovery needs.
     */
    public interface TokenCursor {
        LexerToken current();

        void advance();
    }

    public enum State {
        SCANNING,
        AT_SYNC_POINT,
        BUDGET_EXHAUSTED,
        REACHED_EOF
    }

    public static final SyncPoint[] DEFAULT_SYNC_POINTS = {SyncPoint.SEMICOLON, SyncPoint.CLOSE_BRACE, SyncPoint.KEYWORD};

    private final TokenCursor cursor;
    private final SourceText source;
    private final ParseBudget budget;
    private final BudgetTracker tracker = new BudgetTracker();
    private final Consumer<String> debugLog;
    private final List<ParseError> errors = new ArrayList<>();

    private State state = State.SCANNING;
    private RecoveryResult lastResult;
    // Set once the rest of the input was given up on; later errors are noise
    private boolean abandoned;

    public ErrorRecovery(TokenCursor cursor, SourceText source, ParseBudget budget, Consumer<String> debugLog) {
        this.cursor = cursor;
        this.source = source;
        this.budget = budget;
        this.debugLog = debugLog;
    }

    public void recordError(ParseError error) {
        if (abandoned) {
            return;
        }
        boolean store = !tracker.errorsExhausted(budget);
        tracker.recordError();
        if (store) {
            errors.add(error);
        }
        debugLog.accept("parse error: " + error);
    }

    public ErrorNode recoverWithNode(ParseError error) {
        return recoverWithNode(error, null);
    }

    /**
     * Records the error, builds the error node for it and synchronizes on the
     * default sync points.
     *
     * @param partial what was parsed of the failing construct, or null
     */
    public ErrorNode recoverWithNode(ParseError error, Node partial) {
        recordError(error);
        LexerToken token = cursor.current();
        Span span = token.type == LexerTokenType.EOF ? Span.at(token.span.start()) : token.span;
        if (partial != null) {
            span = span.merge(partial.getLocation());
        }
        ErrorNode node = new ErrorNode(error.getMessage(), error.getExpected(), partial, span);
        lastResult = synchronize(DEFAULT_SYNC_POINTS);
        return node;
    }

    /**
     * Records an error that needs no skipping and returns the node that marks it in
     * the tree, spanning the error's location.
     */
    public ErrorNode errorNode(ParseError error) {
        recordError(error);
        return new ErrorNode(error.getMessage(), error.getExpected(), null, error.getLocation());
    }

    /**
     * Skips tokens until one matches a sync point. Always consumes at least one
     * token unless it returns without skipping.
     */
    public RecoveryResult synchronize(SyncPoint... syncPoints) {
        Set<SyncPoint> points = syncPoints.length == 0
                ? EnumSet.noneOf(SyncPoint.class)
                : EnumSet.copyOf(Arrays.asList(syncPoints));
        state = State.SCANNING;
        if (atSyncPoint(points)) {
            state = State.AT_SYNC_POINT;
            return RecoveryResult.AT_SYNC_POINT;
        }
        if (atEof()) {
            state = State.REACHED_EOF;
            return RecoveryResult.reachedEof(0);
        }
        if (!tracker.beginRecovery(budget)) {
            debugLog.accept("recovery budget exhausted: " + tracker);
            state = State.BUDGET_EXHAUSTED;
            return RecoveryResult.budgetExhausted(0);
        }
        int skipped = 0;
        while (true) {
            if (!tracker.canSkipMore(budget, 1)) {
                debugLog.accept("skip budget exhausted after " + skipped + " tokens");
                state = State.BUDGET_EXHAUSTED;
                return RecoveryResult.budgetExhausted(skipped);
            }
            cursor.advance();
            tracker.recordSkip(1);
            skipped++;
            if (atSyncPoint(points)) {
                debugLog.accept("recovered after skipping " + skipped + " tokens");
                state = State.AT_SYNC_POINT;
                return RecoveryResult.recovered(skipped);
            }
            if (atEof()) {
                state = State.REACHED_EOF;
                return RecoveryResult.reachedEof(skipped);
            }
        }
    }

    /**
     * Handles a statement followed directly by the start of another one. Nothing is
     * skipped; the statement survives as the partial of the returned node.
     */
    public ErrorNode recoverMissingSemicolon(Node statement) {
        Span location = Span.at(statement.getLocation().end());
        ParseError error = new ParseError("Missing semicolon", location)
                .withExpected(List.of(";"))
                .withFound(describe(cursor.current()))
                .withHint("Add a semicolon to end the statement");
        recordError(error);
        return new ErrorNode(error.getMessage(), error.getExpected(), statement, statement.getLocation());
    }

    public SyntheticNode missingExpression() {
        return missing(NodeKind.MISSING_EXPRESSION, "Expected expression", "expression");
    }

    public SyntheticNode missingStatement() {
        return missing(NodeKind.MISSING_STATEMENT, "Expected statement", "statement");
    }

    public SyntheticNode missingIdentifier() {
        return missing(NodeKind.MISSING_IDENTIFIER, "Expected identifier", "identifier");
    }

    public SyntheticNode missingBlock() {
        return missing(NodeKind.MISSING_BLOCK, "Expected block", "{");
    }

    private SyntheticNode missing(NodeKind kind, String message, String expected) {
        LexerToken token = cursor.current();
        Span location = Span.at(token.span.start());
        recordError(new ParseError(message + ", found " + describe(token), location)
                .withExpected(List.of(expected))
                .withFound(describe(token)));
        return new SyntheticNode(kind, "", location);
    }

    /**
     * Consumes everything up to the end of input and wraps it in one node. Errors
     * reported after this point are dropped.
     */
    public SyntheticNode unknownRest() {
        int start = cursor.current().span.start();
        int end = start;
        while (!atEof()) {
            end = cursor.current().span.end();
            cursor.advance();
        }
        end = Math.max(end, start);
        Span span = new Span(start, end);
        debugLog.accept("giving up on the rest of the input at " + span);
        abandoned = true;
        state = State.BUDGET_EXHAUSTED;
        return new SyntheticNode(NodeKind.UNKNOWN_REST, source.slice(span), span);
    }

    private boolean atSyncPoint(Set<SyncPoint> points) {
        LexerToken token = cursor.current();
        for (SyncPoint point : points) {
            if (point.matches(token)) {
                return true;
            }
        }
        return false;
    }

    private boolean atEof() {
        return cursor.current().type == LexerTokenType.EOF;
    }

    static String describe(LexerToken token) {
        return token.type == LexerTokenType.EOF ? "end of file" : "'" + token.text + "'";
    }

    public List<ParseError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public BudgetTracker getTracker() {
        return tracker;
    }

    public ParseBudget getBudget() {
        return budget;
    }

    public State getState() {
        return state;
    }

    public RecoveryResult getLastResult() {
        return lastResult;
    }

    public boolean isAbandoned() {
        return abandoned;
    }
}

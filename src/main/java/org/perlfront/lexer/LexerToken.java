package org.perlfront.lexer;

import org.perlfront.heredoc.PendingHeredoc;

/**
 * A lexical token together with its location in the source.
 *
 * <p>{@code text} is always the exact source slice of {@code span}. Quote-like tokens
 * carry their decoded pieces in {@code quote}, heredoc placeholders carry the
 * pending declaration, and error tokens carry a message.</p>
 */
public class LexerToken {
    public LexerTokenType type;
    public String text;
    public Span span;

    /**
     * True when at least one newline separates this token from the previous one.
     */
    public boolean newlineBefore;

    public QuoteParts quote;
    public PendingHeredoc heredoc;
    public String errorMessage;

    public LexerToken(LexerTokenType type, String text, Span span) {
        this.type = type;
        this.text = text;
        this.span = span;
    }

    public boolean is(LexerTokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isOperator(String text) {
        return is(LexerTokenType.OPERATOR, text);
    }

    /**
     * Identifiers and keywords are both words; the parser dispatches on their text.
     */
    public boolean isWord() {
        return type == LexerTokenType.IDENTIFIER || type == LexerTokenType.KEYWORD;
    }

    public boolean isWord(String text) {
        return isWord() && this.text.equals(text);
    }

    @Override
    public String toString() {
        return "LexerToken{" + "type=" + type + ", text='" + text + '\'' + ", span=" + span + '}';
    }
}

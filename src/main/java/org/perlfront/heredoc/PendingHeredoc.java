package org.perlfront.heredoc;

import org.perlfront.lexer.Span;

/**
 * A heredoc declaration ({@code <<"EOF"}, {@code <<~EOF}, ...) whose body has not been
 * read yet. The lexer queues these in source order and resolves them once the line
 * holding the declarations ends.
 */
public class PendingHeredoc {

    public enum QuoteKind {
        UNQUOTED,
        SINGLE,
        DOUBLE,
        /** {@code <<`CMD`} */
        COMMAND
    }

    private final String label;
    private final boolean allowIndent;
    private final QuoteKind quoteKind;
    private final Span declarationSpan;
    private HeredocContent content;

    public PendingHeredoc(String label, boolean allowIndent, QuoteKind quoteKind, Span declarationSpan) {
        this.label = label;
        this.allowIndent = allowIndent;
        this.quoteKind = quoteKind;
        this.declarationSpan = declarationSpan;
    }

    public String getLabel() {
        return label;
    }

    public boolean isAllowIndent() {
        return allowIndent;
    }

    public QuoteKind getQuoteKind() {
        return quoteKind;
    }

    /**
     * Whether the body interpolates variables. Only single-quoted labels suppress it.
     */
    public boolean isInterpolating() {
        return quoteKind != QuoteKind.SINGLE;
    }

    public Span getDeclarationSpan() {
        return declarationSpan;
    }

    /**
     * Body of the heredoc, or null while it has not been collected.
     */
    public HeredocContent getContent() {
        return content;
    }

    public boolean isResolved() {
        return content != null;
    }

    public void resolve(HeredocContent content) {
        if (this.content != null) {
            throw new IllegalStateException("Heredoc " + label + " already resolved");
        }
        this.content = content;
    }

    @Override
    public String toString() {
        return "PendingHeredoc{" + "label='" + label + '\'' + ", indent=" + allowIndent + ", quote=" + quoteKind + '}';
    }
}

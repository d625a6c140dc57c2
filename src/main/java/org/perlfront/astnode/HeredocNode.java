package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.heredoc.HeredocContent;
import org.perlfront.heredoc.PendingHeredoc;
import org.perlfront.lexer.Span;

/**
 * A heredoc operand. The node is created at the declaration, before the body has been
 * read; the body becomes available through {@link #getContent()} once the lexer has
 * passed the end of the declaring line.
 */
public class HeredocNode extends AbstractNode {
    public final PendingHeredoc heredoc;

    public HeredocNode(PendingHeredoc heredoc, Span location) {
        super(location);
        this.heredoc = heredoc;
    }

    public String getLabel() {
        return heredoc.getLabel();
    }

    /**
     * True unless the label was single-quoted.
     */
    public boolean isInterpolated() {
        return heredoc.isInterpolating();
    }

    public HeredocContent getContent() {
        return heredoc.getContent();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.HEREDOC;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

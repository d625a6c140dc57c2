package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * A statement preceded by {@code LABEL:}.
 */
public class LabelNode extends AbstractNode {
    public final String label;
    public final Node statement;

    public LabelNode(String label, Node statement, Span location) {
        super(location);
        this.label = label;
        this.statement = statement;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LABELED_STATEMENT;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

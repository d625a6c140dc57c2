package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * The For1Node class represents a list loop: {@code foreach my $x (LIST) BLOCK}.
 */
public class For1Node extends AbstractNode {
    /**
     * The loop variable, possibly wrapped in a declaration; null when the loop uses {@code $_}.
     */
    public final Node variable;

    public final Node list;

    public final Node body;

    /**
     * The {@code continue} block, or null.
     */
    public final Node continueBlock;

    public For1Node(Node variable, Node list, Node body, Node continueBlock, Span location) {
        super(location);
        this.variable = variable;
        this.list = list;
        this.body = body;
        this.continueBlock = continueBlock;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FOREACH;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

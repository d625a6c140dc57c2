package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * {@code try BLOCK catch ($e) BLOCK finally BLOCK}. The catch and finally parts are optional.
 */
public class TryNode extends AbstractNode {
    public final Node tryBlock;
    public final Node catchParameter;
    public final Node catchBlock;
    public final Node finallyBlock;

    public TryNode(Node tryBlock, Node catchParameter, Node catchBlock, Node finallyBlock, Span location) {
        super(location);
        this.tryBlock = tryBlock;
        this.catchParameter = catchParameter;
        this.catchBlock = catchBlock;
        this.finallyBlock = finallyBlock;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TRY;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

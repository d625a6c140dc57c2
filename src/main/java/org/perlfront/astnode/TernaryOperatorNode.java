package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * {@code condition ? trueExpr : falseExpr}
 */
public class TernaryOperatorNode extends AbstractNode {
    public final Node condition;
    public final Node trueExpr;
    public final Node falseExpr;

    public TernaryOperatorNode(Node condition, Node trueExpr, Node falseExpr, Span location) {
        super(location);
        this.condition = condition;
        this.trueExpr = trueExpr;
        this.falseExpr = falseExpr;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TERNARY;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

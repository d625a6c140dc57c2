package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * The IfNode class represents an "if", "unless" or "elsif" statement.
 */
public class IfNode extends AbstractNode {
    /**
     * The operator "if", "unless", "elsif"
     */
    public final String operator;

    public final Node condition;

    public final Node thenBranch;

    /**
     * The false branch; null, another IfNode for "elsif", or a block for "else".
     */
    public final Node elseBranch;

    public IfNode(String operator, Node condition, Node thenBranch, Node elseBranch, Span location) {
        super(location);
        this.operator = operator;
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    @Override
    public NodeKind getKind() {
        return operator.equals("unless") ? NodeKind.UNLESS : NodeKind.IF;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

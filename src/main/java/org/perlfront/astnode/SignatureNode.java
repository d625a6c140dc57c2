package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

import java.util.List;

/**
 * A subroutine signature: the parenthesised parameter list after the name.
 */
public class SignatureNode extends AbstractNode {
    public final List<ParameterNode> parameters;

    public SignatureNode(List<ParameterNode> parameters, Span location) {
        super(location);
        this.parameters = List.copyOf(parameters);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SIGNATURE;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

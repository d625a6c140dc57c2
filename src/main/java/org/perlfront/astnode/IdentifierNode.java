package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * A bareword: a function, package or filehandle name, or the name part of a variable.
 */
public class IdentifierNode extends AbstractNode {
    public final String name;

    public IdentifierNode(String name, Span location) {
        super(location);
        this.name = name;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IDENTIFIER;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

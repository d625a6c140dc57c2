package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * A numeric literal. The literal text is kept as written, underscores included.
 */
public class NumberNode extends AbstractNode {
    public final String value;

    public NumberNode(String value, Span location) {
        super(location);
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NUMBER;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

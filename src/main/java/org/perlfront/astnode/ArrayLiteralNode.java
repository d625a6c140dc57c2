package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

import java.util.List;

/**
 * Anonymous array constructor {@code [ ... ]}.
 */
public class ArrayLiteralNode extends AbstractNode {
    public final List<Node> elements;

    public ArrayLiteralNode(List<Node> elements, Span location) {
        super(location);
        this.elements = List.copyOf(elements);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ANON_ARRAY;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

import java.util.List;

/**
 * Anonymous hash constructor {@code { key => value, ... }}.
 */
public class HashLiteralNode extends AbstractNode {
    public final List<Node> elements;

    public HashLiteralNode(List<Node> elements, Span location) {
        super(location);
        this.elements = List.copyOf(elements);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ANON_HASH;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

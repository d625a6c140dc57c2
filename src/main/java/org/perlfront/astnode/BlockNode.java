package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

import java.util.List;

/**
 * The BlockNode class represents a sequence of statements: either a braced block or,
 * at the root of every parse, the whole program.
 */
public class BlockNode extends AbstractNode {
    /**
     * The statements of the block, in source order.
     */
    public final List<Node> elements;

    /**
     * True only for the root node returned by the parser.
     */
    public final boolean program;

    public BlockNode(List<Node> elements, boolean program, Span location) {
        super(location);
        this.elements = List.copyOf(elements);
        this.program = program;
    }

    @Override
    public NodeKind getKind() {
        return program ? NodeKind.PROGRAM : NodeKind.BLOCK;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

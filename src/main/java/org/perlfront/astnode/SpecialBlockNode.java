package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * A phase block: {@code BEGIN}, {@code END}, {@code INIT}, {@code CHECK} or {@code UNITCHECK}.
 */
public class SpecialBlockNode extends AbstractNode {
    public final String phase;
    public final Node block;

    public SpecialBlockNode(String phase, Node block, Span location) {
        super(location);
        this.phase = phase;
        this.block = block;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PHASE_BLOCK;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

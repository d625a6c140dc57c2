package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * A node inserted by error recovery where the source has nothing: a missing expression,
 * statement, identifier or block, or the unparsed rest of the input.
 */
public class SyntheticNode extends AbstractNode {
    private final NodeKind kind;

    /**
     * Source text covered by an UNKNOWN_REST node; null for the missing kinds.
     */
    public final String text;

    public SyntheticNode(NodeKind kind, String text, Span location) {
        super(location);
        if (!kind.isSynthetic() || kind == NodeKind.ERROR) {
            throw new IllegalArgumentException("Not a synthetic node kind: " + kind);
        }
        this.kind = kind;
        this.text = text;
    }

    @Override
    public NodeKind getKind() {
        return kind;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

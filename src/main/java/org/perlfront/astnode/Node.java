package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * A node of the syntax tree. Every node owns its children; nothing points back
 * to a parent (see {@link org.perlfront.astvisitor.ParentMap}).
 */
public interface Node {

    /**
     * Identifier unique within one parse, assigned in pre-order starting from 1.
     */
    int getId();

    void setId(int id);

    NodeKind getKind();

    /**
     * Byte range of the source text this node was built from.
     */
    Span getLocation();

    void accept(Visitor visitor);
}

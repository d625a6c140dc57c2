package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

import java.util.List;

/**
 * Placeholder for a construct that failed to parse. Keeps whatever had been parsed
 * before the failure in {@code partial}.
 */
public class ErrorNode extends AbstractNode {
    public final String message;
    public final List<String> expected;
    public final Node partial;

    public ErrorNode(String message, List<String> expected, Node partial, Span location) {
        super(location);
        this.message = message;
        this.expected = List.copyOf(expected);
        this.partial = partial;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ERROR;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

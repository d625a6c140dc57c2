package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

import java.util.List;

/**
 * A {@code format NAME =} declaration. The picture and argument lines are kept verbatim.
 */
public class FormatNode extends AbstractNode {
    public final String name;
    public final List<String> lines;

    public FormatNode(String name, List<String> lines, Span location) {
        super(location);
        this.name = name;
        this.lines = List.copyOf(lines);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FORMAT;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

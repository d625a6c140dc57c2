package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * One signature parameter.
 * <p>
 * {@code $x} is mandatory, {@code $x = 1} (or {@code //=}, {@code ||=}) is optional,
 * {@code @rest} and {@code %opts} are slurpy, {@code :$name} is named. A bare sigil is a
 * placeholder and has a null {@code name}.
 */
public class ParameterNode extends AbstractNode {
    public final NodeKind kind;
    public final char sigil;
    public final String name;
    public final String defaultOperator;
    public final Node defaultValue;

    public ParameterNode(NodeKind kind, char sigil, String name, String defaultOperator, Node defaultValue, Span location) {
        super(location);
        this.kind = kind;
        this.sigil = sigil;
        this.name = name;
        this.defaultOperator = defaultOperator;
        this.defaultValue = defaultValue;
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

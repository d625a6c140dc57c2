package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * A string literal. {@code value} is the raw body between the delimiters; escape
 * sequences and interpolation are left for later stages.
 */
public class StringNode extends AbstractNode {
    public final String value;

    /**
     * The quote form that produced the string: {@code '}, {@code "}, {@code q}, {@code qq},
     * {@code qx}, {@code `}, {@code v} for version strings, or empty for autoquoted barewords.
     */
    public final String operator;

    public final boolean interpolated;

    public StringNode(String value, String operator, boolean interpolated, Span location) {
        super(location);
        this.value = value;
        this.operator = operator;
        this.interpolated = interpolated;
    }

    @Override
    public NodeKind getKind() {
        if (operator.equals("v")) {
            return NodeKind.VERSION_STRING;
        }
        return interpolated ? NodeKind.INTERPOLATED_STRING : NodeKind.STRING;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

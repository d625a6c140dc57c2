package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * {@code given (EXPR) BLOCK}, {@code when (EXPR) BLOCK} and {@code default BLOCK}.
 */
public class GivenWhenNode extends AbstractNode {
    public final String keyword;
    /**
     * Topic or match expression; null for "default".
     */
    public final Node expression;
    public final Node block;

    public GivenWhenNode(String keyword, Node expression, Node block, Span location) {
        super(location);
        this.keyword = keyword;
        this.expression = expression;
        this.block = block;
    }

    @Override
    public NodeKind getKind() {
        return switch (keyword) {
            case "given" -> NodeKind.GIVEN;
            case "when" -> NodeKind.WHEN;
            default -> NodeKind.DEFAULT;
        };
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

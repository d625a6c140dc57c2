package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * The For3Node class represents a C-style {@code for (init; cond; step)} loop, and also
 * {@code while} and {@code until} loops, which only have a condition.
 */
public class For3Node extends AbstractNode {
    /**
     * "for", "while" or "until".
     */
    public final String keyword;

    public final Node initialization;
    public final Node condition;
    public final Node increment;
    public final Node body;
    public final Node continueBlock;

    public For3Node(String keyword, Node initialization, Node condition, Node increment, Node body,
                    Node continueBlock, Span location) {
        super(location);
        this.keyword = keyword;
        this.initialization = initialization;
        this.condition = condition;
        this.increment = increment;
        this.body = body;
        this.continueBlock = continueBlock;
    }

    @Override
    public NodeKind getKind() {
        return switch (keyword) {
            case "while" -> NodeKind.WHILE;
            case "until" -> NodeKind.UNTIL;
            default -> NodeKind.FOR;
        };
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

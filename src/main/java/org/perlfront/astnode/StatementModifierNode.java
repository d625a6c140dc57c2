package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * A simple statement with a trailing modifier: {@code STATEMENT if COND},
 * {@code STATEMENT for LIST} and so on. The statement is parsed first and then wrapped.
 */
public class StatementModifierNode extends AbstractNode {
    /**
     * "if", "unless", "while", "until", "for", "foreach" or "when".
     */
    public final String modifier;
    public final Node statement;
    public final Node condition;

    public StatementModifierNode(String modifier, Node statement, Node condition, Span location) {
        super(location);
        this.modifier = modifier;
        this.statement = statement;
        this.condition = condition;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STATEMENT_MODIFIER;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * A pattern operator: {@code m//} (or a bare {@code //}), {@code qr//}, {@code s///}
 * and {@code tr///} / {@code y///}.
 */
public class RegexNode extends AbstractNode {
    public final String operator;
    public final String pattern;
    /**
     * Replacement text of {@code s} and {@code tr}; null for the others.
     */
    public final String replacement;
    /**
     * Canonical modifier string.
     */
    public final String modifiers;

    public RegexNode(String operator, String pattern, String replacement, String modifiers, Span location) {
        super(location);
        this.operator = operator;
        this.pattern = pattern;
        this.replacement = replacement;
        this.modifiers = modifiers;
    }

    @Override
    public NodeKind getKind() {
        return switch (operator) {
            case "qr" -> NodeKind.REGEX;
            case "s" -> NodeKind.SUBSTITUTION;
            case "tr", "y" -> NodeKind.TRANSLITERATION;
            default -> NodeKind.MATCH;
        };
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

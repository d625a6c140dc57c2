package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

import java.util.List;

/**
 * The SubroutineNode class represents a named or anonymous subroutine, or a
 * {@code method} inside a class.
 */
public class SubroutineNode extends AbstractNode {
    /**
     * The subroutine name, or null for an anonymous sub.
     */
    public final String name;

    /**
     * "my", "our" or "state" for lexical subs; null otherwise.
     */
    public final String declarator;

    /**
     * The prototype text between the parentheses, or null.
     */
    public final String prototype;

    public final SignatureNode signature;

    /**
     * Attributes such as {@code lvalue} or {@code prototype($$)}, without the colon.
     */
    public final List<String> attributes;

    /**
     * The body; null for a forward declaration {@code sub name;}.
     */
    public final Node block;

    public final boolean method;

    public SubroutineNode(String name, String declarator, String prototype, SignatureNode signature,
                          List<String> attributes, Node block, boolean method, Span location) {
        super(location);
        this.name = name;
        this.declarator = declarator;
        this.prototype = prototype;
        this.signature = signature;
        this.attributes = List.copyOf(attributes);
        this.block = block;
        this.method = method;
    }

    @Override
    public NodeKind getKind() {
        if (method) {
            return NodeKind.METHOD;
        }
        return name == null ? NodeKind.ANON_SUB : NodeKind.SUBROUTINE;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

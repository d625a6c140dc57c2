package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * {@code use Module VERSION LIST;} and {@code no Module LIST;}.
 * {@code use v5.36;} has a version and no module.
 */
public class UseNode extends AbstractNode {
    public final String keyword;
    public final String module;
    public final String version;
    public final Node arguments;

    public UseNode(String keyword, String module, String version, Node arguments, Span location) {
        super(location);
        this.keyword = keyword;
        this.module = module;
        this.version = version;
        this.arguments = arguments;
    }

    @Override
    public NodeKind getKind() {
        return keyword.equals("no") ? NodeKind.NO : NodeKind.USE;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

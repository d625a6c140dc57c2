package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

import java.util.List;

/**
 * {@code package NAME VERSION;}, {@code package NAME { ... }} and the {@code class}
 * forms, which may carry attributes such as {@code :isa(Parent)}.
 */
public class PackageNode extends AbstractNode {
    /**
     * "package" or "class".
     */
    public final String keyword;
    public final String name;
    public final String version;
    public final List<String> attributes;
    /**
     * The block of the block form, or null when the declaration runs to the end of the scope.
     */
    public final Node block;

    public PackageNode(String keyword, String name, String version, List<String> attributes, Node block, Span location) {
        super(location);
        this.keyword = keyword;
        this.name = name;
        this.version = version;
        this.attributes = List.copyOf(attributes);
        this.block = block;
    }

    @Override
    public NodeKind getKind() {
        return keyword.equals("class") ? NodeKind.CLASS : NodeKind.PACKAGE;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

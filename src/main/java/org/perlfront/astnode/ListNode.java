package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * The ListNode class represents a comma-separated list, a parenthesised expression
 * or the argument list of a call.
 */
public class ListNode extends AbstractNode {
    public final List<Node> elements;

    /**
     * Optional filehandle or block for {@code print {$fh} LIST}, {@code sort BLOCK LIST}
     * and similar forms; null otherwise.
     */
    public final Node handle;

    public ListNode(List<Node> elements, Span location) {
        this(elements, null, location);
    }

    public ListNode(List<Node> elements, Node handle, Span location) {
        super(location);
        this.elements = List.copyOf(elements);
        this.handle = handle;
    }

    /**
     * Joins two operands of a comma into one flat list.
     */
    public static ListNode makeList(Node left, Node right, Span location) {
        List<Node> elements = new ArrayList<>();
        addFlattened(elements, left);
        if (right != null) {
            addFlattened(elements, right);
        }
        return new ListNode(elements, location);
    }

    private static void addFlattened(List<Node> elements, Node node) {
        if (node instanceof ListNode list && list.handle == null && !list.getBooleanAnnotation("parens")) {
            elements.addAll(list.elements);
        } else {
            elements.add(node);
        }
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LIST;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

import java.util.Set;

/**
 * The BinaryOperatorNode class represents an infix operation with a left and right operand.
 * <p>
 * Besides arithmetic and logical operators it models element access
 * ({@code "["}, {@code "{"}, {@code "->["}, {@code "->{"}), calls ({@code "("} with the
 * function name on the left, {@code "->("} for code references) and method calls
 * ({@code "->"} with a {@code "("} node on the right).
 */
public class BinaryOperatorNode extends AbstractNode {
    public static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "**=", "+=", "-=", "*=", "/=", ".=", "%=", "x=", "&=", "|=", "^=", "<<=", ">>=",
            "&&=", "||=", "//=", "^^=", "&.=", "|.=", "^.=");

    public final String operator;
    public final Node left;
    public final Node right;

    public BinaryOperatorNode(String operator, Node left, Node right, Span location) {
        super(location);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public NodeKind getKind() {
        if (ASSIGNMENT_OPERATORS.contains(operator)) {
            return NodeKind.ASSIGNMENT;
        }
        return switch (operator) {
            case "[", "{", "->[", "->{" -> NodeKind.SUBSCRIPT;
            case "(", "->(" -> NodeKind.FUNCTION_CALL;
            case "->" -> NodeKind.METHOD_CALL;
            default -> NodeKind.BINARY;
        };
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

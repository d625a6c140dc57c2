package org.perlfront.astnode;

import org.perlfront.astvisitor.Visitor;
import org.perlfront.lexer.Span;

/**
 * The OperatorNode class represents a unary or list operator and its operand.
 * <p>
 * It is also used for variables ({@code $} applied to an identifier), declarations
 * ({@code my} applied to a variable or list), named operators and builtin calls
 * ({@code print} applied to a list). {@link #getKind()} tells these apart.
 */
public class OperatorNode extends AbstractNode {
    /**
     * The operator represented by this node.
     */
    public final String operator;

    /**
     * The operand on which the operator is applied; can be a single node, a ListNode or null.
     */
    public final Node operand;

    public OperatorNode(String operator, Node operand, Span location) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    @Override
    public NodeKind getKind() {
        switch (operator) {
            case "$", "@", "%", "&", "$#":
                return operand instanceof IdentifierNode ? NodeKind.VARIABLE : NodeKind.DEREFERENCE;
            case "*":
                return operand instanceof IdentifierNode ? NodeKind.TYPEGLOB : NodeKind.DEREFERENCE;
            case "->$*", "->@*", "->%*", "->&*", "->**", "->$#*":
                return NodeKind.DEREFERENCE;
            case "my", "our", "state", "local":
                return NodeKind.VARIABLE_DECLARATION;
            case "field":
                return NodeKind.FIELD;
            case "readline":
                return NodeKind.READLINE;
            case "glob":
                return operand instanceof StringNode ? NodeKind.GLOB : NodeKind.FUNCTION_CALL;
            case "postfix++", "postfix--":
                return NodeKind.POSTFIX;
            case "!", "~", "~.", "\\", "unary-", "unary+", "not", "++", "--":
                return NodeKind.UNARY;
            case "return":
                return NodeKind.RETURN;
            case "last", "next", "redo", "goto", "dump":
                return NodeKind.LOOP_CONTROL;
            case "do":
                return operand instanceof BlockNode ? NodeKind.DO_BLOCK : NodeKind.FUNCTION_CALL;
            case "eval":
                return operand instanceof BlockNode ? NodeKind.EVAL_BLOCK : NodeKind.FUNCTION_CALL;
            case "defer":
                return NodeKind.DEFER;
            case "...":
                return NodeKind.YADA;
            case "__END__", "__DATA__":
                return NodeKind.DATA_SECTION;
            default:
                if (operator.length() == 2 && operator.charAt(0) == '-' && Character.isLetter(operator.charAt(1))) {
                    // file test such as -e or -d
                    return NodeKind.UNARY;
                }
                return NodeKind.FUNCTION_CALL;
        }
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}

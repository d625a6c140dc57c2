package org.perlfront.astvisitor;

import org.perlfront.astnode.*;

/**
 * Visitor over the syntax tree, one method per node class.
 */
public interface Visitor {
    void visit(BlockNode node);

    void visit(ListNode node);

    void visit(NumberNode node);

    void visit(StringNode node);

    void visit(IdentifierNode node);

    void visit(OperatorNode node);

    void visit(BinaryOperatorNode node);

    void visit(TernaryOperatorNode node);

    void visit(ArrayLiteralNode node);

    void visit(HashLiteralNode node);

    void visit(IfNode node);

    void visit(For1Node node);

    void visit(For3Node node);

    void visit(GivenWhenNode node);

    void visit(LabelNode node);

    void visit(StatementModifierNode node);

    void visit(TryNode node);

    void visit(SubroutineNode node);

    void visit(SignatureNode node);

    void visit(ParameterNode node);

    void visit(PackageNode node);

    void visit(UseNode node);

    void visit(SpecialBlockNode node);

    void visit(FormatNode node);

    void visit(RegexNode node);

    void visit(HeredocNode node);

    void visit(ErrorNode node);

    void visit(SyntheticNode node);
}

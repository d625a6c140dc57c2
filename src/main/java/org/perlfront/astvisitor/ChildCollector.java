package org.perlfront.astvisitor;

import org.perlfront.astnode.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the direct children of a node, in source order, skipping null slots.
 *
 * <pre>
 *   List&lt;Node&gt; children = ChildCollector.childrenOf(node);
 * </pre>
 */
public class ChildCollector implements Visitor {

    private final List<Node> children = new ArrayList<>();

    public static List<Node> childrenOf(Node node) {
        ChildCollector collector = new ChildCollector();
        node.accept(collector);
        return collector.children;
    }

    private void add(Node... nodes) {
        for (Node node : nodes) {
            if (node != null) {
                children.add(node);
            }
        }
    }

    @Override
    public void visit(BlockNode node) {
        children.addAll(node.elements);
    }

    @Override
    public void visit(ListNode node) {
        add(node.handle);
        children.addAll(node.elements);
    }

    @Override
    public void visit(NumberNode node) {
    }

    @Override
    public void visit(StringNode node) {
    }

    @Override
    public void visit(IdentifierNode node) {
    }

    @Override
    public void visit(OperatorNode node) {
        add(node.operand);
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        add(node.left, node.right);
    }

    @Override
    public void visit(TernaryOperatorNode node) {
        add(node.condition, node.trueExpr, node.falseExpr);
    }

    @Override
    public void visit(ArrayLiteralNode node) {
        children.addAll(node.elements);
    }

    @Override
    public void visit(HashLiteralNode node) {
        children.addAll(node.elements);
    }

    @Override
    public void visit(IfNode node) {
        add(node.condition, node.thenBranch, node.elseBranch);
    }

    @Override
    public void visit(For1Node node) {
        add(node.variable, node.list, node.body, node.continueBlock);
    }

    @Override
    public void visit(For3Node node) {
        add(node.initialization, node.condition, node.increment, node.body, node.continueBlock);
    }

    @Override
    public void visit(GivenWhenNode node) {
        add(node.expression, node.block);
    }

    @Override
    public void visit(LabelNode node) {
        add(node.statement);
    }

    @Override
    public void visit(StatementModifierNode node) {
        add(node.statement, node.condition);
    }

    @Override
    public void visit(TryNode node) {
        add(node.tryBlock, node.catchParameter, node.catchBlock, node.finallyBlock);
    }

    @Override
    public void visit(SubroutineNode node) {
        add(node.signature, node.block);
    }

    @Override
    public void visit(SignatureNode node) {
        children.addAll(node.parameters);
    }

    @Override
    public void visit(ParameterNode node) {
        add(node.defaultValue);
    }

    @Override
    public void visit(PackageNode node) {
        add(node.block);
    }

    @Override
    public void visit(UseNode node) {
        add(node.arguments);
    }

    @Override
    public void visit(SpecialBlockNode node) {
        add(node.block);
    }

    @Override
    public void visit(FormatNode node) {
    }

    @Override
    public void visit(RegexNode node) {
    }

    @Override
    public void visit(HeredocNode node) {
    }

    @Override
    public void visit(ErrorNode node) {
        add(node.partial);
    }

    @Override
    public void visit(SyntheticNode node) {
    }
}

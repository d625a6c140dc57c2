package org.perlfront.astvisitor;

import org.perlfront.astnode.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/*
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   node.accept(printVisitor);
 *   return printVisitor.getResult();
 *
 * Each visit prints its own header and schedules its children on an explicit work
 * stack; nothing recurses, whatever the depth of the tree.
 */
public class PrintVisitor implements Visitor {

    // A node to visit, or a label line when node is null
    private record Item(Node node, String text, int indent) {
    }

    private final StringBuilder sb = new StringBuilder();
    private final Deque<Item> work = new ArrayDeque<>();
    private final List<Item> scheduled = new ArrayList<>();
    private int indentLevel = 0;
    private boolean draining;

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    public String getResult() {
        return sb.toString();
    }

    private void header(AbstractNode node, String text) {
        appendIndent();
        sb.append(text).append("  pos:").append(node.location).append("\n");
    }

    private void line(String text) {
        appendIndent();
        sb.append(text).append("\n");
    }

    private void child(String label, Node node) {
        if (node == null) {
            return;
        }
        scheduled.add(new Item(null, label + ":", indentLevel + 1));
        scheduled.add(new Item(node, null, indentLevel + 2));
    }

    private void children(List<? extends Node> nodes) {
        for (Node node : nodes) {
            scheduled.add(new Item(node, null, indentLevel + 1));
        }
    }

    /**
     * Pushes the children scheduled by the current visit; the outermost call then
     * drains the work stack.
     */
    private void finish() {
        for (int i = scheduled.size() - 1; i >= 0; i--) {
            work.push(scheduled.get(i));
        }
        scheduled.clear();
        if (draining) {
            return;
        }
        draining = true;
        int rootIndent = indentLevel;
        try {
            while (!work.isEmpty()) {
                Item item = work.pop();
                indentLevel = item.indent();
                if (item.node() == null) {
                    line(item.text());
                } else {
                    item.node().accept(this);
                }
            }
        } finally {
            indentLevel = rootIndent;
            draining = false;
        }
    }

    private static String printable(String value) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                case '\r' -> out.append("\\r");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    @Override
    public void visit(BlockNode node) {
        header(node, node.program ? "Program:" : "BlockNode:");
        children(node.elements);
        finish();
    }

    @Override
    public void visit(ListNode node) {
        header(node, "ListNode:");
        child("Handle", node.handle);
        children(node.elements);
        finish();
    }

    @Override
    public void visit(NumberNode node) {
        header(node, "NumberNode: " + node.value);
        finish();
    }

    @Override
    public void visit(StringNode node) {
        header(node, "StringNode: '" + printable(node.value) + "'" + (node.interpolated ? " interpolated" : ""));
        finish();
    }

    @Override
    public void visit(IdentifierNode node) {
        header(node, "IdentifierNode: " + printable(node.name));
        finish();
    }

    @Override
    public void visit(OperatorNode node) {
        header(node, "OperatorNode: " + node.operator);
        if (node.operand != null) {
            children(List.of(node.operand));
        }
        finish();
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        header(node, "BinaryOperatorNode: " + node.operator);
        for (Node operand : new Node[]{node.left, node.right}) {
            scheduled.add(operand == null
                    ? new Item(null, "null", indentLevel + 1)
                    : new Item(operand, null, indentLevel + 1));
        }
        finish();
    }

    @Override
    public void visit(TernaryOperatorNode node) {
        header(node, "TernaryOperatorNode:");
        children(List.of(node.condition, node.trueExpr, node.falseExpr));
        finish();
    }

    @Override
    public void visit(ArrayLiteralNode node) {
        header(node, "ArrayLiteralNode:");
        children(node.elements);
        finish();
    }

    @Override
    public void visit(HashLiteralNode node) {
        header(node, "HashLiteralNode:");
        children(node.elements);
        finish();
    }

    @Override
    public void visit(IfNode node) {
        header(node, "IfNode: " + node.operator);
        child("Condition", node.condition);
        child("Then", node.thenBranch);
        child("Else", node.elseBranch);
        finish();
    }

    @Override
    public void visit(For1Node node) {
        header(node, "For1Node:");
        child("Variable", node.variable);
        child("List", node.list);
        child("Body", node.body);
        child("Continue", node.continueBlock);
        finish();
    }

    @Override
    public void visit(For3Node node) {
        header(node, "For3Node: " + node.keyword);
        child("Init", node.initialization);
        child("Condition", node.condition);
        child("Increment", node.increment);
        child("Body", node.body);
        child("Continue", node.continueBlock);
        finish();
    }

    @Override
    public void visit(GivenWhenNode node) {
        header(node, "GivenWhenNode: " + node.keyword);
        child("Expression", node.expression);
        child("Block", node.block);
        finish();
    }

    @Override
    public void visit(LabelNode node) {
        header(node, "LabelNode: " + node.label);
        children(List.of(node.statement));
        finish();
    }

    @Override
    public void visit(StatementModifierNode node) {
        header(node, "StatementModifierNode: " + node.modifier);
        child("Statement", node.statement);
        child("Condition", node.condition);
        finish();
    }

    @Override
    public void visit(TryNode node) {
        header(node, "TryNode:");
        child("Try", node.tryBlock);
        child("CatchParameter", node.catchParameter);
        child("Catch", node.catchBlock);
        child("Finally", node.finallyBlock);
        finish();
    }

    @Override
    public void visit(SubroutineNode node) {
        StringBuilder text = new StringBuilder(node.method ? "SubroutineNode: method " : "SubroutineNode: ");
        text.append(node.name == null ? "<anon>" : node.name);
        if (node.declarator != null) {
            text.append(" declarator:").append(node.declarator);
        }
        if (node.prototype != null) {
            text.append(" prototype:(").append(node.prototype).append(")");
        }
        if (!node.attributes.isEmpty()) {
            text.append(" attributes:").append(node.attributes);
        }
        header(node, text.toString());
        child("Signature", node.signature);
        child("Block", node.block);
        finish();
    }

    @Override
    public void visit(SignatureNode node) {
        header(node, "SignatureNode:");
        children(node.parameters);
        finish();
    }

    @Override
    public void visit(ParameterNode node) {
        header(node, "ParameterNode: " + node.kind + " " + node.sigil + (node.name == null ? "" : node.name)
                + (node.defaultOperator == null ? "" : " " + node.defaultOperator));
        if (node.defaultValue != null) {
            children(List.of(node.defaultValue));
        }
        finish();
    }

    @Override
    public void visit(PackageNode node) {
        header(node, "PackageNode: " + node.keyword + " " + node.name
                + (node.version == null ? "" : " " + node.version)
                + (node.attributes.isEmpty() ? "" : " attributes:" + node.attributes));
        child("Block", node.block);
        finish();
    }

    @Override
    public void visit(UseNode node) {
        header(node, "UseNode: " + node.keyword + " " + (node.module == null ? "" : node.module)
                + (node.version == null ? "" : " " + node.version));
        child("Arguments", node.arguments);
        finish();
    }

    @Override
    public void visit(SpecialBlockNode node) {
        header(node, "SpecialBlockNode: " + node.phase);
        child("Block", node.block);
        finish();
    }

    @Override
    public void visit(FormatNode node) {
        header(node, "FormatNode: " + node.name);
        indentLevel++;
        for (String picture : node.lines) {
            line("| " + printable(picture));
        }
        indentLevel--;
        finish();
    }

    @Override
    public void visit(RegexNode node) {
        header(node, "RegexNode: " + node.operator + " '" + printable(node.pattern) + "'"
                + (node.replacement == null ? "" : " -> '" + printable(node.replacement) + "'")
                + (node.modifiers.isEmpty() ? "" : " /" + node.modifiers));
        finish();
    }

    @Override
    public void visit(HeredocNode node) {
        header(node, "HeredocNode: " + node.getLabel() + " " + node.heredoc.getQuoteKind()
                + (node.heredoc.isAllowIndent() ? " indent" : "")
                + (node.isInterpolated() ? " interpolated" : ""));
        finish();
    }

    @Override
    public void visit(ErrorNode node) {
        header(node, "ErrorNode: " + printable(node.message));
        child("Partial", node.partial);
        finish();
    }

    @Override
    public void visit(SyntheticNode node) {
        header(node, "SyntheticNode: " + node.getKind());
        finish();
    }
}

package org.perlfront.parser;

import org.junit.jupiter.api.Test;
import org.perlfront.astnode.BinaryOperatorNode;
import org.perlfront.astnode.BlockNode;
import org.perlfront.astnode.For1Node;
import org.perlfront.astnode.For3Node;
import org.perlfront.astnode.FormatNode;
import org.perlfront.astnode.GivenWhenNode;
import org.perlfront.astnode.IfNode;
import org.perlfront.astnode.LabelNode;
import org.perlfront.astnode.ListNode;
import org.perlfront.astnode.Node;
import org.perlfront.astnode.NodeKind;
import org.perlfront.astnode.OperatorNode;
import org.perlfront.astnode.PackageNode;
import org.perlfront.astnode.ParameterNode;
import org.perlfront.astnode.SpecialBlockNode;
import org.perlfront.astnode.StatementModifierNode;
import org.perlfront.astnode.StringNode;
import org.perlfront.astnode.SubroutineNode;
import org.perlfront.astnode.TryNode;
import org.perlfront.astnode.UseNode;
import org.perlfront.recovery.ParseError;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.perlfront.parser.ParserTest.first;
import static org.perlfront.parser.ParserTest.parse;

public class StatementParserTest {

    private static List<Node> statements(String code) {
        ParseResult result = parse(code);
        assertFalse(result.hasErrors(), () -> String.join("\n", result.formattedErrors()));
        return result.program().elements;
    }

    private static String firstError(String code) {
        ParseResult result = parse(code);
        assertTrue(result.hasErrors(), "expected an error for: " + code);
        return result.errors().get(0).getMessage();
    }

    @Test
    public void testIfElsifElse() {
        IfNode node = assertInstanceOf(IfNode.class,
                first("if ($a) { 1 } elsif ($b) { 2 } else { 3 }"));
        assertEquals("if", node.operator);
        IfNode elsif = assertInstanceOf(IfNode.class, node.elseBranch);
        assertEquals("elsif", elsif.operator);
        assertInstanceOf(BlockNode.class, elsif.elseBranch);
    }

    @Test
    public void testUnless() {
        IfNode node = assertInstanceOf(IfNode.class, first("unless ($ok) { die }"));
        assertEquals("unless", node.operator);
        assertNull(node.elseBranch);
    }

    @Test
    public void testIfWithoutBlock() {
        assertTrue(firstError("if ($a) print 1;").startsWith("Expected block"));
    }

    @Test
    public void testWhileWithContinue() {
        For3Node loop = assertInstanceOf(For3Node.class, first("while ($i < 10) { $i++ } continue { $j++ }"));
        assertEquals("while", loop.keyword);
        assertNotNull(loop.condition);
        assertNotNull(loop.continueBlock);
        assertEquals(NodeKind.WHILE, loop.getKind());
    }

    @Test
    public void testWhileWithEmptyCondition() {
        For3Node loop = assertInstanceOf(For3Node.class, first("while () { last }"));
        assertNull(loop.condition);
    }

    @Test
    public void testUntil() {
        For3Node loop = assertInstanceOf(For3Node.class, first("until ($done) { step() }"));
        assertEquals(NodeKind.UNTIL, loop.getKind());
    }

    @Test
    public void testForeachWithLexicalVariable() {
        For1Node loop = assertInstanceOf(For1Node.class, first("foreach my $item (@list) { print $item }"));
        OperatorNode variable = assertInstanceOf(OperatorNode.class, loop.variable);
        assertEquals("my", variable.operator);
        assertNotNull(loop.list);
    }

    @Test
    public void testForeachDefaultVariable() {
        For1Node loop = assertInstanceOf(For1Node.class, first("for (1 .. 10) { print }"));
        assertNull(loop.variable);
    }

    @Test
    public void testForeachOverEmptyList() {
        For1Node loop = assertInstanceOf(For1Node.class, first("for my $x () { }"));
        assertTrue(((ListNode) loop.list).elements.isEmpty());
    }

    @Test
    public void testCStyleFor() {
        For3Node loop = assertInstanceOf(For3Node.class, first("for (my $i = 0; $i < 10; $i++) { }"));
        assertNotNull(loop.initialization);
        assertNotNull(loop.condition);
        assertNotNull(loop.increment);
        assertEquals(NodeKind.FOR, loop.getKind());
    }

    @Test
    public void testCStyleForWithEmptyParts() {
        For3Node loop = assertInstanceOf(For3Node.class, first("for (;;) { last }"));
        assertNull(loop.initialization);
        assertNull(loop.condition);
        assertNull(loop.increment);
    }

    @Test
    public void testStatementModifier() {
        StatementModifierNode node = assertInstanceOf(StatementModifierNode.class, first("print 1 if $x;"));
        assertEquals("if", node.modifier);
        assertEquals("print", ((OperatorNode) node.statement).operator);
    }

    @Test
    public void testDoWhile() {
        StatementModifierNode node = assertInstanceOf(StatementModifierNode.class,
                first("do { $i++ } while ($i < 5);"));
        assertEquals("while", node.modifier);
        assertEquals("do", ((OperatorNode) node.statement).operator);
    }

    @Test
    public void testLabeledLoop() {
        LabelNode label = assertInstanceOf(LabelNode.class,
                first("OUTER: for my $x (@a) { next OUTER if $x; }"));
        assertEquals("OUTER", label.label);
        assertInstanceOf(For1Node.class, label.statement);
    }

    @Test
    public void testBareBlockWithContinue() {
        For3Node loop = assertInstanceOf(For3Node.class, first("{ redo if $again } continue { $n++ }"));
        assertNull(loop.condition);
        assertNotNull(loop.continueBlock);
    }

    @Test
    public void testPackageStatementAndBlock() {
        List<Node> nodes = statements("package Foo::Bar 1.02;\npackage Baz { sub x { } }\n");
        PackageNode plain = assertInstanceOf(PackageNode.class, nodes.get(0));
        assertEquals("Foo::Bar", plain.name);
        assertEquals("1.02", plain.version);
        assertNull(plain.block);
        PackageNode withBlock = assertInstanceOf(PackageNode.class, nodes.get(1));
        assertNotNull(withBlock.block);
    }

    @Test
    public void testClassWithFieldsAndMethods() {
        PackageNode node = assertInstanceOf(PackageNode.class, first(
                "class Point :isa(Shape) {\n"
                        + "    field $x :param = 0;\n"
                        + "    method norm { return sqrt($x * $x); }\n"
                        + "}\n"));
        assertEquals("class", node.keyword);
        assertEquals(List.of("isa(Shape)"), node.attributes);
        BlockNode body = (BlockNode) node.block;
        BinaryOperatorNode field = assertInstanceOf(BinaryOperatorNode.class, body.elements.get(0));
        OperatorNode declaration = (OperatorNode) field.left;
        assertEquals("field", declaration.operator);
        assertEquals(List.of("param"), declaration.getAnnotation("attributes"));
        SubroutineNode method = assertInstanceOf(SubroutineNode.class, body.elements.get(1));
        assertTrue(method.method);
        assertEquals(NodeKind.METHOD, method.getKind());
    }

    @Test
    public void testUseForms() {
        List<Node> nodes = statements("use strict;\nuse 5.036;\nuse POSIX qw(floor ceil);\n"
                + "use List::Util 1.45 qw(max);\nuse Foo ();\nno warnings 'once';\n");
        UseNode strict = (UseNode) nodes.get(0);
        assertEquals("strict", strict.module);
        assertNull(strict.arguments);

        UseNode version = (UseNode) nodes.get(1);
        assertNull(version.module);
        assertEquals("5.036", version.version);

        UseNode posix = (UseNode) nodes.get(2);
        assertEquals(2, ((ListNode) posix.arguments).elements.size());

        UseNode listUtil = (UseNode) nodes.get(3);
        assertEquals("1.45", listUtil.version);

        UseNode empty = (UseNode) nodes.get(4);
        assertTrue(((ListNode) empty.arguments).elements.isEmpty());

        UseNode no = (UseNode) nodes.get(5);
        assertEquals("no", no.keyword);
        assertEquals(NodeKind.NO, no.getKind());
    }

    @Test
    public void testSubWithSignature() {
        SubroutineNode sub = assertInstanceOf(SubroutineNode.class,
                first("sub add($x, $y = 1, @rest) { return $x + $y }"));
        assertEquals("add", sub.name);
        assertNull(sub.prototype);
        List<NodeKind> kinds = sub.signature.parameters.stream().map(p -> p.kind).collect(Collectors.toList());
        assertEquals(List.of(NodeKind.MANDATORY_PARAMETER, NodeKind.OPTIONAL_PARAMETER, NodeKind.SLURPY_PARAMETER),
                kinds);
        ParameterNode y = sub.signature.parameters.get(1);
        assertEquals("y", y.name);
        assertEquals("=", y.defaultOperator);
        assertNotNull(y.defaultValue);
    }

    @Test
    public void testSignatureDefaultsAndPlaceholders() {
        SubroutineNode sub = (SubroutineNode) first("sub f($, $x //= 5, $y ||= 0, $z =, %) { }");
        List<ParameterNode> parameters = sub.signature.parameters;
        assertEquals(5, parameters.size());
        assertNull(parameters.get(0).name);
        assertEquals("//=", parameters.get(1).defaultOperator);
        assertEquals("||=", parameters.get(2).defaultOperator);
        assertNull(parameters.get(3).defaultValue);
        assertEquals('%', parameters.get(4).sigil);
    }

    @Test
    public void testNamedParameter() {
        SubroutineNode sub = (SubroutineNode) first("sub f(:$name, :$size = 10) { }");
        assertEquals(NodeKind.NAMED_PARAMETER, sub.signature.parameters.get(0).kind);
        assertEquals("size", sub.signature.parameters.get(1).name);
    }

    @Test
    public void testSignatureErrors() {
        assertEquals("Slurpy parameter not last", firstError("sub f(@a, $b) { }"));
        assertEquals("Mandatory parameter follows optional parameter", firstError("sub f($a = 1, $b) { }"));
        assertEquals("A slurpy parameter may not have a default value", firstError("sub f(@a = 1) { }"));
        assertEquals("Named parameters cannot be slurpy", firstError("sub f(:@a) { }"));
    }

    @Test
    public void testPrototype() {
        SubroutineNode sub = (SubroutineNode) first("sub max($$) { }");
        assertEquals("$$", sub.prototype);
        assertNull(sub.signature);
    }

    @Test
    public void testAttributes() {
        SubroutineNode sub = (SubroutineNode) first("sub value :lvalue :prototype($) { $v }");
        assertEquals(List.of("lvalue", "prototype($)"), sub.attributes);
        assertEquals("$", sub.prototype);
    }

    @Test
    public void testUnterminatedAttributeArgument() {
        assertEquals("Unterminated attribute parameter in attribute list", firstError("sub f :foo(bar { }"));
    }

    @Test
    public void testForwardDeclaration() {
        SubroutineNode sub = (SubroutineNode) first("sub later;");
        assertEquals("later", sub.name);
        assertNull(sub.block);
    }

    @Test
    public void testAnonymousAndLexicalSubs() {
        String code = "my $f = sub ($n) { $n * 2 };\nmy sub helper { 1 }\n";
        List<Node> nodes = statements(code);
        BinaryOperatorNode assign = (BinaryOperatorNode) nodes.get(0);
        SubroutineNode anon = assertInstanceOf(SubroutineNode.class, assign.right);
        assertNull(anon.name);
        assertEquals(NodeKind.ANON_SUB, anon.getKind());
        SubroutineNode lexical = assertInstanceOf(SubroutineNode.class, nodes.get(1));
        assertEquals("my", lexical.declarator);
        // a lexical sub starts at its declarator
        assertEquals(code.indexOf("my sub"), lexical.getLocation().start());
    }

    @Test
    public void testFormat() {
        FormatNode format = assertInstanceOf(FormatNode.class,
                first("format STDOUT =\n@<<<<< @>>>>>\n$name, $value\n.\n"));
        assertEquals("STDOUT", format.name);
        assertEquals(List.of("@<<<<< @>>>>>", "$name, $value"), format.lines);
    }

    @Test
    public void testFormatDefaultName() {
        List<Node> nodes = statements("format =\ntext\n.\nprint 1;\n");
        assertEquals("STDOUT", ((FormatNode) nodes.get(0)).name);
        assertEquals(2, nodes.size());
    }

    @Test
    public void testUnterminatedFormat() {
        ParseResult result = parse("format X =\nline\n");
        assertEquals("Format not terminated", result.errors().get(0).getMessage());
        assertEquals(List.of("line"), ((FormatNode) result.program().elements.get(0)).lines);
    }

    @Test
    public void testPhaseBlocks() {
        List<Node> nodes = statements("BEGIN { 1 }\nEND { 2 }\n");
        assertEquals("BEGIN", ((SpecialBlockNode) nodes.get(0)).phase);
        assertEquals("END", ((SpecialBlockNode) nodes.get(1)).phase);
    }

    @Test
    public void testTryCatchFinally() {
        TryNode node = assertInstanceOf(TryNode.class,
                first("try { risky() } catch ($e) { warn $e } finally { cleanup() }"));
        assertNotNull(node.catchParameter);
        assertNotNull(node.catchBlock);
        assertNotNull(node.finallyBlock);
    }

    @Test
    public void testGivenWhenDefault() {
        GivenWhenNode given = assertInstanceOf(GivenWhenNode.class,
                first("given ($x) { when (1) { say 'one' } default { say 'other' } }"));
        assertEquals("given", given.keyword);
        BlockNode block = (BlockNode) given.block;
        assertEquals("when", ((GivenWhenNode) block.elements.get(0)).keyword);
        assertNull(((GivenWhenNode) block.elements.get(1)).expression);
    }

    @Test
    public void testDataSection() {
        List<Node> nodes = statements("print 1;\n__DATA__\nraw data\n");
        OperatorNode data = assertInstanceOf(OperatorNode.class, nodes.get(1));
        assertEquals("__DATA__", data.operator);
        assertEquals("\nraw data\n", ((StringNode) data.operand).value);
    }

    @Test
    public void testLexerErrorAfterOperandKeepsItsMessage() {
        ParseResult result = parse("my $x = 1 0b12;\n");
        assertTrue(result.hasErrors());
        ParseError error = result.errors().get(0);
        assertEquals("Illegal binary digit '2'", error.getMessage());
        assertEquals("'0b12'", error.getFound());
    }

    @Test
    public void testUnmatchedRightBracket() {
        assertEquals("Unmatched right bracket", firstError("1;\n);\n"));
    }
}

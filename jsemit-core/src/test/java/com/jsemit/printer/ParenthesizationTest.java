package com.jsemit.printer;

import com.jsemit.ast.*;
import org.junit.jupiter.api.Test;

import static com.jsemit.SampleTrees.binary;
import static com.jsemit.SampleTrees.id;
import static com.jsemit.SampleTrees.num;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Grouping must survive printing: a JavaScript parser reading the output has to rebuild the
 * same tree.
 */
public class ParenthesizationTest {

    private final JsPrinter printer = new JsPrinter();

    private String print(Node node) {
        return printer.print(node);
    }

    @Test
    void testLowerPrecedenceOperandIsWrapped() {
        assertEquals("(a + b) * c",
            print(binary(BinaryOperator.MULTIPLY, binary(BinaryOperator.ADD, id("a"), id("b")), id("c"))));
        assertEquals("a + b * c",
            print(binary(BinaryOperator.ADD, id("a"), binary(BinaryOperator.MULTIPLY, id("b"), id("c")))));
        assertEquals("(a || b) && c",
            print(binary(BinaryOperator.AND, binary(BinaryOperator.OR, id("a"), id("b")), id("c"))));
        assertEquals("a && b || c",
            print(binary(BinaryOperator.OR, binary(BinaryOperator.AND, id("a"), id("b")), id("c"))));
        assertEquals("(a | b) & c",
            print(binary(BinaryOperator.BITWISE_AND, binary(BinaryOperator.BITWISE_OR, id("a"), id("b")), id("c"))));
        assertEquals("a << 1.0 < b",
            print(binary(BinaryOperator.LESS, binary(BinaryOperator.SHIFT_LEFT, id("a"), num(1.0)), id("b"))));
    }

    @Test
    void testLeftAssociativity() {
        assertEquals("a - b - c",
            print(binary(BinaryOperator.SUBTRACT, binary(BinaryOperator.SUBTRACT, id("a"), id("b")), id("c"))));
        assertEquals("a - (b - c)",
            print(binary(BinaryOperator.SUBTRACT, id("a"), binary(BinaryOperator.SUBTRACT, id("b"), id("c")))));
        // String concatenation is not associative either
        assertEquals("a + (b + c)",
            print(binary(BinaryOperator.ADD, id("a"), binary(BinaryOperator.ADD, id("b"), id("c")))));
        assertEquals("a === (b === c)",
            print(binary(BinaryOperator.EQUAL, id("a"), binary(BinaryOperator.EQUAL, id("b"), id("c")))));
    }

    @Test
    void testConditionals() {
        assertEquals("(a ? b : c) ? d : e",
            print(new ConditionalExpression(new ConditionalExpression(id("a"), id("b"), id("c")), id("d"), id("e"))));
        assertEquals("a ? b : c ? d : e",
            print(new ConditionalExpression(id("a"), id("b"), new ConditionalExpression(id("c"), id("d"), id("e")))));
        assertEquals("a || b ? c : d",
            print(new ConditionalExpression(binary(BinaryOperator.OR, id("a"), id("b")), id("c"), id("d"))));
        assertEquals("(a ? b : c) + 1.0",
            print(binary(BinaryOperator.ADD, new ConditionalExpression(id("a"), id("b"), id("c")), num(1.0))));
    }

    @Test
    void testUnaryOperators() {
        assertEquals("!(a === b)",
            print(new UnaryExpression(UnaryOperator.NOT, binary(BinaryOperator.EQUAL, id("a"), id("b")))));
        assertEquals("-a * b",
            print(binary(BinaryOperator.MULTIPLY, new UnaryExpression(UnaryOperator.NEGATE, id("a")), id("b"))));
        assertEquals("~x", print(new UnaryExpression(UnaryOperator.BITWISE_NOT, id("x"))));
        assertEquals("+x", print(new UnaryExpression(UnaryOperator.PLUS, id("x"))));
        assertEquals("!f()", print(new UnaryExpression(UnaryOperator.NOT, new CallExpression(id("f")))));
    }

    @Test
    void testRepeatedSignsAreSeparated() {
        assertEquals("- -x",
            print(new UnaryExpression(UnaryOperator.NEGATE, new UnaryExpression(UnaryOperator.NEGATE, id("x")))));
        assertEquals("- -1.0", print(new UnaryExpression(UnaryOperator.NEGATE, num(-1.0))));
        assertEquals("+ +x",
            print(new UnaryExpression(UnaryOperator.PLUS, new UnaryExpression(UnaryOperator.PLUS, id("x")))));
        assertEquals("-+x",
            print(new UnaryExpression(UnaryOperator.NEGATE, new UnaryExpression(UnaryOperator.PLUS, id("x")))));
        assertEquals("a - -1.0", print(binary(BinaryOperator.SUBTRACT, id("a"), num(-1.0))));
    }

    @Test
    void testTypeof() {
        assertEquals("typeof x === \"number\"",
            print(binary(BinaryOperator.EQUAL, new TypeofExpression(id("x")), new StringLiteral("number"))));
        assertEquals("typeof (a + b)",
            print(new TypeofExpression(binary(BinaryOperator.ADD, id("a"), id("b")))));
        assertEquals("typeof typeof x", print(new TypeofExpression(new TypeofExpression(id("x")))));
    }

    @Test
    void testMemberTargets() {
        assertEquals("(a + b)[0.0]",
            print(new IndexExpression(binary(BinaryOperator.ADD, id("a"), id("b")), num(0.0))));
        assertEquals("(-1.0).toString",
            print(new PropertyAccess("toString", num(-1.0))));
        assertEquals("2.0.toString", print(new PropertyAccess("toString", num(2.0))));
        assertEquals("f()()", print(new CallExpression(new CallExpression(id("f")))));
        assertEquals("(a || b).c", print(new PropertyAccess("c", binary(BinaryOperator.OR, id("a"), id("b")))));
        assertEquals("(-x)(y)",
            print(new CallExpression(new UnaryExpression(UnaryOperator.NEGATE, id("x")), id("y"))));
    }

    @Test
    void testSpreadAndArguments() {
        assertEquals("[...xs, 1.0]",
            print(new ArrayLiteral(new UnaryExpression(UnaryOperator.SPREAD, id("xs")), num(1.0))));
        assertEquals("f(...args)",
            print(new CallExpression(id("f"), new UnaryExpression(UnaryOperator.SPREAD, id("args")))));
        assertEquals("f(a ? b : c, d + e)",
            print(new CallExpression(id("f"),
                new ConditionalExpression(id("a"), id("b"), id("c")),
                binary(BinaryOperator.ADD, id("d"), id("e")))));
    }

    @Test
    void testInlineAssignment() {
        assertEquals("a + (b = c)",
            print(binary(BinaryOperator.ADD, id("a"), new AssignmentStatement(id("b"), id("c")))));
        assertEquals("f(b = c)", print(new CallExpression(id("f"), new AssignmentStatement(id("b"), id("c")))));
        assertEquals("a = b = c;",
            print(new AssignmentStatement(id("a"), new AssignmentStatement(id("b"), id("c")))));
        assertEquals("o.x = 1.0;", print(new AssignmentStatement(new PropertyAccess("x", id("o")), num(1.0))));
    }

    @Test
    void testDestructuringStyleAssignmentIsNotReadAsBlock() {
        Node target = new ObjectLiteral(new ObjectProperty.LiteralKey("a", id("a")));
        String expected = """
            ({
                a: a
            } = b);""";
        assertEquals(expected, print(new AssignmentStatement(target, id("b"))));
    }
}

package com.jsemit.traverse;

import com.jsemit.SampleTrees;
import com.jsemit.ast.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static com.jsemit.SampleTrees.binary;
import static com.jsemit.SampleTrees.id;
import static com.jsemit.SampleTrees.num;
import static org.junit.jupiter.api.Assertions.*;

public class TraversalTest {

    @Test
    void testBottomUpIdentityIsIdentity() {
        List<Node> trees = List.of(
            num(8.0),
            new BreakStatement(),
            SampleTrees.keyedObject(),
            SampleTrees.accessorObject(),
            SampleTrees.everyVariant());
        for (Node tree : trees) {
            assertEquals(tree, Traversal.bottomUp(Function.identity(), tree));
            assertEquals(tree, Traversal.topDown(Function.identity(), tree));
        }
    }

    @Test
    void testLoopsSurviveIdentityRewrite() {
        Node loops = new BlockStatement(
            new ForStatement("i", num(0.0),
                binary(BinaryOperator.LESS, id("i"), num(3.0)),
                new AssignmentStatement(id("i"), binary(BinaryOperator.ADD, id("i"), num(1.0))),
                new BlockStatement(List.of())),
            new LabeledStatement("outer",
                new WhileStatement(new BooleanLiteral(true), new BlockStatement(new BreakStatement("outer")))));
        assertEquals(loops, Traversal.bottomUp(n -> n, loops));
    }

    @Test
    void testCountEveryNode() {
        assertEquals(1, Traversal.count(new NullLiteral()));
        assertEquals(1, Traversal.count(new ObjectLiteral(List.of())));
        assertEquals(5, Traversal.count(SampleTrees.keyedObject()));
        // object, getter's return and its number, nothing for the empty setter
        assertEquals(3, Traversal.count(SampleTrees.accessorObject()));

        Node deep = num(0.0);
        for (int i = 0; i < 100; i++) {
            deep = new UnaryExpression(UnaryOperator.NEGATE, deep);
        }
        assertEquals(101, Traversal.count(deep));
    }

    @Test
    void testEveryVariantIsReached() {
        Set<String> types = Traversal.fold(
            n -> Set.of(n.type()),
            Monoid.of(Set.<String>of(), (a, b) -> {
                Set<String> union = new HashSet<>(a);
                union.addAll(b);
                return union;
            }),
            SampleTrees.everyVariant());
        assertEquals(28, types.size(), () -> "Reached only " + types);
    }

    @Test
    void testBottomUpSeesChildrenFirst() {
        List<String> order = new ArrayList<>();
        Node tree = new ReturnStatement(new UnaryExpression(UnaryOperator.NOT, id("x")));
        Traversal.bottomUp(n -> {
            order.add(n.type());
            return n;
        }, tree);
        assertEquals(List.of("Identifier", "UnaryExpression", "ReturnStatement"), order);
    }

    @Test
    void testBottomUpRewritesWithTransformedChildren() {
        // Folds numeric additions; the inner sum is already folded when the outer one is seen
        Function<Node, Node> foldAdd = n -> {
            if (n instanceof BinaryExpression b
                && b.operator() == BinaryOperator.ADD
                && b.left() instanceof NumericLiteral l
                && b.right() instanceof NumericLiteral r) {
                return num(l.value() + r.value());
            }
            return n;
        };
        Node tree = new ReturnStatement(
            binary(BinaryOperator.ADD, num(1.0), binary(BinaryOperator.ADD, num(2.0), num(3.0))));
        assertEquals(new ReturnStatement(num(6.0)), Traversal.bottomUp(foldAdd, tree));
    }

    @Test
    void testBottomUpReachesObjectPropertyChildren() {
        Node renamed = Traversal.bottomUp(
            n -> n.equals(id("variable")) ? id("v") : n,
            SampleTrees.keyedObject());
        ObjectLiteral object = (ObjectLiteral) renamed;
        assertEquals(new ObjectProperty.ComputedKey(id("v"), new BooleanLiteral(true)), object.properties().get(2));

        Node bumped = Traversal.bottomUp(
            n -> n.equals(num(0.0)) ? num(1.0) : n,
            SampleTrees.accessorObject());
        ObjectProperty.Getter getter = (ObjectProperty.Getter) ((ObjectLiteral) bumped).properties().get(0);
        assertEquals(List.of(new ReturnStatement(num(1.0))), getter.body());
    }

    @Test
    void testTopDownVisitsParentBeforeChildren() {
        List<String> order = new ArrayList<>();
        Node tree = new LabeledStatement("a",
            new LabeledStatement("b",
                new LabeledStatement("c", new BreakStatement("a"))));
        Traversal.topDown(n -> {
            if (n instanceof LabeledStatement labeled) {
                order.add(labeled.label());
            }
            return n;
        }, tree);
        assertEquals(List.of("a", "b", "c"), order);
    }

    @Test
    void testTopDownDescendsIntoReplacement() {
        List<Node> seen = new ArrayList<>();
        Node tree = new ReturnStatement(id("x"));
        Node result = Traversal.topDown(n -> {
            seen.add(n);
            if (n.equals(id("x"))) {
                return binary(BinaryOperator.MULTIPLY, id("y"), id("y"));
            }
            return n;
        }, tree);

        assertEquals(new ReturnStatement(binary(BinaryOperator.MULTIPLY, id("y"), id("y"))), result);
        // The original x was seen once; the y's come from the replacement, not the original
        assertEquals(List.of(tree, id("x"), id("y"), id("y")), seen);
    }

    @Test
    void testTopDownCanPrune() {
        List<Node> seen = new ArrayList<>();
        Node tree = new ReturnStatement(
            new FunctionExpression(List.of(), new ReturnStatement(id("hidden"))));
        Node result = Traversal.topDown(n -> {
            seen.add(n);
            return n instanceof FunctionExpression ? new NullLiteral() : n;
        }, tree);

        assertEquals(new ReturnStatement(new NullLiteral()), result);
        assertFalse(seen.contains(id("hidden")));
    }

    @Test
    void testFoldIsPreOrder() {
        List<String> names = Traversal.fold(
            n -> n instanceof Identifier identifier ? List.of(identifier.name()) : List.of(),
            Monoid.<String>list(),
            new CallExpression(id("f"), id("a"), binary(BinaryOperator.ADD, id("b"), id("c"))));
        assertEquals(List.of("f", "a", "b", "c"), names);
    }

    @Test
    void testAnyMatch() {
        assertTrue(Traversal.anyMatch(SampleTrees.everyVariant(), n -> n instanceof ContinueStatement));
        assertFalse(Traversal.anyMatch(SampleTrees.keyedObject(), n -> n instanceof Statement));
    }

    @Test
    void testChildrenInDeclarationOrder() {
        IfStatement node = new IfStatement(id("t"), id("c"), id("a"));
        assertEquals(List.of(id("t"), id("c"), id("a")), Traversal.children(node));
        assertEquals(List.of(), Traversal.children(new ContinueStatement("l")));
        assertEquals(List.of(id("init")), Traversal.children(new VariableDeclaration("x", id("init"))));
    }

    @Test
    void testStockMonoids() {
        assertEquals(0, Monoid.intSum().identity());
        assertEquals(5, Monoid.intSum().combine(2, 3));
        assertTrue(Monoid.all().identity());
        assertFalse(Monoid.any().identity());
        assertEquals(List.of(1, 2), Monoid.<Integer>list().combine(List.of(1), List.of(2)));
    }
}

package com.jsemit.traverse;

import com.jsemit.ast.*;

import java.util.List;
import java.util.function.Function;

/**
 * Rebuilds a node with every direct child replaced by {@code transform(child)}. Leaves come back
 * as the same instance.
 */
final class ChildRebuilder implements NodeVisitor<Node>, PropertyVisitor<ObjectProperty> {

    private final Function<Node, Node> transform;

    ChildRebuilder(Function<Node, Node> transform) {
        this.transform = transform;
    }

    private Node map(Node child) {
        return transform.apply(child);
    }

    private List<Node> mapAll(List<Node> children) {
        return children.stream().map(transform).toList();
    }

    // ==================== Leaves ====================

    @Override
    public Node visitNullLiteral(NullLiteral node) {
        return node;
    }

    @Override
    public Node visitNumericLiteral(NumericLiteral node) {
        return node;
    }

    @Override
    public Node visitStringLiteral(StringLiteral node) {
        return node;
    }

    @Override
    public Node visitTemplateLiteral(TemplateLiteral node) {
        return node;
    }

    @Override
    public Node visitBooleanLiteral(BooleanLiteral node) {
        return node;
    }

    @Override
    public Node visitIdentifier(Identifier node) {
        return node;
    }

    @Override
    public Node visitBreakStatement(BreakStatement node) {
        return node;
    }

    @Override
    public Node visitContinueStatement(ContinueStatement node) {
        return node;
    }

    // ==================== Expressions ====================

    @Override
    public Node visitUnaryExpression(UnaryExpression node) {
        return new UnaryExpression(node.operator(), map(node.argument()));
    }

    @Override
    public Node visitBinaryExpression(BinaryExpression node) {
        return new BinaryExpression(node.operator(), map(node.left()), map(node.right()));
    }

    @Override
    public Node visitArrayLiteral(ArrayLiteral node) {
        return new ArrayLiteral(mapAll(node.elements()));
    }

    @Override
    public Node visitIndexExpression(IndexExpression node) {
        return new IndexExpression(map(node.object()), map(node.index()));
    }

    @Override
    public Node visitObjectLiteral(ObjectLiteral node) {
        return new ObjectLiteral(node.properties().stream().map(p -> p.accept(this)).toList());
    }

    @Override
    public Node visitPropertyAccess(PropertyAccess node) {
        return new PropertyAccess(node.property(), map(node.object()));
    }

    @Override
    public Node visitFunctionExpression(FunctionExpression node) {
        return new FunctionExpression(node.name(), node.params(), map(node.body()));
    }

    @Override
    public Node visitCallExpression(CallExpression node) {
        // Callee first, matching evaluation order
        Node callee = map(node.callee());
        return new CallExpression(callee, mapAll(node.arguments()));
    }

    @Override
    public Node visitConditionalExpression(ConditionalExpression node) {
        return new ConditionalExpression(map(node.test()), map(node.consequent()), map(node.alternate()));
    }

    @Override
    public Node visitTypeofExpression(TypeofExpression node) {
        return new TypeofExpression(map(node.argument()));
    }

    // ==================== Statements ====================

    @Override
    public Node visitBlockStatement(BlockStatement node) {
        return new BlockStatement(mapAll(node.body()));
    }

    @Override
    public Node visitVariableDeclaration(VariableDeclaration node) {
        return new VariableDeclaration(node.name(), node.init().map(transform));
    }

    @Override
    public Node visitAssignmentStatement(AssignmentStatement node) {
        return new AssignmentStatement(map(node.target()), map(node.value()));
    }

    @Override
    public Node visitWhileStatement(WhileStatement node) {
        return new WhileStatement(map(node.test()), map(node.body()));
    }

    @Override
    public Node visitForStatement(ForStatement node) {
        return new ForStatement(
            node.variable(),
            map(node.init()),
            map(node.test()),
            map(node.update()),
            map(node.body()));
    }

    @Override
    public Node visitForInStatement(ForInStatement node) {
        return new ForInStatement(node.variable(), map(node.object()), map(node.body()));
    }

    @Override
    public Node visitIfStatement(IfStatement node) {
        return new IfStatement(map(node.test()), map(node.consequent()), node.alternate().map(transform));
    }

    @Override
    public Node visitReturnStatement(ReturnStatement node) {
        return new ReturnStatement(node.argument().map(transform));
    }

    @Override
    public Node visitThrowStatement(ThrowStatement node) {
        return new ThrowStatement(map(node.argument()));
    }

    @Override
    public Node visitLabeledStatement(LabeledStatement node) {
        return new LabeledStatement(node.label(), map(node.body()));
    }

    // ==================== Object properties ====================

    @Override
    public ObjectProperty visitLiteralKey(ObjectProperty.LiteralKey property) {
        return new ObjectProperty.LiteralKey(property.key(), map(property.value()));
    }

    @Override
    public ObjectProperty visitComputedKey(ObjectProperty.ComputedKey property) {
        Node key = map(property.key());
        return new ObjectProperty.ComputedKey(key, map(property.value()));
    }

    @Override
    public ObjectProperty visitGetter(ObjectProperty.Getter property) {
        return new ObjectProperty.Getter(property.name(), mapAll(property.body()));
    }

    @Override
    public ObjectProperty visitSetter(ObjectProperty.Setter property) {
        return new ObjectProperty.Setter(property.name(), property.param(), mapAll(property.body()));
    }
}

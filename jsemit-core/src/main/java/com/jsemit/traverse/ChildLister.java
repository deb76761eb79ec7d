package com.jsemit.traverse;

import com.jsemit.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists a node's direct children in declaration order. Object literal entries contribute their
 * computed key, value and accessor body statements.
 */
final class ChildLister implements NodeVisitor<List<Node>>, PropertyVisitor<List<Node>> {

    static final ChildLister INSTANCE = new ChildLister();

    private ChildLister() {
    }

    // ==================== Leaves ====================

    @Override
    public List<Node> visitNullLiteral(NullLiteral node) {
        return List.of();
    }

    @Override
    public List<Node> visitNumericLiteral(NumericLiteral node) {
        return List.of();
    }

    @Override
    public List<Node> visitStringLiteral(StringLiteral node) {
        return List.of();
    }

    @Override
    public List<Node> visitTemplateLiteral(TemplateLiteral node) {
        return List.of();
    }

    @Override
    public List<Node> visitBooleanLiteral(BooleanLiteral node) {
        return List.of();
    }

    @Override
    public List<Node> visitIdentifier(Identifier node) {
        return List.of();
    }

    @Override
    public List<Node> visitBreakStatement(BreakStatement node) {
        return List.of();
    }

    @Override
    public List<Node> visitContinueStatement(ContinueStatement node) {
        return List.of();
    }

    // ==================== Expressions ====================

    @Override
    public List<Node> visitUnaryExpression(UnaryExpression node) {
        return List.of(node.argument());
    }

    @Override
    public List<Node> visitBinaryExpression(BinaryExpression node) {
        return List.of(node.left(), node.right());
    }

    @Override
    public List<Node> visitArrayLiteral(ArrayLiteral node) {
        return node.elements();
    }

    @Override
    public List<Node> visitIndexExpression(IndexExpression node) {
        return List.of(node.object(), node.index());
    }

    @Override
    public List<Node> visitObjectLiteral(ObjectLiteral node) {
        List<Node> children = new ArrayList<>();
        for (ObjectProperty property : node.properties()) {
            children.addAll(property.accept(this));
        }
        return children;
    }

    @Override
    public List<Node> visitPropertyAccess(PropertyAccess node) {
        return List.of(node.object());
    }

    @Override
    public List<Node> visitFunctionExpression(FunctionExpression node) {
        return List.of(node.body());
    }

    @Override
    public List<Node> visitCallExpression(CallExpression node) {
        List<Node> children = new ArrayList<>(node.arguments().size() + 1);
        children.add(node.callee());
        children.addAll(node.arguments());
        return children;
    }

    @Override
    public List<Node> visitConditionalExpression(ConditionalExpression node) {
        return List.of(node.test(), node.consequent(), node.alternate());
    }

    @Override
    public List<Node> visitTypeofExpression(TypeofExpression node) {
        return List.of(node.argument());
    }

    // ==================== Statements ====================

    @Override
    public List<Node> visitBlockStatement(BlockStatement node) {
        return node.body();
    }

    @Override
    public List<Node> visitVariableDeclaration(VariableDeclaration node) {
        return node.init().map(List::of).orElse(List.of());
    }

    @Override
    public List<Node> visitAssignmentStatement(AssignmentStatement node) {
        return List.of(node.target(), node.value());
    }

    @Override
    public List<Node> visitWhileStatement(WhileStatement node) {
        return List.of(node.test(), node.body());
    }

    @Override
    public List<Node> visitForStatement(ForStatement node) {
        return List.of(node.init(), node.test(), node.update(), node.body());
    }

    @Override
    public List<Node> visitForInStatement(ForInStatement node) {
        return List.of(node.object(), node.body());
    }

    @Override
    public List<Node> visitIfStatement(IfStatement node) {
        if (node.alternate().isPresent()) {
            return List.of(node.test(), node.consequent(), node.alternate().get());
        }
        return List.of(node.test(), node.consequent());
    }

    @Override
    public List<Node> visitReturnStatement(ReturnStatement node) {
        return node.argument().map(List::of).orElse(List.of());
    }

    @Override
    public List<Node> visitThrowStatement(ThrowStatement node) {
        return List.of(node.argument());
    }

    @Override
    public List<Node> visitLabeledStatement(LabeledStatement node) {
        return List.of(node.body());
    }

    // ==================== Object properties ====================

    @Override
    public List<Node> visitLiteralKey(ObjectProperty.LiteralKey property) {
        return List.of(property.value());
    }

    @Override
    public List<Node> visitComputedKey(ObjectProperty.ComputedKey property) {
        return List.of(property.key(), property.value());
    }

    @Override
    public List<Node> visitGetter(ObjectProperty.Getter property) {
        return property.body();
    }

    @Override
    public List<Node> visitSetter(ObjectProperty.Setter property) {
        return property.body();
    }
}

package com.jsemit.ast;

import java.util.Objects;

public record BinaryExpression(
    BinaryOperator operator,
    Node left,
    Node right
) implements Expression {
    public BinaryExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinaryExpression(this);
    }

    @Override
    public String type() {
        return "BinaryExpression";
    }
}

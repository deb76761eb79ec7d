package com.jsemit.ast;

import java.util.Objects;

public record UnaryExpression(
    UnaryOperator operator,
    Node argument
) implements Expression {
    public UnaryExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(argument, "argument");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnaryExpression(this);
    }

    @Override
    public String type() {
        return "UnaryExpression";
    }
}

package com.jsemit.ast;

import java.util.Objects;

public record ConditionalExpression(
    Node test,
    Node consequent,
    Node alternate
) implements Expression {
    public ConditionalExpression {
        Objects.requireNonNull(test, "test");
        Objects.requireNonNull(consequent, "consequent");
        Objects.requireNonNull(alternate, "alternate");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConditionalExpression(this);
    }

    @Override
    public String type() {
        return "ConditionalExpression";
    }
}

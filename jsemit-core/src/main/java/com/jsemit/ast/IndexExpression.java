package com.jsemit.ast;

import java.util.Objects;

/**
 * {@code object[index]}
 */
public record IndexExpression(
    Node object,
    Node index
) implements Expression {
    public IndexExpression {
        Objects.requireNonNull(object, "object");
        Objects.requireNonNull(index, "index");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIndexExpression(this);
    }

    @Override
    public String type() {
        return "IndexExpression";
    }
}

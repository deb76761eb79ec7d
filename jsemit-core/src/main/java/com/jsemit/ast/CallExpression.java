package com.jsemit.ast;

import java.util.List;
import java.util.Objects;

public record CallExpression(
    Node callee,
    List<Node> arguments
) implements Expression {
    public CallExpression {
        Objects.requireNonNull(callee, "callee");
        arguments = List.copyOf(arguments);
    }

    public CallExpression(Node callee, Node... arguments) {
        this(callee, List.of(arguments));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCallExpression(this);
    }

    @Override
    public String type() {
        return "CallExpression";
    }
}

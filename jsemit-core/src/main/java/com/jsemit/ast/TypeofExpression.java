package com.jsemit.ast;

import java.util.Objects;

public record TypeofExpression(Node argument) implements Expression {
    public TypeofExpression {
        Objects.requireNonNull(argument, "argument");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTypeofExpression(this);
    }

    @Override
    public String type() {
        return "TypeofExpression";
    }
}

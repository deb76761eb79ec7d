package com.jsemit.ast;

import java.util.Objects;

public record ThrowStatement(Node argument) implements Statement {
    public ThrowStatement {
        Objects.requireNonNull(argument, "argument");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitThrowStatement(this);
    }

    @Override
    public String type() {
        return "ThrowStatement";
    }
}

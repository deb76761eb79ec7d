package com.jsemit.ast;

import java.util.Objects;

public record WhileStatement(
    Node test,
    Node body
) implements Statement {
    public WhileStatement {
        Objects.requireNonNull(test, "test");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitWhileStatement(this);
    }

    @Override
    public String type() {
        return "WhileStatement";
    }
}

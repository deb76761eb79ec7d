package com.jsemit.ast;

import java.util.Objects;

/**
 * {@code for (let variable = init; test; update) body}
 */
public record ForStatement(
    String variable,
    Node init,
    Node test,
    Node update,
    Node body
) implements Statement {
    public ForStatement {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(init, "init");
        Objects.requireNonNull(test, "test");
        Objects.requireNonNull(update, "update");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitForStatement(this);
    }

    @Override
    public String type() {
        return "ForStatement";
    }
}

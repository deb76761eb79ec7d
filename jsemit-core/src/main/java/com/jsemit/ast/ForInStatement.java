package com.jsemit.ast;

import java.util.Objects;

/**
 * {@code for (let variable in object) body}
 */
public record ForInStatement(
    String variable,
    Node object,
    Node body
) implements Statement {
    public ForInStatement {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(object, "object");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitForInStatement(this);
    }

    @Override
    public String type() {
        return "ForInStatement";
    }
}

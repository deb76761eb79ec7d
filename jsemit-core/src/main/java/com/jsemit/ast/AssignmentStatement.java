package com.jsemit.ast;

import java.util.Objects;

/**
 * {@code target = value}. Prints with a terminator in statement position and inline where an
 * expression is expected, such as the update clause of a {@link ForStatement}.
 */
public record AssignmentStatement(
    Node target,
    Node value
) implements Statement {
    public AssignmentStatement {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAssignmentStatement(this);
    }

    @Override
    public String type() {
        return "AssignmentStatement";
    }
}

package com.jsemit.ast;

import java.util.Optional;

public record ReturnStatement(
    Optional<Node> argument  // Empty for a bare "return;"
) implements Statement {
    public ReturnStatement {
        argument = argument == null ? Optional.empty() : argument;
    }

    public ReturnStatement(Node argument) {
        this(Optional.of(argument));
    }

    public ReturnStatement() {
        this(Optional.empty());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitReturnStatement(this);
    }

    @Override
    public String type() {
        return "ReturnStatement";
    }
}

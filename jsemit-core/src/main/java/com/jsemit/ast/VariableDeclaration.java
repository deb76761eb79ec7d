package com.jsemit.ast;

import java.util.Objects;
import java.util.Optional;

public record VariableDeclaration(
    String name,
    Optional<Node> init  // Empty for "let x;"
) implements Statement {
    public VariableDeclaration {
        Objects.requireNonNull(name, "name");
        init = init == null ? Optional.empty() : init;
    }

    public VariableDeclaration(String name, Node init) {
        this(name, Optional.of(init));
    }

    public VariableDeclaration(String name) {
        this(name, Optional.empty());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariableDeclaration(this);
    }

    @Override
    public String type() {
        return "VariableDeclaration";
    }
}

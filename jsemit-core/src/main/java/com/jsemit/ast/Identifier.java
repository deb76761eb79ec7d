package com.jsemit.ast;

import java.util.Objects;

/**
 * A variable reference. The name is printed as is.
 */
public record Identifier(String name) implements Expression {
    public Identifier {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public String type() {
        return "Identifier";
    }
}

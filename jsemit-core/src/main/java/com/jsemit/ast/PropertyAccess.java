package com.jsemit.ast;

import java.util.Objects;

/**
 * {@code object.property}
 */
public record PropertyAccess(
    String property,
    Node object
) implements Expression {
    public PropertyAccess {
        Objects.requireNonNull(property, "property");
        Objects.requireNonNull(object, "object");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitPropertyAccess(this);
    }

    @Override
    public String type() {
        return "PropertyAccess";
    }
}

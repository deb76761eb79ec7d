package com.jsemit.ast;

import java.util.List;

/**
 * An object literal. Property order is kept exactly as given.
 */
public record ObjectLiteral(List<ObjectProperty> properties) implements Expression {
    public ObjectLiteral {
        properties = List.copyOf(properties);
    }

    public ObjectLiteral(ObjectProperty... properties) {
        this(List.of(properties));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitObjectLiteral(this);
    }

    @Override
    public String type() {
        return "ObjectLiteral";
    }
}

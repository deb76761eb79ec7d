package com.jsemit.ast;

import java.util.Objects;

public record StringLiteral(String value) implements Expression {
    public StringLiteral {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }

    @Override
    public String type() {
        return "StringLiteral";
    }
}

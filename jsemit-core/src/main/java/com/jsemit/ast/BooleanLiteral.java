package com.jsemit.ast;

public record BooleanLiteral(boolean value) implements Expression {
    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBooleanLiteral(this);
    }

    @Override
    public String type() {
        return "BooleanLiteral";
    }
}

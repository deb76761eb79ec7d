package com.jsemit.ast;

public record NullLiteral() implements Expression {
    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNullLiteral(this);
    }

    @Override
    public String type() {
        return "NullLiteral";
    }
}

package com.jsemit.ast;

import java.util.List;

public record ArrayLiteral(List<Node> elements) implements Expression {
    public ArrayLiteral {
        elements = List.copyOf(elements);
    }

    public ArrayLiteral(Node... elements) {
        this(List.of(elements));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitArrayLiteral(this);
    }

    @Override
    public String type() {
        return "ArrayLiteral";
    }
}

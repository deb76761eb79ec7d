package com.jsemit.ast;

import java.util.List;

public record BlockStatement(List<Node> body) implements Statement {
    public BlockStatement {
        body = List.copyOf(body);
    }

    public BlockStatement(Node... body) {
        this(List.of(body));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBlockStatement(this);
    }

    @Override
    public String type() {
        return "BlockStatement";
    }
}

package com.jsemit.ast;

import java.util.Objects;

public record LabeledStatement(
    String label,
    Node body
) implements Statement {
    public LabeledStatement {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLabeledStatement(this);
    }

    @Override
    public String type() {
        return "LabeledStatement";
    }
}

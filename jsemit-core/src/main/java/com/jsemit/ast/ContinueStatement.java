package com.jsemit.ast;

import java.util.Optional;

public record ContinueStatement(
    Optional<String> label  // Empty for unlabeled continue
) implements Statement {
    public ContinueStatement {
        label = label == null ? Optional.empty() : label;
    }

    public ContinueStatement(String label) {
        this(Optional.of(label));
    }

    public ContinueStatement() {
        this(Optional.empty());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitContinueStatement(this);
    }

    @Override
    public String type() {
        return "ContinueStatement";
    }
}

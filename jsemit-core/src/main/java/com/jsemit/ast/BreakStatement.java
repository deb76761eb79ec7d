package com.jsemit.ast;

import java.util.Optional;

public record BreakStatement(
    Optional<String> label  // Empty for unlabeled break
) implements Statement {
    public BreakStatement {
        label = label == null ? Optional.empty() : label;
    }

    public BreakStatement(String label) {
        this(Optional.of(label));
    }

    public BreakStatement() {
        this(Optional.empty());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBreakStatement(this);
    }

    @Override
    public String type() {
        return "BreakStatement";
    }
}

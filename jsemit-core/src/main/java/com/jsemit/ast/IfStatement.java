package com.jsemit.ast;

import java.util.Objects;
import java.util.Optional;

public record IfStatement(
    Node test,
    Node consequent,
    Optional<Node> alternate  // Empty when there is no else branch
) implements Statement {
    public IfStatement {
        Objects.requireNonNull(test, "test");
        Objects.requireNonNull(consequent, "consequent");
        alternate = alternate == null ? Optional.empty() : alternate;
    }

    public IfStatement(Node test, Node consequent, Node alternate) {
        this(test, consequent, Optional.of(alternate));
    }

    public IfStatement(Node test, Node consequent) {
        this(test, consequent, Optional.empty());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIfStatement(this);
    }

    @Override
    public String type() {
        return "IfStatement";
    }
}

package com.jsemit.ast;

import java.util.Objects;

/**
 * A template string emitted verbatim between backticks. Interpolations and escapes inside
 * {@code raw} are the producer's responsibility.
 */
public record TemplateLiteral(String raw) implements Expression {
    public TemplateLiteral {
        Objects.requireNonNull(raw, "raw");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTemplateLiteral(this);
    }

    @Override
    public String type() {
        return "TemplateLiteral";
    }
}

package com.jsemit.ast;

/**
 * A double-precision number. Equality uses {@link Double#compare}, so {@code NaN} equals
 * itself and {@code 0.0} differs from {@code -0.0}.
 */
public record NumericLiteral(double value) implements Expression {
    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNumericLiteral(this);
    }

    @Override
    public String type() {
        return "NumericLiteral";
    }
}

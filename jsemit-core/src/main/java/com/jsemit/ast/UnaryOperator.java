package com.jsemit.ast;

/**
 * Prefix operators. {@link #SPREAD} is only meaningful inside array literals and argument lists.
 */
public enum UnaryOperator {
    NEGATE("-"),
    NOT("!"),
    BITWISE_NOT("~"),
    PLUS("+"),
    SPREAD("...");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static UnaryOperator fromSymbol(String symbol) {
        for (UnaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown unary operator: " + symbol);
    }
}

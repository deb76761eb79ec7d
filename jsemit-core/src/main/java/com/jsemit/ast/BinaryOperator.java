package com.jsemit.ast;

/**
 * Infix operators with their JavaScript symbol and precedence level.
 *
 * <p>Precedence values follow the usual JavaScript table: higher binds tighter. All of these
 * operators are left-associative.</p>
 */
public enum BinaryOperator {
    ADD("+", 13),
    SUBTRACT("-", 13),
    MULTIPLY("*", 14),
    DIVIDE("/", 14),
    MODULUS("%", 14),
    EQUAL("===", 10),
    NOT_EQUAL("!==", 10),
    LESS("<", 11),
    LESS_OR_EQUAL("<=", 11),
    GREATER(">", 11),
    GREATER_OR_EQUAL(">=", 11),
    AND("&&", 5),
    OR("||", 4),
    BITWISE_AND("&", 9),
    BITWISE_OR("|", 7),
    BITWISE_XOR("^", 8),
    SHIFT_LEFT("<<", 12),
    SHIFT_RIGHT(">>", 12),
    ZERO_FILL_SHIFT_RIGHT(">>>", 12);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown binary operator: " + symbol);
    }
}

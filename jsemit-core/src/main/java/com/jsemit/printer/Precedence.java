package com.jsemit.printer;

import com.jsemit.ast.*;

/**
 * Binding strength of a node when printed as an expression. Higher binds tighter; a child is
 * parenthesized when its level is below the minimum its position requires.
 */
final class Precedence {

    static final int LOWEST = 0;
    static final int ASSIGNMENT = 1;
    static final int CONDITIONAL = 3;
    static final int UNARY = 15;
    static final int MEMBER = 17;
    static final int PRIMARY = 18;

    private Precedence() {
    }

    static int of(Node node) {
        if (node instanceof BinaryExpression binary) {
            return binary.operator().precedence();
        }
        if (node instanceof ConditionalExpression) {
            return CONDITIONAL;
        }
        if (node instanceof AssignmentStatement) {
            return ASSIGNMENT;
        }
        if (node instanceof UnaryExpression unary) {
            // "...x" is only legal where a whole assignment expression is
            return unary.operator() == UnaryOperator.SPREAD ? ASSIGNMENT : UNARY;
        }
        if (node instanceof TypeofExpression) {
            return UNARY;
        }
        if (node instanceof NumericLiteral number) {
            // A negative literal prints with a leading minus, so it binds like one
            return JsNumbers.format(number.value()).startsWith("-") ? UNARY : PRIMARY;
        }
        if (node instanceof CallExpression || node instanceof PropertyAccess || node instanceof IndexExpression) {
            return MEMBER;
        }
        return PRIMARY;
    }
}

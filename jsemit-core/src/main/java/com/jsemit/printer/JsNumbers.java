package com.jsemit.printer;

/**
 * Number literal formatting.
 */
final class JsNumbers {

    private JsNumbers() {
    }

    /**
     * {@link Double#toString(double)}: whole numbers keep a fractional part ({@code 8.0}), large
     * and small magnitudes use an exponent ({@code 1.0E21}), and {@code NaN},
     * {@code Infinity} and {@code -Infinity} come out as the JavaScript globals of the same name.
     */
    static String format(double value) {
        return Double.toString(value);
    }
}

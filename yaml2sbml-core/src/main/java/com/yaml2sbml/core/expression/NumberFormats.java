package com.yaml2sbml.core.expression;

/**
 * Shared number formatting for infix text, MathML and SBML attributes.
 *
 * <p>Whole numbers below 1e15 print without a fraction ({@code 10}); everything
 * else uses {@link Double#toString(double)}, which reparses to the same value.
 */
public final class NumberFormats {

    private static final double MAX_EXACT_INTEGER = 1e15;

    private NumberFormats() {
    }

    public static boolean isInteger(double value) {
        return Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < MAX_EXACT_INTEGER;
    }

    public static String format(double value) {
        if (isInteger(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}

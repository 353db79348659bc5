package com.yaml2sbml.core.expression;

/**
 * Prefix operators. Unary plus is dropped by the compiler, so only negation remains.
 */
public enum UnaryOperator {
    NEGATE("-", "minus");

    /** Binds tighter than every binary operator, including {@code ^}. */
    public static final int PRECEDENCE = 4;

    private final String symbol;
    private final String mathMlElement;

    UnaryOperator(String symbol, String mathMlElement) {
        this.symbol = symbol;
        this.mathMlElement = mathMlElement;
    }

    public String symbol() {
        return symbol;
    }

    public String mathMlElement() {
        return mathMlElement;
    }
}

package com.yaml2sbml.core.expression;

/**
 * Infix arithmetic operators, with their precedence and MathML element name.
 */
public enum BinaryOperator {
    ADD("+", 1, "plus"),
    SUBTRACT("-", 1, "minus"),
    MULTIPLY("*", 2, "times"),
    DIVIDE("/", 2, "divide"),
    /** Right associative. */
    POWER("^", 3, "power");

    private final String symbol;
    private final int precedence;
    private final String mathMlElement;

    BinaryOperator(String symbol, int precedence, String mathMlElement) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.mathMlElement = mathMlElement;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public String mathMlElement() {
        return mathMlElement;
    }

    public boolean isRightAssociative() {
        return this == POWER;
    }
}

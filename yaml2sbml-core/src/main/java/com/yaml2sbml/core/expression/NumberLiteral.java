package com.yaml2sbml.core.expression;

/**
 * Numeric constant.
 *
 * @param value the literal value, always finite when produced by the compiler
 */
public record NumberLiteral(double value) implements Expression {

    /**
     * Whether the value is a whole number small enough to be written without a fraction.
     *
     * @return true if the literal prints as an integer
     */
    public boolean isInteger() {
        return NumberFormats.isInteger(value);
    }
}

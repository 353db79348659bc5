package com.yaml2sbml.core.model;

import java.util.Objects;

import com.yaml2sbml.core.expression.CompiledFormula;

/**
 * Time derivative of a state equals formula (one ODE).
 *
 * @param variable target state identifier
 * @param formula right-hand side
 */
public record RateRule(
    String variable,
    CompiledFormula formula
) implements ModelRule {

    /**
     * Compact constructor with validation.
     */
    public RateRule {
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(formula, "formula must not be null");
    }
}

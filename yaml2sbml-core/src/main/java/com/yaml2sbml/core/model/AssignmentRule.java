package com.yaml2sbml.core.model;

import java.util.Objects;

import com.yaml2sbml.core.expression.CompiledFormula;

/**
 * Variable equals formula at every instant.
 *
 * @param variable target identifier
 * @param formula assigned formula
 */
public record AssignmentRule(
    String variable,
    CompiledFormula formula
) implements ModelRule {

    /**
     * Compact constructor with validation.
     */
    public AssignmentRule {
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(formula, "formula must not be null");
    }
}

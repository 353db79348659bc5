package com.yaml2sbml.core.model;

import java.util.Objects;

import com.yaml2sbml.core.expression.CompiledFormula;

/**
 * Observable quantity. Written as a non-constant parameter plus an assignment rule.
 *
 * @param id output identifier, prefixed (e.g. {@code observable_Obs_1})
 * @param name identifier as written in the document (e.g. {@code Obs_1})
 * @param formula observable formula
 * @param units unit identifier of the parameter, or null
 */
public record Observable(
    String id,
    String name,
    CompiledFormula formula,
    String units
) implements ModelEntity {

    /**
     * Compact constructor with validation.
     */
    public Observable {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(formula, "formula must not be null");
    }

    public Parameter toParameter() {
        return Parameter.variable(id, name, units);
    }

    public AssignmentRule toAssignmentRule() {
        return new AssignmentRule(id, formula);
    }
}

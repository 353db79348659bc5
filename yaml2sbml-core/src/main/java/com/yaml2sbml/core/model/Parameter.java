package com.yaml2sbml.core.model;

import java.util.Objects;

/**
 * SBML parameter.
 *
 * @param id parameter identifier
 * @param name display name
 * @param value numeric value, or null when an assignment rule determines it
 * @param constant whether the value is fixed during simulation
 * @param units unit identifier, or null for none
 */
public record Parameter(
    String id,
    String name,
    Double value,
    boolean constant,
    String units
) implements ModelEntity {

    /**
     * Compact constructor with validation.
     */
    public Parameter {
        Objects.requireNonNull(id, "id must not be null");
    }

    /**
     * Creates a constant parameter with a value.
     */
    public static Parameter constant(String id, double value, String units) {
        return new Parameter(id, id, value, true, units);
    }

    /**
     * Creates a non-constant parameter whose value comes from a rule.
     */
    public static Parameter variable(String id, String name, String units) {
        return new Parameter(id, name, null, false, units);
    }
}

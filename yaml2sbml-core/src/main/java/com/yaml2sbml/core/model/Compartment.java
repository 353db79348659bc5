package com.yaml2sbml.core.model;

import java.util.Objects;

/**
 * The single compartment all species live in.
 *
 * @param id compartment identifier
 * @param size compartment size
 * @param constant whether the size is fixed
 */
public record Compartment(
    String id,
    double size,
    boolean constant
) implements ModelEntity {

    public static final String DEFAULT_ID = "Compartment";

    /**
     * Compact constructor with validation.
     */
    public Compartment {
        Objects.requireNonNull(id, "id must not be null");
    }

    /**
     * Creates the default compartment: id {@value #DEFAULT_ID}, size 1, constant.
     *
     * @return default compartment
     */
    public static Compartment defaultCompartment() {
        return new Compartment(DEFAULT_ID, 1.0, true);
    }
}

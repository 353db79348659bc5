package com.yaml2sbml.core.model;

import java.util.Objects;

/**
 * SBML species representing one state variable.
 *
 * <p>Species are never constant or boundary species and do not use substance-only units.
 *
 * @param id species identifier
 * @param compartment compartment identifier
 * @param initialAmount initial amount; negative values are accepted
 * @param substanceUnits unit identifier, or null for none
 */
public record Species(
    String id,
    String compartment,
    double initialAmount,
    String substanceUnits
) implements ModelEntity {

    /**
     * Compact constructor with validation.
     */
    public Species {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(compartment, "compartment must not be null");
    }
}

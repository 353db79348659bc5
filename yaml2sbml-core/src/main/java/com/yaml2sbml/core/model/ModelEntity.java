package com.yaml2sbml.core.model;

/**
 * Marker for entities of the output model document.
 *
 * <p>Every entity is an immutable record created by exactly one block builder.
 */
public interface ModelEntity {

    /**
     * Returns the SBML identifier of the entity, or for rules the identifier of the
     * variable the rule targets.
     *
     * @return identifier
     */
    String id();
}

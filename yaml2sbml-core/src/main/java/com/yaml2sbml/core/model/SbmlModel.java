package com.yaml2sbml.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The assembled model: every entity in the order it was built, plus diagnostics.
 *
 * <p>The first entity is always the compartment.
 *
 * @param modelId SBML model identifier, or null
 * @param entities entities in build order
 * @param diagnostics non-fatal findings
 */
public record SbmlModel(
    String modelId,
    List<ModelEntity> entities,
    List<Diagnostic> diagnostics
) {
    /**
     * Compact constructor with validation.
     */
    public SbmlModel {
        Objects.requireNonNull(entities, "entities must not be null");
        entities = List.copyOf(entities);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public List<Parameter> parameters() {
        return ofType(Parameter.class);
    }

    public List<Species> species() {
        return ofType(Species.class);
    }

    public List<AssignmentRule> assignmentRules() {
        return ofType(AssignmentRule.class);
    }

    public List<RateRule> rateRules() {
        return ofType(RateRule.class);
    }

    public List<FunctionDefinition> functionDefinitions() {
        return ofType(FunctionDefinition.class);
    }

    public List<Observable> observables() {
        return ofType(Observable.class);
    }

    public List<Compartment> compartments() {
        return ofType(Compartment.class);
    }

    private <T extends ModelEntity> List<T> ofType(Class<T> type) {
        return entities.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .toList();
    }
}

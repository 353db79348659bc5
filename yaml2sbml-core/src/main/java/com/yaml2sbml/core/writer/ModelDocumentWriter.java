package com.yaml2sbml.core.writer;

import com.yaml2sbml.core.model.AssignmentRule;
import com.yaml2sbml.core.model.Compartment;
import com.yaml2sbml.core.model.FunctionDefinition;
import com.yaml2sbml.core.model.ModelEntity;
import com.yaml2sbml.core.model.Observable;
import com.yaml2sbml.core.model.Parameter;
import com.yaml2sbml.core.model.RateRule;
import com.yaml2sbml.core.model.SbmlModel;
import com.yaml2sbml.core.model.Species;

/**
 * Accumulates model entities and serializes them as one document.
 *
 * <p>Entities may be added in any order; the writer decides the layout of the output.
 * Serializing twice without adding anything in between yields identical text.
 *
 * @see SbmlDocumentWriter
 */
public interface ModelDocumentWriter {

    void addCompartment(Compartment compartment);

    void addParameter(Parameter parameter);

    void addSpecies(Species species);

    void addAssignmentRule(AssignmentRule rule);

    void addRateRule(RateRule rule);

    void addFunctionDefinition(FunctionDefinition function);

    /**
     * Serializes everything added so far.
     *
     * @return the document text
     * @throws IllegalStateException if the document cannot be produced
     */
    String serialize();

    /**
     * Adds every entity of an assembled model, in model order. An observable is added
     * as its parameter and its assignment rule.
     *
     * @param model assembled model
     */
    default void addAll(SbmlModel model) {
        for (ModelEntity entity : model.entities()) {
            if (entity instanceof Compartment compartment) {
                addCompartment(compartment);
            } else if (entity instanceof Parameter parameter) {
                addParameter(parameter);
            } else if (entity instanceof Species species) {
                addSpecies(species);
            } else if (entity instanceof AssignmentRule rule) {
                addAssignmentRule(rule);
            } else if (entity instanceof RateRule rule) {
                addRateRule(rule);
            } else if (entity instanceof FunctionDefinition function) {
                addFunctionDefinition(function);
            } else if (entity instanceof Observable observable) {
                addParameter(observable.toParameter());
                addAssignmentRule(observable.toAssignmentRule());
            } else {
                throw new IllegalArgumentException("Unsupported entity: " + entity.getClass().getSimpleName());
            }
        }
    }
}

package com.yaml2sbml.core.builder;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.io.Field;
import com.yaml2sbml.core.model.Species;
import com.yaml2sbml.core.registry.IdentifierKind;

/**
 * Declares state variables, one species each.
 *
 * <pre>{@code
 * states:
 *   - stateId: x
 *     initialValue: 1
 * }</pre>
 */
public class StatesBlockBuilder extends AbstractBlockBuilder {

    static final Field STATE_ID = Field.of("stateId", "id");
    static final Field INITIAL_VALUE = Field.of("initialValue", "initial_value");

    @Override
    public String blockName() {
        return "states";
    }

    @Override
    public void build(JsonNode content, BuildContext context) {
        String compartment = context.compartment().id();
        String units = context.config().units().defaultUnit();
        int count = 0;
        for (JsonNode entry : entries(content)) {
            String id = requiredText(entry, STATE_ID);
            double initialValue = requiredNumber(entry, INITIAL_VALUE);
            context.registry().declare(blockName(), id, IdentifierKind.STATE);
            context.add(new Species(id, compartment, initialValue, units));
            count++;
        }
        log.debug("Declared {} state(s) in compartment {}", count, compartment);
    }
}

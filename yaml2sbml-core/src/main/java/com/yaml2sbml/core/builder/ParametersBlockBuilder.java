package com.yaml2sbml.core.builder;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.io.Field;
import com.yaml2sbml.core.model.Parameter;
import com.yaml2sbml.core.registry.IdentifierKind;

/**
 * Declares constant parameters.
 *
 * <pre>{@code
 * parameters:
 *   - parameterId: alpha
 *     nominalValue: 2
 * }</pre>
 *
 * <p>Columns only meaningful to the parameter table ({@code parameterScale},
 * {@code lowerBound}, ...) are read by the table generator, not here.
 */
public class ParametersBlockBuilder extends AbstractBlockBuilder {

    static final Field PARAMETER_ID = Field.of("parameterId", "id");
    static final Field NOMINAL_VALUE = Field.of("nominalValue", "value");

    @Override
    public String blockName() {
        return "parameters";
    }

    @Override
    public void build(JsonNode content, BuildContext context) {
        String units = context.config().units().defaultUnit();
        int count = 0;
        for (JsonNode entry : entries(content)) {
            String id = requiredText(entry, PARAMETER_ID);
            double value = requiredNumber(entry, NOMINAL_VALUE);
            context.registry().declare(blockName(), id, IdentifierKind.PARAMETER);
            context.add(Parameter.constant(id, value, units));
            count++;
        }
        log.debug("Declared {} parameter(s)", count);
    }
}

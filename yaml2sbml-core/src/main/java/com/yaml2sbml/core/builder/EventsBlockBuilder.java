package com.yaml2sbml.core.builder;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.config.ConverterConfig.UnsupportedBlockPolicy;
import com.yaml2sbml.core.exception.SchemaException;
import com.yaml2sbml.core.model.Diagnostic;

/**
 * Accepts an {@code events} block. Events are not converted: the block yields one
 * warning, or fails the conversion when {@code eventsPolicy} is {@code FAIL}.
 */
public class EventsBlockBuilder extends AbstractBlockBuilder {

    static final String UNSUPPORTED = "events are not supported";

    @Override
    public String blockName() {
        return "events";
    }

    @Override
    public void build(JsonNode content, BuildContext context) {
        if (context.config().eventsPolicy() == UnsupportedBlockPolicy.FAIL) {
            throw new SchemaException(blockName(), UNSUPPORTED);
        }
        context.report(Diagnostic.warning(blockName(), UNSUPPORTED));
    }
}

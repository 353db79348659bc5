package com.yaml2sbml.core.builder;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.model.Diagnostic;

/**
 * Accepts a {@code noise} block. Noise models are only carried by the observable
 * table, so the block contributes nothing to the model and is reported as a warning.
 */
public class NoiseBlockBuilder extends AbstractBlockBuilder {

    @Override
    public String blockName() {
        return "noise";
    }

    @Override
    public void build(JsonNode content, BuildContext context) {
        context.report(Diagnostic.warning(blockName(), "noise is not supported and was ignored"));
    }
}

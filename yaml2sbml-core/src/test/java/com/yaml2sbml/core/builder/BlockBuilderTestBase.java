package com.yaml2sbml.core.builder;

import org.junit.jupiter.api.BeforeEach;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.config.ConverterConfig;
import com.yaml2sbml.core.io.OdeDocumentLoader;
import com.yaml2sbml.core.model.Compartment;

/**
 * Shared setup for block builder tests: a fresh context and a YAML helper.
 */
abstract class BlockBuilderTestBase {

    private final OdeDocumentLoader loader = new OdeDocumentLoader();

    protected BuildContext context;

    @BeforeEach
    void createContext() {
        context = newContext(ConverterConfig.defaults());
    }

    protected BuildContext newContext(ConverterConfig config) {
        return new BuildContext(config, Compartment.defaultCompartment());
    }

    /**
     * Parses a document and returns the content of one block.
     */
    protected JsonNode block(String name, String yaml) {
        return loader.parse(yaml).get(name);
    }

    /**
     * Runs a builder on the named block of a document.
     */
    protected void build(BlockBuilder builder, String yaml) {
        builder.build(block(builder.blockName(), yaml), context);
    }
}

package com.yaml2sbml.core.petab;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.renderer.GeneratedFile;

/**
 * Produces files that accompany the model document, such as parameter estimation tables.
 *
 * <p>Called once per conversion, after the model was assembled without error, so the
 * document it receives is known to be valid.
 */
public interface CompanionTableGenerator {

    /**
     * Generates the companion files.
     *
     * @param document the validated input document
     * @param modelName model name without extension, used in file names
     * @return generated files, possibly empty
     */
    List<GeneratedFile> generate(JsonNode document, String modelName);
}

package com.yaml2sbml.core.convert;

import java.util.List;
import java.util.Objects;

import com.yaml2sbml.core.model.Diagnostic;
import com.yaml2sbml.core.model.SbmlModel;
import com.yaml2sbml.core.renderer.GeneratedOutput;

/**
 * Outcome of a successful conversion.
 *
 * @param model the assembled model
 * @param sbml the serialized model document
 * @param output every file of the conversion, the model document first
 */
public record ConversionResult(
    SbmlModel model,
    String sbml,
    GeneratedOutput output
) {
    /**
     * Compact constructor with validation.
     */
    public ConversionResult {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(sbml, "sbml must not be null");
        Objects.requireNonNull(output, "output must not be null");
    }

    public List<Diagnostic> diagnostics() {
        return model.diagnostics();
    }
}

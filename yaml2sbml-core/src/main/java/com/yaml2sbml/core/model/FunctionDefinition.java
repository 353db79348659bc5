package com.yaml2sbml.core.model;

import java.util.List;
import java.util.Objects;

import com.yaml2sbml.core.expression.CompiledFormula;

/**
 * User function, written as a MathML lambda.
 *
 * @param id function identifier
 * @param arguments ordered argument names
 * @param body formula over the arguments only
 */
public record FunctionDefinition(
    String id,
    List<String> arguments,
    CompiledFormula body
) implements ModelEntity {

    /**
     * Compact constructor with validation.
     */
    public FunctionDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(body, "body must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }
}

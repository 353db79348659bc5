package com.yaml2sbml.core.expression;

import java.util.Objects;

/**
 * Reference to a name. Resolution against the identifier registry happens after compilation.
 *
 * @param name referenced name
 */
public record Identifier(String name) implements Expression {

    public Identifier {
        Objects.requireNonNull(name, "name must not be null");
    }
}

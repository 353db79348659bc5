package com.yaml2sbml.core.expression;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Call of a builtin or document-declared function.
 *
 * @param name function name as written in the formula
 * @param arguments ordered argument trees
 */
public record FunctionCall(String name, List<Expression> arguments) implements Expression {

    public FunctionCall {
        Objects.requireNonNull(name, "name must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    /**
     * Returns the builtin this call targets, if any.
     *
     * @return builtin function, or empty for a user-defined function
     */
    public Optional<BuiltinFunction> builtin() {
        return BuiltinFunction.lookup(name);
    }
}

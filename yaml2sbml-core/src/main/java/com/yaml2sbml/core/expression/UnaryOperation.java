package com.yaml2sbml.core.expression;

import java.util.Objects;

/**
 * Prefix operator node.
 *
 * @param operator the operator
 * @param operand the operand
 */
public record UnaryOperation(UnaryOperator operator, Expression operand) implements Expression {

    public UnaryOperation {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(operand, "operand must not be null");
    }
}

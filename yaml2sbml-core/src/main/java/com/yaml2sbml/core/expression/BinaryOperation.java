package com.yaml2sbml.core.expression;

import java.util.Objects;

/**
 * Binary arithmetic node.
 *
 * @param operator the operator
 * @param left left operand
 * @param right right operand
 */
public record BinaryOperation(BinaryOperator operator, Expression left, Expression right) implements Expression {

    public BinaryOperation {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }
}

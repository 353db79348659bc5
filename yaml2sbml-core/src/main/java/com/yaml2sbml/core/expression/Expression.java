package com.yaml2sbml.core.expression;

/**
 * Node of a compiled formula tree.
 *
 * <p>Implementations are immutable records:
 * <ul>
 *   <li>{@link NumberLiteral} - a decimal constant</li>
 *   <li>{@link Identifier} - a reference to a declared name, bound argument or reserved constant</li>
 *   <li>{@link BinaryOperation} - {@code + - * / ^}</li>
 *   <li>{@link UnaryOperation} - sign negation</li>
 *   <li>{@link FunctionCall} - builtin or user function applied to arguments</li>
 * </ul>
 *
 * <p>Two trees are structurally equal when their records are equal.
 *
 * @see ExpressionCompiler
 * @see InfixPrinter
 */
public interface Expression {

    /**
     * Renders this tree as infix text that compiles back to an equal tree.
     *
     * @return infix formula text
     */
    default String toInfix() {
        return InfixPrinter.print(this);
    }
}

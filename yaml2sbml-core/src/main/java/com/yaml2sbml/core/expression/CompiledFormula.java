package com.yaml2sbml.core.expression;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Result of compiling one formula.
 *
 * @param source the formula text as written in the document
 * @param tree the expression tree
 * @param boundNames names scoped locally to the formula (function arguments)
 */
public record CompiledFormula(String source, Expression tree, Set<String> boundNames) {

    public CompiledFormula {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(tree, "tree must not be null");
        boundNames = boundNames == null ? Set.of() : Set.copyOf(boundNames);
    }

    /**
     * Returns every identifier leaf that is not a bound name, in order of first appearance.
     * Reserved constants are included; the validator decides how they resolve.
     *
     * @return free identifiers
     */
    public Set<String> freeIdentifiers() {
        Set<String> identifiers = new LinkedHashSet<>();
        collectIdentifiers(tree, identifiers);
        identifiers.removeAll(boundNames);
        return identifiers;
    }

    /**
     * Returns the names of called functions that are not builtins, in order of first appearance.
     *
     * @return user function names
     */
    public Set<String> userFunctionCalls() {
        Set<String> calls = new LinkedHashSet<>();
        collectUserCalls(tree, calls);
        return calls;
    }

    public String toInfix() {
        return tree.toInfix();
    }

    private static void collectIdentifiers(Expression node, Set<String> into) {
        if (node instanceof Identifier identifier) {
            into.add(identifier.name());
        } else if (node instanceof BinaryOperation binary) {
            collectIdentifiers(binary.left(), into);
            collectIdentifiers(binary.right(), into);
        } else if (node instanceof UnaryOperation unary) {
            collectIdentifiers(unary.operand(), into);
        } else if (node instanceof FunctionCall call) {
            call.arguments().forEach(argument -> collectIdentifiers(argument, into));
        }
    }

    private static void collectUserCalls(Expression node, Set<String> into) {
        if (node instanceof BinaryOperation binary) {
            collectUserCalls(binary.left(), into);
            collectUserCalls(binary.right(), into);
        } else if (node instanceof UnaryOperation unary) {
            collectUserCalls(unary.operand(), into);
        } else if (node instanceof FunctionCall call) {
            if (!BuiltinFunction.isBuiltin(call.name())) {
                into.add(call.name());
            }
            call.arguments().forEach(argument -> collectUserCalls(argument, into));
        }
    }
}

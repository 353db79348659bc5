package com.yaml2sbml.core.registry;

import java.util.Objects;
import java.util.Optional;

import com.yaml2sbml.core.exception.ExpressionSyntaxException;
import com.yaml2sbml.core.exception.UnknownFunctionException;
import com.yaml2sbml.core.exception.UnknownIdentifierException;
import com.yaml2sbml.core.expression.BinaryOperation;
import com.yaml2sbml.core.expression.CompiledFormula;
import com.yaml2sbml.core.expression.Expression;
import com.yaml2sbml.core.expression.FunctionCall;
import com.yaml2sbml.core.expression.ReservedConstant;
import com.yaml2sbml.core.expression.UnaryOperation;

/**
 * Resolves the free identifiers and user function calls of a compiled formula.
 *
 * <p>Two scopes are supported:
 * <ul>
 *   <li><b>Global</b> ({@link #validate}): identifiers resolve to value entries of the
 *       registry or to reserved constants.</li>
 *   <li><b>Closed</b> ({@link #validateClosed}): used for function definition bodies.
 *       Identifiers resolve only to the formula's bound names or to time-independent
 *       reserved constants; the global registry is never consulted for values.</li>
 * </ul>
 *
 * <p>In both scopes calls to user functions must name a declared function definition
 * and pass exactly its number of arguments.
 */
public class ReferenceValidator {

    private final IdentifierRegistry registry;

    public ReferenceValidator(IdentifierRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Validates a formula against everything declared so far.
     *
     * @param block block owning the formula, for error messages
     * @param formula the compiled formula
     * @throws UnknownIdentifierException if an identifier is not declared, or names a function
     * @throws UnknownFunctionException if a call targets an undeclared function
     * @throws ExpressionSyntaxException if a user function is called with the wrong arity
     */
    public void validate(String block, CompiledFormula formula) {
        for (String name : formula.freeIdentifiers()) {
            if (ReservedConstant.isReserved(name)) {
                continue;
            }
            Optional<IdentifierKind> kind = registry.find(name);
            if (kind.isEmpty()) {
                throw new UnknownIdentifierException(block, name,
                    "Unknown identifier '" + name + "' in formula '" + formula.source() + "'");
            }
            if (!kind.get().isValue()) {
                throw new UnknownIdentifierException(block, name,
                    "'" + name + "' is a function and cannot be used as a value in formula '"
                        + formula.source() + "'");
            }
        }
        validateCalls(block, formula, formula.tree());
    }

    /**
     * Validates a function definition body, which may only use its own arguments.
     *
     * @param block block owning the formula
     * @param functionId the function being defined, for error messages
     * @param formula the compiled body; its bound names are the function arguments
     * @throws UnknownIdentifierException if the body uses any name that is not an argument
     */
    public void validateClosed(String block, String functionId, CompiledFormula formula) {
        for (String name : formula.freeIdentifiers()) {
            Optional<ReservedConstant> constant = ReservedConstant.lookup(name);
            if (constant.isPresent() && !constant.get().isTimeDependent()) {
                continue;
            }
            throw new UnknownIdentifierException(block, name,
                "Function '" + functionId + "' refers to '" + name
                    + "', which is not one of its arguments " + formula.boundNames());
        }
        validateCalls(block, formula, formula.tree());
    }

    private void validateCalls(String block, CompiledFormula formula, Expression node) {
        if (node instanceof BinaryOperation binary) {
            validateCalls(block, formula, binary.left());
            validateCalls(block, formula, binary.right());
        } else if (node instanceof UnaryOperation unary) {
            validateCalls(block, formula, unary.operand());
        } else if (node instanceof FunctionCall call) {
            if (call.builtin().isEmpty()) {
                validateUserCall(block, formula, call);
            }
            call.arguments().forEach(argument -> validateCalls(block, formula, argument));
        }
    }

    private void validateUserCall(String block, CompiledFormula formula, FunctionCall call) {
        Optional<Integer> arity = registry.arityOf(call.name());
        if (arity.isEmpty()) {
            throw new UnknownFunctionException(block, new UnknownFunctionException(call.name(),
                "Unknown function '" + call.name() + "' in formula '" + formula.source() + "'"));
        }
        if (arity.get() != call.arguments().size()) {
            throw new ExpressionSyntaxException(block, new ExpressionSyntaxException(formula.source(), -1,
                "Function '" + call.name() + "' expects " + arity.get() + " argument(s) but got "
                    + call.arguments().size()));
        }
    }
}

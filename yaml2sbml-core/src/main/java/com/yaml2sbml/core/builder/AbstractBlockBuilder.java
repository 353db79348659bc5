package com.yaml2sbml.core.builder;

import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.exception.ExpressionSyntaxException;
import com.yaml2sbml.core.exception.UnknownFunctionException;
import com.yaml2sbml.core.expression.CompiledFormula;
import com.yaml2sbml.core.io.DocumentFields;
import com.yaml2sbml.core.io.Field;

/**
 * Base class for block builders providing common functionality.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per builder class)</li>
 *   <li>Entry and field access bound to this builder's block name</li>
 *   <li>Formula compilation that tags compiler errors with the block name</li>
 *   <li>Compile-and-validate for formulas in the global scope</li>
 * </ul>
 *
 * @see BlockBuilder
 */
public abstract class AbstractBlockBuilder implements BlockBuilder {

    /**
     * Logger instance for this builder.
     * Automatically initialized with the concrete builder class name.
     */
    protected final Logger log;

    protected AbstractBlockBuilder() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== Document access ====================

    protected List<JsonNode> entries(JsonNode content) {
        return DocumentFields.entries(blockName(), content);
    }

    protected String requiredText(JsonNode entry, Field field) {
        return DocumentFields.requiredText(blockName(), entry, field);
    }

    protected double requiredNumber(JsonNode entry, Field field) {
        return DocumentFields.requiredNumber(blockName(), entry, field);
    }

    // ==================== Formulas ====================

    /**
     * Compiles a formula, attributing syntax and unknown-function errors to this block.
     *
     * @param context running conversion
     * @param formula formula text
     * @param boundNames locally scoped names
     * @return the compiled formula
     */
    protected CompiledFormula compile(BuildContext context, String formula, Set<String> boundNames) {
        try {
            return context.compiler().compile(formula, boundNames);
        } catch (ExpressionSyntaxException e) {
            throw new ExpressionSyntaxException(blockName(), e);
        } catch (UnknownFunctionException e) {
            throw new UnknownFunctionException(blockName(), e);
        }
    }

    /**
     * Compiles a formula and resolves its identifiers against everything declared so far.
     *
     * @param context running conversion
     * @param formula formula text
     * @return the compiled, validated formula
     */
    protected CompiledFormula compileAndValidate(BuildContext context, String formula) {
        CompiledFormula compiled = compile(context, formula, Set.of());
        context.validator().validate(blockName(), compiled);
        return compiled;
    }
}

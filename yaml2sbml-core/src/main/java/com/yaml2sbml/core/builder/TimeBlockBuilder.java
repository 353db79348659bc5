package com.yaml2sbml.core.builder;

import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.exception.DuplicateIdentifierException;
import com.yaml2sbml.core.exception.SchemaException;
import com.yaml2sbml.core.expression.CompiledFormula;
import com.yaml2sbml.core.expression.ReservedConstant;
import com.yaml2sbml.core.io.Field;
import com.yaml2sbml.core.model.AssignmentRule;
import com.yaml2sbml.core.model.Parameter;
import com.yaml2sbml.core.registry.IdentifierKind;

/**
 * Names the time variable.
 *
 * <p>The block is a single mapping:
 * <pre>{@code
 * time:
 *   variable: t
 * }</pre>
 * and produces a non-constant parameter {@code t} bound to the simulation time symbol
 * by an assignment rule.
 */
public class TimeBlockBuilder extends AbstractBlockBuilder {

    static final Field VARIABLE = Field.of("variable");

    @Override
    public String blockName() {
        return "time";
    }

    @Override
    public void build(JsonNode content, BuildContext context) {
        if (content == null || content.isNull()) {
            log.debug("Empty time block, no time variable declared");
            return;
        }
        if (!content.isObject()) {
            throw new SchemaException(blockName(), "Block must be a mapping with a 'variable' field, found "
                + content.getNodeType());
        }

        String variable = requiredText(content, VARIABLE);
        if (ReservedConstant.isReserved(variable)) {
            throw new DuplicateIdentifierException(blockName(), variable,
                "Time variable '" + variable + "' clashes with the reserved name '" + variable
                    + "'; choose a different name for the time variable, e.g. 't'");
        }
        context.registry().declare(blockName(), variable, IdentifierKind.TIME);

        CompiledFormula time = compile(context, ReservedConstant.TIME.names().get(0), Set.of());
        context.add(Parameter.variable(variable, variable, null));
        context.add(new AssignmentRule(variable, time));
        log.debug("Time variable: {}", variable);
    }
}

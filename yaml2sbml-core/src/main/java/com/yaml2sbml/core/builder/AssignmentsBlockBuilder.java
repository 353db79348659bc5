package com.yaml2sbml.core.builder;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.expression.CompiledFormula;
import com.yaml2sbml.core.io.Field;
import com.yaml2sbml.core.model.AssignmentRule;
import com.yaml2sbml.core.model.Parameter;
import com.yaml2sbml.core.registry.IdentifierKind;

/**
 * Declares derived quantities.
 *
 * <pre>{@code
 * assignments:
 *   - assignmentId: total
 *     formula: x + y
 * }</pre>
 *
 * <p>The formula may only use names declared before the assignment itself, so an
 * assignment can never refer to itself or to a later one.
 */
public class AssignmentsBlockBuilder extends AbstractBlockBuilder {

    static final Field ASSIGNMENT_ID = Field.of("assignmentId", "id");
    static final Field FORMULA = Field.of("formula");

    @Override
    public String blockName() {
        return "assignments";
    }

    @Override
    public void build(JsonNode content, BuildContext context) {
        String units = context.config().units().defaultUnit();
        for (JsonNode entry : entries(content)) {
            String id = requiredText(entry, ASSIGNMENT_ID);
            CompiledFormula formula = compileAndValidate(context, requiredText(entry, FORMULA));
            context.registry().declare(blockName(), id, IdentifierKind.ASSIGNMENT);
            context.add(Parameter.variable(id, id, units));
            context.add(new AssignmentRule(id, formula));
            log.debug("Assignment {} = {}", id, formula.toInfix());
        }
    }
}

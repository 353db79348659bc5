package com.yaml2sbml.core.builder;

import java.util.HashSet;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.exception.DuplicateIdentifierException;
import com.yaml2sbml.core.exception.UnknownIdentifierException;
import com.yaml2sbml.core.expression.CompiledFormula;
import com.yaml2sbml.core.io.Field;
import com.yaml2sbml.core.model.RateRule;
import com.yaml2sbml.core.registry.IdentifierKind;

/**
 * Declares the time derivative of states.
 *
 * <pre>{@code
 * odes:
 *   - state: x
 *     rightHandSide: alpha * x - beta * x * y
 * }</pre>
 *
 * <p>At most one rate rule per state. States without an ODE keep their initial value.
 */
public class OdesBlockBuilder extends AbstractBlockBuilder {

    static final Field STATE = Field.of("state", "stateId");
    static final Field RIGHT_HAND_SIDE = Field.of("rightHandSide", "right_hand_side");

    @Override
    public String blockName() {
        return "odes";
    }

    @Override
    public void build(JsonNode content, BuildContext context) {
        Set<String> defined = new HashSet<>();
        for (JsonNode entry : entries(content)) {
            String state = requiredText(entry, STATE);
            boolean isState = context.registry().find(state)
                .map(kind -> kind == IdentifierKind.STATE)
                .orElse(false);
            if (!isState) {
                throw new UnknownIdentifierException(blockName(), state,
                    "ODE target '" + state + "' is not a declared state");
            }
            if (!defined.add(state)) {
                throw new DuplicateIdentifierException(blockName(), state,
                    "State '" + state + "' already has an ODE");
            }

            CompiledFormula rightHandSide = compileAndValidate(context, requiredText(entry, RIGHT_HAND_SIDE));
            context.add(new RateRule(state, rightHandSide));
            log.debug("d{}/dt = {}", state, rightHandSide.toInfix());
        }
    }
}

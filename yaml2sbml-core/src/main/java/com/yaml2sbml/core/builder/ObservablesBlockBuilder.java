package com.yaml2sbml.core.builder;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.expression.CompiledFormula;
import com.yaml2sbml.core.io.Field;
import com.yaml2sbml.core.model.Diagnostic;
import com.yaml2sbml.core.model.Observable;
import com.yaml2sbml.core.registry.IdentifierKind;

/**
 * Declares measured quantities.
 *
 * <pre>{@code
 * observables:
 *   - observableId: prey_measured
 *     observableFormula: log(x)
 * }</pre>
 *
 * <p>Each observable becomes a parameter named {@code <prefix><observableId>} with an
 * assignment rule. A block that is not a list contributes nothing and is reported
 * as a warning.
 */
public class ObservablesBlockBuilder extends AbstractBlockBuilder {

    static final Field OBSERVABLE_ID = Field.of("observableId", "id");
    static final Field OBSERVABLE_FORMULA = Field.of("observableFormula", "formula");

    @Override
    public String blockName() {
        return "observables";
    }

    @Override
    public void build(JsonNode content, BuildContext context) {
        if (content == null || !content.isArray()) {
            String found = content == null ? "nothing" : content.getNodeType().toString();
            context.report(Diagnostic.warning(blockName(),
                "Observables must be a list of entries, found " + found + "; no observables were added"));
            return;
        }

        String prefix = context.config().observables().prefix();
        String units = context.config().units().defaultUnit();
        for (JsonNode entry : entries(content)) {
            String name = requiredText(entry, OBSERVABLE_ID);
            CompiledFormula formula = compileAndValidate(context, requiredText(entry, OBSERVABLE_FORMULA));

            String id = prefix + name;
            context.registry().declare(blockName(), id, IdentifierKind.OBSERVABLE);
            context.add(new Observable(id, name, formula, units));
            log.debug("Observable {} = {}", id, formula.toInfix());
        }
    }
}

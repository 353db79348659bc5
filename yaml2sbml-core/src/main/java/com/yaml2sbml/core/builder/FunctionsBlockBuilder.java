package com.yaml2sbml.core.builder;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.exception.DuplicateIdentifierException;
import com.yaml2sbml.core.exception.SchemaException;
import com.yaml2sbml.core.expression.BuiltinFunction;
import com.yaml2sbml.core.expression.CompiledFormula;
import com.yaml2sbml.core.expression.ReservedConstant;
import com.yaml2sbml.core.io.DocumentFields;
import com.yaml2sbml.core.io.Field;
import com.yaml2sbml.core.model.FunctionDefinition;
import com.yaml2sbml.core.registry.IdentifierRegistry;

/**
 * Declares user functions.
 *
 * <pre>{@code
 * functions:
 *   - functionId: hill
 *     arguments: x, k, n
 *     formula: x^n / (k^n + x^n)
 * }</pre>
 *
 * <p>{@code arguments} is either a comma separated string or a list. The body is
 * closed over its arguments: it cannot see parameters, states or the time variable.
 * It may call builtins and functions declared earlier in the block.
 */
public class FunctionsBlockBuilder extends AbstractBlockBuilder {

    static final Field FUNCTION_ID = Field.of("functionId", "id");
    static final Field ARGUMENTS = Field.of("arguments");
    static final Field FORMULA = Field.of("formula");

    @Override
    public String blockName() {
        return "functions";
    }

    @Override
    public void build(JsonNode content, BuildContext context) {
        for (JsonNode entry : entries(content)) {
            String id = requiredText(entry, FUNCTION_ID);
            List<String> arguments = readArguments(id, entry);

            CompiledFormula body = compile(context, requiredText(entry, FORMULA), new LinkedHashSet<>(arguments));
            context.validator().validateClosed(blockName(), id, body);

            context.registry().declareFunction(blockName(), id, arguments.size());
            context.add(new FunctionDefinition(id, arguments, body));
            log.debug("Function {}({}) = {}", id, String.join(", ", arguments), body.toInfix());
        }
    }

    private List<String> readArguments(String functionId, JsonNode entry) {
        List<String> names = new ArrayList<>();
        DocumentFields.find(entry, ARGUMENTS).ifPresent(value -> {
            if (value.isArray()) {
                value.forEach(item -> {
                    if (!item.isValueNode()) {
                        throw new SchemaException(blockName(),
                            "Arguments of function '" + functionId + "' must be names, found " + item.getNodeType());
                    }
                    names.add(item.asText().trim());
                });
            } else if (value.isValueNode()) {
                for (String name : value.asText().split(",")) {
                    if (!name.isBlank()) {
                        names.add(name.trim());
                    }
                }
            } else {
                throw new SchemaException(blockName(),
                    "Arguments of function '" + functionId + "' must be a list or a comma separated string");
            }
        });

        Set<String> seen = new LinkedHashSet<>();
        for (String name : names) {
            if (!IdentifierRegistry.isValidIdentifier(name)) {
                throw new SchemaException(blockName(),
                    "Function '" + functionId + "' has an invalid argument name '" + name + "'");
            }
            if (ReservedConstant.isReserved(name) || BuiltinFunction.isBuiltin(name)) {
                throw new DuplicateIdentifierException(blockName(), name,
                    "Function '" + functionId + "' argument '" + name + "' is a reserved name");
            }
            if (!seen.add(name)) {
                throw new DuplicateIdentifierException(blockName(), name,
                    "Function '" + functionId + "' declares argument '" + name + "' more than once");
            }
        }
        return names;
    }
}

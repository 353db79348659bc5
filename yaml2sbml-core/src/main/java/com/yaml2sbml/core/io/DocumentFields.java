package com.yaml2sbml.core.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.exception.InvalidValueException;
import com.yaml2sbml.core.exception.SchemaException;

/**
 * Typed access to block content and entry fields of a loaded document.
 *
 * <p>Block content is either a sequence of mapping entries or, for the time block,
 * a single mapping. Shape violations are {@link SchemaException}s; values that must
 * be numbers but are not are {@link InvalidValueException}s.
 */
public final class DocumentFields {

    /** Decimal notation with optional exponent. */
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private DocumentFields() {
    }

    /**
     * Returns the entries of a sequence block. A null block counts as empty.
     *
     * @param block block name
     * @param content block content
     * @return mapping entries in document order
     * @throws SchemaException if the content is not a sequence or an entry is not a mapping
     */
    public static List<JsonNode> entries(String block, JsonNode content) {
        if (content == null || content.isNull()) {
            return List.of();
        }
        if (!content.isArray()) {
            throw new SchemaException(block, "Block must be a list of entries, found " + content.getNodeType());
        }
        List<JsonNode> entries = new ArrayList<>();
        for (int i = 0; i < content.size(); i++) {
            JsonNode entry = content.get(i);
            if (!entry.isObject()) {
                throw new SchemaException(block, "Entry " + (i + 1) + " must be a mapping, found " + entry.getNodeType());
            }
            entries.add(entry);
        }
        return entries;
    }

    /**
     * Finds a field value under its canonical name or any alias.
     *
     * @param entry mapping entry
     * @param field field to look up
     * @return the value, or empty if absent or null
     */
    public static Optional<JsonNode> find(JsonNode entry, Field field) {
        for (String name : field.names()) {
            JsonNode value = entry.get(name);
            if (value != null && !value.isNull()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Reads a required scalar field as text.
     *
     * @throws SchemaException if the field is missing or not a scalar
     */
    public static String requiredText(String block, JsonNode entry, Field field) {
        JsonNode value = find(entry, field)
            .orElseThrow(() -> new SchemaException(block, "Missing required field '" + field.name() + "' in " + entry));
        if (!value.isValueNode()) {
            throw new SchemaException(block, "Field '" + field.name() + "' must be a scalar, found " + value.getNodeType());
        }
        return value.asText().trim();
    }

    /**
     * Reads a required real number. Numeric YAML values and decimal text are accepted.
     *
     * @throws SchemaException if the field is missing
     * @throws InvalidValueException if the value is not a finite real number
     */
    public static double requiredNumber(String block, JsonNode entry, Field field) {
        JsonNode value = find(entry, field)
            .orElseThrow(() -> new SchemaException(block, "Missing required field '" + field.name() + "' in " + entry));
        return toNumber(block, field, value);
    }

    private static double toNumber(String block, Field field, JsonNode value) {
        if (value.isNumber()) {
            double number = value.doubleValue();
            if (!Double.isFinite(number)) {
                throw new InvalidValueException(block, "Field '" + field.name() + "' must be a finite number, found " + value);
            }
            return number;
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (DECIMAL.matcher(text).matches()) {
                double number = Double.parseDouble(text);
                if (Double.isFinite(number)) {
                    return number;
                }
            }
        }
        throw new InvalidValueException(block,
            "Field '" + field.name() + "' must be a real number, found '" + value.asText() + "'");
    }
}

package com.yaml2sbml.core.builder;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts one top-level block of the ODE document into model entities.
 *
 * <p>Each implementation owns exactly one block name. The assembler calls
 * {@link #build(JsonNode, BuildContext)} at most once per conversion, in a fixed order,
 * so a builder may rely on every block that comes earlier in that order having been
 * processed already.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class StatesBlockBuilder extends AbstractBlockBuilder {
 *     @Override
 *     public String blockName() {
 *         return "states";
 *     }
 *
 *     @Override
 *     public void build(JsonNode content, BuildContext context) {
 *         for (JsonNode entry : entries(content)) {
 *             String id = requiredText(entry, STATE_ID);
 *             context.registry().declare(blockName(), id, IdentifierKind.STATE);
 *             context.add(new Species(id, ...));
 *         }
 *     }
 * }
 * }</pre>
 *
 * @see AbstractBlockBuilder
 * @see BuildContext
 */
public interface BlockBuilder {

    /**
     * Returns the top-level key of the block this builder handles.
     *
     * @return block name, e.g. "parameters"
     */
    String blockName();

    /**
     * Processes the block content.
     *
     * @param content the block value; may be a null node
     * @param context registry, compiler and entity sink of the running conversion
     * @throws com.yaml2sbml.core.exception.ConversionException if the block is invalid
     */
    void build(JsonNode content, BuildContext context);
}

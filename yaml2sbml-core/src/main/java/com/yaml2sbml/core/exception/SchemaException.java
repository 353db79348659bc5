package com.yaml2sbml.core.exception;

/**
 * The document does not have the expected structure: an unknown top-level block,
 * a block or entry of the wrong shape, or a missing required field.
 */
public class SchemaException extends ConversionException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String block, String message) {
        super(block, message);
    }

    public SchemaException(String block, String message, Throwable cause) {
        super(block, message, cause);
    }
}

package com.yaml2sbml.core.exception;

/**
 * Base class for every error that aborts a YAML to SBML conversion.
 *
 * <p>All subclasses are unchecked. A conversion either completes or fails with one of
 * these exceptions, and nothing is serialized or written in the failing case.
 *
 * <p><b>Taxonomy:</b>
 * <ul>
 *   <li>{@link SchemaException} - unknown block, wrong shape, missing field</li>
 *   <li>{@link DuplicateIdentifierException} - a name declared twice</li>
 *   <li>{@link UnknownIdentifierException} - a reference to an undeclared name</li>
 *   <li>{@link ExpressionSyntaxException} - malformed formula text</li>
 *   <li>{@link UnknownFunctionException} - call to a function that is neither builtin nor declared</li>
 *   <li>{@link InvalidValueException} - non-numeric text where a number is required</li>
 * </ul>
 */
public class ConversionException extends RuntimeException {

    private final String block;

    public ConversionException(String message) {
        this(null, message, null);
    }

    public ConversionException(String block, String message) {
        this(block, message, null);
    }

    public ConversionException(String block, String message, Throwable cause) {
        super(block == null ? message : "[" + block + "] " + message, cause);
        this.block = block;
    }

    /**
     * Returns the name of the block being processed when the error occurred.
     *
     * @return block name, or null if the error is not tied to a block
     */
    public String getBlock() {
        return block;
    }
}

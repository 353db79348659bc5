package com.yaml2sbml.core.exception;

/**
 * A formula or rate rule refers to a name that has not been declared in an
 * earlier-processed block (or, inside a function body, is not one of its arguments).
 */
public class UnknownIdentifierException extends ConversionException {

    private final String identifier;

    public UnknownIdentifierException(String block, String identifier, String message) {
        super(block, message);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}

package com.yaml2sbml.core.exception;

/**
 * An identifier was declared more than once, in the same block or across blocks.
 */
public class DuplicateIdentifierException extends ConversionException {

    private final String identifier;

    public DuplicateIdentifierException(String block, String identifier, String message) {
        super(block, message);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}

package com.yaml2sbml.core.exception;

/**
 * A field that must hold a real number holds something else.
 */
public class InvalidValueException extends ConversionException {

    public InvalidValueException(String block, String message) {
        super(block, message);
    }

    public InvalidValueException(String block, String message, Throwable cause) {
        super(block, message, cause);
    }
}

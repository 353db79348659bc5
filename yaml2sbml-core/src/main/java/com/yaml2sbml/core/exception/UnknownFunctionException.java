package com.yaml2sbml.core.exception;

/**
 * A formula calls a function that is neither in the builtin allow-list nor a
 * function definition declared earlier in the document.
 */
public class UnknownFunctionException extends ConversionException {

    private final String functionName;

    public UnknownFunctionException(String functionName, String message) {
        super(message);
        this.functionName = functionName;
    }

    public UnknownFunctionException(String block, UnknownFunctionException cause) {
        super(block, cause.getMessage(), cause);
        this.functionName = cause.functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}

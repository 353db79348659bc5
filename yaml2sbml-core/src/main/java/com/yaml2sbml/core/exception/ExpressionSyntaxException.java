package com.yaml2sbml.core.exception;

/**
 * Formula text could not be parsed: unbalanced parentheses, invalid tokens,
 * trailing input, nesting too deep, or a builtin called with the wrong number of
 * arguments.
 */
public class ExpressionSyntaxException extends ConversionException {

    private final int position;

    public ExpressionSyntaxException(String formula, int position, String message) {
        super(message + " in formula '" + formula + "'" + (position >= 0 ? " at position " + position : ""));
        this.position = position;
    }

    public ExpressionSyntaxException(String block, ExpressionSyntaxException cause) {
        super(block, cause.getMessage(), cause);
        this.position = cause.position;
    }

    /**
     * Returns the zero-based character offset of the offending input.
     *
     * @return offset into the formula, or -1 if not tied to a position
     */
    public int getPosition() {
        return position;
    }
}

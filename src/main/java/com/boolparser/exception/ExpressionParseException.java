package com.boolparser.exception;

/**
 * Base class for failures raised while turning expression text into a tree.
 * Nothing has been evaluated when one of these is thrown.
 */
public abstract class ExpressionParseException extends BoolParserException {

    private final String input;

    protected ExpressionParseException(String message, String input) {
        super(message);
        this.input = input;
    }

    protected static String format(String reason, int position, String input) {
        return "Invalid expression at position " + position + ": " + reason + " in '" + input + "'";
    }

    /**
     * The whitespace-stripped input being parsed, or null when the failure
     * happened below the level of a whole input.
     */
    public String getInput() {
        return input;
    }
}

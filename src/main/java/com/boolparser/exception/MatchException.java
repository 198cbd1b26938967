package com.boolparser.exception;

/**
 * Thrown when a precedence tier completes a pattern that consumed no operator,
 * or whose operator names no operation of the tier.
 * Points at a defective grammar configuration rather than bad user input.
 */
public class MatchException extends ExpressionParseException {

    public MatchException(String message, String input) {
        super(message, input);
    }
}

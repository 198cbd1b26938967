package com.boolparser.exception;

/**
 * Thrown when a right parenthesis has no open parenthesis to close.
 */
public class MissingLeftParenthesisException extends ExpressionParseException {

    private final int position;

    public MissingLeftParenthesisException(int position, String input) {
        super(format("')' without matching '('", position, input), input);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}

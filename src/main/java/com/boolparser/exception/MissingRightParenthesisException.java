package com.boolparser.exception;

/**
 * Thrown when one or more left parentheses are still open at the end of a scan.
 */
public class MissingRightParenthesisException extends ExpressionParseException {

    private final int position;

    public MissingRightParenthesisException(int position, String input) {
        super(format("unclosed '('", position, input), input);
        this.position = position;
    }

    /**
     * Position of the innermost unclosed left parenthesis.
     */
    public int getPosition() {
        return position;
    }
}

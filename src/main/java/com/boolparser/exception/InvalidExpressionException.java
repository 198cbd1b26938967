package com.boolparser.exception;

import java.util.List;

/**
 * Thrown when the working sequence does not collapse to a single expression,
 * or when the expression it collapses to cannot yield a boolean.
 */
public class InvalidExpressionException extends ExpressionParseException {

    private final List<?> residual;

    public InvalidExpressionException(String message, String input, List<?> residual) {
        super(message, input);
        this.residual = residual == null ? List.of() : List.copyOf(residual);
    }

    /**
     * What was left of the working sequence when parsing gave up.
     */
    public List<?> getResidual() {
        return residual;
    }
}

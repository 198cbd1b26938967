package com.boolparser.exception;

/**
 * Thrown when a value of the wrong kind reaches an operation,
 * e.g. a numeric symbol used as an operand of '&amp;'.
 */
public class TypeMismatchException extends EvaluationException {

    public TypeMismatchException(String message) {
        super(message);
    }
}

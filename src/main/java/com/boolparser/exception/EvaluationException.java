package com.boolparser.exception;

/**
 * Exception thrown while evaluating a parsed expression tree.
 */
public class EvaluationException extends BoolParserException {

    public EvaluationException(String message) {
        super(message);
    }
}

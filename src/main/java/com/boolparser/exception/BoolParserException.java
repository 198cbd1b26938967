package com.boolparser.exception;

/**
 * Base exception for the boolean expression parser.
 */
public class BoolParserException extends RuntimeException {

    public BoolParserException(String message) {
        super(message);
    }

    public BoolParserException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.boolparser.exception;

/**
 * Exception thrown when a grammar configuration is invalid or cannot be loaded.
 */
public class ConfigurationException extends BoolParserException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

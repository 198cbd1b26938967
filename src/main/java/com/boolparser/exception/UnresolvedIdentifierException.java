package com.boolparser.exception;

/**
 * Thrown when an identifier has no value in the symbol table at evaluation time.
 */
public class UnresolvedIdentifierException extends EvaluationException {

    private final String name;

    public UnresolvedIdentifierException(String name) {
        super("Unresolved identifier '" + name + "'");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}

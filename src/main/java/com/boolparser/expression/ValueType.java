package com.boolparser.expression;

/**
 * Semantic type an expression yields, as far as it is known at parse time.
 */
public enum ValueType {
    BOOLEAN,
    NUMERIC,

    /**
     * Not known until evaluation (identifiers). Satisfies every requirement
     * and, used as a requirement, accepts every operand.
     */
    ANY;

    /**
     * Whether an operand of type {@code actual} may fill a slot requiring this type.
     */
    public boolean accepts(ValueType actual) {
        return this == ANY || actual == ANY || this == actual;
    }
}

package com.boolparser.expression;

import java.util.Objects;

/**
 * One requirement of an operation's pattern: either a specific operator symbol,
 * or an operand of a given type.
 *
 * @param symbol      Operator symbol, or null for an operand requirement
 * @param operandType Required operand type, or null for an operator requirement
 */
public record PatternElement(String symbol, ValueType operandType) {

    public PatternElement {
        if ((symbol == null) == (operandType == null)) {
            throw new IllegalArgumentException("Pattern element needs exactly one of symbol or operand type");
        }
    }

    public static PatternElement operator(String symbol) {
        return new PatternElement(Objects.requireNonNull(symbol, "symbol"), null);
    }

    public static PatternElement operand(ValueType type) {
        return new PatternElement(null, Objects.requireNonNull(type, "type"));
    }

    public boolean isOperator() {
        return symbol != null;
    }

    @Override
    public String toString() {
        return isOperator() ? "'" + symbol + "'" : operandType.name();
    }
}

package com.boolparser.expression.impl;

import com.boolparser.exception.TypeMismatchException;
import com.boolparser.expression.Expression;
import com.boolparser.expression.Operation;
import com.boolparser.expression.ValueType;
import com.boolparser.expression.Values;
import com.boolparser.variable.SymbolTable;

/**
 * Equality (==, !=) between two booleans or two numbers.
 * Numbers compare by value regardless of their boxed type.
 */
public class EqualityExpression implements Expression {

    private final Expression left;
    private final Expression right;
    private final Operation operation;
    private final String symbol;

    public EqualityExpression(Expression left, Expression right, Operation operation, String symbol) {
        this.left = left;
        this.right = right;
        this.operation = operation;
        this.symbol = symbol;
    }

    @Override
    public Object evaluate(SymbolTable symbols) {
        boolean equal = compareValues(left.evaluate(symbols), right.evaluate(symbols));

        return switch (operation) {
            case EQUALS -> equal;
            case NOT_EQUALS -> !equal;
            default -> throw new IllegalStateException("Invalid equality operation: " + operation);
        };
    }

    private boolean compareValues(Object actual, Object expected) {
        if (actual instanceof Boolean a && expected instanceof Boolean e) {
            return a.booleanValue() == e.booleanValue();
        }
        if (actual instanceof Number a && expected instanceof Number e) {
            return Values.compare(a, e) == 0;
        }
        throw new TypeMismatchException("Cannot compare " + describe(actual) + " with " + describe(expected)
                + " in '" + this + "'");
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }

    @Override
    public ValueType returns() {
        return ValueType.BOOLEAN;
    }

    @Override
    public String toString() {
        return "(" + left + " " + symbol + " " + right + ")";
    }
}

package com.boolparser.expression.impl;

import com.boolparser.expression.Expression;
import com.boolparser.expression.Operation;
import com.boolparser.expression.ValueType;
import com.boolparser.expression.Values;
import com.boolparser.variable.SymbolTable;

/**
 * Numeric comparison (>, >=, <, <=).
 */
public class ComparisonExpression implements Expression {

    private final Expression left;
    private final Expression right;
    private final Operation operation;
    private final String symbol;

    public ComparisonExpression(Expression left, Expression right, Operation operation, String symbol) {
        this.left = left;
        this.right = right;
        this.operation = operation;
        this.symbol = symbol;
    }

    @Override
    public Object evaluate(SymbolTable symbols) {
        int cmp = Values.compare(left.evaluateNumber(symbols), right.evaluateNumber(symbols));

        return switch (operation) {
            case GREATER_THAN -> cmp > 0;
            case GREATER_THAN_OR_EQUALS -> cmp >= 0;
            case LESS_THAN -> cmp < 0;
            case LESS_THAN_OR_EQUALS -> cmp <= 0;
            default -> throw new IllegalStateException("Invalid comparison operation: " + operation);
        };
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

package com.boolparser.expression.impl;

import com.boolparser.expression.Expression;
import com.boolparser.expression.ValueType;
import com.boolparser.variable.SymbolTable;

/**
 * Logical AND. The right operand is not evaluated when the left one is false.
 */
public class AndExpression implements Expression {

    private final Expression left;
    private final Expression right;
    private final String symbol;

    public AndExpression(Expression left, Expression right, String symbol) {
        this.left = left;
        this.right = right;
        this.symbol = symbol;
    }

    @Override
    public Object evaluate(SymbolTable symbols) {
        return left.evaluateBoolean(symbols) && right.evaluateBoolean(symbols);
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

package com.boolparser.expression.impl;

import com.boolparser.expression.Expression;
import com.boolparser.expression.ValueType;
import com.boolparser.variable.SymbolTable;

/**
 * Logical NOT - negates the operand.
 */
public class NotExpression implements Expression {

    private final Expression operand;
    private final String symbol;

    public NotExpression(Expression operand, String symbol) {
        this.operand = operand;
        this.symbol = symbol;
    }

    @Override
    public Object evaluate(SymbolTable symbols) {
        return !operand.evaluateBoolean(symbols);
    }

    @Override
    public ValueType returns() {
        return ValueType.BOOLEAN;
    }

    @Override
    public String toString() {
        return symbol + operand;
    }
}

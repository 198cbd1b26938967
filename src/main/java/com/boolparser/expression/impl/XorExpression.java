package com.boolparser.expression.impl;

import com.boolparser.expression.Expression;
import com.boolparser.expression.ValueType;
import com.boolparser.variable.SymbolTable;

/**
 * Logical exclusive OR. Both operands are always evaluated.
 */
public class XorExpression implements Expression {

    private final Expression left;
    private final Expression right;
    private final String symbol;

    public XorExpression(Expression left, Expression right, String symbol) {
        this.left = left;
        this.right = right;
        this.symbol = symbol;
    }

    @Override
    public Object evaluate(SymbolTable symbols) {
        boolean l = left.evaluateBoolean(symbols);
        boolean r = right.evaluateBoolean(symbols);
        return l ^ r;
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

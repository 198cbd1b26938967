package com.boolparser.expression.impl;

import com.boolparser.expression.Expression;
import com.boolparser.expression.ValueType;
import com.boolparser.expression.Values;
import com.boolparser.variable.SymbolTable;

import java.math.BigInteger;

/**
 * Literal number such as {@code 3} or {@code 2.5}. The text is converted when evaluated:
 * without a decimal point to an exact integer, otherwise to a double.
 */
public class NumericLiteral implements Expression {

    private final String text;

    public NumericLiteral(String text) {
        this.text = text;
    }

    @Override
    public Object evaluate(SymbolTable symbols) {
        if (text.indexOf('.') >= 0) {
            return Double.parseDouble(text);
        }
        return Values.narrow(new BigInteger(text));
    }

    @Override
    public ValueType returns() {
        return ValueType.NUMERIC;
    }

    @Override
    public String toString() {
        return text;
    }
}

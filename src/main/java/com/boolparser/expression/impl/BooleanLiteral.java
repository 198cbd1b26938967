package com.boolparser.expression.impl;

import com.boolparser.expression.Expression;
import com.boolparser.expression.ValueType;
import com.boolparser.token.LexerConfig;
import com.boolparser.variable.SymbolTable;

/**
 * Literal {@code True} or {@code False}. The text is converted when evaluated.
 */
public class BooleanLiteral implements Expression {

    private final String text;

    public BooleanLiteral(String text) {
        this.text = text;
    }

    @Override
    public Object evaluate(SymbolTable symbols) {
        Boolean value = LexerConfig.BOOLEAN_VALUES.get(text);
        if (value == null) {
            throw new IllegalStateException("Not a boolean literal: " + text);
        }
        return value;
    }

    @Override
    public ValueType returns() {
        return ValueType.BOOLEAN;
    }

    @Override
    public String toString() {
        return text;
    }
}

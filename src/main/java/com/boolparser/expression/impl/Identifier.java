package com.boolparser.expression.impl;

import com.boolparser.exception.UnresolvedIdentifierException;
import com.boolparser.expression.Expression;
import com.boolparser.expression.ValueType;
import com.boolparser.variable.SymbolTable;

/**
 * Named value looked up in the symbol table each time it is evaluated.
 * Its type is unknown until then, so it can fill any operand slot.
 */
public class Identifier implements Expression {

    private final String name;

    public Identifier(String name) {
        this.name = name;
    }

    @Override
    public Object evaluate(SymbolTable symbols) {
        return symbols.lookup(name)
                .orElseThrow(() -> new UnresolvedIdentifierException(name));
    }

    @Override
    public ValueType returns() {
        return ValueType.ANY;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}

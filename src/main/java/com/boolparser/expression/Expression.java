package com.boolparser.expression;

import com.boolparser.parser.ParseItem;
import com.boolparser.variable.SymbolTable;

/**
 * Node of a parsed expression tree.
 */
public interface Expression extends ParseItem {

    /**
     * Evaluate this node. Operands are evaluated first; identifiers are looked up
     * in the symbol table at this point and no earlier.
     *
     * @param symbols Table identifiers are resolved against
     * @return a {@link Boolean} or a {@link Number}
     */
    Object evaluate(SymbolTable symbols);

    /**
     * The type this node yields.
     */
    ValueType returns();

    default boolean evaluateBoolean(SymbolTable symbols) {
        return Values.toBoolean(evaluate(symbols), this);
    }

    default Number evaluateNumber(SymbolTable symbols) {
        return Values.toNumber(evaluate(symbols), this);
    }
}

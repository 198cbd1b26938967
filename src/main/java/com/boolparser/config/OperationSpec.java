package com.boolparser.config;

import com.boolparser.exception.ConfigurationException;
import com.boolparser.expression.Expression;
import com.boolparser.expression.Operation;
import com.boolparser.expression.PatternElement;

import java.util.List;
import java.util.Objects;

/**
 * An operation as a grammar uses it: the catalog entry, the symbol it is written
 * with, and the pattern the precedence matcher recognizes it by.
 *
 * @param operation Catalog entry providing the semantics
 * @param symbol    Operator symbol in this grammar
 * @param expects   Pattern of operator and operand requirements
 */
public record OperationSpec(
        Operation operation,
        String symbol,
        List<PatternElement> expects
) {
    public OperationSpec {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(symbol, "symbol");
        expects = List.copyOf(expects);

        // A pattern without an operator is reported by the precedence matcher
        long operands = expects.stream().filter(e -> !e.isOperator()).count();
        if (operands != operation.getShape().arity()) {
            throw new ConfigurationException("Pattern " + expects + " for " + operation + " has " + operands
                    + " operand(s), but " + operation + " takes " + operation.getShape().arity());
        }
    }

    /**
     * Spec using the operation's default symbol.
     */
    public static OperationSpec of(Operation operation) {
        return of(operation, operation.getSymbol());
    }

    /**
     * Spec writing the operation with a different symbol.
     */
    public static OperationSpec of(Operation operation, String symbol) {
        return new OperationSpec(operation, symbol, operation.expects(symbol));
    }

    /**
     * Number of operand slots in the pattern.
     */
    public int arity() {
        return (int) expects.stream().filter(e -> !e.isOperator()).count();
    }

    /**
     * Whether the pattern starts with its operator.
     */
    public boolean isPrefix() {
        return !expects.isEmpty() && expects.get(0).isOperator();
    }

    public Expression create(List<Expression> operands) {
        return operation.create(operands, symbol);
    }

    @Override
    public String toString() {
        return operation + expects.toString();
    }
}

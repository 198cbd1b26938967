package com.boolparser.expression;

import com.boolparser.expression.impl.AndExpression;
import com.boolparser.expression.impl.ArithmeticExpression;
import com.boolparser.expression.impl.ComparisonExpression;
import com.boolparser.expression.impl.EqualityExpression;
import com.boolparser.expression.impl.NotExpression;
import com.boolparser.expression.impl.OrExpression;
import com.boolparser.expression.impl.XorExpression;

import java.util.List;

/**
 * Catalog of expression kinds the precedence matcher can fold.
 * Which of them a grammar uses, with which symbols and in which precedence
 * order, is decided by {@link com.boolparser.config.GrammarConfig}.
 */
public enum Operation {
    // Logical
    NOT("!", Shape.PREFIX, ValueType.BOOLEAN, ValueType.BOOLEAN),
    AND("&", Shape.INFIX, ValueType.BOOLEAN, ValueType.BOOLEAN),
    XOR("^", Shape.INFIX, ValueType.BOOLEAN, ValueType.BOOLEAN),
    OR("|", Shape.INFIX, ValueType.BOOLEAN, ValueType.BOOLEAN),

    // Comparison
    GREATER_THAN(">", Shape.INFIX, ValueType.NUMERIC, ValueType.BOOLEAN),
    GREATER_THAN_OR_EQUALS(">=", Shape.INFIX, ValueType.NUMERIC, ValueType.BOOLEAN),
    LESS_THAN("<", Shape.INFIX, ValueType.NUMERIC, ValueType.BOOLEAN),
    LESS_THAN_OR_EQUALS("<=", Shape.INFIX, ValueType.NUMERIC, ValueType.BOOLEAN),

    // Equality, on two booleans or two numbers
    EQUALS("==", Shape.INFIX, ValueType.ANY, ValueType.BOOLEAN),
    NOT_EQUALS("!=", Shape.INFIX, ValueType.ANY, ValueType.BOOLEAN),

    // Arithmetic
    MULTIPLY("*", Shape.INFIX, ValueType.NUMERIC, ValueType.NUMERIC),
    DIVIDE("/", Shape.INFIX, ValueType.NUMERIC, ValueType.NUMERIC),
    ADD("+", Shape.INFIX, ValueType.NUMERIC, ValueType.NUMERIC),
    SUBTRACT("-", Shape.INFIX, ValueType.NUMERIC, ValueType.NUMERIC);

    /**
     * Where the operator sits relative to its operands.
     */
    public enum Shape {
        PREFIX(1),
        INFIX(2);

        private final int arity;

        Shape(int arity) {
            this.arity = arity;
        }

        public int arity() {
            return arity;
        }
    }

    private final String symbol;
    private final Shape shape;
    private final ValueType operandType;
    private final ValueType returns;

    Operation(String symbol, Shape shape, ValueType operandType, ValueType returns) {
        this.symbol = symbol;
        this.shape = shape;
        this.operandType = operandType;
        this.returns = returns;
    }

    /**
     * Symbol used when a grammar does not override it.
     */
    public String getSymbol() {
        return symbol;
    }

    public Shape getShape() {
        return shape;
    }

    public ValueType returns() {
        return returns;
    }

    /**
     * Pattern matching this operation when written with the given symbol.
     */
    public List<PatternElement> expects(String operatorSymbol) {
        PatternElement operator = PatternElement.operator(operatorSymbol);
        PatternElement operand = PatternElement.operand(operandType);
        return switch (shape) {
            case PREFIX -> List.of(operator, operand);
            case INFIX -> List.of(operand, operator, operand);
        };
    }

    /**
     * Build the node for this operation, written with its default symbol.
     */
    public Expression create(List<Expression> operands) {
        return create(operands, symbol);
    }

    /**
     * Build the node for this operation.
     *
     * @param operands       Operands in the order they appear in the input
     * @param operatorSymbol Symbol the operation was written with, kept for display
     * @return The new node
     */
    public Expression create(List<Expression> operands, String operatorSymbol) {
        if (operands.size() != shape.arity()) {
            throw new IllegalArgumentException(name() + " takes " + shape.arity()
                    + " operand(s), got " + operands.size());
        }
        Expression first = operands.get(0);
        if (shape == Shape.PREFIX) {
            return new NotExpression(first, operatorSymbol);
        }
        Expression second = operands.get(1);

        return switch (this) {
            case AND -> new AndExpression(first, second, operatorSymbol);
            case OR -> new OrExpression(first, second, operatorSymbol);
            case XOR -> new XorExpression(first, second, operatorSymbol);
            case GREATER_THAN, GREATER_THAN_OR_EQUALS, LESS_THAN, LESS_THAN_OR_EQUALS ->
                    new ComparisonExpression(first, second, this, operatorSymbol);
            case EQUALS, NOT_EQUALS -> new EqualityExpression(first, second, this, operatorSymbol);
            case MULTIPLY, DIVIDE, ADD, SUBTRACT -> new ArithmeticExpression(first, second, this, operatorSymbol);
            case NOT -> throw new IllegalStateException("NOT is a prefix operation");
        };
    }
}

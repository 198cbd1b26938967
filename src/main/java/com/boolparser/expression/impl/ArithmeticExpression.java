package com.boolparser.expression.impl;

import com.boolparser.exception.EvaluationException;
import com.boolparser.expression.Expression;
import com.boolparser.expression.Operation;
import com.boolparser.expression.ValueType;
import com.boolparser.expression.Values;
import com.boolparser.variable.SymbolTable;

import java.math.BigInteger;

/**
 * Arithmetic (*, /, +, -) on two numbers.
 * Addition, subtraction and multiplication of two integers stay exact; division
 * and anything involving a fractional operand is done in double precision.
 */
public class ArithmeticExpression implements Expression {

    private final Expression left;
    private final Expression right;
    private final Operation operation;
    private final String symbol;

    public ArithmeticExpression(Expression left, Expression right, Operation operation, String symbol) {
        this.left = left;
        this.right = right;
        this.operation = operation;
        this.symbol = symbol;
    }

    @Override
    public Object evaluate(SymbolTable symbols) {
        Number leftValue = left.evaluateNumber(symbols);
        Number rightValue = right.evaluateNumber(symbols);

        if (operation == Operation.DIVIDE) {
            if (rightValue.doubleValue() == 0.0) {
                throw new EvaluationException("Division by zero in '" + this + "'");
            }
            return leftValue.doubleValue() / rightValue.doubleValue();
        }
        if (Values.isIntegral(leftValue) && Values.isIntegral(rightValue)) {
            return Values.narrow(exact(Values.toBigInteger(leftValue), Values.toBigInteger(rightValue)));
        }

        double l = leftValue.doubleValue();
        double r = rightValue.doubleValue();
        return switch (operation) {
            case MULTIPLY -> l * r;
            case ADD -> l + r;
            case SUBTRACT -> l - r;
            default -> throw new IllegalStateException("Invalid arithmetic operation: " + operation);
        };
    }

    private BigInteger exact(BigInteger l, BigInteger r) {
        return switch (operation) {
            case MULTIPLY -> l.multiply(r);
            case ADD -> l.add(r);
            case SUBTRACT -> l.subtract(r);
            default -> throw new IllegalStateException("Invalid arithmetic operation: " + operation);
        };
    }

    @Override
    public ValueType returns() {
        return ValueType.NUMERIC;
    }

    @Override
    public String toString() {
        return "(" + left + " " + symbol + " " + right + ")";
    }
}

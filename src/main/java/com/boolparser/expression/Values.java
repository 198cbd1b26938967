package com.boolparser.expression;

import com.boolparser.exception.TypeMismatchException;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Conversions and comparisons applied to evaluated operand values.
 * <p>
 * Integral numbers ({@link Long}, {@link Integer}, {@link Short}, {@link Byte},
 * {@link BigInteger}) and {@link BigDecimal} are compared exactly; as soon as one
 * side is a {@link Double} or {@link Float}, both sides are compared as doubles.
 */
public final class Values {

    private Values() {
    }

    public static boolean toBoolean(Object value, Expression source) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw mismatch("boolean", value, source);
    }

    public static Number toNumber(Object value, Expression source) {
        if (value instanceof Number n) {
            return n;
        }
        throw mismatch("numeric", value, source);
    }

    /**
     * Compare two numbers by value, regardless of their boxed type.
     *
     * @return negative, zero or positive as {@code left} is less than, equal to or greater than {@code right}
     */
    public static int compare(Number left, Number right) {
        if (isExact(left) && isExact(right)) {
            return toBigDecimal(left).compareTo(toBigDecimal(right));
        }
        return Double.compare(left.doubleValue(), right.doubleValue());
    }

    public static boolean isIntegral(Number value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    public static BigInteger toBigInteger(Number value) {
        return value instanceof BigInteger big ? big : BigInteger.valueOf(value.longValue());
    }

    /**
     * Smallest of {@link Long} and {@link BigInteger} that holds the value.
     */
    public static Number narrow(BigInteger value) {
        if (value.bitLength() < Long.SIZE) {
            return value.longValue();
        }
        return value;
    }

    private static boolean isExact(Number value) {
        return isIntegral(value) || value instanceof BigDecimal;
    }

    private static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(toBigInteger(value));
    }

    private static TypeMismatchException mismatch(String expected, Object value, Expression source) {
        String actual = value == null ? "null" : value.getClass().getSimpleName() + " " + value;
        return new TypeMismatchException("Expected a " + expected + " value from '" + source + "' but got " + actual);
    }
}

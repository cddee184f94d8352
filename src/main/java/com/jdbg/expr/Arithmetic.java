package com.jdbg.expr;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Number operations on runtime values. Integers are {@code Long} and grow into {@code BigInteger}
 * instead of overflowing; a {@code Double} operand makes the result a double.
 */
final class Arithmetic {
    private Arithmetic() {
    }

    static boolean isInteger(Object value) {
        return value instanceof Long || value instanceof BigInteger
            || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    /** {@code +}, {@code -} or {@code *}. */
    static Number apply(String operator, Number left, Number right) {
        if (isInteger(left) && isInteger(right)) {
            BigInteger a = big(left);
            BigInteger b = big(right);
            return integer(switch (operator) {
                case "+" -> a.add(b);
                case "-" -> a.subtract(b);
                case "*" -> a.multiply(b);
                default -> throw new IllegalArgumentException("Unsupported operator: " + operator);
            });
        }
        double a = left.doubleValue();
        double b = right.doubleValue();
        return switch (operator) {
            case "+" -> a + b;
            case "-" -> a - b;
            case "*" -> a * b;
            default -> throw new IllegalArgumentException("Unsupported operator: " + operator);
        };
    }

    /** Exact ordering; integers are never rounded through {@code double}. */
    static int compare(Number left, Number right) {
        if (isInteger(left) && isInteger(right)) {
            return big(left).compareTo(big(right));
        }
        if (!finite(left) || !finite(right)) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return decimal(left).compareTo(decimal(right));
    }

    /** Numeric equality across integers and floats, so {@code 1 == 1.0}. NaN equals nothing. */
    static boolean equal(Number left, Number right) {
        if (!finite(left) || !finite(right)) {
            return left.doubleValue() == right.doubleValue();
        }
        return compare(left, right) == 0;
    }

    /** The smallest representation: {@code Long} when it fits. */
    static Number integer(BigInteger value) {
        return value.bitLength() < Long.SIZE ? Long.valueOf(value.longValue()) : value;
    }

    private static BigInteger big(Number n) {
        return n instanceof BigInteger b ? b : BigInteger.valueOf(n.longValue());
    }

    private static BigDecimal decimal(Number n) {
        return n instanceof Double d ? new BigDecimal(d) : new BigDecimal(big(n));
    }

    private static boolean finite(Number n) {
        return !(n instanceof Double d) || Double.isFinite(d);
    }
}

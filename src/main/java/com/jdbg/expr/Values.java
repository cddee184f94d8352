package com.jdbg.expr;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;
import java.util.List;

/**
 * Helpers shared by everything that handles runtime values.
 */
public final class Values {
    private Values() {
    }

    /**
     * Only {@code null} (nil) and {@code false} are falsy.
     */
    public static boolean isTruthy(Object value) {
        return value != null && !Boolean.FALSE.equals(value);
    }

    /**
     * Widens integral numbers to {@code Long} (or {@code BigInteger} past its range) and
     * {@code Float} to {@code Double}, recursively inside lists, so that equality between values
     * does not depend on how they were built.
     */
    public static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return Arithmetic.integer(big);
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof List<?> list) {
            MutableList<Object> elements = Lists.mutable.empty();
            for (Object element : list) {
                elements.add(normalize(element));
            }
            return elements.asUnmodifiable();
        }
        return value;
    }

    /**
     * Short description used in error messages.
     */
    public static String describe(Object value) {
        if (value == null) {
            return "nil";
        }
        if (value instanceof String s) {
            return "\"" + s + "\"";
        }
        if (value instanceof Atom atom) {
            return ":" + atom.name();
        }
        return value.toString();
    }
}

package com.jdbg.expr;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * The function library available to traced expressions that do not bring their own.
 */
public final class Builtins {
    private Builtins() {
    }

    public static Environment standard() {
        return install(Environment.empty());
    }

    public static Environment install(Environment env) {
        return env
            .define("length", unary("length", Builtins::length))
            .define("reverse", unary("reverse", Builtins::reverse))
            .define("sum", unary("sum", Builtins::sum))
            .define("max", unary("max", list -> extreme(list, 1)))
            .define("min", unary("min", list -> extreme(list, -1)))
            .define("hd", unary("hd", Builtins::head))
            .define("upcase", unary("upcase", value -> string(value).toUpperCase(Locale.ROOT)))
            .define("downcase", unary("downcase", value -> string(value).toLowerCase(Locale.ROOT)))
            .define("to_string", unary("to_string", Builtins::toText))
            .define("is_nil", unary("is_nil", value -> value == null))
            .define("not", unary("not", Builtins::not));
    }

    private static Environment.NativeFunction unary(String name, Function<Object, Object> body) {
        return args -> {
            if (args.size() != 1) {
                throw new IllegalArgumentException("undefined function " + name + "/" + args.size());
            }
            return body.apply(args.get(0));
        };
    }

    private static Object length(Object value) {
        if (value instanceof String s) {
            return (long) s.codePointCount(0, s.length());
        }
        return (long) list(value).size();
    }

    private static Object reverse(Object value) {
        if (value instanceof String s) {
            return new StringBuilder(s).reverse().toString();
        }
        MutableList<Object> reversed = Lists.mutable.<Object>withAll(list(value)).reverseThis();
        return reversed.asUnmodifiable();
    }

    private static Object sum(Object value) {
        Number total = 0L;
        for (Object element : list(value)) {
            if (!(element instanceof Number n)) {
                throw new ArithmeticException("bad argument in arithmetic expression: " + Values.describe(element));
            }
            total = Arithmetic.apply("+", total, n);
        }
        return total;
    }

    private static Object extreme(Object value, int direction) {
        List<?> elements = list(value);
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("empty list has no " + (direction > 0 ? "max" : "min"));
        }
        Object best = elements.get(0);
        for (Object element : elements) {
            if (Arithmetic.compare(number(element), number(best)) * direction > 0) {
                best = element;
            }
        }
        return best;
    }

    private static Object head(Object value) {
        List<?> elements = list(value);
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("argument error: hd([])");
        }
        return elements.get(0);
    }

    private static Object toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Atom atom) {
            return atom.name();
        }
        return value.toString();
    }

    private static Object not(Object value) {
        if (!(value instanceof Boolean b)) {
            throw new IllegalArgumentException("argument error: not(" + Values.describe(value) + ")");
        }
        return !b;
    }

    private static List<?> list(Object value) {
        if (value instanceof List<?> l) {
            return l;
        }
        throw new IllegalArgumentException("expected a list, got: " + Values.describe(value));
    }

    private static String string(Object value) {
        if (value instanceof String s) {
            return s;
        }
        throw new IllegalArgumentException("expected a string, got: " + Values.describe(value));
    }

    private static Number number(Object value) {
        if (value instanceof Number n) {
            return n;
        }
        throw new IllegalArgumentException("expected a number, got: " + Values.describe(value));
    }
}

package com.jdbg.expr;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.Objects;

/**
 * Plain, untraced evaluation of a single form.
 */
public class FormEvaluator {

    public Object evaluate(Form form, Environment env) {
        if (form instanceof Form.Literal literal) {
            return literal.value();
        }
        if (form instanceof Form.Var var) {
            return env.lookup(var.name());
        }
        if (form instanceof Form.Call call) {
            MutableList<Object> args = Lists.mutable.empty();
            // Arguments are evaluated left to right before the function is resolved
            for (Form arg : call.args()) {
                args.add(evaluate(arg, env));
            }
            return env.function(call.function(), args.size()).apply(args.toImmutable());
        }
        if (form instanceof Form.ListForm list) {
            MutableList<Object> elements = Lists.mutable.empty();
            for (Form element : list.elements()) {
                elements.add(evaluate(element, env));
            }
            return elements.asUnmodifiable();
        }
        if (form instanceof Form.BinaryOp op) {
            return evaluateBinary(op, env);
        }
        throw new IllegalStateException("Unknown form: " + form);
    }

    private Object evaluateBinary(Form.BinaryOp op, Environment env) {
        LogicOperator logic = LogicOperator.fromSymbol(op.operator());
        if (logic != null) {
            Object left = evaluate(op.left(), env);
            return logic.shortCircuits(left) ? left : evaluate(op.right(), env);
        }

        Object left = evaluate(op.left(), env);
        Object right = evaluate(op.right(), env);

        return switch (op.operator()) {
            case "+", "-", "*", "/" -> arithmetic(op.operator(), left, right);
            case "==" -> looselyEqual(left, right);
            case "!=" -> !looselyEqual(left, right);
            case "<" -> compare(op.operator(), left, right) < 0;
            case ">" -> compare(op.operator(), left, right) > 0;
            case "<=" -> compare(op.operator(), left, right) <= 0;
            case ">=" -> compare(op.operator(), left, right) >= 0;
            case "<>" -> concatStrings(left, right);
            case "++" -> concatLists(left, right);
            default -> throw new IllegalArgumentException("Unsupported operator: " + op.operator());
        };
    }

    private Object arithmetic(String operator, Object left, Object right) {
        if (!(left instanceof Number l) || !(right instanceof Number r)) {
            throw new ArithmeticException("bad argument in arithmetic expression: "
                    + Values.describe(left) + " " + operator + " " + Values.describe(right));
        }
        if (operator.equals("/")) {
            if (r.doubleValue() == 0.0) {
                throw new ArithmeticException("bad argument in arithmetic expression: "
                        + Values.describe(left) + " / " + Values.describe(right));
            }
            return l.doubleValue() / r.doubleValue();
        }
        return Arithmetic.apply(operator, l, r);
    }

    static boolean looselyEqual(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return Arithmetic.equal(l, r);
        }
        return Objects.equals(left, right);
    }

    private int compare(String operator, Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return Arithmetic.compare(l, r);
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        throw new IllegalArgumentException("cannot compare " + Values.describe(left)
                + " " + operator + " " + Values.describe(right));
    }

    private String concatStrings(Object left, Object right) {
        if (left instanceof String l && right instanceof String r) {
            return l + r;
        }
        throw new IllegalArgumentException("expected binary arguments for <>, got: "
                + Values.describe(left) + " and " + Values.describe(right));
    }

    private List<Object> concatLists(Object left, Object right) {
        if (left instanceof List<?> l && right instanceof List<?> r) {
            MutableList<Object> joined = Lists.mutable.<Object>withAll(l);
            joined.addAll(r);
            return joined.asUnmodifiable();
        }
        throw new IllegalArgumentException("expected list arguments for ++, got: "
                + Values.describe(left) + " and " + Values.describe(right));
    }
}

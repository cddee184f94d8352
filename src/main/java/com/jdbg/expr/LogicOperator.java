package com.jdbg.expr;

/**
 * Short-circuiting boolean operators. The strict variants only accept a boolean on their left side.
 */
public enum LogicOperator {
    AND("&&", false, false),
    OR("||", true, false),
    STRICT_AND("and", false, true),
    STRICT_OR("or", true, true);

    private final String symbol;
    private final boolean stopsWhenTruthy;
    private final boolean strict;

    LogicOperator(String symbol, boolean stopsWhenTruthy, boolean strict) {
        this.symbol = symbol;
        this.stopsWhenTruthy = stopsWhenTruthy;
        this.strict = strict;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Whether evaluation stops at {@code left}, making it the result and leaving the right side
     * unevaluated.
     *
     * @throws BadBooleanException if the operator is strict and {@code left} is not a boolean
     */
    public boolean shortCircuits(Object left) {
        if (strict && !(left instanceof Boolean)) {
            throw new BadBooleanException(symbol, left);
        }
        return Values.isTruthy(left) == stopsWhenTruthy;
    }

    public static LogicOperator fromSymbol(String symbol) {
        for (LogicOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        return null;
    }
}

package com.jdbg.expr;

/**
 * Thrown when a strict boolean operator receives a non-boolean left operand.
 */
public class BadBooleanException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Object term;

    public BadBooleanException(String operator, Object term) {
        super("expected a boolean on left-side of \"" + operator + "\", got: " + Values.describe(term));
        this.term = term;
    }

    public Object term() {
        return term;
    }
}

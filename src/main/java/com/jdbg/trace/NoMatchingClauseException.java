package com.jdbg.trace;

import com.jdbg.expr.Values;

/**
 * Raised when no clause of a {@code case} or {@code cond} applies.
 */
public class NoMatchingClauseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private NoMatchingClauseException(String message) {
        super(message);
    }

    public static NoMatchingClauseException forCase(Object subject) {
        return new NoMatchingClauseException("no case clause matching: " + Values.describe(subject));
    }

    public static NoMatchingClauseException forCond() {
        return new NoMatchingClauseException("no cond clause evaluated to a truthy value");
    }
}

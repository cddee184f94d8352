package com.jdbg.expr;

/**
 * A named constant such as {@code :ok}.
 */
public record Atom(String name) {
    public Atom {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Atom name must not be empty");
        }
    }
}

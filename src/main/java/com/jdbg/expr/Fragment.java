package com.jdbg.expr;

/**
 * Anything that keeps enough of its original shape to be printed back as source text.
 */
public sealed interface Fragment permits Form, Expression {
}

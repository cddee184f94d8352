package com.jdbg.expr;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * The head of a {@code case} clause.
 */
public sealed interface Pattern {
    record Wildcard() implements Pattern {}
    record Bind(String name) implements Pattern {}
    record Literal(Object value) implements Pattern {}
    record ListOf(ImmutableList<Pattern> elements) implements Pattern {}

    static Pattern any() {
        return new Wildcard();
    }

    static Pattern bind(String name) {
        return new Bind(name);
    }

    static Pattern literal(Object value) {
        return new Literal(Values.normalize(value));
    }

    static Pattern atom(String name) {
        return new Literal(new Atom(name));
    }

    static Pattern list(Pattern... elements) {
        return new ListOf(Lists.immutable.with(elements));
    }
}

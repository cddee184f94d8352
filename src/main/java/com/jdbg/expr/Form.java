package com.jdbg.expr;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A source fragment: the smallest piece of an expression that is evaluated as a whole.
 */
public sealed interface Form extends Fragment {
    record Literal(Object value) implements Form {}
    record Var(String name) implements Form {}
    record Call(String function, ImmutableList<Form> args) implements Form {}
    record BinaryOp(String operator, Form left, Form right) implements Form {}
    record ListForm(ImmutableList<Form> elements) implements Form {}

    static Form literal(Object value) {
        return new Literal(Values.normalize(value));
    }

    static Form nil() {
        return new Literal(null);
    }

    static Form atom(String name) {
        return new Literal(new Atom(name));
    }

    static Form var(String name) {
        return new Var(name);
    }

    static Form call(String function, Form... args) {
        return new Call(function, Lists.immutable.with(args));
    }

    static Form op(String operator, Form left, Form right) {
        return new BinaryOp(operator, left, right);
    }

    static Form list(Form... elements) {
        return new ListForm(Lists.immutable.with(elements));
    }
}

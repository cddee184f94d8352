package com.jdbg.trace;

import com.jdbg.expr.Expression;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.OptionalInt;

/**
 * Everything recorded while evaluating one traced expression.
 *
 * @param shape          shape of the traced expression, which decides how the steps are laid out
 * @param header         call-site identifier printed above the trace
 * @param location       {@code file:line} of the call site
 * @param steps          recorded steps in evaluation order, never empty
 * @param matchedClause  0-based index of the clause that matched, for {@code case} and {@code cond}
 * @param finalValue     the value of the whole expression
 */
public record Trace(Expression.Shape shape,
                    String header,
                    String location,
                    ImmutableList<Step> steps,
                    OptionalInt matchedClause,
                    Object finalValue) {

    public Trace {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("A trace needs at least one step");
        }
    }
}

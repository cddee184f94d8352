package com.jdbg.trace;

import com.jdbg.expr.Expression;
import com.jdbg.expr.Form;
import com.jdbg.expr.LogicOperator;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * What the instrumented evaluator runs: an expression taken apart into the pieces that get
 * recorded. Nothing in a plan has been evaluated yet.
 */
public sealed interface DecomposedPlan {

    Expression.Shape shape();

    record ValuePlan(Form form) implements DecomposedPlan {
        @Override
        public Expression.Shape shape() {
            return Expression.Shape.VALUE;
        }
    }

    /**
     * @param source  the stage as written, without the piped argument
     * @param applied the stage with the previous stage's value threaded in as first argument
     */
    record PipeStage(Form source, Form applied) {}

    record PipePlan(ImmutableList<PipeStage> stages) implements DecomposedPlan {
        @Override
        public Expression.Shape shape() {
            return Expression.Shape.PIPE;
        }
    }

    /**
     * One operator applied to the running value of a logic chain.
     *
     * @param source the whole sub-expression ending at this operator
     */
    record LogicLink(LogicOperator operator, Form right, Form source) {}

    record LogicPlan(Form first, ImmutableList<LogicLink> links) implements DecomposedPlan {
        @Override
        public Expression.Shape shape() {
            return Expression.Shape.LOGIC_OP;
        }
    }

    record CasePlan(Expression.Case source) implements DecomposedPlan {
        @Override
        public Expression.Shape shape() {
            return Expression.Shape.CASE;
        }
    }

    record CondPlan(Expression.Cond source) implements DecomposedPlan {
        @Override
        public Expression.Shape shape() {
            return Expression.Shape.COND;
        }
    }
}

package com.jdbg.trace;

import com.jdbg.expr.Expression;
import com.jdbg.expr.Form;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Takes an expression apart into the steps the instrumented evaluator records.
 */
public class Decomposer {

    /**
     * Variable holding the previous pipe stage's value. It can never clash with a user variable
     * because {@code $} is not part of any identifier.
     */
    static final String PIPE_VALUE = "$pipe";

    public DecomposedPlan decompose(Expression expression) {
        return switch (expression.shape()) {
            case VALUE -> new DecomposedPlan.ValuePlan(((Expression.Value) expression).form());
            case PIPE -> decomposePipe((Expression.Pipe) expression);
            case LOGIC_OP -> decomposeLogic((Expression.LogicOp) expression);
            case CASE -> new DecomposedPlan.CasePlan((Expression.Case) expression);
            case COND -> new DecomposedPlan.CondPlan((Expression.Cond) expression);
        };
    }

    private DecomposedPlan decomposePipe(Expression.Pipe pipe) {
        MutableList<DecomposedPlan.PipeStage> stages = Lists.mutable.empty();
        Form start = pipe.stages().getFirst();
        stages.add(new DecomposedPlan.PipeStage(start, start));

        for (int i = 1; i < pipe.stages().size(); i++) {
            Form.Call call = asCall(pipe.stages().get(i), i);
            Form.Call applied = new Form.Call(call.function(),
                Lists.immutable.<Form>with(Form.var(PIPE_VALUE)).newWithAll(call.args()));
            stages.add(new DecomposedPlan.PipeStage(call, applied));
        }
        return new DecomposedPlan.PipePlan(stages.toImmutable());
    }

    private Form.Call asCall(Form stage, int index) {
        if (stage instanceof Form.Call call) {
            return call;
        }
        // A bare function name pipes like a call without arguments
        if (stage instanceof Form.Var var) {
            return new Form.Call(var.name(), Lists.immutable.empty());
        }
        String kind = stage instanceof Form.Literal ? "a literal"
            : stage instanceof Form.ListForm ? "a list" : "an operator expression";
        throw new IllegalArgumentException("cannot pipe into " + kind + " at stage " + (index + 1)
            + ", only function calls can be piped into");
    }

    private DecomposedPlan decomposeLogic(Expression.LogicOp op) {
        MutableList<DecomposedPlan.LogicLink> links = Lists.mutable.empty();
        Form first = flattenLeft(op, links);
        return new DecomposedPlan.LogicPlan(first, links.toImmutable());
    }

    /**
     * Walks down the left spine, appending one link per operator on the way back up so that
     * links come out innermost first. Right operands are kept whole.
     */
    private Form flattenLeft(Expression expression, MutableList<DecomposedPlan.LogicLink> links) {
        if (expression instanceof Expression.LogicOp op) {
            Form first = flattenLeft(op.left(), links);
            links.add(new DecomposedPlan.LogicLink(op.operator(), op.right(), op.toForm()));
            return first;
        }
        return ((Expression.Value) expression).form();
    }
}

package com.jdbg.trace;

import com.jdbg.expr.Environment;
import com.jdbg.expr.Expression;
import com.jdbg.expr.FormEvaluator;
import com.jdbg.expr.PatternMatcher;
import com.jdbg.expr.Values;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.util.OptionalInt;

/**
 * Runs a decomposed plan with the same evaluation order as the untraced expression, recording a
 * {@link Step} for every piece that actually gets evaluated. Errors raised while evaluating are
 * not caught; whatever was recorded before them is dropped.
 */
public class InstrumentedEvaluator {
    private final FormEvaluator forms;
    private final PatternMatcher patterns;

    public InstrumentedEvaluator() {
        this(new FormEvaluator(), new PatternMatcher());
    }

    public InstrumentedEvaluator(FormEvaluator forms, PatternMatcher patterns) {
        this.forms = forms;
        this.patterns = patterns;
    }

    public Trace evaluate(DecomposedPlan plan, Environment env, CallSite site) {
        return switch (plan.shape()) {
            case VALUE -> evaluateValue((DecomposedPlan.ValuePlan) plan, env, site);
            case PIPE -> evaluatePipe((DecomposedPlan.PipePlan) plan, env, site);
            case LOGIC_OP -> evaluateLogic((DecomposedPlan.LogicPlan) plan, env, site);
            case CASE -> evaluateCase((DecomposedPlan.CasePlan) plan, env, site);
            case COND -> evaluateCond((DecomposedPlan.CondPlan) plan, env, site);
        };
    }

    private Trace evaluateValue(DecomposedPlan.ValuePlan plan, Environment env, CallSite site) {
        Object value = forms.evaluate(plan.form(), env);
        return trace(Expression.Shape.VALUE, site, Lists.immutable.with(new Step(plan.form(), value)),
            OptionalInt.empty(), value);
    }

    private Trace evaluatePipe(DecomposedPlan.PipePlan plan, Environment env, CallSite site) {
        var steps = Lists.mutable.<Step>empty();
        DecomposedPlan.PipeStage start = plan.stages().getFirst();
        Object value = forms.evaluate(start.applied(), env);
        steps.add(new Step(start.source(), value));

        for (DecomposedPlan.PipeStage stage : plan.stages().drop(1)) {
            MutableMap<String, Object> piped = Maps.mutable.empty();
            piped.put(Decomposer.PIPE_VALUE, value);
            value = forms.evaluate(stage.applied(), env.child(piped));
            steps.add(new Step(stage.source(), value));
        }
        return trace(Expression.Shape.PIPE, site, steps.toImmutable(), OptionalInt.empty(), value);
    }

    private Trace evaluateLogic(DecomposedPlan.LogicPlan plan, Environment env, CallSite site) {
        var steps = Lists.mutable.<Step>empty();
        Object value = forms.evaluate(plan.first(), env);
        steps.add(new Step(plan.first(), value));

        for (DecomposedPlan.LogicLink link : plan.links()) {
            // A short-circuited link leaves the running value as the result and records nothing
            if (link.operator().shortCircuits(value)) {
                continue;
            }
            value = forms.evaluate(link.right(), env);
            steps.add(new Step(link.source(), value));
        }
        return trace(Expression.Shape.LOGIC_OP, site, steps.toImmutable(), OptionalInt.empty(), value);
    }

    private Trace evaluateCase(DecomposedPlan.CasePlan plan, Environment env, CallSite site) {
        Expression.Case source = plan.source();
        Object subject = forms.evaluate(source.subject(), env);

        ImmutableList<Expression.CaseClause> clauses = source.clauses();
        for (int i = 0; i < clauses.size(); i++) {
            MutableMap<String, Object> bindings = Maps.mutable.empty();
            if (patterns.match(clauses.get(i).pattern(), subject, bindings)) {
                Object result = forms.evaluate(clauses.get(i).body(), env.child(bindings));
                return trace(Expression.Shape.CASE, site,
                    Lists.immutable.with(new Step(source.subject(), subject), new Step(source, result)),
                    OptionalInt.of(i), result);
            }
        }
        throw NoMatchingClauseException.forCase(subject);
    }

    private Trace evaluateCond(DecomposedPlan.CondPlan plan, Environment env, CallSite site) {
        Expression.Cond source = plan.source();

        ImmutableList<Expression.CondClause> clauses = source.clauses();
        for (int i = 0; i < clauses.size(); i++) {
            Expression.CondClause clause = clauses.get(i);
            Object guard = forms.evaluate(clause.guard(), env);
            if (Values.isTruthy(guard)) {
                Object result = forms.evaluate(clause.body(), env);
                return trace(Expression.Shape.COND, site,
                    Lists.immutable.with(new Step(clause.guard(), guard), new Step(source, result)),
                    OptionalInt.of(i), result);
            }
        }
        throw NoMatchingClauseException.forCond();
    }

    private static Trace trace(Expression.Shape shape, CallSite site, ImmutableList<Step> steps,
                               OptionalInt matchedClause, Object finalValue) {
        return new Trace(shape, site.header(), site.location(), steps, matchedClause, finalValue);
    }
}

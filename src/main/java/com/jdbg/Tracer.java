package com.jdbg;

import com.jdbg.expr.Environment;
import com.jdbg.expr.Expression;
import com.jdbg.output.OutputSink;
import com.jdbg.output.TraceRenderer;
import com.jdbg.trace.CallSite;
import com.jdbg.trace.DecomposedPlan;
import com.jdbg.trace.Decomposer;
import com.jdbg.trace.InstrumentedEvaluator;
import com.jdbg.trace.Trace;

import java.io.PrintStream;

/**
 * Evaluates an expression, prints what each of its steps produced, and returns its value as if
 * it had not been traced at all.
 */
public class Tracer {
    private final Decomposer decomposer = new Decomposer();
    private final InstrumentedEvaluator evaluator = new InstrumentedEvaluator();
    private final TraceRenderer renderer;
    private final OutputSink sink;

    public Tracer(TracerConfig config) {
        this(config, System.out);
    }

    public Tracer(TracerConfig config, PrintStream out) {
        this.renderer = new TraceRenderer(config.renderOptions());
        this.sink = new OutputSink(out, config.outputDir());
    }

    /**
     * Traces {@code expression}, reporting the caller of this method as the call site.
     */
    public Object dbg(Expression expression, Environment env) {
        return dbg(expression, env, CallSite.capture(Tracer.class, Dbg.class));
    }

    /**
     * Traces {@code expression} on behalf of {@code site}.
     *
     * @throws IllegalArgumentException if the call site is a pattern or a guard
     */
    public Object dbg(Expression expression, Environment env, CallSite site) {
        rejectInvalidContext(site.context());

        DecomposedPlan plan = decomposer.decompose(expression);
        Trace trace = evaluator.evaluate(plan, env, site);
        return sink.emit(renderer.render(trace), trace.finalValue(), trace.location());
    }

    private static void rejectInvalidContext(CallSite.Context context) {
        switch (context) {
            case MATCH -> throw new IllegalArgumentException(
                "invalid expression in match, dbg is not allowed in patterns such as function clauses, "
                    + "case clauses or on the left side of the = operator");
            case GUARD -> throw new IllegalArgumentException(
                "invalid expression in guard, dbg is not allowed in guards");
            case EXPRESSION -> {
            }
        }
    }
}

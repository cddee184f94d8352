package com.jdbg.output;

import com.jdbg.trace.Step;
import com.jdbg.trace.Trace;

/**
 * Lays a trace out as text: every step's source next to its value, after an optional
 * call-site header, followed by a blank line.
 *
 * <pre>
 * [CheckoutTest.java:42: com.shop.CheckoutTest.total]
 * items #=&gt; [3, 4]
 * |&gt; sum() #=&gt; 7
 * </pre>
 */
public class TraceRenderer {
    private final RenderOptions options;
    private final Palette palette;
    private final SourceFormatter sources;
    private final ValueInspector values;

    public TraceRenderer(RenderOptions options) {
        this.options = options;
        this.palette = Palette.of(options.color());
        this.sources = new SourceFormatter(palette, options.lineWidth());
        this.values = new ValueInspector(palette, options.lineWidth());
    }

    public String render(Trace trace) {
        StringBuilder sb = new StringBuilder();
        if (options.showLocation()) {
            sb.append(palette.header(trace.header())).append("\n");
        }

        switch (trace.shape()) {
            case VALUE, LOGIC_OP -> {
                for (Step step : trace.steps()) {
                    line(step, sb);
                }
            }
            case PIPE -> {
                line(trace.steps().getFirst(), sb);
                for (Step step : trace.steps().drop(1)) {
                    sb.append(palette.faint("|> "));
                    line(step, sb);
                }
            }
            case CASE -> {
                int clause = trace.matchedClause().orElseThrow() + 1;
                sb.append(label("Case argument")).append(":\n");
                line(trace.steps().get(0), sb);
                sb.append("\n");
                sb.append(label("Case expression")).append(" (clause #").append(clause).append(" matched):\n");
                line(trace.steps().get(1), sb);
            }
            case COND -> {
                int clause = trace.matchedClause().orElseThrow() + 1;
                sb.append(label("Cond clause")).append(" (clause #").append(clause).append(" matched):\n");
                line(trace.steps().get(0), sb);
                sb.append("\n");
                sb.append(label("Cond expression")).append(":\n");
                line(trace.steps().get(1), sb);
            }
        }
        return sb.append("\n").toString();
    }

    private void line(Step step, StringBuilder sb) {
        sb.append(sources.format(step.source()))
          .append(palette.faint(" #=>"))
          .append(" ")
          .append(values.inspect(step.value()))
          .append("\n");
    }

    private String label(String text) {
        return options.decorate() ? Palette.underline(text) : text;
    }
}

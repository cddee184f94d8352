package com.jdbg;

import com.jdbg.expr.Environment;
import com.jdbg.expr.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * The process-wide tracer. It is configured at most once, before the first trace; after that
 * every caller shares the same configuration.
 */
public final class Dbg {
    private static final Logger LOG = LoggerFactory.getLogger(Dbg.class);

    private static final AtomicReference<Tracer> INSTALLED = new AtomicReference<>();

    private Dbg() {
    }

    /**
     * @throws IllegalStateException if a tracer is already in use
     */
    public static Tracer configure(TracerConfig config) {
        Tracer tracer = new Tracer(config);
        if (!INSTALLED.compareAndSet(null, tracer)) {
            throw new IllegalStateException("The tracer is already configured for this process");
        }
        LOG.debug("Tracer configured: {}", config);
        return tracer;
    }

    /** The installed tracer, falling back to defaults when nothing was configured. */
    public static Tracer tracer() {
        Tracer tracer = INSTALLED.get();
        if (tracer == null) {
            INSTALLED.compareAndSet(null, new Tracer(TracerConfig.defaults()));
            tracer = INSTALLED.get();
        }
        return tracer;
    }

    public static Object dbg(Expression expression, Environment env) {
        return tracer().dbg(expression, env);
    }
}

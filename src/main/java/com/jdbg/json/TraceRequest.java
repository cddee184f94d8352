package com.jdbg.json;

import com.jdbg.expr.Builtins;
import com.jdbg.expr.Environment;
import com.jdbg.expr.Expression;
import com.jdbg.trace.CallSite;
import org.eclipse.collections.api.map.ImmutableMap;

/**
 * An expression to trace, the variables it refers to, and the call site it is reported under.
 */
public record TraceRequest(Expression expression, ImmutableMap<String, Object> bindings, CallSite callSite) {

    /** The built-in functions plus this request's bindings. */
    public Environment environment() {
        Environment env = Builtins.standard();
        bindings.forEachKeyValue(env::bind);
        return env;
    }
}

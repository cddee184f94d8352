package com.jdbg.expr;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MapIterable;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Variable bindings and named functions visible to a form while it is evaluated.
 * Child environments see their parent's bindings and share its functions.
 */
public class Environment {

    @FunctionalInterface
    public interface NativeFunction {
        Object apply(ImmutableList<Object> args);
    }

    private final Environment parent;
    private final MutableMap<String, Object> bindings;
    private final MutableMap<String, NativeFunction> functions;

    private Environment(Environment parent, MutableMap<String, Object> bindings,
                        MutableMap<String, NativeFunction> functions) {
        this.parent = parent;
        this.bindings = bindings;
        this.functions = functions;
    }

    public static Environment empty() {
        return new Environment(null, Maps.mutable.empty(), Maps.mutable.empty());
    }

    public Environment bind(String name, Object value) {
        bindings.put(name, Values.normalize(value));
        return this;
    }

    public Environment define(String name, NativeFunction function) {
        functions.put(name, function);
        return this;
    }

    public Environment child(MapIterable<String, Object> scope) {
        MutableMap<String, Object> childBindings = Maps.mutable.empty();
        scope.forEachKeyValue(childBindings::put);
        return new Environment(this, childBindings, functions);
    }

    public boolean isBound(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.bindings.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    public Object lookup(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.bindings.containsKey(name)) {
                return env.bindings.get(name);
            }
        }
        throw new IllegalArgumentException("undefined variable \"" + name + "\"");
    }

    public NativeFunction function(String name, int arity) {
        NativeFunction function = functions.get(name);
        if (function == null) {
            throw new IllegalArgumentException("undefined function " + name + "/" + arity);
        }
        return function;
    }
}

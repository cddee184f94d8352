package com.jdbg.expr;

import org.eclipse.collections.api.map.MutableMap;

import java.util.List;
import java.util.Objects;

/**
 * Matches values against case clause heads. Literals match strictly, so {@code 1} does not
 * match {@code 1.0}.
 */
public class PatternMatcher {

    /**
     * Tries to match {@code value}, adding any variables the pattern binds to {@code bindings}.
     * A name bound twice in one pattern must see equal values both times. On failure
     * {@code bindings} may hold a partial set of bindings and should be discarded.
     */
    public boolean match(Pattern pattern, Object value, MutableMap<String, Object> bindings) {
        if (pattern instanceof Pattern.Wildcard) {
            return true;
        }
        if (pattern instanceof Pattern.Bind bind) {
            if (bindings.containsKey(bind.name())) {
                return Objects.equals(bindings.get(bind.name()), value);
            }
            bindings.put(bind.name(), value);
            return true;
        }
        if (pattern instanceof Pattern.Literal literal) {
            return Objects.equals(literal.value(), value);
        }
        if (pattern instanceof Pattern.ListOf listOf) {
            if (!(value instanceof List<?> list) || list.size() != listOf.elements().size()) {
                return false;
            }
            for (int i = 0; i < list.size(); i++) {
                if (!match(listOf.elements().get(i), list.get(i), bindings)) {
                    return false;
                }
            }
            return true;
        }
        throw new IllegalStateException("Unknown pattern: " + pattern);
    }
}

package com.jdbg.json;

import com.jdbg.expr.Atom;
import com.jdbg.expr.Expression;
import com.jdbg.expr.Form;
import com.jdbg.expr.LogicOperator;
import com.jdbg.expr.Pattern;
import com.jdbg.trace.CallSite;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decodes a JSON trace request into an {@link Expression} tree, its bindings and its call site.
 *
 * <pre>
 * {
 *   "expression": {"pipe": [{"var": "x"}, {"call": "double"}, {"call": "increment"}]},
 *   "bindings": {"x": 3},
 *   "context": "expression",
 *   "location": {"file": "orders_test.exs", "line": 12, "function": "OrdersTest.totals"}
 * }
 * </pre>
 */
public class TraceRequestReader {
    private final JsonValueReader json = new JsonValueReader();

    public TraceRequest read(InputStream input, String sourceName) throws IOException {
        Map<String, Object> document = object(json.read(input), "request");
        if (!document.containsKey("expression")) {
            throw new IOException("Trace request has no \"expression\"");
        }

        Expression expression = expression(document.get("expression"));

        MutableMap<String, Object> bindings = Maps.mutable.empty();
        if (document.get("bindings") != null) {
            for (Map.Entry<String, Object> entry : object(document.get("bindings"), "bindings").entrySet()) {
                bindings.put(entry.getKey(), value(entry.getValue()));
            }
        }

        return new TraceRequest(expression, bindings.toImmutable(), callSite(document, sourceName));
    }

    private CallSite callSite(Map<String, Object> document, String sourceName) throws IOException {
        CallSite site = CallSite.of(sourceName, 1, "jdbg");
        if (document.get("location") != null) {
            Map<String, Object> location = object(document.get("location"), "location");
            site = CallSite.of(
                string(location.getOrDefault("file", sourceName), "location file"),
                number(location.getOrDefault("line", 1L), "location line").intValue(),
                string(location.getOrDefault("function", "jdbg"), "location function"));
        }
        if (document.get("context") != null) {
            String context = string(document.get("context"), "context");
            try {
                site = site.inContext(CallSite.Context.valueOf(context.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IOException("Unknown context: " + context, e);
            }
        }
        return site;
    }

    Expression expression(Object node) throws IOException {
        if (node instanceof Map<?, ?> map && map.size() == 1) {
            String key = (String) map.keySet().iterator().next();
            Object body = map.get(key);
            switch (key) {
                case "pipe" -> {
                    MutableList<Form> stages = Lists.mutable.empty();
                    for (Object stage : array(body, "pipe")) {
                        stages.add(form(stage));
                    }
                    return decoded(() -> new Expression.Pipe(stages.toImmutable()));
                }
                case "and", "or", "strict_and", "strict_or" -> {
                    List<Object> operands = array(body, key);
                    if (operands.size() != 2) {
                        throw new IOException("\"" + key + "\" takes exactly two operands, got " + operands.size());
                    }
                    LogicOperator operator = LogicOperator.valueOf(key.toUpperCase(Locale.ROOT));
                    Expression left = expression(operands.get(0));
                    Form right = form(operands.get(1));
                    return decoded(() -> Expression.logic(operator, left, right));
                }
                case "case" -> {
                    Map<String, Object> caseNode = object(body, "case");
                    Form subject = form(required(caseNode, "subject", "case"));
                    MutableList<Expression.CaseClause> clauses = Lists.mutable.empty();
                    for (Object clause : array(required(caseNode, "clauses", "case"), "case clauses")) {
                        List<Object> pair = pair(clause, "case clause");
                        clauses.add(Expression.clause(pattern(pair.get(0)), form(pair.get(1))));
                    }
                    return decoded(() -> new Expression.Case(subject, clauses.toImmutable()));
                }
                case "cond" -> {
                    MutableList<Expression.CondClause> clauses = Lists.mutable.empty();
                    for (Object clause : array(body, "cond")) {
                        List<Object> pair = pair(clause, "cond clause");
                        clauses.add(Expression.clause(form(pair.get(0)), form(pair.get(1))));
                    }
                    return decoded(() -> new Expression.Cond(clauses.toImmutable()));
                }
                default -> {
                    // Any other node is an opaque value
                }
            }
        }
        return Expression.value(form(node));
    }

    Form form(Object node) throws IOException {
        if (node instanceof List<?>) {
            throw new IOException("Bare JSON arrays are not forms, wrap list elements in {\"list\": [...]}");
        }
        if (!(node instanceof Map<?, ?>)) {
            return Form.literal(node);
        }
        Map<String, Object> map = object(node, "form");
        if (map.containsKey("var")) {
            return Form.var(string(map.get("var"), "var"));
        }
        if (map.containsKey("atom")) {
            return Form.atom(string(map.get("atom"), "atom"));
        }
        if (map.containsKey("call")) {
            MutableList<Form> args = Lists.mutable.empty();
            if (map.get("args") != null) {
                for (Object arg : array(map.get("args"), "args")) {
                    args.add(form(arg));
                }
            }
            return new Form.Call(string(map.get("call"), "call"), args.toImmutable());
        }
        if (map.containsKey("op")) {
            return Form.op(string(map.get("op"), "op"),
                form(required(map, "left", "op")), form(required(map, "right", "op")));
        }
        if (map.containsKey("list")) {
            MutableList<Form> elements = Lists.mutable.empty();
            for (Object element : array(map.get("list"), "list")) {
                elements.add(form(element));
            }
            return new Form.ListForm(elements.toImmutable());
        }
        throw new IOException("Unsupported form with keys " + map.keySet());
    }

    /** The string {@code "_"} is the wildcard; {@code {"literal": "_"}} matches that string instead. */
    Pattern pattern(Object node) throws IOException {
        if ("_".equals(node)) {
            return Pattern.any();
        }
        if (node instanceof List<?>) {
            throw new IOException("Bare JSON arrays are not patterns, wrap list elements in {\"list\": [...]}");
        }
        if (!(node instanceof Map<?, ?>)) {
            return Pattern.literal(node);
        }
        Map<String, Object> map = object(node, "pattern");
        if (map.containsKey("bind")) {
            return Pattern.bind(string(map.get("bind"), "bind"));
        }
        if (map.containsKey("atom")) {
            return Pattern.atom(string(map.get("atom"), "atom"));
        }
        if (map.containsKey("literal")) {
            Object literal = map.get("literal");
            if (literal instanceof Map<?, ?> || literal instanceof List<?>) {
                throw new IOException("Expected a scalar for literal pattern, got " + literal);
            }
            return Pattern.literal(literal);
        }
        if (map.containsKey("list")) {
            MutableList<Pattern> elements = Lists.mutable.empty();
            for (Object element : array(map.get("list"), "list pattern")) {
                elements.add(pattern(element));
            }
            return new Pattern.ListOf(elements.toImmutable());
        }
        throw new IOException("Unsupported pattern with keys " + map.keySet());
    }

    /** Binding values: JSON as is, except that {@code {"atom": name}} is an atom. */
    private Object value(Object node) throws IOException {
        if (node instanceof List<?> list) {
            MutableList<Object> elements = Lists.mutable.empty();
            for (Object element : list) {
                elements.add(value(element));
            }
            return elements.asUnmodifiable();
        }
        if (node instanceof Map<?, ?>) {
            Map<String, Object> map = object(node, "binding");
            if (map.size() == 1 && map.containsKey("atom")) {
                return new Atom(string(map.get("atom"), "atom"));
            }
            MutableMap<Object, Object> fields = Maps.mutable.empty();
            for (Map.Entry<String, Object> entry : map.entrySet()) {
                fields.put(entry.getKey(), value(entry.getValue()));
            }
            return fields.asUnmodifiable();
        }
        return node;
    }

    @FunctionalInterface
    private interface Construction {
        Expression build();
    }

    /** Model constructors reject malformed shapes with IllegalArgumentException; report those as bad input. */
    private static Expression decoded(Construction construction) throws IOException {
        try {
            return construction.build();
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    /** A key that must be present; its value may still be JSON {@code null}. */
    private static Object required(Map<String, Object> map, String key, String what) throws IOException {
        if (!map.containsKey(key)) {
            throw new IOException("Missing \"" + key + "\" in " + what);
        }
        return map.get(key);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> object(Object node, String what) throws IOException {
        if (node instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new IOException("Expected an object for " + what + ", got " + node);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> array(Object node, String what) throws IOException {
        if (node instanceof List<?> list) {
            return (List<Object>) list;
        }
        throw new IOException("Expected an array for " + what + ", got " + node);
    }

    private static List<Object> pair(Object node, String what) throws IOException {
        List<Object> pair = array(node, what);
        if (pair.size() != 2) {
            throw new IOException("Expected a [head, body] pair for " + what + ", got " + node);
        }
        return pair;
    }

    private static String string(Object node, String what) throws IOException {
        if (node instanceof String s) {
            return s;
        }
        throw new IOException("Expected a string for " + what + ", got " + node);
    }

    private static Number number(Object node, String what) throws IOException {
        if (node instanceof Number n) {
            return n;
        }
        throw new IOException("Expected a number for " + what + ", got " + node);
    }
}

package com.jdbg.trace;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Where a trace was requested from.
 */
public record CallSite(String file, int line, String className, String methodName, Context context) {

    /** The syntactic position of the traced expression at its call site. */
    public enum Context {
        EXPRESSION,
        MATCH,
        GUARD
    }

    public CallSite {
        if (file == null || file.isBlank()) {
            file = "nofile";
        }
        if (context == null) {
            context = Context.EXPRESSION;
        }
    }

    public static CallSite of(String file, int line, String function) {
        int dot = function.lastIndexOf('.');
        return dot < 0
            ? new CallSite(file, line, "", function, Context.EXPRESSION)
            : new CallSite(file, line, function.substring(0, dot), function.substring(dot + 1), Context.EXPRESSION);
    }

    public CallSite inContext(Context newContext) {
        return new CallSite(file, line, className, methodName, newContext);
    }

    /**
     * The first frame on the current thread's stack that does not belong to one of the
     * {@code skipped} classes.
     */
    public static CallSite capture(Class<?>... skipped) {
        Set<String> ignored = Stream.concat(Stream.of(skipped).map(Class::getName), Stream.of(CallSite.class.getName()))
            .collect(Collectors.toSet());
        return StackWalker.getInstance()
            .walk(frames -> frames
                .filter(frame -> !ignored.contains(frame.getClassName()))
                .findFirst())
            .map(frame -> new CallSite(frame.getFileName(), frame.getLineNumber(),
                frame.getClassName(), frame.getMethodName(), Context.EXPRESSION))
            .orElseGet(() -> new CallSite(null, 0, "", "", Context.EXPRESSION));
    }

    /** {@code [File.java:12: com.example.Type.method]} */
    public String header() {
        String function = className.isEmpty() ? methodName : className + "." + methodName;
        return "[" + location() + ": " + function + "]";
    }

    /** {@code File.java:12} */
    public String location() {
        return file + ":" + line;
    }
}

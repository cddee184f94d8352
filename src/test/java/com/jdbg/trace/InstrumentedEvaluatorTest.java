package com.jdbg.trace;

import com.jdbg.expr.Atom;
import com.jdbg.expr.BadBooleanException;
import com.jdbg.expr.Environment;
import com.jdbg.expr.Expression;
import com.jdbg.expr.Form;
import com.jdbg.expr.FormEvaluator;
import com.jdbg.expr.LogicOperator;
import com.jdbg.expr.Pattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class InstrumentedEvaluatorTest {

    private static final CallSite SITE = CallSite.of("OrdersTest.java", 12, "OrdersTest.totals");

    private final Decomposer decomposer = new Decomposer();
    private final InstrumentedEvaluator evaluator = new InstrumentedEvaluator();
    private final AtomicInteger probes = new AtomicInteger();
    private Environment env;

    @BeforeEach
    public void setUp() {
        env = Environment.empty()
            .bind("x", 3)
            .define("double", args -> (Long) args.get(0) * 2)
            .define("increment", args -> (Long) args.get(0) + 1)
            .define("probe", args -> {
                probes.incrementAndGet();
                return true;
            })
            .define("boom", args -> {
                throw new IllegalStateException("boom");
            });
    }

    @Test
    public void testValueRecordsOneStep() {
        Form form = Form.op("+", Form.var("x"), Form.literal(1));
        Trace trace = trace(Expression.value(form));

        assertEquals(Expression.Shape.VALUE, trace.shape());
        assertEquals(List.of(new Step(form, 4L)), trace.steps().castToList());
        assertEquals(4L, trace.finalValue());
        assertEquals(OptionalInt.empty(), trace.matchedClause());
    }

    @Test
    public void testPipeRecordsEveryStage() {
        Trace trace = trace(Expression.pipe(Form.var("x"), Form.var("double"), Form.var("increment")));

        assertEquals(List.of(3L, 6L, 7L), values(trace));
        assertEquals(7L, trace.finalValue());
        assertEquals(Form.call("double"), trace.steps().get(1).source());
    }

    @Test
    public void testEachPipeStageAppliesToThePreviousValue() {
        Trace trace = trace(Expression.pipe(Form.literal(5), Form.var("increment"), Form.var("double"),
            Form.var("increment")));

        List<Object> values = values(trace);
        assertEquals(4, values.size());
        assertEquals((Long) values.get(0) + 1, values.get(1));
        assertEquals((Long) values.get(1) * 2, values.get(2));
        assertEquals((Long) values.get(2) + 1, values.get(3));
    }

    @Test
    public void testAndStopsAtFalsyLeft() {
        Trace trace = trace(Expression.and(Form.literal(false), Form.call("probe")));

        assertEquals(List.of(false), values(trace));
        assertEquals(false, trace.finalValue());
        assertEquals(0, probes.get());
    }

    @Test
    public void testOrStopsAtTruthyLeft() {
        Trace trace = trace(Expression.or(Form.literal("present"), Form.call("probe")));

        assertEquals(List.of("present"), values(trace));
        assertEquals("present", trace.finalValue());
        assertEquals(0, probes.get());
    }

    @Test
    public void testAndEvaluatesRightWhenLeftIsTruthy() {
        Trace trace = trace(Expression.and(Form.var("x"), Form.call("probe")));

        assertEquals(List.of(3L, true), values(trace));
        assertEquals(Form.op("&&", Form.var("x"), Form.call("probe")), trace.steps().get(1).source());
        assertEquals(1, probes.get());
    }

    @Test
    public void testChainStopsAsSoonAsItShortCircuits() {
        Expression chain = Expression.and(Expression.and(Form.literal(true), Form.nil()), Form.call("probe"));
        Trace trace = trace(chain);

        assertEquals(2, trace.steps().size());
        assertNull(trace.finalValue());
        assertEquals(0, probes.get());
    }

    @Test
    public void testMixedChainResumesAfterShortCircuit() {
        Expression chain = Expression.or(Expression.and(Form.literal(false), Form.call("probe")),
            Form.literal("fallback"));
        Trace trace = trace(chain);

        assertEquals(List.of(false, "fallback"), values(trace));
        assertEquals(Form.op("||", Form.op("&&", Form.literal(false), Form.call("probe")), Form.literal("fallback")),
            trace.steps().get(1).source());
        assertEquals(0, probes.get());
    }

    @Test
    public void testRightHandChainIsOneStep() {
        Trace trace = trace(Expression.and(Form.literal(true),
            Form.op("&&", Form.call("probe"), Form.call("probe"))));

        assertEquals(List.of(true, true), values(trace));
        assertEquals(2, probes.get());
    }

    @Test
    public void testStrictOperatorRejectsNonBooleanLeft() {
        Expression strict = Expression.logic(LogicOperator.STRICT_OR, Expression.value(Form.literal(1)),
            Form.call("probe"));

        assertThrows(BadBooleanException.class, () -> trace(strict));
        assertEquals(0, probes.get());
    }

    @Test
    public void testCondMatchesFirstTruthyGuard() {
        Expression cond = Expression.cond(
            Expression.clause(Form.literal(false), Form.literal("a")),
            Expression.clause(Form.literal(true), Form.literal("b")),
            Expression.clause(Form.call("probe"), Form.call("probe")));
        Trace trace = trace(cond);

        assertEquals(OptionalInt.of(1), trace.matchedClause());
        assertEquals("b", trace.finalValue());
        assertEquals(List.of(new Step(Form.literal(true), true), new Step(cond, "b")), trace.steps().castToList());
        assertEquals(0, probes.get());
    }

    @Test
    public void testCondWithoutTruthyGuardFails() {
        Expression cond = Expression.cond(
            Expression.clause(Form.nil(), Form.literal("a")),
            Expression.clause(Form.literal(false), Form.literal("b")));

        NoMatchingClauseException e = assertThrows(NoMatchingClauseException.class, () -> trace(cond));
        assertEquals("no cond clause evaluated to a truthy value", e.getMessage());
    }

    @Test
    public void testCaseBindsMatchedPatternAndEvaluatesOnlyItsBody() {
        env.bind("result", List.of(new Atom("ok"), 4L));
        Expression caseExpression = Expression.caseOf(Form.var("result"),
            Expression.clause(Pattern.list(Pattern.atom("error"), Pattern.any()), Form.call("probe")),
            Expression.clause(Pattern.list(Pattern.atom("ok"), Pattern.bind("v")),
                Form.op("*", Form.var("v"), Form.literal(10))),
            Expression.clause(Pattern.any(), Form.call("probe")));
        Trace trace = trace(caseExpression);

        assertEquals(OptionalInt.of(1), trace.matchedClause());
        assertEquals(40L, trace.finalValue());
        assertEquals(List.of(List.of(new Atom("ok"), 4L), 40L), values(trace));
        assertEquals(caseExpression, trace.steps().get(1).source());
        assertEquals(0, probes.get());
    }

    @Test
    public void testCaseWithoutMatchingClauseFails() {
        Expression caseExpression = Expression.caseOf(Form.var("x"),
            Expression.clause(Pattern.literal(1), Form.literal("one")));

        NoMatchingClauseException e = assertThrows(NoMatchingClauseException.class, () -> trace(caseExpression));
        assertEquals("no case clause matching: 3", e.getMessage());
    }

    @Test
    public void testErrorsPropagateUnchanged() {
        Expression pipe = Expression.pipe(Form.var("x"), Form.var("double"), Form.var("boom"), Form.var("probe"));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> trace(pipe));
        assertEquals("boom", e.getMessage());
        assertEquals(0, probes.get());
    }

    @Test
    public void testFinalValueMatchesUntracedEvaluation() {
        FormEvaluator plain = new FormEvaluator();

        Expression.LogicOp logic = (Expression.LogicOp) Expression.or(
            Expression.and(Form.var("x"), Form.nil()), Form.literal("z"));
        assertEquals(plain.evaluate(logic.toForm(), env), trace(logic).finalValue());

        Form value = Form.op("-", Form.var("x"), Form.literal(10));
        assertEquals(plain.evaluate(value, env), trace(Expression.value(value)).finalValue());

        assertEquals(plain.evaluate(Form.call("increment", Form.call("double", Form.var("x"))), env),
            trace(Expression.pipe(Form.var("x"), Form.var("double"), Form.var("increment"))).finalValue());

        // x is 3, so the bind clause applies with n = x
        Expression caseExpression = Expression.caseOf(Form.var("x"),
            Expression.clause(Pattern.literal(1), Form.literal("one")),
            Expression.clause(Pattern.bind("n"), Form.op("*", Form.var("n"), Form.call("double", Form.var("n")))));
        assertEquals(plain.evaluate(Form.op("*", Form.var("x"), Form.call("double", Form.var("x"))), env),
            trace(caseExpression).finalValue());

        Expression cond = Expression.cond(
            Expression.clause(Form.op(">", Form.var("x"), Form.literal(10)), Form.literal("big")),
            Expression.clause(Form.op(">", Form.var("x"), Form.literal(1)), Form.call("increment", Form.var("x"))),
            Expression.clause(Form.literal(true), Form.literal("small")));
        assertEquals(plain.evaluate(Form.call("increment", Form.var("x")), env), trace(cond).finalValue());
    }

    @Test
    public void testTraceCarriesCallSite() {
        Trace trace = trace(Expression.value(Form.var("x")));

        assertEquals("[OrdersTest.java:12: OrdersTest.totals]", trace.header());
        assertEquals("OrdersTest.java:12", trace.location());
    }

    private Trace trace(Expression expression) {
        return evaluator.evaluate(decomposer.decompose(expression), env, SITE);
    }

    private static List<Object> values(Trace trace) {
        return trace.steps().castToList().stream().map(Step::value).collect(Collectors.toList());
    }
}

package com.jdbg.trace;

import com.jdbg.expr.Expression;
import com.jdbg.expr.Form;
import com.jdbg.expr.LogicOperator;
import com.jdbg.expr.Pattern;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DecomposerTest {

    private final Decomposer decomposer = new Decomposer();

    @Test
    public void testValueBecomesSingleStepPlan() {
        Form form = Form.op("+", Form.var("x"), Form.literal(1));
        DecomposedPlan plan = decomposer.decompose(Expression.value(form));

        assertEquals(new DecomposedPlan.ValuePlan(form), plan);
    }

    @Test
    public void testPipeThreadsPreviousValueAsFirstArgument() {
        DecomposedPlan plan = decomposer.decompose(Expression.pipe(
            Form.var("items"),
            Form.var("reverse"),
            Form.call("take", Form.literal(2))));

        DecomposedPlan.PipePlan pipe = assertInstanceOf(DecomposedPlan.PipePlan.class, plan);
        assertEquals(3, pipe.stages().size());

        DecomposedPlan.PipeStage start = pipe.stages().get(0);
        assertEquals(Form.var("items"), start.source());
        assertEquals(Form.var("items"), start.applied());

        DecomposedPlan.PipeStage bare = pipe.stages().get(1);
        assertEquals(Form.call("reverse"), bare.source());
        assertEquals(Form.call("reverse", Form.var(Decomposer.PIPE_VALUE)), bare.applied());

        DecomposedPlan.PipeStage withArgs = pipe.stages().get(2);
        assertEquals(Form.call("take", Form.literal(2)), withArgs.source());
        assertEquals(Form.call("take", Form.var(Decomposer.PIPE_VALUE), Form.literal(2)), withArgs.applied());
    }

    @Test
    public void testPipeIntoLiteralIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> decomposer.decompose(Expression.pipe(Form.var("x"), Form.literal(1))));
        assertTrue(e.getMessage().startsWith("cannot pipe into a literal at stage 2"));
    }

    @Test
    public void testLogicChainIsFlattenedLeftToRight() {
        Form a = Form.var("a");
        Form b = Form.var("b");
        Form c = Form.var("c");
        Expression inner = Expression.and(a, b);
        Expression outer = Expression.or(inner, c);

        DecomposedPlan.LogicPlan plan = assertInstanceOf(DecomposedPlan.LogicPlan.class,
            decomposer.decompose(outer));

        assertEquals(a, plan.first());
        assertEquals(2, plan.links().size());
        assertEquals(new DecomposedPlan.LogicLink(LogicOperator.AND, b, Form.op("&&", a, b)), plan.links().get(0));
        assertEquals(new DecomposedPlan.LogicLink(LogicOperator.OR, c, Form.op("||", Form.op("&&", a, b), c)),
            plan.links().get(1));
    }

    @Test
    public void testRightHandChainIsKeptWhole() {
        Form right = Form.op("&&", Form.var("b"), Form.var("c"));
        DecomposedPlan.LogicPlan plan = assertInstanceOf(DecomposedPlan.LogicPlan.class,
            decomposer.decompose(Expression.and(Form.var("a"), right)));

        assertEquals(1, plan.links().size());
        assertEquals(right, plan.links().get(0).right());
    }

    @Test
    public void testCaseAndCondKeepTheirSource() {
        Expression caseExpression = Expression.caseOf(Form.var("x"),
            Expression.clause(Pattern.literal(1), Form.literal("one")),
            Expression.clause(Pattern.any(), Form.literal("other")));
        Expression condExpression = Expression.cond(
            Expression.clause(Form.literal(true), Form.literal("yes")));

        assertEquals(new DecomposedPlan.CasePlan((Expression.Case) caseExpression),
            decomposer.decompose(caseExpression));
        assertEquals(new DecomposedPlan.CondPlan((Expression.Cond) condExpression),
            decomposer.decompose(condExpression));
    }

    @Test
    public void testLogicOperandMustBeValueOrLogic() {
        assertThrows(IllegalArgumentException.class, () -> Expression.logic(LogicOperator.AND,
            Expression.pipe(Form.var("x"), Form.var("f")), Form.var("y")));
    }
}

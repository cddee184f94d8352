package com.jdbg.expr;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A traceable expression. Each variant is one of the shapes the tracer knows how to take apart;
 * anything else is an opaque {@link Value}.
 */
public sealed interface Expression extends Fragment {

    enum Shape {
        VALUE,
        PIPE,
        LOGIC_OP,
        CASE,
        COND
    }

    Shape shape();

    record Value(Form form) implements Expression {
        @Override
        public Shape shape() {
            return Shape.VALUE;
        }
    }

    record Pipe(ImmutableList<Form> stages) implements Expression {
        public Pipe {
            if (stages.size() < 2) {
                throw new IllegalArgumentException("A pipe needs at least two stages, got " + stages.size());
            }
        }

        @Override
        public Shape shape() {
            return Shape.PIPE;
        }
    }

    record LogicOp(LogicOperator operator, Expression left, Form right) implements Expression {
        public LogicOp {
            if (!(left instanceof Value) && !(left instanceof LogicOp)) {
                throw new IllegalArgumentException("Left side of " + operator.symbol()
                        + " must be a value or another logic operator, got " + left.shape());
            }
        }

        @Override
        public Shape shape() {
            return Shape.LOGIC_OP;
        }

        /**
         * The whole operation as a single form, as it appears in source.
         */
        public Form toForm() {
            Form leftForm = left instanceof LogicOp op ? op.toForm() : ((Value) left).form();
            return new Form.BinaryOp(operator.symbol(), leftForm, right);
        }
    }

    record CaseClause(Pattern pattern, Form body) {}

    record Case(Form subject, ImmutableList<CaseClause> clauses) implements Expression {
        public Case {
            if (clauses.isEmpty()) {
                throw new IllegalArgumentException("A case needs at least one clause");
            }
        }

        @Override
        public Shape shape() {
            return Shape.CASE;
        }
    }

    record CondClause(Form guard, Form body) {}

    record Cond(ImmutableList<CondClause> clauses) implements Expression {
        public Cond {
            if (clauses.isEmpty()) {
                throw new IllegalArgumentException("A cond needs at least one clause");
            }
        }

        @Override
        public Shape shape() {
            return Shape.COND;
        }
    }

    static Expression value(Form form) {
        return new Value(form);
    }

    static Expression pipe(Form... stages) {
        return new Pipe(Lists.immutable.with(stages));
    }

    static Expression and(Expression left, Form right) {
        return new LogicOp(LogicOperator.AND, left, right);
    }

    static Expression and(Form left, Form right) {
        return and(value(left), right);
    }

    static Expression or(Expression left, Form right) {
        return new LogicOp(LogicOperator.OR, left, right);
    }

    static Expression or(Form left, Form right) {
        return or(value(left), right);
    }

    static Expression logic(LogicOperator operator, Expression left, Form right) {
        return new LogicOp(operator, left, right);
    }

    static Expression caseOf(Form subject, CaseClause... clauses) {
        return new Case(subject, Lists.immutable.with(clauses));
    }

    static CaseClause clause(Pattern pattern, Form body) {
        return new CaseClause(pattern, body);
    }

    static Expression cond(CondClause... clauses) {
        return new Cond(Lists.immutable.with(clauses));
    }

    static CondClause clause(Form guard, Form body) {
        return new CondClause(guard, body);
    }
}

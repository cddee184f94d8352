package com.jdbg.output;

import com.jdbg.expr.Expression;
import com.jdbg.expr.Form;
import com.jdbg.expr.Fragment;
import com.jdbg.expr.Pattern;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Prints fragments back as source text. Anything that fits the line width stays on one line;
 * otherwise calls and lists put one argument per line, pipes put one stage per line, and
 * {@code case}/{@code cond} are always laid out as blocks.
 */
public class SourceFormatter {

    private static final ImmutableMap<String, Integer> PRECEDENCE = Maps.mutable.<String, Integer>empty()
        .withKeyValue("||", 1).withKeyValue("or", 1)
        .withKeyValue("&&", 2).withKeyValue("and", 2)
        .withKeyValue("==", 3).withKeyValue("!=", 3)
        .withKeyValue("<", 4).withKeyValue(">", 4).withKeyValue("<=", 4).withKeyValue(">=", 4)
        .withKeyValue("<>", 5).withKeyValue("++", 5)
        .withKeyValue("+", 6).withKeyValue("-", 6)
        .withKeyValue("*", 7).withKeyValue("/", 7)
        .toImmutable();

    private final Palette palette;
    private final int width;

    public SourceFormatter(Palette palette, int width) {
        this.palette = palette;
        this.width = width;
    }

    public String format(Fragment fragment) {
        StringBuilder sb = new StringBuilder();
        format(fragment, 0, sb);
        return sb.toString();
    }

    private void format(Fragment fragment, int indent, StringBuilder sb) {
        if (fragment instanceof Form form) {
            formatForm(form, indent, sb);
            return;
        }
        Expression expression = (Expression) fragment;
        switch (expression.shape()) {
            case VALUE -> formatForm(((Expression.Value) expression).form(), indent, sb);
            case PIPE -> formatPipe((Expression.Pipe) expression, indent, sb);
            case LOGIC_OP -> formatForm(((Expression.LogicOp) expression).toForm(), indent, sb);
            case CASE -> formatCase((Expression.Case) expression, indent, sb);
            case COND -> formatCond((Expression.Cond) expression, indent, sb);
        }
    }

    private void formatForm(Form form, int indent, StringBuilder sb) {
        if (fits(form, indent)) {
            flat(form, palette, sb);
            return;
        }
        if (form instanceof Form.Call call) {
            sb.append(call.function());
            formatBroken(call.args(), "(", ")", indent, sb);
        } else if (form instanceof Form.ListForm list) {
            formatBroken(list.elements(), "[", "]", indent, sb);
        } else if (form instanceof Form.BinaryOp op) {
            formatOperand(op.left(), op, false, indent, sb);
            sb.append(" ").append(op.operator()).append("\n").append(" ".repeat(indent + 2));
            formatOperand(op.right(), op, true, indent + 2, sb);
        } else {
            flat(form, palette, sb);
        }
    }

    private void formatOperand(Form operand, Form.BinaryOp parent, boolean right, int indent, StringBuilder sb) {
        if (needsParens(operand, parent, right)) {
            sb.append("(");
            formatForm(operand, indent + 1, sb);
            sb.append(")");
        } else {
            formatForm(operand, indent, sb);
        }
    }

    private void formatBroken(ImmutableList<Form> items, String open, String close, int indent, StringBuilder sb) {
        if (items.isEmpty()) {
            sb.append(open).append(close);
            return;
        }
        String inner = " ".repeat(indent + 2);
        sb.append(open).append("\n");
        for (int i = 0; i < items.size(); i++) {
            sb.append(inner);
            formatForm(items.get(i), indent + 2, sb);
            sb.append(i < items.size() - 1 ? ",\n" : "\n");
        }
        sb.append(" ".repeat(indent)).append(close);
    }

    private void formatPipe(Expression.Pipe pipe, int indent, StringBuilder sb) {
        StringBuilder flat = new StringBuilder();
        for (int i = 0; i < pipe.stages().size(); i++) {
            flat.append(i == 0 ? "" : " |> ");
            flat(pipeStage(pipe.stages().get(i), i), Palette.PLAIN, flat);
        }
        boolean oneLine = indent + flat.length() <= width;

        formatForm(pipe.stages().getFirst(), indent, sb);
        for (int i = 1; i < pipe.stages().size(); i++) {
            sb.append(oneLine ? " " : "\n" + " ".repeat(indent)).append("|> ");
            formatForm(pipeStage(pipe.stages().get(i), i), indent + 3, sb);
        }
    }

    /** Bare function names in a pipe print as calls. */
    private static Form pipeStage(Form stage, int index) {
        if (index > 0 && stage instanceof Form.Var var) {
            return Form.call(var.name());
        }
        return stage;
    }

    private void formatCase(Expression.Case expression, int indent, StringBuilder sb) {
        sb.append("case ");
        formatForm(expression.subject(), indent + 5, sb);
        sb.append(" do\n");
        for (Expression.CaseClause clause : expression.clauses()) {
            StringBuilder head = new StringBuilder();
            pattern(clause.pattern(), palette, head);
            formatClause(head.toString(), plainLength(clause.pattern()), clause.body(), indent, sb);
        }
        sb.append(" ".repeat(indent)).append("end");
    }

    private void formatCond(Expression.Cond expression, int indent, StringBuilder sb) {
        sb.append("cond do\n");
        for (Expression.CondClause clause : expression.clauses()) {
            StringBuilder head = new StringBuilder();
            formatForm(clause.guard(), indent + 2, head);
            StringBuilder plainHead = new StringBuilder();
            flat(clause.guard(), Palette.PLAIN, plainHead);
            formatClause(head.toString(), plainHead.length(), clause.body(), indent, sb);
        }
        sb.append(" ".repeat(indent)).append("end");
    }

    private void formatClause(String head, int headLength, Form body, int indent, StringBuilder sb) {
        sb.append(" ".repeat(indent + 2)).append(head).append(" ->");
        int bodyColumn = indent + 2 + headLength + 4;
        if (!head.contains("\n") && fits(body, bodyColumn)) {
            sb.append(" ");
            flat(body, palette, sb);
        } else {
            sb.append("\n").append(" ".repeat(indent + 4));
            formatForm(body, indent + 4, sb);
        }
        sb.append("\n");
    }

    private boolean fits(Form form, int indent) {
        StringBuilder plain = new StringBuilder();
        flat(form, Palette.PLAIN, plain);
        return indent + plain.length() <= width;
    }

    private int plainLength(Pattern pattern) {
        StringBuilder plain = new StringBuilder();
        pattern(pattern, Palette.PLAIN, plain);
        return plain.length();
    }

    static void flat(Form form, Palette palette, StringBuilder sb) {
        if (form instanceof Form.Literal literal) {
            ValueInspector.formatFlat(literal.value(), palette, sb);
        } else if (form instanceof Form.Var var) {
            sb.append(var.name());
        } else if (form instanceof Form.Call call) {
            sb.append(call.function()).append("(");
            flatAll(call.args(), palette, sb);
            sb.append(")");
        } else if (form instanceof Form.ListForm list) {
            sb.append("[");
            flatAll(list.elements(), palette, sb);
            sb.append("]");
        } else if (form instanceof Form.BinaryOp op) {
            flatOperand(op.left(), op, false, palette, sb);
            sb.append(" ").append(op.operator()).append(" ");
            flatOperand(op.right(), op, true, palette, sb);
        }
    }

    private static void flatAll(ImmutableList<Form> forms, Palette palette, StringBuilder sb) {
        for (int i = 0; i < forms.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            flat(forms.get(i), palette, sb);
        }
    }

    private static void flatOperand(Form operand, Form.BinaryOp parent, boolean right, Palette palette,
                                    StringBuilder sb) {
        if (needsParens(operand, parent, right)) {
            sb.append("(");
            flat(operand, palette, sb);
            sb.append(")");
        } else {
            flat(operand, palette, sb);
        }
    }

    /** Operators are left-associative, so an equal-precedence operand only needs parentheses on the right. */
    private static boolean needsParens(Form operand, Form.BinaryOp parent, boolean right) {
        if (!(operand instanceof Form.BinaryOp child)) {
            return false;
        }
        int childPrecedence = PRECEDENCE.getIfAbsentValue(child.operator(), 0);
        int parentPrecedence = PRECEDENCE.getIfAbsentValue(parent.operator(), 0);
        return childPrecedence < parentPrecedence || (right && childPrecedence == parentPrecedence);
    }

    static void pattern(Pattern pattern, Palette palette, StringBuilder sb) {
        if (pattern instanceof Pattern.Wildcard) {
            sb.append("_");
        } else if (pattern instanceof Pattern.Bind bind) {
            sb.append(bind.name());
        } else if (pattern instanceof Pattern.Literal literal) {
            ValueInspector.formatFlat(literal.value(), palette, sb);
        } else if (pattern instanceof Pattern.ListOf list) {
            sb.append("[");
            for (int i = 0; i < list.elements().size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                pattern(list.elements().get(i), palette, sb);
            }
            sb.append("]");
        }
    }
}

package io.lighting.stencil.template;

import io.lighting.stencil.TemplateEvaluationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

interface TemplateExpression {
    Object evaluate(TemplateContext context);
}

final class LiteralExpression implements TemplateExpression {
    private final Object value;

    LiteralExpression(Object value) {
        this.value = value;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return value;
    }
}

final class VariableExpression implements TemplateExpression {
    private final String name;

    VariableExpression(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return context.resolveName(name);
    }
}

final class FieldAccessExpression implements TemplateExpression {
    private final TemplateExpression target;
    private final String field;

    FieldAccessExpression(TemplateExpression target, String field) {
        this.target = Objects.requireNonNull(target, "target");
        this.field = Objects.requireNonNull(field, "field");
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return context.readField(target.evaluate(context), field);
    }
}

final class IndexAccessExpression implements TemplateExpression {
    private final TemplateExpression target;
    private final TemplateExpression index;

    IndexAccessExpression(TemplateExpression target, TemplateExpression index) {
        this.target = Objects.requireNonNull(target, "target");
        this.index = Objects.requireNonNull(index, "index");
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return context.readIndex(target.evaluate(context), index.evaluate(context));
    }
}

enum UnaryOp {
    NOT,
    NEGATE,
    PLUS
}

final class UnaryExpression implements TemplateExpression {
    private final UnaryOp op;
    private final TemplateExpression operand;

    UnaryExpression(UnaryOp op, TemplateExpression operand) {
        this.op = Objects.requireNonNull(op, "op");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    @Override
    public Object evaluate(TemplateContext context) {
        Object value = operand.evaluate(context);
        return switch (op) {
            case NOT -> !Values.toBoolean(value);
            case NEGATE -> Values.negate(value);
            case PLUS -> {
                if (!(value instanceof Number)) {
                    throw new TemplateEvaluationException(
                        "unary + cannot be applied to " + Values.typeName(value)
                    );
                }
                yield value;
            }
        };
    }
}

enum BinaryOp {
    OR,
    AND,
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    ADD,
    SUB,
    MUL,
    DIV,
    MOD
}

final class BinaryExpression implements TemplateExpression {
    private final TemplateExpression left;
    private final TemplateExpression right;
    private final BinaryOp op;

    BinaryExpression(TemplateExpression left, BinaryOp op, TemplateExpression right) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.op = Objects.requireNonNull(op, "op");
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return switch (op) {
            case OR -> Values.toBoolean(left.evaluate(context)) || Values.toBoolean(right.evaluate(context));
            case AND -> Values.toBoolean(left.evaluate(context)) && Values.toBoolean(right.evaluate(context));
            case EQ -> Values.valuesEqual(left.evaluate(context), right.evaluate(context));
            case NE -> !Values.valuesEqual(left.evaluate(context), right.evaluate(context));
            case LT -> Values.compare(left.evaluate(context), right.evaluate(context)) < 0;
            case LE -> Values.compare(left.evaluate(context), right.evaluate(context)) <= 0;
            case GT -> Values.compare(left.evaluate(context), right.evaluate(context)) > 0;
            case GE -> Values.compare(left.evaluate(context), right.evaluate(context)) >= 0;
            case ADD -> Values.add(left.evaluate(context), right.evaluate(context));
            case SUB -> Values.subtract(left.evaluate(context), right.evaluate(context));
            case MUL -> Values.multiply(left.evaluate(context), right.evaluate(context));
            case DIV -> Values.divide(left.evaluate(context), right.evaluate(context));
            case MOD -> Values.modulo(left.evaluate(context), right.evaluate(context));
        };
    }
}

final class CallExpression implements TemplateExpression {
    private final String function;
    private final List<TemplateExpression> arguments;

    CallExpression(String function, List<TemplateExpression> arguments) {
        this.function = Objects.requireNonNull(function, "function");
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public Object evaluate(TemplateContext context) {
        if ("data".equals(function) && arguments.isEmpty()) {
            return context.data();
        }
        List<Object> values = new ArrayList<>(arguments.size());
        for (TemplateExpression argument : arguments) {
            values.add(argument.evaluate(context));
        }
        return context.call(function, values);
    }
}

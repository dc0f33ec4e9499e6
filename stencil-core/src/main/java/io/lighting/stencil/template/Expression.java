package io.lighting.stencil.template;

import io.lighting.stencil.TemplateEvaluationException;
import java.util.Objects;

/**
 * A parsed expression together with its source text.
 * <pre>{@code
 * Expression expression = Expression.parse("price * quantity");
 * Object total = expression.evaluate(TemplateContext.of(Map.of("price", 3, "quantity", 4)));
 * }</pre>
 * Parsing fails with {@link io.lighting.stencil.TemplateSyntaxException}; evaluation failures are
 * reported as {@link TemplateEvaluationException} naming the expression.
 */
public final class Expression {
    private final String source;
    private final TemplateExpression root;

    private Expression(String source, TemplateExpression root) {
        this.source = source;
        this.root = root;
    }

    public static Expression parse(String source) {
        Objects.requireNonNull(source, "source");
        return new Expression(source, new TemplateExpressionParser(source).parse());
    }

    public String source() {
        return source;
    }

    public Object evaluate(TemplateContext context) {
        Objects.requireNonNull(context, "context");
        try {
            return root.evaluate(context);
        } catch (TemplateEvaluationException ex) {
            if (ex.expression() != null) {
                throw ex;
            }
            throw new TemplateEvaluationException(source, ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            throw new TemplateEvaluationException(source, String.valueOf(ex.getMessage()), ex);
        }
    }

    public boolean test(TemplateContext context) {
        return Values.toBoolean(evaluate(context));
    }

    @Override
    public String toString() {
        return source;
    }
}

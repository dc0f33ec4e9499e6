package io.lighting.stencil;

/**
 * Evaluation of a well-formed expression failed: unknown function, arity or type mismatch,
 * a collection that cannot be iterated.
 * <p>
 * When raised for a concrete expression the message carries the expression text so the author
 * can find the broken directive in the document.
 */
public class TemplateEvaluationException extends TemplateException {
    private final String expression;

    public TemplateEvaluationException(String message) {
        super(message);
        this.expression = null;
    }

    public TemplateEvaluationException(String expression, String message, Throwable cause) {
        super("evaluation error for expression '" + expression + "': " + message, cause);
        this.expression = expression;
    }

    /**
     * Source text of the failing expression, or {@code null} when the failure is not tied to one.
     */
    public String expression() {
        return expression;
    }
}

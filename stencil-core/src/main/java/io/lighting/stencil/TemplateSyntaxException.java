package io.lighting.stencil;

/**
 * A malformed expression.
 */
public class TemplateSyntaxException extends TemplateException {
    private final String expression;
    private final int position;

    public TemplateSyntaxException(String message, String expression, int position) {
        super(message + " at position " + position + " in expression: " + expression);
        this.expression = expression;
        this.position = position;
    }

    public String expression() {
        return expression;
    }

    public int position() {
        return position;
    }
}

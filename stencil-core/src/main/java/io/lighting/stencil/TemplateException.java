package io.lighting.stencil;

/**
 * Base type for every failure raised while parsing or rendering a template.
 * <p>
 * Template defects are authoring errors: a render that throws never returns a partial document.
 */
public class TemplateException extends IllegalArgumentException {
    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}

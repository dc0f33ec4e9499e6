package io.lighting.stencil.template;

import io.lighting.stencil.TemplateEvaluationException;

/**
 * Renders an {@code {{include}}} met inside template text.
 */
@FunctionalInterface
public interface IncludeHandler {
    RenderedText include(String fragmentName, TemplateContext context);

    static IncludeHandler unsupported() {
        return (fragmentName, context) -> {
            throw new TemplateEvaluationException("fragments not available, cannot include: " + fragmentName);
        };
    }
}

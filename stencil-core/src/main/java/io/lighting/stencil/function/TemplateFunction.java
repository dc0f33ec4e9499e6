package io.lighting.stencil.function;

import java.util.List;

/**
 * A function callable from template expressions.
 * <p>
 * Arguments are positional. A result may be a plain value or a
 * {@link io.lighting.stencil.template.Marker} requesting a structural effect.
 */
public interface TemplateFunction {
    String name();

    int minArgs();

    /**
     * Maximum number of arguments, or {@code -1} when unlimited.
     */
    int maxArgs();

    Object call(List<Object> args);
}

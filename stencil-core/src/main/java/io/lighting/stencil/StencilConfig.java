package io.lighting.stencil;

import io.lighting.stencil.render.RenderContext;
import java.util.Map;
import java.util.Objects;

/**
 * Engine limits.
 *
 * @param maxRenderDepth maximum number of fragments being included at the same time
 */
public record StencilConfig(int maxRenderDepth) {
    public static final String MAX_RENDER_DEPTH_ENV = "STENCIL_MAX_RENDER_DEPTH";

    public StencilConfig {
        if (maxRenderDepth <= 0) {
            throw new IllegalArgumentException("maxRenderDepth must be positive: " + maxRenderDepth);
        }
    }

    public static StencilConfig defaults() {
        return new StencilConfig(RenderContext.DEFAULT_MAX_RENDER_DEPTH);
    }

    /**
     * Reads overrides from environment variables, {@code System.getenv()} in production.
     */
    public static StencilConfig fromEnvironment(Map<String, String> environment) {
        Objects.requireNonNull(environment, "environment");
        String depth = environment.get(MAX_RENDER_DEPTH_ENV);
        if (depth == null || depth.isBlank()) {
            return defaults();
        }
        try {
            return new StencilConfig(Integer.parseInt(depth.trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid " + MAX_RENDER_DEPTH_ENV + ": " + depth, ex);
        }
    }
}

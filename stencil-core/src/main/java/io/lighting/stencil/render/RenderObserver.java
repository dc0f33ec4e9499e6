package io.lighting.stencil.render;

import io.lighting.stencil.document.DocumentElement;
import java.util.List;

/**
 * Callbacks around a render call. All methods default to no-ops.
 */
public interface RenderObserver {
    default void beforeRender(List<DocumentElement> elements) {
    }

    default void afterRender(List<DocumentElement> elements, RenderResult result, long elapsedNanos) {
    }

    default void onRenderError(List<DocumentElement> elements, Exception error, long elapsedNanos) {
    }

    default void onFragmentEnter(String name, List<String> inclusionStack) {
    }
}

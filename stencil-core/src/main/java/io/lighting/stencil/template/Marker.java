package io.lighting.stencil.template;

import java.util.Objects;

/**
 * A function result that asks the document renderer for a structural effect instead of text.
 * <p>
 * Expressions pass markers through untouched; text rendering turns them into marker segments
 * that the document renderer consumes or reports.
 *
 * @param kind    requested effect
 * @param payload effect argument, for example the target URL of a link replacement
 */
public record Marker(MarkerKind kind, Object payload) {
    public Marker {
        Objects.requireNonNull(kind, "kind");
    }

    public static Marker of(MarkerKind kind) {
        return new Marker(kind, null);
    }
}

package io.lighting.stencil.render;

/**
 * An {@code elsif} or {@code else} marker found at depth 1 of a block.
 *
 * @param index     position of the marker element
 * @param kind      {@link DirectiveKind#ELSIF} or {@link DirectiveKind#ELSE}
 * @param condition the elsif condition, empty for else
 */
public record ElseBranch(int index, DirectiveKind kind, String condition) {
}

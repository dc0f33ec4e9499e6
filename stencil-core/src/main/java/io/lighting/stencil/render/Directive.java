package io.lighting.stencil.render;

import java.util.Objects;

/**
 * What an element contributes to block structure.
 *
 * @param kind    directive kind
 * @param content directive payload: the condition, loop header or fragment name expression
 * @param offset  character offset of the directive tag in the element text, {@code -1} when not applicable
 */
public record Directive(DirectiveKind kind, String content, int offset) {
    public static final Directive NONE = new Directive(DirectiveKind.NONE, "", -1);

    public Directive {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(content, "content");
    }
}

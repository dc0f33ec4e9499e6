package io.lighting.stencil.document;

import java.util.Objects;

/**
 * Run text.
 *
 * @param content       the characters
 * @param preserveSpace whether leading and trailing spaces are significant ({@code xml:space="preserve"})
 */
public record Text(String content, boolean preserveSpace) {
    public Text {
        Objects.requireNonNull(content, "content");
    }

    public static Text of(String content) {
        return new Text(content, false);
    }
}

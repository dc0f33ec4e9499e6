package io.lighting.stencil.document;

import java.util.Objects;

/**
 * Formatting properties of a document element, kept as the opaque markup they were read from.
 */
public record Properties(String markup) {
    public static final Properties NONE = new Properties("");

    public Properties {
        Objects.requireNonNull(markup, "markup");
    }

    public static Properties of(String markup) {
        return markup == null || markup.isEmpty() ? NONE : new Properties(markup);
    }

    public boolean isEmpty() {
        return markup.isEmpty();
    }
}

package io.lighting.stencil.document;

import java.util.Objects;

/**
 * Smallest formatted unit of a paragraph. Text and break are both optional.
 */
public record Run(Properties properties, Text text, Break br) implements ParagraphContent {
    public Run {
        Objects.requireNonNull(properties, "properties");
    }

    public static Run text(String content) {
        return new Run(Properties.NONE, Text.of(content), null);
    }

    public static Run text(Properties properties, String content) {
        return new Run(properties, Text.of(content), null);
    }

    public static Run lineBreak(Properties properties) {
        return new Run(properties, null, Break.LINE);
    }

    public boolean hasText() {
        return text != null;
    }

    public boolean hasBreak() {
        return br != null;
    }

    public Run withText(Text newText) {
        return new Run(properties, newText, br);
    }

    public Run withoutText() {
        return new Run(properties, null, br);
    }

    public Run withoutBreak() {
        return new Run(properties, text, null);
    }
}

package io.lighting.stencil.document;

import java.util.List;
import java.util.Objects;

public record TableCell(Properties properties, List<Paragraph> paragraphs) {
    public TableCell {
        Objects.requireNonNull(properties, "properties");
        paragraphs = List.copyOf(paragraphs);
    }

    public static TableCell of(Paragraph... paragraphs) {
        return new TableCell(Properties.NONE, List.of(paragraphs));
    }
}

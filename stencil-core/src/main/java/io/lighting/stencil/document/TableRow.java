package io.lighting.stencil.document;

import java.util.List;
import java.util.Objects;

public record TableRow(Properties properties, List<TableCell> cells) {
    public TableRow {
        Objects.requireNonNull(properties, "properties");
        cells = List.copyOf(cells);
    }

    public static TableRow of(TableCell... cells) {
        return new TableRow(Properties.NONE, List.of(cells));
    }

    /**
     * The paragraph that carries row-level directives: first paragraph of the first cell.
     */
    public Paragraph directiveParagraph() {
        if (cells.isEmpty() || cells.get(0).paragraphs().isEmpty()) {
            return null;
        }
        return cells.get(0).paragraphs().get(0);
    }
}

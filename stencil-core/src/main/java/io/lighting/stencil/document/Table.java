package io.lighting.stencil.document;

import java.util.List;
import java.util.Objects;

/**
 * A table.
 *
 * @param properties table properties
 * @param grid       column widths from the table grid
 * @param rows       rows in document order
 */
public record Table(Properties properties, List<Integer> grid, List<TableRow> rows) implements DocumentElement {
    public Table {
        Objects.requireNonNull(properties, "properties");
        grid = List.copyOf(grid);
        rows = List.copyOf(rows);
    }

    public static Table of(TableRow... rows) {
        return new Table(Properties.NONE, List.of(), List.of(rows));
    }

    public Table withRows(List<TableRow> newRows) {
        return new Table(properties, grid, newRows);
    }
}

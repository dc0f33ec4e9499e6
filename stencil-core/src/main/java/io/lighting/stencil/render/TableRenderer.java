package io.lighting.stencil.render;

import io.lighting.stencil.TemplateStructureException;
import io.lighting.stencil.document.DocumentElement;
import io.lighting.stencil.document.Paragraph;
import io.lighting.stencil.document.Properties;
import io.lighting.stencil.document.RunMerger;
import io.lighting.stencil.document.Table;
import io.lighting.stencil.document.TableCell;
import io.lighting.stencil.document.TableRow;
import io.lighting.stencil.template.ForSpec;
import io.lighting.stencil.template.MarkerKind;
import io.lighting.stencil.template.TemplateContext;
import io.lighting.stencil.template.TextRenderer;
import java.util.ArrayList;
import java.util.List;

/**
 * Block structure at row granularity. The directive of a row sits in the first paragraph of its
 * first cell; directive rows are consumed and never appear in the output. Cells of ordinary rows
 * render through {@link DocumentRenderer}, so inline and multi-paragraph directives inside a cell
 * keep working.
 */
final class TableRenderer {
    private final DocumentRenderer documents;
    private final RenderContext renderContext;

    TableRenderer(DocumentRenderer documents, RenderContext renderContext) {
        this.documents = documents;
        this.renderContext = renderContext;
    }

    Table render(Table table, TemplateContext context) {
        List<TableRow> rows = table.rows();
        List<Directive> directives = new ArrayList<>(rows.size());
        for (TableRow row : rows) {
            directives.add(rowDirective(row));
        }
        List<TableRow> out = new ArrayList<>();
        renderRows(rows, directives, 0, rows.size(), context, out);
        return table.withRows(out);
    }

    private static Directive rowDirective(TableRow row) {
        Paragraph paragraph = row.directiveParagraph();
        if (paragraph == null) {
            return Directive.NONE;
        }
        Directive directive = DirectiveDetector.detect(RunMerger.merge(paragraph));
        return switch (directive.kind()) {
            case INLINE_FOR, INCLUDE -> Directive.NONE;
            case IF, UNLESS, FOR -> closedWithinCell(row.cells().get(0)) ? Directive.NONE : directive;
            default -> directive;
        };
    }

    /**
     * Whether the block opened by the cell's first paragraph also ends in that cell, making it a
     * cell-level block rather than a row directive.
     */
    private static boolean closedWithinCell(TableCell cell) {
        List<Directive> directives = new ArrayList<>(cell.paragraphs().size());
        for (Paragraph paragraph : cell.paragraphs()) {
            directives.add(DirectiveDetector.detect(RunMerger.merge(paragraph)));
        }
        return DirectiveMatcher.isClosed(directives, 0, directives.size());
    }

    private void renderRows(
        List<TableRow> rows,
        List<Directive> directives,
        int from,
        int to,
        TemplateContext context,
        List<TableRow> out
    ) {
        int i = from;
        while (i < to) {
            Directive directive = directives.get(i);
            switch (directive.kind()) {
                case FOR -> {
                    DirectiveRange range = DirectiveMatcher.match(directives, i, to, "row");
                    for (TemplateContext iteration : TextRenderer.iterations(ForSpec.parse(directive.content()), context)) {
                        renderRows(rows, directives, range.open() + 1, range.end(), iteration, out);
                    }
                    i = range.end() + 1;
                }
                case IF, UNLESS -> {
                    DirectiveRange range = DirectiveMatcher.match(directives, i, to, "row");
                    DocumentRenderer.selectBranch(directive, range, context).ifPresent(
                        span -> renderRows(rows, directives, span.from(), span.to(), context, out)
                    );
                    i = range.end() + 1;
                }
                case END, ELSE, ELSIF -> throw new TemplateStructureException(
                    "unmatched {{" + DirectiveMatcher.keyword(directive.kind()) + "}} at row " + i
                );
                default -> {
                    TableRow row = renderRow(rows.get(i), context);
                    if (row != null) {
                        out.add(row);
                    }
                    i++;
                }
            }
        }
    }

    /**
     * Renders every cell of a row; {@code null} when a cell asked for the row to be hidden.
     */
    private TableRow renderRow(TableRow row, TemplateContext context) {
        int mark = renderContext.markerCount();
        List<TableCell> cells = new ArrayList<>(row.cells().size());
        for (TableCell cell : row.cells()) {
            cells.add(renderCell(cell, context));
        }
        if (renderContext.consumeSince(mark, MarkerKind.HIDE_ROW)) {
            return null;
        }
        return new TableRow(row.properties(), cells);
    }

    private TableCell renderCell(TableCell cell, TemplateContext context) {
        List<DocumentElement> rendered = documents.render(new ArrayList<>(cell.paragraphs()), context);
        List<Paragraph> paragraphs = new ArrayList<>(rendered.size());
        for (DocumentElement element : rendered) {
            if (!(element instanceof Paragraph paragraph)) {
                throw new TemplateStructureException("a table cell can only hold paragraphs, got a nested table");
            }
            paragraphs.add(paragraph);
        }
        if (paragraphs.isEmpty()) {
            Properties properties = cell.paragraphs().isEmpty() ? Properties.NONE : cell.paragraphs().get(0).properties();
            paragraphs.add(Paragraph.empty(properties));
        }
        return new TableCell(cell.properties(), paragraphs);
    }
}

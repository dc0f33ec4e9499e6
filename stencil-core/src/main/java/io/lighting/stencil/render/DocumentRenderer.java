package io.lighting.stencil.render;

import io.lighting.stencil.TemplateEvaluationException;
import io.lighting.stencil.TemplateStructureException;
import io.lighting.stencil.document.DocumentElement;
import io.lighting.stencil.document.Paragraph;
import io.lighting.stencil.document.ParagraphContent;
import io.lighting.stencil.document.RunMerger;
import io.lighting.stencil.document.Table;
import io.lighting.stencil.document.TableCell;
import io.lighting.stencil.document.TableRow;
import io.lighting.stencil.fragment.Fragment;
import io.lighting.stencil.template.Expression;
import io.lighting.stencil.template.ForSpec;
import io.lighting.stencil.template.RenderedText;
import io.lighting.stencil.template.TemplateContext;
import io.lighting.stencil.template.TextRenderer;
import io.lighting.stencil.template.Values;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders a document body: blocks spanning several paragraphs are matched by nesting depth,
 * branches are selected, loops unrolled, fragments spliced in and tables handed to
 * {@link TableRenderer}.
 * <p>
 * The input is never modified; every rendered element is a new instance. An instance belongs to
 * one render call through its {@link RenderContext}.
 */
public final class DocumentRenderer {
    private final RenderContext renderContext;
    private final ParagraphRenderer paragraphs;
    private final InlineLoopExpander inlineLoops;
    private final TableRenderer tables;

    public DocumentRenderer(RenderContext renderContext) {
        this.renderContext = Objects.requireNonNull(renderContext, "renderContext");
        TextRenderer textRenderer = new TextRenderer(this::includeText);
        this.paragraphs = new ParagraphRenderer(renderContext, textRenderer);
        this.inlineLoops = new InlineLoopExpander(renderContext, textRenderer);
        this.tables = new TableRenderer(this, renderContext);
    }

    public List<DocumentElement> render(List<DocumentElement> elements, TemplateContext context) {
        List<DocumentElement> merged = new ArrayList<>(elements.size());
        List<Directive> directives = new ArrayList<>(elements.size());
        for (DocumentElement element : elements) {
            if (element instanceof Paragraph paragraph) {
                Paragraph normalized = RunMerger.merge(paragraph);
                merged.add(normalized);
                directives.add(DirectiveDetector.detect(normalized));
            } else {
                merged.add(element);
                directives.add(Directive.NONE);
            }
        }
        List<DocumentElement> out = new ArrayList<>();
        renderRange(merged, directives, 0, merged.size(), context, out);
        return out;
    }

    private void renderRange(
        List<DocumentElement> elements,
        List<Directive> directives,
        int from,
        int to,
        TemplateContext context,
        List<DocumentElement> out
    ) {
        int i = from;
        while (i < to) {
            DocumentElement element = elements.get(i);
            Directive directive = directives.get(i);
            switch (directive.kind()) {
                case FOR -> {
                    DirectiveRange range = DirectiveMatcher.match(directives, i, to, "element");
                    for (TemplateContext iteration : TextRenderer.iterations(ForSpec.parse(directive.content()), context)) {
                        renderRange(elements, directives, range.open() + 1, range.end(), iteration, out);
                    }
                    i = range.end() + 1;
                }
                case IF, UNLESS -> {
                    DirectiveRange range = DirectiveMatcher.match(directives, i, to, "element");
                    List<DocumentElement> branch = new ArrayList<>();
                    selectBranch(directive, range, context).ifPresent(
                        span -> renderRange(elements, directives, span.from(), span.to(), context, branch)
                    );
                    out.addAll(withLeadingText((Paragraph) element, directive, branch, context));
                    i = range.end() + 1;
                }
                case END, ELSE, ELSIF -> throw new TemplateStructureException(
                    "unmatched {{" + DirectiveMatcher.keyword(directive.kind()) + "}} at element " + i
                );
                case INCLUDE -> {
                    out.addAll(include(directive.content(), context));
                    i++;
                }
                case INLINE_FOR -> {
                    out.add(inlineLoops.expand((Paragraph) element, context));
                    i++;
                }
                default -> {
                    out.add(renderElement(element, context));
                    i++;
                }
            }
        }
    }

    /**
     * Element bounds {@code [from, to)} of a selected branch.
     */
    record Span(int from, int to) {
    }

    /**
     * The branch whose condition holds first, in source order, or the else branch.
     */
    static Optional<Span> selectBranch(Directive opener, DirectiveRange range, TemplateContext context) {
        boolean condition = Expression.parse(opener.content()).test(context);
        if (opener.kind() == DirectiveKind.UNLESS) {
            condition = !condition;
        }
        if (condition) {
            return Optional.of(new Span(range.open() + 1, range.endOfBranchAt(range.open())));
        }
        for (ElseBranch branch : range.branches()) {
            if (branch.kind() == DirectiveKind.ELSE || Expression.parse(branch.condition()).test(context)) {
                return Optional.of(new Span(branch.index() + 1, range.endOfBranchAt(branch.index())));
            }
        }
        return Optional.empty();
    }

    private List<DocumentElement> withLeadingText(
        Paragraph opener,
        Directive directive,
        List<DocumentElement> branch,
        TemplateContext context
    ) {
        if (branch.isEmpty() || directive.offset() <= 0) {
            return branch;
        }
        Paragraph prefix = opener.withContent(ParagraphRenderer.contentBefore(opener, directive.offset()));
        if (prefix.text().isBlank()) {
            return branch;
        }
        List<ParagraphContent> leading = paragraphs.renderContent(prefix.content(), context);
        List<DocumentElement> result = new ArrayList<>(branch.size() + 1);
        if (branch.get(0) instanceof Paragraph first) {
            List<ParagraphContent> content = new ArrayList<>(leading);
            content.addAll(first.content());
            result.add(first.withContent(content));
            result.addAll(branch.subList(1, branch.size()));
        } else {
            result.add(opener.withContent(leading));
            result.addAll(branch);
        }
        return result;
    }

    private DocumentElement renderElement(DocumentElement element, TemplateContext context) {
        if (element instanceof Table table) {
            return tables.render(table, context);
        }
        return paragraphs.render((Paragraph) element, context);
    }

    private List<DocumentElement> include(String nameExpression, TemplateContext context) {
        String name = fragmentName(nameExpression, context);
        Fragment fragment = renderContext.enterFragment(name);
        try {
            return render(fragment.elements(), context);
        } finally {
            renderContext.exitFragment();
        }
    }

    private RenderedText includeText(String name, TemplateContext context) {
        Fragment fragment = renderContext.enterFragment(name);
        try {
            String text = render(fragment.elements(), context).stream()
                .map(DocumentRenderer::plainText)
                .collect(Collectors.joining("\n"));
            return new RenderedText.Builder().text(text).build();
        } finally {
            renderContext.exitFragment();
        }
    }

    private static String fragmentName(String nameExpression, TemplateContext context) {
        Expression expression = Expression.parse(nameExpression);
        Object name = expression.evaluate(context);
        if (!(name instanceof String fragmentName)) {
            throw new TemplateEvaluationException(
                expression.source(),
                "fragment name must be a string, got " + Values.typeName(name),
                null
            );
        }
        return fragmentName;
    }

    private static String plainText(DocumentElement element) {
        if (element instanceof Paragraph paragraph) {
            return paragraph.text();
        }
        List<String> lines = new ArrayList<>();
        for (TableRow row : ((Table) element).rows()) {
            for (TableCell cell : row.cells()) {
                cell.paragraphs().forEach(paragraph -> lines.add(paragraph.text()));
            }
        }
        return String.join("\n", lines);
    }
}

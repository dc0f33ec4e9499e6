package io.lighting.stencil.render;

import io.lighting.stencil.document.Break;
import io.lighting.stencil.document.Hyperlink;
import io.lighting.stencil.document.Paragraph;
import io.lighting.stencil.document.ParagraphContent;
import io.lighting.stencil.document.Properties;
import io.lighting.stencil.document.Run;
import io.lighting.stencil.document.Text;
import io.lighting.stencil.template.ControlParser;
import io.lighting.stencil.template.Marker;
import io.lighting.stencil.template.MarkerKind;
import io.lighting.stencil.template.RenderedText;
import io.lighting.stencil.template.TemplateContext;
import io.lighting.stencil.template.TextRenderer;
import io.lighting.stencil.template.Token;
import io.lighting.stencil.template.TokenType;
import io.lighting.stencil.template.Tokenizer;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Renders a paragraph that is not part of a multi-element block.
 * <p>
 * Without control tags every run and hyperlink keeps its own formatting and only variables are
 * substituted. With inline {@code if}/{@code unless}/{@code for} tags the whole paragraph text is
 * rendered at once and rebuilt from the first run's formatting.
 */
final class ParagraphRenderer {
    private final RenderContext renderContext;
    private final TextRenderer textRenderer;

    ParagraphRenderer(RenderContext renderContext, TextRenderer textRenderer) {
        this.renderContext = renderContext;
        this.textRenderer = textRenderer;
    }

    Paragraph render(Paragraph paragraph, TemplateContext context) {
        List<Token> tokens = Tokenizer.tokenize(paragraph.text());
        if (Tokenizer.hasControlTokens(tokens)) {
            RenderedText text = textRenderer.render(ControlParser.parse(tokens), context);
            List<ParagraphContent> runs = new ArrayList<>(
                toRuns(text, paragraph.firstRunProperties(), false, renderContext::record)
            );
            return paragraph.withContent(runs);
        }
        return paragraph.withContent(renderContent(paragraph.content(), context));
    }

    List<ParagraphContent> renderContent(List<ParagraphContent> content, TemplateContext context) {
        List<ParagraphContent> rendered = new ArrayList<>();
        for (ParagraphContent item : content) {
            if (item instanceof Run run) {
                rendered.addAll(renderRun(run, context, renderContext::record));
            } else if (item instanceof Hyperlink link) {
                rendered.add(renderHyperlink(link, context));
            }
        }
        return rendered;
    }

    private Hyperlink renderHyperlink(Hyperlink link, TemplateContext context) {
        String[] target = {link.target()};
        Consumer<Marker> markers = marker -> {
            if (marker.kind() == MarkerKind.REPLACE_LINK) {
                target[0] = String.valueOf(marker.payload());
            } else {
                renderContext.record(marker);
            }
        };
        List<Run> runs = new ArrayList<>();
        for (Run run : link.runs()) {
            runs.addAll(renderRun(run, context, markers));
        }
        return new Hyperlink(link.id(), target[0], runs);
    }

    private List<Run> renderRun(Run run, TemplateContext context, Consumer<Marker> markers) {
        if (!run.hasText()) {
            return List.of(run);
        }
        List<Token> tokens = Tokenizer.tokenize(run.text().content());
        if (tokens.stream().allMatch(token -> token.type() == TokenType.TEXT)) {
            return List.of(run);
        }
        RenderedText text = textRenderer.render(ControlParser.parse(tokens), context);
        List<Run> runs = new ArrayList<>();
        if (run.hasBreak()) {
            runs.add(run.withoutText());
        }
        runs.addAll(toRuns(text, run.properties(), run.text().preserveSpace(), markers));
        return runs;
    }

    /**
     * Turns rendered text into runs: line feeds become line breaks and page break markers become
     * page breaks. Other markers go to {@code markers}.
     */
    static List<Run> toRuns(RenderedText text, Properties properties, boolean preserveSpace, Consumer<Marker> markers) {
        List<Run> runs = new ArrayList<>();
        for (RenderedText.Segment segment : text.segments()) {
            if (segment instanceof RenderedText.TextSegment textSegment) {
                String[] lines = textSegment.text().split("\n", -1);
                for (int i = 0; i < lines.length; i++) {
                    if (i > 0) {
                        runs.add(new Run(properties, null, Break.LINE));
                    }
                    if (!lines[i].isEmpty()) {
                        runs.add(new Run(properties, new Text(lines[i], preserveSpace || hasEdgeSpace(lines[i])), null));
                    }
                }
            } else if (segment instanceof RenderedText.MarkerSegment markerSegment) {
                Marker marker = markerSegment.marker();
                if (marker.kind() == MarkerKind.PAGE_BREAK) {
                    runs.add(new Run(properties, null, Break.PAGE));
                } else {
                    markers.accept(marker);
                }
            }
        }
        if (runs.isEmpty()) {
            runs.add(new Run(properties, new Text("", preserveSpace), null));
        }
        return runs;
    }

    /**
     * Content of {@code paragraph} before character {@code offset} of its text.
     */
    static List<ParagraphContent> contentBefore(Paragraph paragraph, int offset) {
        List<ParagraphContent> prefix = new ArrayList<>();
        int position = 0;
        for (ParagraphContent item : paragraph.content()) {
            if (position >= offset) {
                break;
            }
            if (item instanceof Run run) {
                Run cut = cutRun(run, offset - position);
                if (cut != null) {
                    prefix.add(cut);
                }
                position += length(run);
            } else if (item instanceof Hyperlink link) {
                List<Run> runs = new ArrayList<>();
                for (Run run : link.runs()) {
                    if (position >= offset) {
                        break;
                    }
                    Run cut = cutRun(run, offset - position);
                    if (cut != null) {
                        runs.add(cut);
                    }
                    position += length(run);
                }
                if (!runs.isEmpty()) {
                    prefix.add(link.withRuns(runs));
                }
            }
        }
        return prefix;
    }

    private static Run cutRun(Run run, int available) {
        if (available >= length(run)) {
            return run;
        }
        int textAvailable = run.hasBreak() ? available - 1 : available;
        if (textAvailable <= 0) {
            return run.hasBreak() && available > 0 ? run.withoutText() : null;
        }
        Text text = run.text();
        return run.withText(new Text(text.content().substring(0, textAvailable), text.preserveSpace()));
    }

    private static int length(Run run) {
        return (run.hasBreak() ? 1 : 0) + (run.hasText() ? run.text().content().length() : 0);
    }

    private static boolean hasEdgeSpace(String text) {
        return Character.isWhitespace(text.charAt(0)) || Character.isWhitespace(text.charAt(text.length() - 1));
    }
}

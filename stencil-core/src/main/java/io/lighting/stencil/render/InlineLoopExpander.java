package io.lighting.stencil.render;

import io.lighting.stencil.TemplateStructureException;
import io.lighting.stencil.document.Paragraph;
import io.lighting.stencil.document.ParagraphContent;
import io.lighting.stencil.template.ControlParser;
import io.lighting.stencil.template.RenderedText;
import io.lighting.stencil.template.TemplateContext;
import io.lighting.stencil.template.TextRenderer;
import io.lighting.stencil.template.Token;
import io.lighting.stencil.template.TokenType;
import io.lighting.stencil.template.Tokenizer;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands a loop written entirely inside one paragraph, such as
 * {@code {{for i, x in xs}}{{if i > 0}}, {{end}}{{x}}{{end}}}.
 * <p>
 * The paragraph text is split around the first top-level loop into prefix, loop and suffix; each
 * part is rendered on its own and the result replaces the paragraph as runs carrying the first
 * run's formatting. Spaces are always preserved because generated separators depend on them.
 */
final class InlineLoopExpander {
    private final RenderContext renderContext;
    private final TextRenderer textRenderer;

    InlineLoopExpander(RenderContext renderContext, TextRenderer textRenderer) {
        this.renderContext = renderContext;
        this.textRenderer = textRenderer;
    }

    Paragraph expand(Paragraph paragraph, TemplateContext context) {
        List<Token> tokens = Tokenizer.tokenize(paragraph.text());
        int open = firstTopLevelLoop(tokens);
        int end = matchingEnd(tokens, open);
        RenderedText rendered = new RenderedText.Builder()
            .append(renderPart(tokens.subList(0, open), context))
            .append(renderPart(tokens.subList(open, end + 1), context))
            .append(renderPart(tokens.subList(end + 1, tokens.size()), context))
            .build();
        List<ParagraphContent> runs = new ArrayList<>(
            ParagraphRenderer.toRuns(rendered, paragraph.firstRunProperties(), true, renderContext::record)
        );
        return paragraph.withContent(runs);
    }

    private RenderedText renderPart(List<Token> tokens, TemplateContext context) {
        return textRenderer.render(ControlParser.parse(tokens), context);
    }

    private static int firstTopLevelLoop(List<Token> tokens) {
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.FOR && depth == 0) {
                return i;
            }
            if (type.opensBlock()) {
                depth++;
            } else if (type == TokenType.END) {
                depth--;
            }
        }
        // A loop nested in an inline if: render the whole text as one part.
        return 0;
    }

    private static int matchingEnd(List<Token> tokens, int open) {
        if (!tokens.get(open).type().opensBlock()) {
            return tokens.size() - 1;
        }
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type.opensBlock()) {
                depth++;
            } else if (type == TokenType.END) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new TemplateStructureException("expected {{end}} to close {{for " + tokens.get(open).value() + "}}");
    }
}

package io.lighting.stencil.document;

import java.util.List;
import java.util.Objects;

public record Paragraph(Properties properties, List<ParagraphContent> content) implements DocumentElement {
    public Paragraph {
        Objects.requireNonNull(properties, "properties");
        content = List.copyOf(content);
    }

    public static Paragraph of(ParagraphContent... content) {
        return new Paragraph(Properties.NONE, List.of(content));
    }

    public static Paragraph empty(Properties properties) {
        return new Paragraph(properties, List.of());
    }

    public Paragraph withContent(List<ParagraphContent> newContent) {
        return new Paragraph(properties, newContent);
    }

    /**
     * Concatenated text of all runs, hyperlinks included, with breaks as {@code \n}.
     */
    public String text() {
        StringBuilder builder = new StringBuilder();
        for (ParagraphContent item : content) {
            if (item instanceof Run run) {
                appendRun(builder, run);
            } else if (item instanceof Hyperlink link) {
                link.runs().forEach(run -> appendRun(builder, run));
            }
        }
        return builder.toString();
    }

    /**
     * Properties of the first run, the paragraph's own when there is none.
     */
    public Properties firstRunProperties() {
        for (ParagraphContent item : content) {
            if (item instanceof Run run) {
                return run.properties();
            }
            if (item instanceof Hyperlink link && !link.runs().isEmpty()) {
                return link.runs().get(0).properties();
            }
        }
        return Properties.NONE;
    }

    static void appendRun(StringBuilder builder, Run run) {
        if (run.hasBreak()) {
            builder.append('\n');
        }
        if (run.hasText()) {
            builder.append(run.text().content());
        }
    }
}

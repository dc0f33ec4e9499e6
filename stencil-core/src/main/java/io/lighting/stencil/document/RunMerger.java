package io.lighting.stencil.document;

import java.util.ArrayList;
import java.util.List;

/**
 * Coalesces text that editors split across runs, so a {@code {{...}}} tag typed in several
 * editing sessions reads as one piece of text again.
 * <p>
 * Consecutive text-only runs merge into the first one and keep its properties. A run carrying a
 * break and text becomes a break run followed by a text run. Hyperlinks are merged internally
 * and never merge with the runs around them. The input paragraph is left untouched and merging
 * a merged paragraph changes nothing.
 */
public final class RunMerger {
    private RunMerger() {
    }

    public static Paragraph merge(Paragraph paragraph) {
        List<ParagraphContent> merged = new ArrayList<>();
        List<Run> span = new ArrayList<>();
        for (ParagraphContent item : paragraph.content()) {
            if (item instanceof Run run) {
                span.add(run);
            } else if (item instanceof Hyperlink link) {
                merged.addAll(mergeRuns(span));
                span.clear();
                merged.add(link.withRuns(mergeRuns(link.runs())));
            }
        }
        merged.addAll(mergeRuns(span));
        return paragraph.withContent(merged);
    }

    static List<Run> mergeRuns(List<Run> runs) {
        List<Run> result = new ArrayList<>();
        Run current = null;
        for (Run run : runs) {
            if (run.hasBreak() && run.hasText()) {
                flush(result, current);
                result.add(run.withoutText());
                current = run.withoutBreak();
            } else if (current != null && current.hasText() && run.hasText() && !run.hasBreak()) {
                current = current.withText(concat(current.text(), run.text()));
            } else {
                flush(result, current);
                current = run;
            }
        }
        flush(result, current);
        return result;
    }

    private static Text concat(Text first, Text second) {
        return new Text(first.content() + second.content(), first.preserveSpace() || second.preserveSpace());
    }

    private static void flush(List<Run> result, Run current) {
        if (current != null) {
            result.add(current);
        }
    }
}

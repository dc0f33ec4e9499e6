package io.lighting.stencil.document;

import java.util.List;

/**
 * A hyperlink wrapping runs.
 *
 * @param id     relationship id of the link target in the source document, may be {@code null}
 * @param target replacement target URL set while rendering, {@code null} to keep the original
 * @param runs   the linked runs
 */
public record Hyperlink(String id, String target, List<Run> runs) implements ParagraphContent {
    public Hyperlink {
        runs = List.copyOf(runs);
    }

    public Hyperlink withRuns(List<Run> newRuns) {
        return new Hyperlink(id, target, newRuns);
    }

    public Hyperlink withTarget(String newTarget) {
        return new Hyperlink(id, newTarget, runs);
    }
}

package io.lighting.stencil.render;

import java.util.List;

/**
 * A block spread over several elements: opener, branch markers and the matching end.
 */
public record DirectiveRange(int open, int end, List<ElseBranch> branches) {
    public DirectiveRange {
        branches = List.copyOf(branches);
    }

    /**
     * End of the range that starts right after {@code marker}: the next branch marker or the end.
     */
    int endOfBranchAt(int marker) {
        for (ElseBranch branch : branches) {
            if (branch.index() > marker) {
                return branch.index();
            }
        }
        return end;
    }
}

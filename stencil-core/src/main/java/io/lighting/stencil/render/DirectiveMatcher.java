package io.lighting.stencil.render;

import io.lighting.stencil.TemplateStructureException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds the end of a block by scanning forward and counting nesting depth.
 */
public final class DirectiveMatcher {
    private DirectiveMatcher() {
    }

    /**
     * @param directives classification of every element
     * @param open       index of the opening directive
     * @param limit      exclusive upper bound of the scan
     * @param unit       element name used in error messages, for example "element" or "row"
     */
    public static DirectiveRange match(List<Directive> directives, int open, int limit, String unit) {
        DirectiveKind opener = directives.get(open).kind();
        List<ElseBranch> branches = new ArrayList<>();
        boolean seenElse = false;
        int depth = 1;
        for (int i = open + 1; i < limit; i++) {
            Directive directive = directives.get(i);
            DirectiveKind kind = directive.kind();
            if (kind.opensBlock()) {
                depth++;
            } else if (kind == DirectiveKind.END) {
                depth--;
                if (depth == 0) {
                    return new DirectiveRange(open, i, branches);
                }
            } else if (kind.isBranch() && depth == 1) {
                if (opener == DirectiveKind.FOR) {
                    throw new TemplateStructureException(
                        "{{" + keyword(kind) + "}} at " + unit + " " + i + " is not allowed inside {{for}} at " + unit + " " + open
                    );
                }
                if (seenElse) {
                    throw new TemplateStructureException(
                        "{{" + keyword(kind) + "}} at " + unit + " " + i + " follows {{else}}"
                    );
                }
                seenElse = kind == DirectiveKind.ELSE;
                branches.add(new ElseBranch(i, kind, directive.content()));
            }
        }
        throw new TemplateStructureException(
            "unmatched {{" + keyword(opener) + "}} at " + unit + " " + open + ": missing {{end}}"
        );
    }

    /**
     * Whether the block opened at {@code open} reaches its matching end before {@code limit}.
     */
    static boolean isClosed(List<Directive> directives, int open, int limit) {
        int depth = 1;
        for (int i = open + 1; i < limit; i++) {
            DirectiveKind kind = directives.get(i).kind();
            if (kind.opensBlock()) {
                depth++;
            } else if (kind == DirectiveKind.END && --depth == 0) {
                return true;
            }
        }
        return false;
    }

    static String keyword(DirectiveKind kind) {
        return switch (kind) {
            case IF -> "if";
            case ELSIF -> "elsif";
            case ELSE -> "else";
            case UNLESS -> "unless";
            case FOR -> "for";
            case END -> "end";
            case INCLUDE -> "include";
            default -> kind.name().toLowerCase(Locale.ROOT);
        };
    }
}

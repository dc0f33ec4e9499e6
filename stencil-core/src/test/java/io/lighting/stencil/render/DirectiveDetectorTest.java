package io.lighting.stencil.render;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.lighting.stencil.document.Paragraph;
import io.lighting.stencil.document.Run;
import org.junit.jupiter.api.Test;

class DirectiveDetectorTest {
    @Test
    void detectsBlockOpeners() {
        assertEquals(new Directive(DirectiveKind.IF, "a > 1", 0), DirectiveDetector.detect("{{if a > 1}}"));
        assertEquals(new Directive(DirectiveKind.UNLESS, "paid", 0), DirectiveDetector.detect("{{unless paid}}"));
        assertEquals(new Directive(DirectiveKind.FOR, "x in xs", 0), DirectiveDetector.detect("{{ for x in xs }}"));
    }

    @Test
    void reportsOffsetOfOpenerAfterLeadingText() {
        assertEquals(new Directive(DirectiveKind.IF, "vip", 5), DirectiveDetector.detect("Dear {{if vip}}"));
    }

    @Test
    void picksOutermostUnclosedOpener() {
        assertEquals(DirectiveKind.IF, DirectiveDetector.detect("{{if a}}{{for x in xs}}").kind());
        assertEquals(DirectiveKind.FOR, DirectiveDetector.detect("{{for x in xs}}{{if a}}b{{end}}").kind());
    }

    @Test
    void leavesBalancedParagraphsInline() {
        assertEquals(Directive.NONE, DirectiveDetector.detect("{{if a}}yes{{end}}"));
        assertEquals(Directive.NONE, DirectiveDetector.detect("Hello {{name}}"));
        assertEquals(Directive.NONE, DirectiveDetector.detect("{{pageBreak}}"));
        assertEquals(Directive.NONE, DirectiveDetector.detect("plain text"));
        assertEquals(Directive.NONE, DirectiveDetector.detect((Paragraph) null));
    }

    @Test
    void detectsInlineLoops() {
        assertEquals(DirectiveKind.INLINE_FOR, DirectiveDetector.detect("{{for x in xs}}{{x}}{{end}}").kind());
        assertEquals(DirectiveKind.INLINE_FOR, DirectiveDetector.detect("{{if a}}{{for x in xs}}{{x}}{{end}}{{end}}").kind());
    }

    @Test
    void detectsClosersBranchesAndIncludes() {
        assertEquals(DirectiveKind.END, DirectiveDetector.detect("{{end}}").kind());
        assertEquals(DirectiveKind.ELSE, DirectiveDetector.detect(" {{else}} ").kind());
        assertEquals(new Directive(DirectiveKind.ELSIF, "b", 0), DirectiveDetector.detect("{{elsif b}}"));
        assertEquals(new Directive(DirectiveKind.INCLUDE, "'footer'", 0), DirectiveDetector.detect("{{include 'footer'}}"));
        assertEquals(DirectiveKind.END, DirectiveDetector.detect("{{end}}{{if a}}x{{end}}").kind());
        assertEquals(DirectiveKind.INCLUDE, DirectiveDetector.detect("  {{include 'footer'}} ").kind());
    }

    @Test
    void leavesIncludeWithSurroundingContentInline() {
        assertEquals(Directive.NONE, DirectiveDetector.detect("See {{include 'terms'}} below."));
        assertEquals(Directive.NONE, DirectiveDetector.detect("{{include 'a'}}{{include 'b'}}"));
        assertEquals(Directive.NONE, DirectiveDetector.detect("{{include 'a'}} {{name}}"));
    }

    @Test
    void readsDirectiveSplitAcrossRuns() {
        Paragraph paragraph = Paragraph.of(Run.text("{{i"), Run.text("f ready}}"));

        assertEquals(new Directive(DirectiveKind.IF, "ready", 0), DirectiveDetector.detect(paragraph));
    }
}

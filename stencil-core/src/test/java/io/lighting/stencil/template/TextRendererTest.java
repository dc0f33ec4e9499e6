package io.lighting.stencil.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.stencil.TemplateEvaluationException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TextRendererTest {
    private final TextRenderer renderer = new TextRenderer(IncludeHandler.unsupported());

    private String render(String template, Map<String, Object> data) {
        return renderer.render(ControlParser.parse(template), TemplateContext.of(data)).text();
    }

    @Test
    void rendersConditionOnlyWhenTrue() {
        assertEquals("yes", render("{{if x > 5}}yes{{end}}", Map.of("x", 10)));
        assertEquals("", render("{{if x > 5}}yes{{end}}", Map.of("x", 3)));
    }

    @Test
    void selectsFirstMatchingBranch() {
        String template = "{{if x>10}}big{{elsif x>5}}medium{{else}}small{{end}}";

        assertEquals("big", render(template, Map.of("x", 11)));
        assertEquals("medium", render(template, Map.of("x", 7)));
        assertEquals("small", render(template, Map.of("x", 1)));
    }

    @Test
    void rendersNothingWhenNoBranchMatchesAndNoElse() {
        assertEquals("[]", render("[{{if a}}A{{elsif b}}B{{end}}]", Map.of()));
    }

    @Test
    void joinsLoopItemsWithSeparators() {
        String template = "{{for i, item in items}}{{if i>0}}, {{end}}{{item}}{{end}}";

        assertEquals("North, South, East", render(template, Map.of("items", List.of("North", "South", "East"))));
    }

    @Test
    void rendersLoopBodyOncePerItem() {
        assertEquals("", render("{{for x in xs}}*{{end}}", Map.of()));
        assertEquals("", render("{{for x in xs}}*{{end}}", Map.of("xs", List.of())));
        assertEquals("*****", render("{{for x in xs}}*{{end}}", Map.of("xs", List.of(1, 2, 3, 4, 5))));
    }

    @Test
    void bindsLoopVariablesPerIteration() {
        Map<String, Object> data = new HashMap<>();
        data.put("x", "outer");
        data.put("xs", List.of("a", "b"));

        assertEquals("ab|outer", render("{{for x in xs}}{{x}}{{end}}|{{x}}", data));
        assertEquals(
            "0:a,1:b;",
            render("{{for i, x in xs}}{{i}}:{{x}}{{if i < length(xs) - 1}},{{end}}{{end}};", data)
        );
    }

    @Test
    void iteratesMapsAndStrings() {
        Map<String, Object> prices = new LinkedHashMap<>();
        prices.put("tea", 2);
        prices.put("cake", 3.5);

        assertEquals("tea=2 cake=3.5 ", render("{{for p in prices}}{{p.key}}={{p.value}} {{end}}", Map.of("prices", prices)));
        assertEquals("a-b-", render("{{for c in word}}{{c}}-{{end}}", Map.of("word", "ab")));
    }

    @Test
    void invertsUnless() {
        assertEquals("due", render("{{unless paid}}due{{else}}settled{{end}}", Map.of("paid", false)));
        assertEquals("settled", render("{{unless paid}}due{{else}}settled{{end}}", Map.of("paid", true)));
    }

    @Test
    void emitsPageBreakMarkers() {
        RenderedText text = renderer.render(ControlParser.parse("a{{pageBreak}}b{{ pageBreak() }}"), TemplateContext.of(Map.of()));

        assertEquals("ab", text.text());
        assertEquals(
            List.of(Marker.of(MarkerKind.PAGE_BREAK), Marker.of(MarkerKind.PAGE_BREAK)),
            text.markers()
        );
        assertEquals(4, text.segments().size());
    }

    @Test
    void rejectsNonIterableCollections() {
        TemplateEvaluationException ex = assertThrows(
            TemplateEvaluationException.class,
            () -> render("{{for x in count}}{{x}}{{end}}", Map.of("count", 3))
        );

        assertEquals("count", ex.expression());
        assertTrue(ex.getMessage().contains("not iterable"));
    }

    @Test
    void delegatesIncludesToHandler() {
        List<String> included = new ArrayList<>();
        TextRenderer withFragments = new TextRenderer((name, context) -> {
            included.add(name);
            return new RenderedText.Builder().text("<" + context.resolveName("who") + ">").build();
        });

        RenderedText text = withFragments.render(
            ControlParser.parse("Hi {{include \"greeting\"}}"),
            TemplateContext.of(Map.of("who", "Ada"))
        );

        assertEquals("Hi <Ada>", text.text());
        assertEquals(List.of("greeting"), included);
        assertThrows(TemplateEvaluationException.class, () -> render("{{include 42}}", Map.of()));
    }
}

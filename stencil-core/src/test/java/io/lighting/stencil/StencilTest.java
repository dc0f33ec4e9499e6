package io.lighting.stencil;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.stencil.document.DocumentElement;
import io.lighting.stencil.document.Paragraph;
import io.lighting.stencil.document.Run;
import io.lighting.stencil.fragment.Fragment;
import io.lighting.stencil.fragment.FragmentResolvers;
import io.lighting.stencil.function.DefaultFunctionRegistry;
import io.lighting.stencil.function.FunctionRegistry;
import io.lighting.stencil.render.RenderObserver;
import io.lighting.stencil.render.RenderResult;
import io.lighting.stencil.template.Marker;
import io.lighting.stencil.template.MarkerKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StencilTest {
    private static Paragraph p(String text) {
        return Paragraph.of(Run.text(text));
    }

    @Test
    void rendersInvoiceBody() {
        Stencil stencil = Stencil.builder()
            .fragments(FragmentResolvers.of(Fragment.ofText("footer", "Thank you, {{customer}}")))
            .build();
        List<DocumentElement> body = List.of(
            p("Invoice {{number}}"),
            p("{{for line in lines}}"),
            p("{{line.name}}: {{line.price * line.quantity}}"),
            p("{{end}}"),
            p("{{if sum(list(1, 2)) > 2}}"),
            p("Total: {{total}}"),
            p("{{end}}"),
            p("{{include 'footer'}}")
        );
        Map<String, Object> data = Map.of(
            "number", "2024-001",
            "customer", "Ada",
            "total", 7.5,
            "lines", List.of(
                Map.of("name", "Tea", "price", 2.5, "quantity", 1),
                Map.of("name", "Cake", "price", 2.5, "quantity", 2)
            )
        );

        RenderResult result = stencil.render(body, data);

        List<String> texts = new ArrayList<>();
        result.elements().forEach(element -> texts.add(((Paragraph) element).text()));
        assertEquals(List.of("Invoice 2024-001", "Tea: 2.5", "Cake: 5", "Total: 7.5", "Thank you, Ada"), texts);
        assertTrue(result.markers().isEmpty());
    }

    @Test
    void rendersPlainText() {
        Stencil stencil = Stencil.builder().build();

        assertEquals(
            "Order 7 (2 items)",
            stencil.renderText("Order {{id}}{{if count > 0}} ({{count}} items){{end}}", Map.of("id", 7, "count", 2))
        );
        assertThrows(TemplateEvaluationException.class, () -> stencil.renderText("{{include 'x'}}", Map.of()));
    }

    @Test
    void returnsMarkersNotAppliedInline() {
        Stencil stencil = Stencil.builder().build();

        RenderResult result = stencil.render(List.of(p("{{hideRow()}}")), Map.of());

        assertEquals(List.of(Marker.of(MarkerKind.HIDE_ROW)), result.markers());
    }

    @Test
    void usesInjectedFunctions() {
        DefaultFunctionRegistry functions = FunctionRegistry.standard()
            .register("money", 1, 1, args -> "EUR " + args.get(0));
        Stencil custom = Stencil.builder().functions(functions).build();
        Stencil plain = Stencil.builder().build();

        assertEquals("EUR 5", custom.renderText("{{money(5)}}", Map.of()));
        assertThrows(TemplateEvaluationException.class, () -> plain.renderText("{{money(5)}}", Map.of()));
        assertNotSame(plain.functions(), Stencil.builder().build().functions());
    }

    @Test
    void notifiesObservers() {
        List<String> events = new ArrayList<>();
        RenderObserver observer = new RenderObserver() {
            @Override
            public void beforeRender(List<DocumentElement> elements) {
                events.add("before " + elements.size());
            }

            @Override
            public void afterRender(List<DocumentElement> elements, RenderResult result, long elapsedNanos) {
                events.add("after " + result.elements().size());
            }

            @Override
            public void onRenderError(List<DocumentElement> elements, Exception error, long elapsedNanos) {
                events.add("error " + error.getClass().getSimpleName());
            }
        };
        Stencil stencil = Stencil.builder().observers(List.of(observer)).build();

        stencil.render(List.of(p("{{if a}}"), p("x"), p("{{end}}")), Map.of("a", true));
        assertThrows(TemplateStructureException.class, () -> stencil.render(List.of(p("{{if a}}")), Map.of()));

        assertEquals(List.of("before 3", "after 1", "before 1", "error TemplateStructureException"), events);
    }

    @Test
    void appliesRenderDepthLimit() {
        Stencil stencil = Stencil.builder()
            .fragments(FragmentResolvers.of(
                new Fragment("outer", List.of(p("{{include 'inner'}}"))),
                Fragment.ofText("inner", "deep")
            ))
            .maxRenderDepth(1)
            .build();

        RenderDepthExceededException ex = assertThrows(
            RenderDepthExceededException.class,
            () -> stencil.render(List.of(p("{{include 'outer'}}")), Map.of())
        );
        assertEquals("maximum render depth exceeded: 1", ex.getMessage());
        assertEquals(1, stencil.config().maxRenderDepth());
    }

    @Test
    void readsRenderDepthFromEnvironment() {
        Map<String, String> environment = Map.of(StencilConfig.MAX_RENDER_DEPTH_ENV, "3");

        assertEquals(3, Stencil.builder().environment(environment).build().config().maxRenderDepth());
        assertEquals(10, Stencil.builder().environment(Map.of()).build().config().maxRenderDepth());
        assertEquals(5, Stencil.builder().environment(environment).maxRenderDepth(5).build().config().maxRenderDepth());
        assertThrows(
            IllegalArgumentException.class,
            () -> Stencil.builder().environment(Map.of(StencilConfig.MAX_RENDER_DEPTH_ENV, "deep")).build()
        );
    }
}

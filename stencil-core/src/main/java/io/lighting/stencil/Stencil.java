package io.lighting.stencil;

import io.lighting.stencil.document.DocumentElement;
import io.lighting.stencil.fragment.FragmentResolver;
import io.lighting.stencil.fragment.FragmentResolvers;
import io.lighting.stencil.function.FunctionRegistry;
import io.lighting.stencil.render.DocumentRenderer;
import io.lighting.stencil.render.RenderContext;
import io.lighting.stencil.render.RenderObserver;
import io.lighting.stencil.render.RenderResult;
import io.lighting.stencil.template.ControlParser;
import io.lighting.stencil.template.IncludeHandler;
import io.lighting.stencil.template.TemplateContext;
import io.lighting.stencil.template.TextRenderer;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the template engine.
 * <pre>{@code
 * Stencil stencil = Stencil.builder()
 *     .fragments(FragmentResolvers.of(Fragment.ofText("signature", "Kind regards")))
 *     .build();
 * RenderResult result = stencil.render(body, Map.of("customer", customer));
 * }</pre>
 * Instances are immutable and safe to share: each render call owns its own render state.
 */
public final class Stencil {
    private final FunctionRegistry functions;
    private final FragmentResolver fragments;
    private final StencilConfig config;
    private final List<RenderObserver> observers;

    private Stencil(
        FunctionRegistry functions,
        FragmentResolver fragments,
        StencilConfig config,
        List<RenderObserver> observers
    ) {
        this.functions = functions;
        this.fragments = fragments;
        this.config = config;
        this.observers = observers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public StencilConfig config() {
        return config;
    }

    public FunctionRegistry functions() {
        return functions;
    }

    /**
     * Renders a document body against {@code data}. The input elements are not modified.
     */
    public RenderResult render(List<DocumentElement> elements, Map<String, Object> data) {
        Objects.requireNonNull(elements, "elements");
        Objects.requireNonNull(data, "data");
        notifyBeforeRender(elements);
        long start = System.nanoTime();
        try {
            RenderContext renderContext = new RenderContext(fragments, config.maxRenderDepth(), observers);
            List<DocumentElement> rendered = new DocumentRenderer(renderContext)
                .render(elements, new TemplateContext(data, functions));
            RenderResult result = new RenderResult(rendered, renderContext.markers());
            notifyAfterRender(elements, result, start);
            return result;
        } catch (RuntimeException ex) {
            notifyRenderError(elements, ex, start);
            throw ex;
        }
    }

    /**
     * Renders template text, for example a document title or an email subject. Fragments cannot
     * be included from plain text; marker values contribute no text.
     */
    public String renderText(String template, Map<String, Object> data) {
        Objects.requireNonNull(template, "template");
        TemplateContext context = new TemplateContext(data, functions);
        return new TextRenderer(IncludeHandler.unsupported())
            .render(ControlParser.parse(template), context)
            .text();
    }

    private void notifyBeforeRender(List<DocumentElement> elements) {
        for (RenderObserver observer : observers) {
            observer.beforeRender(elements);
        }
    }

    private void notifyAfterRender(List<DocumentElement> elements, RenderResult result, long start) {
        long elapsed = System.nanoTime() - start;
        for (RenderObserver observer : observers) {
            observer.afterRender(elements, result, elapsed);
        }
    }

    private void notifyRenderError(List<DocumentElement> elements, Exception error, long start) {
        long elapsed = System.nanoTime() - start;
        for (RenderObserver observer : observers) {
            observer.onRenderError(elements, error, elapsed);
        }
    }

    public static final class Builder {
        private FunctionRegistry functions;
        private FragmentResolver fragments = FragmentResolvers.none();
        private StencilConfig config;
        private Map<String, String> environment = System.getenv();
        private List<RenderObserver> observers = List.of();

        private Builder() {
        }

        // 函数注册表：默认每个实例持有一份独立的内置函数表。
        public Builder functions(FunctionRegistry functions) {
            this.functions = Objects.requireNonNull(functions, "functions");
            return this;
        }

        public Builder fragments(FragmentResolver fragments) {
            this.fragments = Objects.requireNonNull(fragments, "fragments");
            return this;
        }

        public Builder config(StencilConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        // 片段最大嵌套深度，用于阻断间接递归的 include。
        public Builder maxRenderDepth(int maxRenderDepth) {
            this.config = new StencilConfig(maxRenderDepth);
            return this;
        }

        // 未显式配置时从环境变量读取限制，默认为 System.getenv()。
        public Builder environment(Map<String, String> environment) {
            this.environment = Objects.requireNonNull(environment, "environment");
            return this;
        }

        public Builder observers(List<RenderObserver> observers) {
            this.observers = List.copyOf(Objects.requireNonNull(observers, "observers"));
            return this;
        }

        public Stencil build() {
            FunctionRegistry finalFunctions = functions == null ? FunctionRegistry.standard() : functions;
            StencilConfig finalConfig = config == null ? StencilConfig.fromEnvironment(environment) : config;
            return new Stencil(finalFunctions, fragments, finalConfig, observers);
        }
    }
}

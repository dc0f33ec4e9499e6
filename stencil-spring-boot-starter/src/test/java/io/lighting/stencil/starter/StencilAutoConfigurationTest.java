package io.lighting.stencil.starter;

import static org.assertj.core.api.Assertions.assertThat;

import io.lighting.stencil.Stencil;
import io.lighting.stencil.document.DocumentElement;
import io.lighting.stencil.document.Paragraph;
import io.lighting.stencil.document.Run;
import io.lighting.stencil.fragment.Fragment;
import io.lighting.stencil.fragment.FragmentResolver;
import io.lighting.stencil.fragment.FragmentResolvers;
import io.lighting.stencil.function.FunctionRegistry;
import io.lighting.stencil.render.RenderLog;
import io.lighting.stencil.render.RenderObserver;
import io.lighting.stencil.render.RenderResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class StencilAutoConfigurationTest {
    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(StencilAutoConfiguration.class));

    @Test
    void createsDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(Stencil.class);
            assertThat(context).hasSingleBean(FunctionRegistry.class);
            assertThat(context).hasSingleBean(FragmentResolver.class);
            Stencil stencil = context.getBean(Stencil.class);
            assertThat(context.getBean(StencilProperties.class).getMaxRenderDepth()).isNull();
            assertThat(stencil.config().maxRenderDepth()).isEqualTo(10);
            assertThat(stencil.functions()).isSameAs(context.getBean(FunctionRegistry.class));
            assertThat(stencil.renderText("Hello {{name}}", Map.of("name", "Ada"))).isEqualTo("Hello Ada");
        });
    }

    @Test
    void bindsProperties() {
        contextRunner
            .withPropertyValues(
                "stencil.max-render-depth=3",
                "stencil.log.mode=DETAILED",
                "stencil.log.log-fragments=true",
                "stencil.log.prefix=DOC"
            )
            .run(context -> {
                StencilProperties properties = context.getBean(StencilProperties.class);
                assertThat(properties.getMaxRenderDepth()).isEqualTo(3);
                assertThat(properties.getLog().getMode()).isEqualTo(RenderLog.Mode.DETAILED);
                assertThat(properties.getLog().isLogFragments()).isTrue();
                assertThat(properties.getLog().getPrefix()).isEqualTo("DOC");
                assertThat(context.getBean(Stencil.class).config().maxRenderDepth()).isEqualTo(3);
            });
    }

    @Test
    void usesApplicationFragmentsAndObservers() {
        contextRunner
            .withUserConfiguration(FragmentConfig.class)
            .withPropertyValues("stencil.log.enabled=false")
            .run(context -> {
                Stencil stencil = context.getBean(Stencil.class);
                List<DocumentElement> body = List.of(Paragraph.of(Run.text("{{include 'footer'}}")));

                RenderResult result = stencil.render(body, Map.of());

                assertThat(((Paragraph) result.elements().get(0)).text()).isEqualTo("Kind regards");
                assertThat(context.getBean(RecordingObserver.class).rendered).containsExactly(1);
            });
    }

    @Test
    void buildsRenderLogFromProperties() {
        StencilProperties.RenderLogProperties log = new StencilProperties.RenderLogProperties();
        List<String> lines = new ArrayList<>();

        log.build(lines::add).afterRender(List.of(), new RenderResult(List.of(), List.of()), 0L);
        log.setEnabled(false);

        assertThat(lines).containsExactly("STENCIL: rendered 0 -> 0 elements");
        assertThat(log.build(lines::add)).isNull();
    }

    @Configuration(proxyBeanMethods = false)
    static class FragmentConfig {
        @Bean
        FragmentResolver footerFragments() {
            return FragmentResolvers.of(Fragment.ofText("footer", "Kind regards"));
        }

        @Bean
        RecordingObserver recordingObserver() {
            return new RecordingObserver();
        }
    }

    static class RecordingObserver implements RenderObserver {
        private final List<Integer> rendered = new ArrayList<>();

        @Override
        public void afterRender(List<DocumentElement> elements, RenderResult result, long elapsedNanos) {
            rendered.add(result.elements().size());
        }
    }
}

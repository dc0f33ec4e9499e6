package io.lighting.stencil.starter;

import io.lighting.stencil.Stencil;
import io.lighting.stencil.fragment.FragmentResolver;
import io.lighting.stencil.fragment.FragmentResolvers;
import io.lighting.stencil.function.FunctionRegistry;
import io.lighting.stencil.render.RenderLog;
import io.lighting.stencil.render.RenderObserver;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@ConditionalOnClass(Stencil.class)
@EnableConfigurationProperties(StencilProperties.class)
public class StencilAutoConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(StencilAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public FunctionRegistry stencilFunctionRegistry() {
        return FunctionRegistry.standard();
    }

    @Bean
    @ConditionalOnMissingBean
    public FragmentResolver stencilFragmentResolver() {
        return FragmentResolvers.none();
    }

    @Bean
    @ConditionalOnMissingBean
    public Stencil stencil(
        StencilProperties properties,
        FunctionRegistry functionRegistry,
        FragmentResolver fragmentResolver,
        ObjectProvider<RenderObserver> customObservers
    ) {
        List<RenderObserver> observers = new ArrayList<>();
        RenderLog renderLog = properties.getLog().build(LOGGER::info);
        if (renderLog != null) {
            observers.add(renderLog);
        }
        customObservers.orderedStream().forEach(observers::add);
        Stencil.Builder builder = Stencil.builder()
            .functions(functionRegistry)
            .fragments(fragmentResolver)
            .observers(observers);
        if (properties.getMaxRenderDepth() != null) {
            builder.maxRenderDepth(properties.getMaxRenderDepth());
        }
        return builder.build();
    }
}

package io.lighting.stencil.starter;

import io.lighting.stencil.render.RenderLog;
import java.util.function.Consumer;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Stencil.
 * <p>
 * Configure these properties under the "stencil" prefix in application.yml:
 * <pre>{@code
 * stencil:
 *   max-render-depth: 10
 *   log:
 *     enabled: true
 *     mode: SUMMARY
 *     log-fragments: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "stencil")
public class StencilProperties {

    /**
     * Maximum fragment nesting. When unset the STENCIL_MAX_RENDER_DEPTH environment variable
     * applies, then the default of 10.
     */
    private Integer maxRenderDepth;

    private RenderLogProperties log = new RenderLogProperties();

    public Integer getMaxRenderDepth() {
        return maxRenderDepth;
    }

    public void setMaxRenderDepth(Integer maxRenderDepth) {
        this.maxRenderDepth = maxRenderDepth;
    }

    public RenderLogProperties getLog() {
        return log;
    }

    public void setLog(RenderLogProperties log) {
        this.log = log;
    }

    public static class RenderLogProperties {
        private boolean enabled = true;
        private boolean logOnRender = true;
        private boolean logFragments = false;
        private boolean logErrors = true;
        private boolean includeElapsed = false;
        private RenderLog.Mode mode = RenderLog.Mode.SUMMARY;
        private String prefix = "STENCIL:";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isLogOnRender() {
            return logOnRender;
        }

        public void setLogOnRender(boolean logOnRender) {
            this.logOnRender = logOnRender;
        }

        public boolean isLogFragments() {
            return logFragments;
        }

        public void setLogFragments(boolean logFragments) {
            this.logFragments = logFragments;
        }

        public boolean isLogErrors() {
            return logErrors;
        }

        public void setLogErrors(boolean logErrors) {
            this.logErrors = logErrors;
        }

        public boolean isIncludeElapsed() {
            return includeElapsed;
        }

        public void setIncludeElapsed(boolean includeElapsed) {
            this.includeElapsed = includeElapsed;
        }

        public RenderLog.Mode getMode() {
            return mode;
        }

        public void setMode(RenderLog.Mode mode) {
            this.mode = mode;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public RenderLog build(Consumer<String> logger) {
            if (!enabled) {
                return null;
            }
            return RenderLog.builder()
                .mode(mode)
                .logOnRender(logOnRender)
                .logFragments(logFragments)
                .logErrors(logErrors)
                .includeElapsed(includeElapsed)
                .prefix(prefix)
                .sink(logger)
                .build();
        }
    }
}

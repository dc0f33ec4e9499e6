package io.lighting.stencil.render;

import io.lighting.stencil.document.DocumentElement;
import io.lighting.stencil.document.Paragraph;
import io.lighting.stencil.document.Table;
import io.lighting.stencil.template.Marker;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 模板渲染日志观察器。
 * <p>
 * 本类作为 {@link RenderObserver} 的实现，在文档渲染完成、失败或引入片段时输出可读日志。
 * 主要场景：
 * <ul>
 *   <li>排查模板指令是否按预期展开（元素数量、剩余标记）。</li>
 *   <li>观察片段引入链路，定位循环引用或嵌套过深。</li>
 * </ul>
 * 通过 {@link Builder} 配置，构建后为不可变对象，线程安全。
 */
public final class RenderLog implements RenderObserver {
    /**
     * 日志输出模式。
     */
    public enum Mode {
        /**
         * 仅输出元素数量与标记数量。
         */
        SUMMARY,
        /**
         * 额外逐行输出渲染后每个元素的文本。
         */
        DETAILED
    }

    private final boolean enabled;
    private final boolean logOnRender;
    private final boolean logFragments;
    private final boolean logErrors;
    private final boolean includeElapsed;
    private final Mode mode;
    /**
     * 日志前缀，用于快速识别日志来源。
     */
    private final String prefix;
    /**
     * 日志输出目标，默认 System.out。
     */
    private final Consumer<String> sink;

    private RenderLog(Builder builder) {
        this.enabled = builder.enabled;
        this.logOnRender = builder.logOnRender;
        this.logFragments = builder.logFragments;
        this.logErrors = builder.logErrors;
        this.includeElapsed = builder.includeElapsed;
        this.mode = builder.mode;
        this.prefix = builder.prefix;
        this.sink = builder.sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 渲染完成后的回调。
     */
    @Override
    public void afterRender(List<DocumentElement> elements, RenderResult result, long elapsedNanos) {
        if (!enabled || !logOnRender) {
            return;
        }
        StringBuilder line = new StringBuilder(prefix)
            .append(" rendered ").append(elements.size()).append(" -> ").append(result.elements().size())
            .append(" elements");
        if (!result.markers().isEmpty()) {
            line.append(", markers=").append(formatMarkers(result.markers()));
        }
        if (includeElapsed) {
            line.append(", elapsed=").append(elapsedNanos).append("ns");
        }
        sink.accept(line.toString());
        if (mode == Mode.DETAILED) {
            for (int i = 0; i < result.elements().size(); i++) {
                sink.accept(prefix + " [" + i + "] " + describe(result.elements().get(i)));
            }
        }
    }

    /**
     * 渲染失败回调：模板缺陷属于编写错误，这里只记录，不做恢复。
     */
    @Override
    public void onRenderError(List<DocumentElement> elements, Exception error, long elapsedNanos) {
        if (!enabled || !logErrors) {
            return;
        }
        String line = prefix + " failed: " + error.getMessage();
        if (includeElapsed) {
            line += ", elapsed=" + elapsedNanos + "ns";
        }
        sink.accept(line);
    }

    /**
     * 片段引入回调，输出当前引入栈。
     */
    @Override
    public void onFragmentEnter(String name, List<String> inclusionStack) {
        if (!enabled || !logFragments) {
            return;
        }
        sink.accept(prefix + " include " + name + " stack=" + String.join(" > ", inclusionStack));
    }

    private String formatMarkers(List<Marker> markers) {
        StringBuilder out = new StringBuilder("[");
        for (int i = 0; i < markers.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            Marker marker = markers.get(i);
            out.append(marker.kind().name());
            if (marker.payload() != null) {
                out.append('(').append(marker.payload()).append(')');
            }
        }
        return out.append(']').toString();
    }

    private String describe(DocumentElement element) {
        if (element instanceof Paragraph paragraph) {
            return "paragraph \"" + paragraph.text().replace("\n", "\\n") + "\"";
        }
        return "table rows=" + ((Table) element).rows().size();
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean logOnRender = true;
        private boolean logFragments = false;
        private boolean logErrors = true;
        private boolean includeElapsed = false;
        private Mode mode = Mode.SUMMARY;
        private String prefix = "STENCIL:";
        private Consumer<String> sink = System.out::println;

        /**
         * 全局开关：关闭后不输出任何日志。
         */
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder logOnRender(boolean enabled) {
            this.logOnRender = enabled;
            return this;
        }

        /**
         * 是否输出片段引入日志。
         */
        public Builder logFragments(boolean enabled) {
            this.logFragments = enabled;
            return this;
        }

        public Builder logErrors(boolean enabled) {
            this.logErrors = enabled;
            return this;
        }

        /**
         * 是否输出耗时信息（纳秒）。
         */
        public Builder includeElapsed(boolean enabled) {
            this.includeElapsed = enabled;
            return this;
        }

        public Builder mode(Mode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder prefix(String prefix) {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("prefix must not be blank");
            }
            this.prefix = prefix;
            return this;
        }

        /**
         * 日志输出目标，例如 {@code logger::info}。
         */
        public Builder sink(Consumer<String> sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /**
         * 构建实例。至少需要开启一类日志。
         */
        public RenderLog build() {
            if (!logOnRender && !logFragments && !logErrors) {
                throw new IllegalStateException("At least one of logOnRender/logFragments/logErrors must be enabled");
            }
            return new RenderLog(this);
        }
    }
}

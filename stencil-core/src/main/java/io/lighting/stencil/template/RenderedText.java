package io.lighting.stencil.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Output of text rendering: literal text interleaved with marker values, in document order.
 */
public record RenderedText(List<Segment> segments) {
    public RenderedText {
        segments = List.copyOf(segments);
    }

    public sealed interface Segment permits TextSegment, MarkerSegment {
    }

    public record TextSegment(String text) implements Segment {
        public TextSegment {
            Objects.requireNonNull(text, "text");
        }
    }

    public record MarkerSegment(Marker marker) implements Segment {
        public MarkerSegment {
            Objects.requireNonNull(marker, "marker");
        }
    }

    /**
     * Concatenated text, markers skipped.
     */
    public String text() {
        StringBuilder builder = new StringBuilder();
        for (Segment segment : segments) {
            if (segment instanceof TextSegment text) {
                builder.append(text.text());
            }
        }
        return builder.toString();
    }

    public List<Marker> markers() {
        List<Marker> markers = new ArrayList<>();
        for (Segment segment : segments) {
            if (segment instanceof MarkerSegment marker) {
                markers.add(marker.marker());
            }
        }
        return markers;
    }

    public static final class Builder {
        private final List<Segment> segments = new ArrayList<>();
        private final StringBuilder pending = new StringBuilder();

        public Builder text(String text) {
            pending.append(text);
            return this;
        }

        public Builder marker(Marker marker) {
            flush();
            segments.add(new MarkerSegment(marker));
            return this;
        }

        public Builder append(RenderedText rendered) {
            for (Segment segment : rendered.segments()) {
                if (segment instanceof TextSegment text) {
                    text(text.text());
                } else if (segment instanceof MarkerSegment marker) {
                    marker(marker.marker());
                }
            }
            return this;
        }

        public RenderedText build() {
            flush();
            return new RenderedText(segments);
        }

        private void flush() {
            if (pending.length() > 0) {
                segments.add(new TextSegment(pending.toString()));
                pending.setLength(0);
            }
        }
    }
}

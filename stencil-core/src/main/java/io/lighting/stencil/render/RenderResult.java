package io.lighting.stencil.render;

import io.lighting.stencil.document.DocumentElement;
import io.lighting.stencil.template.Marker;
import java.util.List;

/**
 * Rendered body plus the markers the renderer could not apply itself, in the order they were
 * produced. Serialization code applies those, for example a link replacement outside a hyperlink.
 */
public record RenderResult(List<DocumentElement> elements, List<Marker> markers) {
    public RenderResult {
        elements = List.copyOf(elements);
        markers = List.copyOf(markers);
    }
}

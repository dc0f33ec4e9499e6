package io.lighting.stencil.fragment;

import io.lighting.stencil.document.DocumentElement;
import io.lighting.stencil.document.Paragraph;
import io.lighting.stencil.document.Run;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named, separately authored body that templates splice in with {@code {{include "name"}}}.
 */
public record Fragment(String name, List<DocumentElement> elements) {
    public Fragment {
        Objects.requireNonNull(name, "name");
        elements = List.copyOf(elements);
    }

    /**
     * A fragment of plain paragraphs, one per line of {@code text}.
     */
    public static Fragment ofText(String name, String text) {
        Objects.requireNonNull(text, "text");
        List<DocumentElement> paragraphs = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            paragraphs.add(Paragraph.of(Run.text(line)));
        }
        return new Fragment(name, paragraphs);
    }
}

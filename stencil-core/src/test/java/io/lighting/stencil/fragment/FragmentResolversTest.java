package io.lighting.stencil.fragment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.stencil.document.Paragraph;
import java.util.List;
import org.junit.jupiter.api.Test;

class FragmentResolversTest {
    @Test
    void resolvesByName() {
        Fragment footer = Fragment.ofText("footer", "a\nb");
        FragmentResolver resolver = FragmentResolvers.of(footer);

        assertEquals(footer, resolver.lookup("footer").orElseThrow());
        assertTrue(resolver.lookup("header").isEmpty());
        assertTrue(FragmentResolvers.none().lookup("footer").isEmpty());
    }

    @Test
    void splitsTextIntoParagraphs() {
        Fragment fragment = Fragment.ofText("address", "Main Street 1\n\nSpringfield");

        assertEquals(3, fragment.elements().size());
        assertEquals("Springfield", ((Paragraph) fragment.elements().get(2)).text());
    }

    @Test
    void rejectsDuplicateNames() {
        assertThrows(
            IllegalArgumentException.class,
            () -> FragmentResolvers.of(List.of(Fragment.ofText("a", "1"), Fragment.ofText("a", "2")))
        );
    }
}

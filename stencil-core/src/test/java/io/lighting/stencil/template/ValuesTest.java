package io.lighting.stencil.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.lighting.stencil.TemplateEvaluationException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ValuesTest {
    @Test
    void coercesValuesToSlices() {
        assertEquals(List.of(), Values.toSlice(null));
        assertEquals(List.of("a", "b"), Values.toSlice("ab"));
        assertEquals(List.of(Map.of("key", "k", "value", "v")), Values.toSlice(Map.of("k", "v")));
        assertEquals(List.of(1, 2), Values.toSlice(new int[] {1, 2}));
        assertEquals(List.of("x"), Values.toSlice(Set.of("x")));
        assertEquals(List.of("😀"), Values.toSlice("😀"));
    }

    @Test
    void rejectsScalarsAsCollections() {
        TemplateEvaluationException ex = assertThrows(TemplateEvaluationException.class, () -> Values.toSlice(12));

        assertEquals("type Integer is not iterable", ex.getMessage());
    }

    @Test
    void formatsValuesForDocuments() {
        assertEquals("", Values.format(null));
        assertEquals("2", Values.format(2.0d));
        assertEquals("0.3", Values.format(0.1d + 0.2d));
        assertEquals("3.25", Values.format(3.25d));
        assertEquals("42", Values.format(42L));
        assertEquals("true", Values.format(true));
    }
}

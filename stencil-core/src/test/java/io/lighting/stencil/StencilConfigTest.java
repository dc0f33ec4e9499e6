package io.lighting.stencil;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class StencilConfigTest {
    @Test
    void defaultsToTenLevels() {
        assertEquals(10, StencilConfig.defaults().maxRenderDepth());
        assertEquals(StencilConfig.defaults(), StencilConfig.fromEnvironment(Map.of()));
        assertEquals(StencilConfig.defaults(), StencilConfig.fromEnvironment(Map.of("STENCIL_MAX_RENDER_DEPTH", " ")));
    }

    @Test
    void readsDepthFromEnvironment() {
        assertEquals(4, StencilConfig.fromEnvironment(Map.of("STENCIL_MAX_RENDER_DEPTH", " 4 ")).maxRenderDepth());
    }

    @Test
    void rejectsInvalidDepth() {
        assertThrows(IllegalArgumentException.class, () -> StencilConfig.fromEnvironment(Map.of("STENCIL_MAX_RENDER_DEPTH", "deep")));
        assertThrows(IllegalArgumentException.class, () -> StencilConfig.fromEnvironment(Map.of("STENCIL_MAX_RENDER_DEPTH", "0")));
        assertThrows(IllegalArgumentException.class, () -> new StencilConfig(-1));
    }
}

package io.lighting.stencil.fragment;

import java.util.Optional;

/**
 * Looks fragments up by name. Cycle and depth bookkeeping happen in the renderer.
 */
@FunctionalInterface
public interface FragmentResolver {
    Optional<Fragment> lookup(String name);
}

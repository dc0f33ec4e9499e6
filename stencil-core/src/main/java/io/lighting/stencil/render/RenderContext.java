package io.lighting.stencil.render;

import io.lighting.stencil.FragmentCycleException;
import io.lighting.stencil.RenderDepthExceededException;
import io.lighting.stencil.TemplateEvaluationException;
import io.lighting.stencil.fragment.Fragment;
import io.lighting.stencil.fragment.FragmentResolver;
import io.lighting.stencil.template.Marker;
import io.lighting.stencil.template.MarkerKind;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * State owned by a single render call: the fragment inclusion stack and the markers left for
 * serialization. Never share an instance between concurrent renders.
 */
public final class RenderContext {
    public static final int DEFAULT_MAX_RENDER_DEPTH = 10;

    private final FragmentResolver fragments;
    private final int maxRenderDepth;
    private final List<RenderObserver> observers;
    private final List<String> inclusionStack = new ArrayList<>();
    private final List<Marker> markers = new ArrayList<>();

    public RenderContext(FragmentResolver fragments, int maxRenderDepth, List<RenderObserver> observers) {
        this.fragments = Objects.requireNonNull(fragments, "fragments");
        if (maxRenderDepth <= 0) {
            throw new IllegalArgumentException("maxRenderDepth must be positive: " + maxRenderDepth);
        }
        this.maxRenderDepth = maxRenderDepth;
        this.observers = List.copyOf(Objects.requireNonNull(observers, "observers"));
    }

    /**
     * Pushes {@code name} on the inclusion stack and returns the fragment to render. Every
     * successful call must be paired with {@link #exitFragment()}.
     */
    Fragment enterFragment(String name) {
        if (inclusionStack.contains(name)) {
            List<String> cycle = new ArrayList<>(inclusionStack);
            cycle.add(name);
            throw new FragmentCycleException(name, cycle);
        }
        if (inclusionStack.size() >= maxRenderDepth) {
            throw new RenderDepthExceededException(maxRenderDepth);
        }
        Fragment fragment = fragments.lookup(name)
            .orElseThrow(() -> new TemplateEvaluationException("fragment not found: " + name));
        inclusionStack.add(name);
        List<String> snapshot = List.copyOf(inclusionStack);
        for (RenderObserver observer : observers) {
            observer.onFragmentEnter(name, snapshot);
        }
        return fragment;
    }

    void exitFragment() {
        inclusionStack.remove(inclusionStack.size() - 1);
    }

    public List<String> inclusionStack() {
        return List.copyOf(inclusionStack);
    }

    public int maxRenderDepth() {
        return maxRenderDepth;
    }

    void record(Marker marker) {
        markers.add(Objects.requireNonNull(marker, "marker"));
    }

    int markerCount() {
        return markers.size();
    }

    /**
     * Removes markers of {@code kind} recorded at or after {@code mark}; true when any was found.
     */
    boolean consumeSince(int mark, MarkerKind kind) {
        boolean found = false;
        Iterator<Marker> iterator = markers.listIterator(mark);
        while (iterator.hasNext()) {
            if (iterator.next().kind() == kind) {
                iterator.remove();
                found = true;
            }
        }
        return found;
    }

    public List<Marker> markers() {
        return List.copyOf(markers);
    }
}

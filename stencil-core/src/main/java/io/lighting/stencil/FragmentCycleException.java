package io.lighting.stencil;

import java.util.List;

/**
 * A fragment includes itself, directly or through other fragments.
 */
public class FragmentCycleException extends TemplateException {
    private final List<String> stack;

    public FragmentCycleException(String fragment, List<String> stack) {
        super("circular fragment reference detected: " + fragment + " (inclusion stack " + stack + ")");
        this.stack = List.copyOf(stack);
    }

    public List<String> stack() {
        return stack;
    }
}

package io.lighting.stencil;

public class RenderDepthExceededException extends TemplateException {
    private final int maxDepth;

    public RenderDepthExceededException(int maxDepth) {
        super("maximum render depth exceeded: " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}

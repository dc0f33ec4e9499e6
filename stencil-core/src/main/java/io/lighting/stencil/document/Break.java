package io.lighting.stencil.document;

/**
 * A break inside a run. A {@code null} type is an ordinary line break.
 */
public record Break(String type) {
    public static final Break LINE = new Break(null);
    public static final Break PAGE = new Break("page");
}

package io.lighting.stencil.template;

public enum MarkerKind {
    PAGE_BREAK,
    HIDE_ROW,
    REPLACE_LINK
}

package io.lighting.stencil.render;

public enum DirectiveKind {
    IF,
    ELSIF,
    ELSE,
    UNLESS,
    FOR,
    END,
    INCLUDE,
    INLINE_FOR,
    NONE;

    boolean opensBlock() {
        return this == IF || this == UNLESS || this == FOR;
    }

    boolean isBranch() {
        return this == ELSIF || this == ELSE;
    }
}

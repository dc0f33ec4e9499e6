package io.lighting.stencil.template;

public enum TokenType {
    TEXT,
    VARIABLE,
    IF,
    ELSIF,
    ELSE,
    UNLESS,
    FOR,
    END,
    INCLUDE,
    PAGE_BREAK;

    /**
     * Directives that open a block closed by {@code {{end}}}.
     */
    public boolean opensBlock() {
        return this == IF || this == UNLESS || this == FOR;
    }

    public boolean isControl() {
        return this != TEXT && this != VARIABLE;
    }
}

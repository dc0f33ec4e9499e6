package io.lighting.stencil.template;

import java.util.Objects;

/**
 * A lexical unit of template text.
 *
 * @param type   token kind
 * @param value  literal text for {@link TokenType#TEXT}, otherwise the trimmed directive payload
 * @param offset character offset of the token in the tokenized text
 */
public record Token(TokenType type, String value, int offset) {
    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
    }
}

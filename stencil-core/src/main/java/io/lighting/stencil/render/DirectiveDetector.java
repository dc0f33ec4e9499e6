package io.lighting.stencil.render;

import io.lighting.stencil.document.Paragraph;
import io.lighting.stencil.template.Token;
import io.lighting.stencil.template.TokenType;
import io.lighting.stencil.template.Tokenizer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Classifies a paragraph by the directives in its text.
 * <ul>
 *   <li>every block closed within the paragraph: {@link DirectiveKind#INLINE_FOR} when one of them is a
 *   loop, otherwise {@link DirectiveKind#NONE} and the paragraph renders inline;</li>
 *   <li>a block left open: that opener, whose body continues in the following elements;</li>
 *   <li>otherwise the leading {@code end}, {@code else} or {@code elsif} tag, or an {@code include} tag
 *   standing alone in the paragraph.</li>
 * </ul>
 */
public final class DirectiveDetector {
    private DirectiveDetector() {
    }

    public static Directive detect(Paragraph paragraph) {
        return paragraph == null ? Directive.NONE : detect(paragraph.text());
    }

    public static Directive detect(String text) {
        List<Token> tokens = Tokenizer.tokenize(text);
        Deque<Token> open = new ArrayDeque<>();
        Token firstControl = null;
        boolean loop = false;
        boolean stray = false;
        for (Token token : tokens) {
            TokenType type = token.type();
            if (!type.isControl()) {
                continue;
            }
            if (firstControl == null) {
                firstControl = token;
            }
            if (type.opensBlock()) {
                open.push(token);
                loop |= type == TokenType.FOR;
            } else if (type == TokenType.END) {
                if (open.isEmpty()) {
                    stray = true;
                } else {
                    open.pop();
                }
            } else if (type == TokenType.ELSE || type == TokenType.ELSIF) {
                stray |= open.isEmpty();
            }
        }
        if (firstControl == null) {
            return Directive.NONE;
        }
        if (!open.isEmpty()) {
            Token outermost = open.peekLast();
            return new Directive(kindOf(outermost.type()), outermost.value(), outermost.offset());
        }
        if (!stray && firstControl.type().opensBlock()) {
            return loop ? new Directive(DirectiveKind.INLINE_FOR, "", firstControl.offset()) : Directive.NONE;
        }
        if (firstControl.type() == TokenType.INCLUDE && !standsAlone(tokens, firstControl)) {
            return Directive.NONE;
        }
        return switch (firstControl.type()) {
            case END, ELSE, ELSIF, INCLUDE -> new Directive(
                kindOf(firstControl.type()),
                firstControl.value(),
                firstControl.offset()
            );
            default -> Directive.NONE;
        };
    }

    /**
     * Whether {@code tag} is the only non-blank content; anything else renders inline.
     */
    private static boolean standsAlone(List<Token> tokens, Token tag) {
        for (Token token : tokens) {
            if (token != tag && (token.type() != TokenType.TEXT || !token.value().isBlank())) {
                return false;
            }
        }
        return true;
    }

    private static DirectiveKind kindOf(TokenType type) {
        return switch (type) {
            case IF -> DirectiveKind.IF;
            case ELSIF -> DirectiveKind.ELSIF;
            case ELSE -> DirectiveKind.ELSE;
            case UNLESS -> DirectiveKind.UNLESS;
            case FOR -> DirectiveKind.FOR;
            case END -> DirectiveKind.END;
            case INCLUDE -> DirectiveKind.INCLUDE;
            default -> DirectiveKind.NONE;
        };
    }
}

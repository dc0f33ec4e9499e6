package io.lighting.stencil.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits template text into literal text and {@code {{...}}} tags.
 * <p>
 * Tags do not nest. The tag content is trimmed and classified by its first word; content without
 * a keyword is a variable expression. Tokenizing never fails, malformed expressions are reported
 * when they are parsed.
 */
public final class Tokenizer {
    private static final Pattern TAG = Pattern.compile("\\{\\{([^}]*)}}");
    private static final Map<String, TokenType> KEYWORDS = Map.of(
        "if", TokenType.IF,
        "elsif", TokenType.ELSIF,
        "elseif", TokenType.ELSIF,
        "elif", TokenType.ELSIF,
        "else", TokenType.ELSE,
        "unless", TokenType.UNLESS,
        "for", TokenType.FOR,
        "end", TokenType.END,
        "include", TokenType.INCLUDE,
        "pageBreak", TokenType.PAGE_BREAK
    );

    private Tokenizer() {
    }

    public static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TAG.matcher(text);
        int last = 0;
        while (matcher.find()) {
            if (matcher.start() > last) {
                tokens.add(new Token(TokenType.TEXT, text.substring(last, matcher.start()), last));
            }
            tokens.add(classify(matcher.group(1).trim(), matcher.group(), matcher.start()));
            last = matcher.end();
        }
        if (last < text.length()) {
            tokens.add(new Token(TokenType.TEXT, text.substring(last), last));
        }
        return tokens;
    }

    /**
     * Whether the text contains at least one directive other than a plain variable.
     */
    public static boolean hasControlTokens(List<Token> tokens) {
        for (Token token : tokens) {
            if (token.type().isControl()) {
                return true;
            }
        }
        return false;
    }

    private static Token classify(String content, String tag, int offset) {
        if (content.isEmpty()) {
            return new Token(TokenType.TEXT, tag, offset);
        }
        int split = 0;
        while (split < content.length() && !Character.isWhitespace(content.charAt(split))) {
            split++;
        }
        TokenType keyword = KEYWORDS.get(content.substring(0, split));
        if (keyword == null) {
            return new Token(TokenType.VARIABLE, content, offset);
        }
        return new Token(keyword, content.substring(split).trim(), offset);
    }
}

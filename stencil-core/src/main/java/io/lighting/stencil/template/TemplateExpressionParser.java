package io.lighting.stencil.template;

import io.lighting.stencil.TemplateSyntaxException;
import java.util.ArrayList;
import java.util.List;

final class TemplateExpressionParser {
    private final String input;
    private int index;

    TemplateExpressionParser(String input) {
        this.input = input;
        this.index = 0;
    }

    TemplateExpression parse() {
        skipWhitespace();
        if (isAtEnd()) {
            throw error("Empty expression");
        }
        TemplateExpression expression = parseOr();
        skipWhitespace();
        if (!isAtEnd()) {
            throw error("Unexpected token '" + peek() + "'");
        }
        return expression;
    }

    private TemplateExpression parseOr() {
        TemplateExpression left = parseAnd();
        while (match("||") || match("|")) {
            TemplateExpression right = parseAnd();
            left = new BinaryExpression(left, BinaryOp.OR, right);
        }
        return left;
    }

    private TemplateExpression parseAnd() {
        TemplateExpression left = parseEquality();
        while (match("&&") || match("&")) {
            TemplateExpression right = parseEquality();
            left = new BinaryExpression(left, BinaryOp.AND, right);
        }
        return left;
    }

    private TemplateExpression parseEquality() {
        TemplateExpression left = parseRelational();
        while (true) {
            if (match("==")) {
                left = new BinaryExpression(left, BinaryOp.EQ, parseRelational());
            } else if (match("!=")) {
                left = new BinaryExpression(left, BinaryOp.NE, parseRelational());
            } else {
                return left;
            }
        }
    }

    private TemplateExpression parseRelational() {
        TemplateExpression left = parseAdditive();
        while (true) {
            if (match("<=")) {
                left = new BinaryExpression(left, BinaryOp.LE, parseAdditive());
            } else if (match(">=")) {
                left = new BinaryExpression(left, BinaryOp.GE, parseAdditive());
            } else if (match("<")) {
                left = new BinaryExpression(left, BinaryOp.LT, parseAdditive());
            } else if (match(">")) {
                left = new BinaryExpression(left, BinaryOp.GT, parseAdditive());
            } else {
                return left;
            }
        }
    }

    private TemplateExpression parseAdditive() {
        TemplateExpression left = parseMultiplicative();
        while (true) {
            if (match("+")) {
                left = new BinaryExpression(left, BinaryOp.ADD, parseMultiplicative());
            } else if (match("-")) {
                left = new BinaryExpression(left, BinaryOp.SUB, parseMultiplicative());
            } else {
                return left;
            }
        }
    }

    private TemplateExpression parseMultiplicative() {
        TemplateExpression left = parseUnary();
        while (true) {
            if (match("*")) {
                left = new BinaryExpression(left, BinaryOp.MUL, parseUnary());
            } else if (match("/")) {
                left = new BinaryExpression(left, BinaryOp.DIV, parseUnary());
            } else if (match("%")) {
                left = new BinaryExpression(left, BinaryOp.MOD, parseUnary());
            } else {
                return left;
            }
        }
    }

    private TemplateExpression parseUnary() {
        skipWhitespace();
        if (peek() == '!' && peekNext() != '=') {
            index++;
            return new UnaryExpression(UnaryOp.NOT, parseUnary());
        }
        if (match("-")) {
            return new UnaryExpression(UnaryOp.NEGATE, parseUnary());
        }
        if (match("+")) {
            return new UnaryExpression(UnaryOp.PLUS, parseUnary());
        }
        return parsePostfix();
    }

    private TemplateExpression parsePostfix() {
        TemplateExpression expression = parsePrimary();
        while (true) {
            if (match(".")) {
                expression = new FieldAccessExpression(expression, parseIdentifier());
            } else if (match("[")) {
                TemplateExpression key = parseOr();
                expect("]");
                expression = new IndexAccessExpression(expression, key);
            } else {
                return expression;
            }
        }
    }

    private TemplateExpression parsePrimary() {
        skipWhitespace();
        if (isAtEnd()) {
            throw error("Unexpected end of expression");
        }
        if (match("(")) {
            TemplateExpression inner = parseOr();
            expect(")");
            return inner;
        }
        char ch = peek();
        if (ch == '"' || ch == '\'' || ch == '„' || ch == '»') {
            return new LiteralExpression(parseStringLiteral());
        }
        if (Character.isDigit(ch) || (ch == '.' && Character.isDigit(peekNext()))) {
            return new LiteralExpression(parseNumber());
        }
        if (isIdentifierStart(ch)) {
            String name = parseIdentifier();
            switch (name) {
                case "true":
                    return new LiteralExpression(Boolean.TRUE);
                case "false":
                    return new LiteralExpression(Boolean.FALSE);
                case "null":
                case "nil":
                    return new LiteralExpression(null);
                default:
                    break;
            }
            if (match("(")) {
                return new CallExpression(name, parseArguments());
            }
            return new VariableExpression(name);
        }
        throw error("Unexpected token '" + ch + "'");
    }

    private List<TemplateExpression> parseArguments() {
        List<TemplateExpression> arguments = new ArrayList<>();
        if (match(")")) {
            return arguments;
        }
        do {
            arguments.add(parseOr());
        } while (match(","));
        expect(")");
        return arguments;
    }

    private String parseIdentifier() {
        skipWhitespace();
        if (!isIdentifierStart(peek())) {
            throw error("Expected identifier");
        }
        int start = index;
        index++;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            index++;
        }
        return input.substring(start, index);
    }

    private String parseStringLiteral() {
        char open = peek();
        char close = closingQuote(open);
        int start = index;
        index++;
        StringBuilder builder = new StringBuilder();
        while (!isAtEnd() && !isClosingQuote(open, close, peek())) {
            char ch = peek();
            if (ch == '\\') {
                index++;
                if (isAtEnd()) {
                    break;
                }
                builder.append(unescape(peek()));
            } else {
                builder.append(ch);
            }
            index++;
        }
        if (isAtEnd()) {
            index = start;
            throw error("Unterminated string literal");
        }
        index++;
        return builder.toString();
    }

    private static char closingQuote(char open) {
        return switch (open) {
            case '„' -> '“';
            case '»' -> '«';
            default -> open;
        };
    }

    private static boolean isClosingQuote(char open, char close, char ch) {
        // German quotes are often closed with a plain double quote.
        return ch == close || (open == '„' && ch == '"');
    }

    private static char unescape(char ch) {
        return switch (ch) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            default -> ch;
        };
    }

    private Number parseNumber() {
        int start = index;
        while (!isAtEnd() && Character.isDigit(peek())) {
            index++;
        }
        boolean decimal = false;
        if (peek() == '.' && Character.isDigit(peekNext())) {
            decimal = true;
            index++;
            while (!isAtEnd() && Character.isDigit(peek())) {
                index++;
            }
        }
        String value = input.substring(start, index);
        if (decimal) {
            return Double.parseDouble(value.startsWith(".") ? "0" + value : value);
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            return Double.parseDouble(value);
        }
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            index++;
        }
    }

    private boolean match(String token) {
        skipWhitespace();
        if (input.startsWith(token, index)) {
            index += token.length();
            return true;
        }
        return false;
    }

    private void expect(String token) {
        if (!match(token)) {
            throw error("Expected '" + token + "'");
        }
    }

    private TemplateSyntaxException error(String message) {
        return new TemplateSyntaxException(message, input, index);
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return input.charAt(index);
    }

    private char peekNext() {
        if (index + 1 >= input.length()) {
            return '\0';
        }
        return input.charAt(index + 1);
    }

    private boolean isAtEnd() {
        return index >= input.length();
    }

    private boolean isIdentifierStart(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
    }

    private boolean isIdentifierPart(char ch) {
        return isIdentifierStart(ch) || (ch >= '0' && ch <= '9');
    }
}

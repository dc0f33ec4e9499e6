package io.lighting.stencil.template;

import io.lighting.stencil.TemplateStructureException;
import io.lighting.stencil.template.ControlNode.ElsIfClause;
import io.lighting.stencil.template.ControlNode.ExpressionNode;
import io.lighting.stencil.template.ControlNode.ForNode;
import io.lighting.stencil.template.ControlNode.IfNode;
import io.lighting.stencil.template.ControlNode.IncludeNode;
import io.lighting.stencil.template.ControlNode.PageBreakNode;
import io.lighting.stencil.template.ControlNode.TextNode;
import io.lighting.stencil.template.ControlNode.UnlessNode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds control nodes from a token stream in which every block is closed.
 */
public final class ControlParser {
    private static final Set<TokenType> IF_BRANCH_END = EnumSet.of(TokenType.ELSIF, TokenType.ELSE, TokenType.END);
    private static final Set<TokenType> UNLESS_BRANCH_END = EnumSet.of(TokenType.ELSE, TokenType.END);
    private static final Set<TokenType> BLOCK_END = EnumSet.of(TokenType.END);

    private final List<Token> tokens;
    private int index;

    private ControlParser(List<Token> tokens) {
        this.tokens = tokens;
        this.index = 0;
    }

    public static List<ControlNode> parse(String text) {
        return parse(Tokenizer.tokenize(text));
    }

    public static List<ControlNode> parse(List<Token> tokens) {
        ControlParser parser = new ControlParser(List.copyOf(tokens));
        return parser.parseBody(Set.of());
    }

    private List<ControlNode> parseBody(Set<TokenType> terminators) {
        List<ControlNode> nodes = new ArrayList<>();
        while (!isAtEnd()) {
            Token token = peek();
            if (terminators.contains(token.type())) {
                return nodes;
            }
            switch (token.type()) {
                case TEXT -> {
                    index++;
                    nodes.add(new TextNode(token.value()));
                }
                case VARIABLE -> {
                    index++;
                    nodes.add(new ExpressionNode(Expression.parse(token.value())));
                }
                case IF -> nodes.add(parseIf());
                case UNLESS -> nodes.add(parseUnless());
                case FOR -> nodes.add(parseFor());
                case INCLUDE -> {
                    index++;
                    nodes.add(new IncludeNode(Expression.parse(requirePayload(token, "include"))));
                }
                case PAGE_BREAK -> {
                    index++;
                    nodes.add(new PageBreakNode());
                }
                case ELSIF, ELSE, END -> throw unexpected(token);
                default -> throw new IllegalStateException("Unhandled token type: " + token.type());
            }
        }
        return nodes;
    }

    private IfNode parseIf() {
        Token open = advance();
        Expression condition = Expression.parse(requirePayload(open, "if"));
        List<ControlNode> thenBody = parseBody(IF_BRANCH_END);
        List<ElsIfClause> elsIfs = new ArrayList<>();
        while (!isAtEnd() && peek().type() == TokenType.ELSIF) {
            Token elsIf = advance();
            Expression elsIfCondition = Expression.parse(requirePayload(elsIf, "elsif"));
            elsIfs.add(new ElsIfClause(elsIfCondition, parseBody(IF_BRANCH_END)));
        }
        List<ControlNode> elseBody = List.of();
        if (!isAtEnd() && peek().type() == TokenType.ELSE) {
            advance();
            elseBody = parseBody(BLOCK_END);
        }
        expectEnd("if");
        return new IfNode(condition, thenBody, elsIfs, elseBody);
    }

    private UnlessNode parseUnless() {
        Token open = advance();
        Expression condition = Expression.parse(requirePayload(open, "unless"));
        List<ControlNode> thenBody = parseBody(UNLESS_BRANCH_END);
        List<ControlNode> elseBody = List.of();
        if (!isAtEnd() && peek().type() == TokenType.ELSE) {
            advance();
            elseBody = parseBody(BLOCK_END);
        }
        expectEnd("unless");
        return new UnlessNode(condition, thenBody, elseBody);
    }

    private ForNode parseFor() {
        Token open = advance();
        ForSpec spec = ForSpec.parse(requirePayload(open, "for"));
        List<ControlNode> body = parseBody(BLOCK_END);
        expectEnd("for");
        return new ForNode(spec, body);
    }

    private void expectEnd(String construct) {
        if (isAtEnd()) {
            throw new TemplateStructureException("expected {{end}} to close {{" + construct + "}}");
        }
        Token token = peek();
        if (token.type() != TokenType.END) {
            throw unexpected(token);
        }
        index++;
    }

    private String requirePayload(Token token, String keyword) {
        if (token.value().isEmpty()) {
            throw new TemplateStructureException("{{" + keyword + "}} requires an expression at offset " + token.offset());
        }
        return token.value();
    }

    private TemplateStructureException unexpected(Token token) {
        String name = switch (token.type()) {
            case ELSIF -> "{{elsif}}";
            case ELSE -> "{{else}}";
            case END -> "{{end}}";
            default -> token.type().name();
        };
        return new TemplateStructureException("unexpected " + name + " at offset " + token.offset());
    }

    private Token advance() {
        return tokens.get(index++);
    }

    private Token peek() {
        return tokens.get(index);
    }

    private boolean isAtEnd() {
        return index >= tokens.size();
    }
}

package io.lighting.stencil.template;

import java.util.List;
import java.util.Objects;

/**
 * Tree form of template text whose directives are all closed within the same text.
 */
public sealed interface ControlNode permits ControlNode.TextNode, ControlNode.ExpressionNode, ControlNode.IfNode,
    ControlNode.UnlessNode, ControlNode.ForNode, ControlNode.IncludeNode, ControlNode.PageBreakNode {

    record TextNode(String text) implements ControlNode {
        public TextNode {
            Objects.requireNonNull(text, "text");
        }
    }

    record ExpressionNode(Expression expression) implements ControlNode {
        public ExpressionNode {
            Objects.requireNonNull(expression, "expression");
        }
    }

    record IfNode(
        Expression condition,
        List<ControlNode> thenBody,
        List<ElsIfClause> elsIfs,
        List<ControlNode> elseBody
    ) implements ControlNode {
        public IfNode {
            Objects.requireNonNull(condition, "condition");
            thenBody = List.copyOf(thenBody);
            elsIfs = List.copyOf(elsIfs);
            elseBody = List.copyOf(elseBody);
        }
    }

    record ElsIfClause(Expression condition, List<ControlNode> body) {
        public ElsIfClause {
            Objects.requireNonNull(condition, "condition");
            body = List.copyOf(body);
        }
    }

    record UnlessNode(Expression condition, List<ControlNode> thenBody, List<ControlNode> elseBody)
        implements ControlNode {
        public UnlessNode {
            Objects.requireNonNull(condition, "condition");
            thenBody = List.copyOf(thenBody);
            elseBody = List.copyOf(elseBody);
        }
    }

    record ForNode(ForSpec spec, List<ControlNode> body) implements ControlNode {
        public ForNode {
            Objects.requireNonNull(spec, "spec");
            body = List.copyOf(body);
        }
    }

    record IncludeNode(Expression fragmentName) implements ControlNode {
        public IncludeNode {
            Objects.requireNonNull(fragmentName, "fragmentName");
        }
    }

    record PageBreakNode() implements ControlNode {
    }
}

package io.lighting.stencil.template;

import io.lighting.stencil.TemplateEvaluationException;
import io.lighting.stencil.template.ControlNode.ElsIfClause;
import io.lighting.stencil.template.ControlNode.ExpressionNode;
import io.lighting.stencil.template.ControlNode.ForNode;
import io.lighting.stencil.template.ControlNode.IfNode;
import io.lighting.stencil.template.ControlNode.IncludeNode;
import io.lighting.stencil.template.ControlNode.PageBreakNode;
import io.lighting.stencil.template.ControlNode.TextNode;
import io.lighting.stencil.template.ControlNode.UnlessNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders control nodes to text, taking branches and unrolling loops.
 */
public final class TextRenderer {
    private final IncludeHandler includes;

    public TextRenderer(IncludeHandler includes) {
        this.includes = Objects.requireNonNull(includes, "includes");
    }

    public RenderedText render(List<ControlNode> nodes, TemplateContext context) {
        RenderedText.Builder out = new RenderedText.Builder();
        renderNodes(nodes, context, out);
        return out.build();
    }

    private void renderNodes(List<ControlNode> nodes, TemplateContext context, RenderedText.Builder out) {
        for (ControlNode node : nodes) {
            renderNode(node, context, out);
        }
    }

    private void renderNode(ControlNode node, TemplateContext context, RenderedText.Builder out) {
        if (node instanceof TextNode text) {
            out.text(text.text());
            return;
        }
        if (node instanceof ExpressionNode expression) {
            appendValue(expression.expression().evaluate(context), out);
            return;
        }
        if (node instanceof IfNode ifNode) {
            renderNodes(selectBranch(ifNode, context), context, out);
            return;
        }
        if (node instanceof UnlessNode unless) {
            renderNodes(unless.condition().test(context) ? unless.elseBody() : unless.thenBody(), context, out);
            return;
        }
        if (node instanceof ForNode forNode) {
            ForSpec spec = forNode.spec();
            for (TemplateContext iteration : iterations(spec, context)) {
                renderNodes(forNode.body(), iteration, out);
            }
            return;
        }
        if (node instanceof IncludeNode include) {
            Object name = include.fragmentName().evaluate(context);
            if (!(name instanceof String fragmentName)) {
                throw new TemplateEvaluationException(
                    include.fragmentName().source(),
                    "fragment name must be a string, got " + Values.typeName(name),
                    null
                );
            }
            out.append(includes.include(fragmentName, context));
            return;
        }
        if (node instanceof PageBreakNode) {
            out.marker(Marker.of(MarkerKind.PAGE_BREAK));
            return;
        }
        throw new IllegalStateException("Unsupported control node: " + node);
    }

    private List<ControlNode> selectBranch(IfNode node, TemplateContext context) {
        if (node.condition().test(context)) {
            return node.thenBody();
        }
        for (ElsIfClause clause : node.elsIfs()) {
            if (clause.condition().test(context)) {
                return clause.body();
            }
        }
        return node.elseBody();
    }

    /**
     * One context per loop item, each extending {@code context} with the loop variables.
     * The collection is evaluated once.
     */
    public static List<TemplateContext> iterations(ForSpec spec, TemplateContext context) {
        Object collection = spec.collection().evaluate(context);
        List<Object> items;
        try {
            items = Values.toSlice(collection);
        } catch (TemplateEvaluationException ex) {
            throw new TemplateEvaluationException(spec.collection().source(), ex.getMessage(), ex);
        }
        List<TemplateContext> contexts = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            TemplateContext iteration = context.withLocal(spec.itemVariable(), items.get(i));
            if (spec.indexVariable() != null) {
                iteration = iteration.withLocal(spec.indexVariable(), i);
            }
            contexts.add(iteration);
        }
        return contexts;
    }

    static void appendValue(Object value, RenderedText.Builder out) {
        if (value instanceof Marker marker) {
            out.marker(marker);
        } else {
            out.text(Values.format(value));
        }
    }
}

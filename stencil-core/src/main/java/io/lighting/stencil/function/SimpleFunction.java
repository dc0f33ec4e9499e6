package io.lighting.stencil.function;

import io.lighting.stencil.TemplateEvaluationException;
import java.util.List;
import java.util.Objects;

/**
 * A {@link TemplateFunction} backed by a lambda, with the arity checked before every call.
 */
public record SimpleFunction(String name, int minArgs, int maxArgs, FunctionBody body) implements TemplateFunction {
    public SimpleFunction {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        if (minArgs < 0 || (maxArgs != -1 && maxArgs < minArgs)) {
            throw new IllegalArgumentException("Invalid arity for function " + name + ": " + minArgs + ".." + maxArgs);
        }
    }

    @Override
    public Object call(List<Object> args) {
        Objects.requireNonNull(args, "args");
        if (args.size() < minArgs) {
            throw new TemplateEvaluationException(
                "function " + name + " requires at least " + minArgs + " arguments, got " + args.size()
            );
        }
        if (maxArgs >= 0 && args.size() > maxArgs) {
            throw new TemplateEvaluationException(
                "function " + name + " accepts at most " + maxArgs + " arguments, got " + args.size()
            );
        }
        return body.apply(args);
    }
}

package io.lighting.stencil.function;

import java.util.List;

@FunctionalInterface
public interface FunctionBody {
    Object apply(List<Object> args);
}

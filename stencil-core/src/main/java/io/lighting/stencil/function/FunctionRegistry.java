package io.lighting.stencil.function;

import java.util.Optional;

public interface FunctionRegistry {
    Optional<TemplateFunction> lookup(String name);

    /**
     * A fresh registry holding the built-in functions. Each call returns a new instance, so
     * registering custom functions never leaks into other renders.
     */
    static DefaultFunctionRegistry standard() {
        return BuiltinFunctions.registerAll(new DefaultFunctionRegistry());
    }
}

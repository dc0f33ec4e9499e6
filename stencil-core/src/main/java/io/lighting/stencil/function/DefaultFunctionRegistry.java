package io.lighting.stencil.function;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class DefaultFunctionRegistry implements FunctionRegistry {
    private final Map<String, TemplateFunction> functions = new ConcurrentHashMap<>();

    public DefaultFunctionRegistry register(TemplateFunction function) {
        Objects.requireNonNull(function, "function");
        functions.put(normalize(function.name()), function);
        return this;
    }

    public DefaultFunctionRegistry register(String name, int minArgs, int maxArgs, FunctionBody body) {
        return register(new SimpleFunction(name, minArgs, maxArgs, body));
    }

    @Override
    public Optional<TemplateFunction> lookup(String name) {
        Objects.requireNonNull(name, "name");
        return Optional.ofNullable(functions.get(normalize(name)));
    }

    public Set<String> names() {
        Set<String> names = new TreeSet<>();
        functions.values().forEach(function -> names.add(function.name()));
        return names;
    }

    private String normalize(String name) {
        return name.trim();
    }
}

package io.lighting.stencil.template;

import io.lighting.stencil.TemplateEvaluationException;
import io.lighting.stencil.function.FunctionRegistry;
import io.lighting.stencil.function.TemplateFunction;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigInteger;
import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluation environment: the caller's data, loop variables layered on top of it and the
 * function registry of the current render.
 * <p>
 * Instances are immutable. {@link #withLocal(String, Object)} returns a new context, so every
 * loop iteration gets its own binding and nothing is shared between iterations.
 */
public final class TemplateContext {
    private final Map<String, Object> values;
    private final FunctionRegistry functions;
    private final Deque<Map.Entry<String, Object>> locals;

    public TemplateContext(Map<String, Object> values, FunctionRegistry functions) {
        this(copy(values), functions, new ArrayDeque<>());
    }

    private TemplateContext(
        Map<String, Object> values,
        FunctionRegistry functions,
        Deque<Map.Entry<String, Object>> locals
    ) {
        this.values = values;
        this.functions = Objects.requireNonNull(functions, "functions");
        this.locals = locals;
    }

    public static TemplateContext of(Map<String, Object> values) {
        return new TemplateContext(values, FunctionRegistry.standard());
    }

    public TemplateContext withLocal(String name, Object value) {
        Objects.requireNonNull(name, "name");
        Deque<Map.Entry<String, Object>> next = new ArrayDeque<>(locals);
        next.push(new AbstractMap.SimpleImmutableEntry<>(name, value));
        return new TemplateContext(values, functions, next);
    }

    public FunctionRegistry functions() {
        return functions;
    }

    /**
     * Looks a name up in the loop variables, innermost first, then in the data. Unknown names
     * resolve to {@code null}.
     */
    public Object resolveName(String name) {
        for (Map.Entry<String, Object> entry : locals) {
            if (entry.getKey().equals(name)) {
                return entry.getValue();
            }
        }
        return values.get(name);
    }

    /**
     * The whole environment as seen by expressions, loop variables included.
     */
    public Map<String, Object> data() {
        Map<String, Object> merged = new LinkedHashMap<>(values);
        Iterator<Map.Entry<String, Object>> outermostFirst = locals.descendingIterator();
        while (outermostFirst.hasNext()) {
            Map.Entry<String, Object> entry = outermostFirst.next();
            merged.put(entry.getKey(), entry.getValue());
        }
        return Collections.unmodifiableMap(merged);
    }

    public Object call(String name, List<Object> args) {
        TemplateFunction function = functions.lookup(name)
            .orElseThrow(() -> new TemplateEvaluationException("unknown function: " + name));
        return function.call(args);
    }

    Object readField(Object target, String name) {
        if (target == null) {
            return null;
        }
        if (target instanceof Map<?, ?> map) {
            return map.get(name);
        }
        if (target instanceof Optional<?> optional) {
            return readField(optional.orElse(null), name);
        }
        Method accessor = findAccessor(target.getClass(), name);
        if (accessor != null) {
            try {
                return accessor.invoke(target);
            } catch (ReflectiveOperationException ex) {
                throw new TemplateEvaluationException("failed to read property " + name + ": " + ex.getMessage());
            }
        }
        Field field = findField(target.getClass(), name);
        if (field != null) {
            try {
                field.setAccessible(true);
                return field.get(target);
            } catch (ReflectiveOperationException | RuntimeException ex) {
                throw new TemplateEvaluationException("failed to read field " + name + ": " + ex.getMessage());
            }
        }
        return null;
    }

    Object readIndex(Object target, Object index) {
        if (target == null) {
            return null;
        }
        if (target instanceof Map<?, ?> map) {
            return map.get(index instanceof String ? index : Values.format(index));
        }
        int length;
        if (target instanceof List<?> list) {
            length = list.size();
        } else if (target instanceof CharSequence sequence) {
            length = sequence.length();
        } else if (target.getClass().isArray()) {
            length = Array.getLength(target);
        } else {
            throw new TemplateEvaluationException("cannot index into " + Values.typeName(target));
        }
        long requested = toPosition(index);
        if (requested < 0) {
            requested += length;
        }
        if (requested < 0 || requested >= length) {
            return null;
        }
        int position = (int) requested;
        if (target instanceof List<?> list) {
            return list.get(position);
        }
        if (target instanceof CharSequence sequence) {
            return String.valueOf(sequence.charAt(position));
        }
        return Array.get(target, position);
    }

    private static long toPosition(Object index) {
        if (index instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? big.longValue() : (big.signum() < 0 ? Long.MIN_VALUE : Long.MAX_VALUE);
        }
        if (Values.isIntegral(index)) {
            return ((Number) index).longValue();
        }
        if (index instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            return (long) number.doubleValue();
        }
        if (index instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException ex) {
                throw new TemplateEvaluationException("invalid index: " + text);
            }
        }
        throw new TemplateEvaluationException("invalid index type " + Values.typeName(index));
    }

    private static Method findAccessor(Class<?> type, String name) {
        if (name.isEmpty() || !Modifier.isPublic(type.getModifiers())) {
            return null;
        }
        String capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        for (String candidate : List.of("get" + capitalized, "is" + capitalized)) {
            try {
                return type.getMethod(candidate);
            } catch (NoSuchMethodException ignored) {
                // try the next naming convention
            }
        }
        if (type.isRecord()) {
            try {
                return type.getMethod(name);
            } catch (NoSuchMethodException ignored) {
                return null;
            }
        }
        return null;
    }

    private static Field findField(Class<?> type, String name) {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            try {
                Field field = current.getDeclaredField(name);
                return Modifier.isStatic(field.getModifiers()) ? null : field;
            } catch (NoSuchFieldException ignored) {
                // continue with the superclass
            }
        }
        return null;
    }

    private static Map<String, Object> copy(Map<String, Object> values) {
        Objects.requireNonNull(values, "values");
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}

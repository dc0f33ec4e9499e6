package io.lighting.stencil.function;

import io.lighting.stencil.TemplateEvaluationException;
import io.lighting.stencil.template.Marker;
import io.lighting.stencil.template.MarkerKind;
import io.lighting.stencil.template.Values;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Functions every registry starts with.
 */
final class BuiltinFunctions {
    private BuiltinFunctions() {
    }

    static DefaultFunctionRegistry registerAll(DefaultFunctionRegistry registry) {
        return registry
            .register("empty", 1, 1, args -> isEmpty(args.get(0)))
            .register("coalesce", 1, -1, BuiltinFunctions::coalesce)
            .register("list", 0, -1, args -> new ArrayList<>(args))
            .register("str", 1, 1, args -> Values.format(args.get(0)))
            .register("integer", 1, 1, args -> toInteger(args.get(0)))
            .register("decimal", 1, 1, args -> toDecimal(args.get(0)))
            .register("lowercase", 1, 1, args -> mapText(args.get(0), text -> text.toLowerCase(Locale.ROOT)))
            .register("uppercase", 1, 1, args -> mapText(args.get(0), text -> text.toUpperCase(Locale.ROOT)))
            .register("titlecase", 1, 1, args -> mapText(args.get(0), BuiltinFunctions::titleCase))
            .register("join", 1, 2, BuiltinFunctions::join)
            .register("joinAnd", 3, 3, BuiltinFunctions::joinAnd)
            .register("replace", 3, 3, BuiltinFunctions::replace)
            .register("length", 1, 1, args -> length(args.get(0)))
            .register("round", 1, 1, args -> rounded(args.get(0), RoundingMode.HALF_UP))
            .register("floor", 1, 1, args -> rounded(args.get(0), RoundingMode.FLOOR))
            .register("ceil", 1, 1, args -> rounded(args.get(0), RoundingMode.CEILING))
            .register("sum", 1, 1, args -> sum(args.get(0)))
            .register("contains", 2, 2, args -> contains(args.get(0), args.get(1)))
            .register("range", 1, 3, BuiltinFunctions::range)
            .register("switch", 3, -1, BuiltinFunctions::switchCase)
            .register("pageBreak", 0, 0, args -> Marker.of(MarkerKind.PAGE_BREAK))
            .register("hideRow", 0, 0, args -> Marker.of(MarkerKind.HIDE_ROW))
            .register("replaceLink", 1, 1, BuiltinFunctions::replaceLink);
    }

    static boolean isEmpty(Object value) {
        return !Values.toBoolean(value);
    }

    private static Object coalesce(List<Object> args) {
        for (Object arg : args) {
            if (!isEmpty(arg)) {
                return arg;
            }
        }
        return null;
    }

    private static Object toInteger(Object value) {
        if (value == null) {
            return null;
        }
        if (Values.isIntegral(value)) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number number) {
            return (long) number.doubleValue();
        }
        if (value instanceof Boolean bool) {
            return bool ? 1L : 0L;
        }
        try {
            return new BigDecimal(Values.format(value).trim()).longValue();
        } catch (NumberFormatException ex) {
            throw new TemplateEvaluationException("cannot convert " + Values.format(value) + " to integer");
        }
    }

    private static Object toDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(Values.format(value).trim());
        } catch (NumberFormatException ex) {
            throw new TemplateEvaluationException("cannot convert " + Values.format(value) + " to decimal");
        }
    }

    private static Object mapText(Object value, UnaryOperator<String> mapper) {
        return value == null ? null : mapper.apply(Values.format(value));
    }

    private static String titleCase(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch)) {
                startOfWord = true;
                builder.append(ch);
            } else if (startOfWord) {
                builder.append(Character.toTitleCase(ch));
                startOfWord = false;
            } else {
                builder.append(Character.toLowerCase(ch));
            }
        }
        return builder.toString();
    }

    private static Object join(List<Object> args) {
        if (args.get(0) == null) {
            return "";
        }
        String separator = args.size() > 1 ? Values.format(args.get(1)) : "";
        return String.join(separator, formatAll(Values.toSlice(args.get(0))));
    }

    private static Object joinAnd(List<Object> args) {
        if (args.get(0) == null) {
            return "";
        }
        if (!(args.get(1) instanceof String separator) || !(args.get(2) instanceof String lastSeparator)) {
            throw new TemplateEvaluationException("joinAnd separators must be strings");
        }
        List<String> items = formatAll(Values.toSlice(args.get(0)));
        if (items.size() <= 1) {
            return items.isEmpty() ? "" : items.get(0);
        }
        return String.join(separator, items.subList(0, items.size() - 1)) + lastSeparator + items.get(items.size() - 1);
    }

    private static List<String> formatAll(List<Object> items) {
        List<String> formatted = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item != null) {
                formatted.add(Values.format(item));
            }
        }
        return formatted;
    }

    private static Object replace(List<Object> args) {
        if (args.get(0) == null) {
            return null;
        }
        return Values.format(args.get(0)).replace(Values.format(args.get(1)), Values.format(args.get(2)));
    }

    private static Object length(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Collection<?> collection) {
            return (long) collection.size();
        }
        if (value instanceof Map<?, ?> map) {
            return (long) map.size();
        }
        if (value.getClass().isArray()) {
            return (long) Array.getLength(value);
        }
        String text = Values.format(value);
        return (long) text.codePointCount(0, text.length());
    }

    private static Object rounded(Object value, RoundingMode mode) {
        if (value == null) {
            return null;
        }
        if (Values.isIntegral(value)) {
            return ((Number) value).longValue();
        }
        BigDecimal number;
        try {
            number = value instanceof Number num
                ? BigDecimal.valueOf(num.doubleValue())
                : new BigDecimal(Values.format(value).trim());
        } catch (NumberFormatException ex) {
            throw new TemplateEvaluationException("cannot round " + Values.format(value));
        }
        return number.setScale(0, mode).longValue();
    }

    private static Object sum(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            throw new TemplateEvaluationException("sum() requires a list, got " + Values.typeName(value));
        }
        Object total = 0L;
        for (Object item : Values.toSlice(value)) {
            if (!(item instanceof Number)) {
                throw new TemplateEvaluationException("sum() cannot add " + Values.typeName(item));
            }
            if (Values.isIntegral(total) && Values.isIntegral(item)) {
                total = ((Number) total).longValue() + ((Number) item).longValue();
            } else {
                total = ((Number) total).doubleValue() + ((Number) item).doubleValue();
            }
        }
        return total;
    }

    private static Object contains(Object needle, Object haystack) {
        if (haystack == null) {
            return false;
        }
        if (haystack instanceof CharSequence || haystack instanceof Number || haystack instanceof Boolean) {
            throw new TemplateEvaluationException(
                "contains() second parameter must be a list, got " + Values.typeName(haystack)
            );
        }
        for (Object item : Values.toSlice(haystack)) {
            if (Values.valuesEqual(item, needle) || Values.format(item).equals(Values.format(needle))) {
                return true;
            }
        }
        return false;
    }

    private static Object range(List<Object> args) {
        long start = 0L;
        long end;
        long step = 1L;
        if (args.size() == 1) {
            end = wholeNumber(args.get(0), "range");
        } else {
            start = wholeNumber(args.get(0), "range");
            end = wholeNumber(args.get(1), "range");
            if (args.size() == 3) {
                step = wholeNumber(args.get(2), "range");
            }
        }
        if (step == 0L) {
            throw new TemplateEvaluationException("range() step cannot be zero");
        }
        List<Object> numbers = new ArrayList<>();
        for (long i = start; step > 0 ? i < end : i > end; i += step) {
            numbers.add(i);
        }
        return numbers;
    }

    private static long wholeNumber(Object value, String function) {
        if (!(value instanceof Number number)) {
            throw new TemplateEvaluationException(function + "() arguments must be numbers, got " + Values.typeName(value));
        }
        return number.longValue();
    }

    private static Object switchCase(List<Object> args) {
        Object value = args.get(0);
        int index = 1;
        while (index + 1 < args.size()) {
            if (Values.valuesEqual(value, args.get(index))) {
                return args.get(index + 1);
            }
            index += 2;
        }
        return index < args.size() ? args.get(index) : null;
    }

    private static Object replaceLink(List<Object> args) {
        String url = Values.format(args.get(0));
        if (url.isBlank()) {
            throw new TemplateEvaluationException("replaceLink() requires a non-empty URL");
        }
        return new Marker(MarkerKind.REPLACE_LINK, url);
    }
}

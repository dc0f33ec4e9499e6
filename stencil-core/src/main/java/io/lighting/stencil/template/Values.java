package io.lighting.stencil.template;

import io.lighting.stencil.TemplateEvaluationException;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value semantics shared by expressions, control nodes and built-in functions.
 */
public final class Values {
    private static final MathContext SIGNIFICANT_DIGITS = new MathContext(15);

    private Values() {
    }

    public static boolean toBoolean(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return isIntegral(number) ? number.longValue() != 0L : number.doubleValue() != 0.0d;
        }
        if (value instanceof CharSequence sequence) {
            return sequence.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value instanceof Iterable<?> iterable) {
            return iterable.iterator().hasNext();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    /**
     * Coerces a value into the sequence a loop iterates.
     * <p>
     * {@code null} is empty, lists and arrays keep their order, maps become {@code {key, value}}
     * entries in iteration order and strings iterate by code point.
     */
    public static List<Object> toSlice(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(list);
        }
        if (value instanceof Map<?, ?> map) {
            List<Object> entries = new ArrayList<>(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Map<String, Object> pair = new LinkedHashMap<>();
                pair.put("key", entry.getKey());
                pair.put("value", entry.getValue());
                entries.add(Collections.unmodifiableMap(pair));
            }
            return entries;
        }
        if (value instanceof CharSequence sequence) {
            List<Object> chars = new ArrayList<>();
            sequence.toString().codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
            return chars;
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> items = new ArrayList<>();
            iterable.forEach(items::add);
            return items;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
            return items;
        }
        throw new TemplateEvaluationException("type " + typeName(value) + " is not iterable");
    }

    /**
     * Text form of a value as it appears in the document.
     */
    public static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return String.valueOf(number);
            }
            return new BigDecimal(number).round(SIGNIFICANT_DIGITS).stripTrailingZeros().toPlainString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger;
    }

    public static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number leftNum && right instanceof Number rightNum) {
            return toDecimal(leftNum).compareTo(toDecimal(rightNum)) == 0;
        }
        return Objects.equals(left, right);
    }

    public static int compare(Object left, Object right) {
        if (left instanceof Number leftNum && right instanceof Number rightNum) {
            return toDecimal(leftNum).compareTo(toDecimal(rightNum));
        }
        if (left instanceof Comparable<?> comparable && right != null && left.getClass().isInstance(right)) {
            @SuppressWarnings("unchecked")
            Comparable<Object> cast = (Comparable<Object>) comparable;
            return cast.compareTo(right);
        }
        throw new TemplateEvaluationException("cannot compare " + typeName(left) + " and " + typeName(right));
    }

    static Object add(Object left, Object right) {
        if (left instanceof CharSequence || right instanceof CharSequence) {
            return format(left) + format(right);
        }
        requireNumbers("+", left, right);
        if (isIntegral(left) && isIntegral(right)) {
            return Math.addExact(((Number) left).longValue(), ((Number) right).longValue());
        }
        return ((Number) left).doubleValue() + ((Number) right).doubleValue();
    }

    static Object subtract(Object left, Object right) {
        requireNumbers("-", left, right);
        if (isIntegral(left) && isIntegral(right)) {
            return Math.subtractExact(((Number) left).longValue(), ((Number) right).longValue());
        }
        return ((Number) left).doubleValue() - ((Number) right).doubleValue();
    }

    static Object multiply(Object left, Object right) {
        requireNumbers("*", left, right);
        if (isIntegral(left) && isIntegral(right)) {
            return Math.multiplyExact(((Number) left).longValue(), ((Number) right).longValue());
        }
        return ((Number) left).doubleValue() * ((Number) right).doubleValue();
    }

    static Object divide(Object left, Object right) {
        requireNumbers("/", left, right);
        if (((Number) right).doubleValue() == 0.0d) {
            throw new TemplateEvaluationException("division by zero");
        }
        if (isIntegral(left) && isIntegral(right)) {
            long dividend = ((Number) left).longValue();
            long divisor = ((Number) right).longValue();
            if (dividend == Long.MIN_VALUE && divisor == -1L) {
                throw new ArithmeticException("long overflow");
            }
            if (dividend % divisor == 0) {
                return dividend / divisor;
            }
        }
        return ((Number) left).doubleValue() / ((Number) right).doubleValue();
    }

    static Object modulo(Object left, Object right) {
        if (!isIntegral(left) || !isIntegral(right)) {
            throw new TemplateEvaluationException(
                "modulo requires integers, got " + typeName(left) + " and " + typeName(right)
            );
        }
        long divisor = ((Number) right).longValue();
        if (divisor == 0L) {
            throw new TemplateEvaluationException("modulo by zero");
        }
        return ((Number) left).longValue() % divisor;
    }

    static Object negate(Object value) {
        if (isIntegral(value)) {
            return Math.negateExact(((Number) value).longValue());
        }
        if (value instanceof Number number) {
            return -number.doubleValue();
        }
        throw new TemplateEvaluationException("cannot negate " + typeName(value));
    }

    public static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static void requireNumbers(String operator, Object left, Object right) {
        if (!(left instanceof Number) || !(right instanceof Number)) {
            throw new TemplateEvaluationException(
                "operator " + operator + " cannot be applied to " + typeName(left) + " and " + typeName(right)
            );
        }
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (isIntegral(number)) {
            return BigDecimal.valueOf(number.longValue());
        }
        return BigDecimal.valueOf(number.doubleValue());
    }
}

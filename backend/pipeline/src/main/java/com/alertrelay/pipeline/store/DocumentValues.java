package com.alertrelay.pipeline.store;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class DocumentValues {
    private DocumentValues() {
    }

    public static Object normalize(Object value) {
        if (value instanceof Instant instant) {
            return instant.toEpochMilli();
        }
        if (value instanceof Date date) {
            return date.getTime();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        return value;
    }

    public static boolean valuesEqual(Object stored, Object operand) {
        Object left = normalize(stored);
        Object right = normalize(operand);
        if (left instanceof Number a && right instanceof Number b) {
            return toDecimal(a).compareTo(toDecimal(b)) == 0;
        }
        return Objects.equals(left, right);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object stored, Object operand) {
        Object left = normalize(stored);
        Object right = normalize(operand);
        if (left instanceof Number a && right instanceof Number b) {
            return toDecimal(a).compareTo(toDecimal(b));
        }
        if (left instanceof Comparable && left.getClass().equals(right.getClass())) {
            return ((Comparable) left).compareTo(right);
        }
        throw new IllegalArgumentException("Cannot compare " + left.getClass().getSimpleName()
                + " with " + right.getClass().getSimpleName());
    }

    public static Map<String, Object> resolveForWrite(Map<String, Object> fields, long nowMillis) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            resolved.put(entry.getKey(), resolveValue(entry.getValue(), nowMillis));
        }
        return resolved;
    }

    public static Map<String, Object> deepCopy(Map<String, Object> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            copy.put(entry.getKey(), copyValue(entry.getValue()));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object resolveValue(Object value, long nowMillis) {
        if (value == ServerValue.TIMESTAMP) {
            return nowMillis;
        }
        if (value instanceof Map<?, ?> map) {
            return resolveForWrite((Map<String, Object>) map, nowMillis);
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            for (Object item : list) {
                resolved.add(resolveValue(item, nowMillis));
            }
            return resolved;
        }
        return normalize(value);
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(copyValue(item));
            }
            return copy;
        }
        return value;
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }
}

package com.mcpcat.core.truncate;

import com.mcpcat.core.json.ObjectTrees;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.*;

/**
 * Converts an arbitrary value graph into a bounded tree of {@link LinkedHashMap},
 * {@link ArrayList}, String, Number, Boolean and null that Gson can always write.
 *
 * Rules:
 * - Strings longer than the limit: cut, suffixed with "..."
 * - NaN / infinities: "[NaN]", "[Infinity]", "[-Infinity]"
 * - BigInteger: "[BigInt: value]"
 * - Optional.empty(): "[undefined]"; map entries holding it are dropped
 * - Callables: "[Function: name]"; bare Object / Class tokens: "[Symbol(...)]"
 * - Dates and java.time values: ISO-8601 strings
 * - Depth limit: containers at the limit become "[Object]" / "[Array]"
 * - Breadth limit: extra entries replaced by one "[MaxProperties ~]" sentinel
 * - Cycle detection: via IdentityHashMap of the current path, emits "[Circular ~]"
 *
 * The input is never modified.
 */
public final class Normalizer {

    private Normalizer() {}

    public static final String CIRCULAR = "[Circular ~]";
    public static final String MAX_PROPERTIES = "[MaxProperties ~]";
    public static final String MAX_PROPERTIES_KEY = "...";
    public static final String OBJECT = "[Object]";
    public static final String ARRAY = "[Array]";
    public static final String UNDEFINED = "[undefined]";

    public static Object normalize(Object value) {
        return normalize(value, NormalizerLimits.defaults());
    }

    public static Object normalize(Object value, NormalizerLimits limits) {
        IdentityHashMap<Object, Boolean> visited = new IdentityHashMap<>();
        return visit(value, limits.depthLimit, limits, visited);
    }

    private static Object visit(
            Object raw,
            int remainingDepth,
            NormalizerLimits limits,
            IdentityHashMap<Object, Boolean> visited) {

        Object value = ObjectTrees.unwrapJson(raw);
        if (value == null) return null;

        if (value instanceof Optional<?> opt) {
            return opt.isPresent() ? visit(opt.get(), remainingDepth, limits, visited) : UNDEFINED;
        }
        if (value instanceof Boolean) return value;
        if (value instanceof Number n) return normalizeNumber(n);
        if (value instanceof CharSequence || value instanceof Character) {
            return Strings.truncate(value.toString(), limits.maxStringLength);
        }
        if (value instanceof Enum<?> e) return e.name();
        if (ObjectTrees.isTemporal(value)) return isoString(value);
        if (ObjectTrees.isCallable(value)) {
            String name = ObjectTrees.callableName(value);
            return "[Function: " + (name != null ? name : "<anonymous>") + "]";
        }
        if (value.getClass() == Object.class) return "[Symbol()]";
        if (value instanceof Class<?> c) return "[Symbol(" + c.getName() + ")]";

        boolean array = ObjectTrees.isArrayLike(value);
        if (!array && !ObjectTrees.isObjectLike(value)) {
            return Strings.truncate(String.valueOf(value), limits.maxStringLength);
        }

        if (visited.containsKey(value)) return CIRCULAR;
        if (remainingDepth <= 0) return array ? ARRAY : OBJECT;

        visited.put(value, Boolean.TRUE);
        try {
            return array
                ? visitArray(value, remainingDepth - 1, limits, visited)
                : visitObject(value, remainingDepth - 1, limits, visited);
        } finally {
            visited.remove(value);
        }
    }

    private static List<Object> visitArray(
            Object arrayLike,
            int remainingDepth,
            NormalizerLimits limits,
            IdentityHashMap<Object, Boolean> visited) {

        List<Object> elements = ObjectTrees.elements(arrayLike);
        List<Object> result = new ArrayList<>(Math.min(elements.size(), limits.maxBreadth + 1));
        for (int i = 0; i < elements.size(); i++) {
            if (i >= limits.maxBreadth) {
                result.add(MAX_PROPERTIES);
                break;
            }
            result.add(visit(elements.get(i), remainingDepth, limits, visited));
        }
        return result;
    }

    private static Map<String, Object> visitObject(
            Object objectLike,
            int remainingDepth,
            NormalizerLimits limits,
            IdentityHashMap<Object, Boolean> visited) {

        Map<String, Object> result = new LinkedHashMap<>();
        int count = 0;
        for (Map.Entry<String, Object> e : ObjectTrees.entries(objectLike).entrySet()) {
            if (count >= limits.maxBreadth) {
                result.put(MAX_PROPERTIES_KEY, MAX_PROPERTIES);
                break;
            }
            // Absent values are omitted, like JSON serialization does
            if (isAbsent(e.getValue())) continue;
            result.put(e.getKey(), visit(e.getValue(), remainingDepth, limits, visited));
            count++;
        }
        return result;
    }

    private static boolean isAbsent(Object value) {
        return value instanceof Optional<?> opt && opt.isEmpty();
    }

    private static Object normalizeNumber(Number n) {
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d)) return "[NaN]";
            if (Double.isInfinite(d)) return d > 0 ? "[Infinity]" : "[-Infinity]";
            return n;
        }
        if (n instanceof BigInteger) return "[BigInt: " + n + "]";
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
            || n instanceof BigDecimal || isGsonNumber(n)) {
            return n;
        }
        // Other Number types (atomics, adders, custom subclasses) have no plain JSON form
        return normalizeNumber(n.doubleValue());
    }

    // Numbers parsed lazily from JSON text; Gson writes them verbatim
    private static boolean isGsonNumber(Number n) {
        return n.getClass().getName().startsWith("com.google.gson.");
    }

    private static String isoString(Object temporal) {
        if (temporal instanceof Date d) {
            return ObjectTrees.ISO_MILLIS.format(Instant.ofEpochMilli(d.getTime()));
        }
        if (temporal instanceof Calendar c) {
            return ObjectTrees.ISO_MILLIS.format(c.toInstant());
        }
        if (temporal instanceof Instant i) {
            return ObjectTrees.ISO_MILLIS.format(i);
        }
        return temporal.toString();
    }
}

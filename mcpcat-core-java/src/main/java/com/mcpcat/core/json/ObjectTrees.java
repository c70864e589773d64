package com.mcpcat.core.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.function.*;

/**
 * Classification and reading of the values found in user-controlled event fields.
 *
 * Objects are {@link Map}s, Gson {@link JsonObject}s, or plain Java objects read
 * field by field. Arrays are {@link Collection}s, Gson {@link JsonArray}s or Java
 * arrays. Everything else is a scalar.
 */
public final class ObjectTrees {

    private ObjectTrees() {}

    private static final String[] PLATFORM_PACKAGES = {"java.", "javax.", "jdk.", "sun.", "com.sun."};

    /** ISO-8601 instant in UTC, always with milliseconds. */
    public static final DateTimeFormatter ISO_MILLIS =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    public static boolean isArrayLike(Object value) {
        return value instanceof Collection<?>
            || value instanceof JsonArray
            || (value != null && value.getClass().isArray());
    }

    public static boolean isObjectLike(Object value) {
        return value instanceof Map<?, ?> || value instanceof JsonObject || isPojo(value);
    }

    public static boolean isTemporal(Object value) {
        return value instanceof Date || value instanceof TemporalAccessor || value instanceof Calendar;
    }

    /**
     * Lists the elements of an array-like value in iteration order.
     * Primitive arrays are boxed.
     */
    public static List<Object> elements(Object arrayLike) {
        if (arrayLike instanceof JsonArray json) {
            return new ArrayList<>(json.asList());
        }
        if (arrayLike instanceof Collection<?> col) {
            return new ArrayList<>(col);
        }
        int len = Array.getLength(arrayLike);
        List<Object> out = new ArrayList<>(len);
        for (int i = 0; i < len; i++) {
            out.add(Array.get(arrayLike, i));
        }
        return out;
    }

    /**
     * Reads the entries of an object-like value, keys as strings, in iteration order.
     * Plain objects contribute their declared and inherited instance fields.
     */
    public static Map<String, Object> entries(Object objectLike) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (objectLike instanceof JsonObject json) {
            out.putAll(json.asMap());
            return out;
        }
        if (objectLike instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.put(String.valueOf(e.getKey()), e.getValue());
            }
            return out;
        }
        readFields(objectLike, out);
        return out;
    }

    private static void readFields(Object obj, Map<String, Object> out) {
        // Walk class hierarchy up to Object; subclass fields first
        Class<?> c = obj.getClass();
        while (c != null && c != Object.class) {
            for (Field f : c.getDeclaredFields()) {
                int mod = f.getModifiers();
                if (f.isSynthetic() || Modifier.isStatic(mod) || Modifier.isTransient(mod)) continue;
                String name = fieldName(f);
                if (out.containsKey(name)) continue; // shadowed by a subclass field
                try {
                    f.setAccessible(true);
                    out.put(name, f.get(obj));
                } catch (RuntimeException | IllegalAccessException e) {
                    // Module system may deny access; inaccessible fields are left out.
                    continue;
                }
            }
            c = c.getSuperclass();
        }
    }

    private static String fieldName(Field f) {
        SerializedName sn = f.getAnnotation(SerializedName.class);
        return sn != null ? sn.value() : f.getName();
    }

    /** Unwraps Gson primitives and nulls to plain Java values; other values are returned as is. */
    public static Object unwrapJson(Object value) {
        if (!(value instanceof JsonElement el)) return value;
        if (el.isJsonNull()) return null;
        if (el.isJsonPrimitive()) {
            var p = el.getAsJsonPrimitive();
            if (p.isBoolean()) return p.getAsBoolean();
            if (p.isNumber()) return p.getAsNumber();
            return p.getAsString();
        }
        return value;
    }

    /**
     * True for application objects that should be read field by field: anything that is
     * not a container, scalar, temporal or callable, and not a JDK platform class.
     */
    public static boolean isPojo(Object value) {
        if (value == null) return false;
        if (value instanceof Map<?, ?> || isArrayLike(value) || value instanceof JsonElement) return false;
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean
            || value instanceof Character || value instanceof Enum<?> || value instanceof Optional<?>
            || isTemporal(value) || isCallable(value)) {
            return false;
        }
        Class<?> cls = value.getClass();
        if (cls == Object.class || cls.isEnum()) return false;
        String name = cls.getName();
        for (String prefix : PLATFORM_PACKAGES) {
            if (name.startsWith(prefix)) return false;
        }
        return true;
    }

    public static boolean isCallable(Object value) {
        if (value == null) return false;
        if (value instanceof Method) return true;
        if (value instanceof Runnable || value instanceof Callable<?>
            || value instanceof Function<?, ?> || value instanceof BiFunction<?, ?, ?>
            || value instanceof Supplier<?> || value instanceof Consumer<?>
            || value instanceof BiConsumer<?, ?> || value instanceof Predicate<?>
            || value instanceof BiPredicate<?, ?>) {
            return !(value instanceof Thread);
        }
        return isLambda(value.getClass());
    }

    /** Name of a callable, or {@code null} for lambdas and anonymous classes. */
    public static String callableName(Object callable) {
        if (callable instanceof Method m) return m.getName();
        Class<?> cls = callable.getClass();
        if (isLambda(cls) || cls.isAnonymousClass()) return null;
        String simple = cls.getSimpleName();
        return simple.isEmpty() ? null : simple;
    }

    private static boolean isLambda(Class<?> cls) {
        return cls.isSynthetic() || cls.isHidden() || cls.getName().contains("$$Lambda");
    }
}

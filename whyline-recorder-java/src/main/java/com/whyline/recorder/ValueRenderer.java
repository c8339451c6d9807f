package com.whyline.recorder;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.util.*;

/**
 * Renders recorded values as text for the JSON export and for answer explanations.
 *
 * Rules:
 * - null renders as "null", scalars with String.valueOf, placeholders with their own text
 * - objects are flattened into "path=value" entries: declared and inherited instance fields,
 *   "length" plus up to maxCollectionElements entries for arrays, collections and maps
 * - at the depth limit the type name is emitted as "&lt;Type&gt;" instead of recursing
 * - objects re-visited on the current path emit "&lt;circular&gt;"
 * - fields the module system refuses to open are skipped
 */
public final class ValueRenderer {

    private ValueRenderer() {}

    /** Compact single-line form, e.g. {@code Point{x=1, y=2}} or {@code ArrayList{length=2, [0]=a, [1]=b}}. */
    public static String render(Object value, RenderLimits limits) {
        if (value == null) return "null";
        if (isScalar(value.getClass()) || value instanceof ValuePlaceholder) return String.valueOf(value);
        Map<String, String> flat = flatten(value, limits);
        return renderFlattened(typeName(value.getClass()), flat);
    }

    public static Map<String, String> flatten(Object value, RenderLimits limits) {
        Map<String, String> out = new LinkedHashMap<>();
        if (value == null) return out;
        flattenInto(value, limits, 0, "", out, new IdentityHashMap<>());
        return out;
    }

    /** Renders a flattened map as {@code Type{k=v, ...}}. */
    public static String renderFlattened(String typeName, Map<String, String> flat) {
        StringJoiner joiner = new StringJoiner(", ", typeName + "{", "}");
        for (Map.Entry<String, String> e : flat.entrySet()) {
            joiner.add(e.getKey() + "=" + e.getValue());
        }
        return joiner.toString();
    }

    private static void flattenInto(
            Object value,
            RenderLimits limits,
            int depth,
            String prefix,
            Map<String, String> out,
            IdentityHashMap<Object, Boolean> path) {

        String key = prefix.isEmpty() ? "value" : prefix;
        if (value == null) {
            out.put(key, "null");
            return;
        }
        Class<?> cls = value.getClass();
        if (isScalar(cls) || value instanceof ValuePlaceholder) {
            out.put(key, String.valueOf(value));
            return;
        }
        if (path.containsKey(value)) {
            out.put(key, "<circular>");
            return;
        }

        path.put(value, Boolean.TRUE);
        try {
            if (cls.isArray()) {
                int len = Array.getLength(value);
                out.put(join(prefix, "length"), String.valueOf(len));
                for (int i = 0; i < Math.min(len, limits.maxCollectionElements); i++) {
                    child(Array.get(value, i), limits, depth, index(prefix, i), out, path);
                }
            } else if (value instanceof Collection<?> col) {
                out.put(join(prefix, "length"), String.valueOf(col.size()));
                int i = 0;
                for (Object elem : col) {
                    if (i >= limits.maxCollectionElements) break;
                    child(elem, limits, depth, index(prefix, i++), out, path);
                }
            } else if (value instanceof Map<?, ?> map) {
                out.put(join(prefix, "length"), String.valueOf(map.size()));
                int i = 0;
                for (Map.Entry<?, ?> e : map.entrySet()) {
                    if (i++ >= limits.maxCollectionElements) break;
                    child(e.getValue(), limits, depth, index(prefix, e.getKey()), out, path);
                }
            } else if (depth >= limits.depthLimit) {
                out.put(key, "<" + typeName(cls) + ">");
            } else {
                for (Field field : instanceFields(cls)) {
                    Object fieldValue;
                    try {
                        field.setAccessible(true);
                        fieldValue = field.get(value);
                    } catch (IllegalAccessException | RuntimeException e) {
                        continue;
                    }
                    child(fieldValue, limits, depth, join(prefix, field.getName()), out, path);
                }
            }
        } finally {
            path.remove(value);
        }
    }

    private static void child(
            Object value,
            RenderLimits limits,
            int depth,
            String key,
            Map<String, String> out,
            IdentityHashMap<Object, Boolean> path) {
        if (value != null && !isScalar(value.getClass()) && !(value instanceof ValuePlaceholder)
                && depth + 1 >= limits.depthLimit && !path.containsKey(value)) {
            out.put(key, "<" + typeName(value.getClass()) + ">");
            return;
        }
        flattenInto(value, limits, depth + 1, key, out, path);
    }

    static List<Field> instanceFields(Class<?> cls) {
        List<Field> fields = new ArrayList<>();
        for (Class<?> c = cls; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field f : c.getDeclaredFields()) {
                if (f.isSynthetic() || java.lang.reflect.Modifier.isStatic(f.getModifiers())) continue;
                fields.add(f);
            }
        }
        return fields;
    }

    static boolean isScalar(Class<?> cls) {
        return cls.isPrimitive()
            || cls == String.class
            || cls == Boolean.class
            || cls == Character.class
            || cls.isEnum()
            || Number.class.isAssignableFrom(cls) && cls.getPackageName().startsWith("java.");
    }

    static String typeName(Class<?> cls) {
        return cls.getSimpleName().isEmpty() ? cls.getName() : cls.getSimpleName();
    }

    private static String join(String prefix, String name) {
        return prefix.isEmpty() ? name : prefix + "." + name;
    }

    private static String index(String prefix, Object index) {
        return prefix + "[" + index + "]";
    }
}

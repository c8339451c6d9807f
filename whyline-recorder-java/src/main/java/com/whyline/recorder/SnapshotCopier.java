package com.whyline.recorder;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Produces the copies stored in event payloads and snapshots.
 *
 * Rules:
 * - null and immutable scalars (String, boxed primitives, enums, BigInteger/BigDecimal) are kept as is
 * - other Serializable values are deep copied through a serialization round trip, so later
 *   mutation by the program does not alter the recorded copy
 * - anything else, or anything whose copy fails, becomes a {@link ValuePlaceholder}
 *
 * Copying never throws.
 */
final class SnapshotCopier {

    private SnapshotCopier() {}

    static Object copy(Object value, ObjectRegistry registry) {
        if (value == null) return null;
        Class<?> cls = value.getClass();
        if (isImmutable(cls)) return value;
        if (!(value instanceof Serializable)) {
            return ValuePlaceholder.of(value, registry.idOf(value));
        }
        try {
            return deepCopy(value);
        } catch (IOException | ClassNotFoundException | RuntimeException | StackOverflowError e) {
            return ValuePlaceholder.of(value, registry.idOf(value));
        }
    }

    /** Copies alternating name/value pairs, skipping names injected by the rewriter. */
    static Map<String, Object> copyBindings(Object[] namesAndValues, ObjectRegistry registry) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (namesAndValues == null) return out;
        for (int i = 0; i + 1 < namesAndValues.length; i += 2) {
            String name = String.valueOf(namesAndValues[i]);
            if (TraceRecorder.isInjectedName(name)) continue;
            out.put(name, copy(namesAndValues[i + 1], registry));
        }
        return out;
    }

    static boolean isImmutable(Class<?> cls) {
        return cls == String.class
            || cls == Boolean.class
            || cls == Byte.class
            || cls == Short.class
            || cls == Integer.class
            || cls == Long.class
            || cls == Float.class
            || cls == Double.class
            || cls == Character.class
            || cls == BigInteger.class
            || cls == BigDecimal.class
            || cls == ValuePlaceholder.class
            || cls.isEnum()
            || cls.getSuperclass() != null && cls.getSuperclass().isEnum();
    }

    private static Object deepCopy(Object value) throws IOException, ClassNotFoundException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        }
        ClassLoader loader = value.getClass().getClassLoader();
        try (ObjectInputStream in = new LoaderAwareObjectInputStream(
                new ByteArrayInputStream(bytes.toByteArray()), loader)) {
            return in.readObject();
        }
    }
}

package com.whyline.recorder;

import java.io.Serializable;

/**
 * Stands in for a snapshot or payload value that could not be copied.
 * Keeps the runtime type name and the display id the recorder gave the object.
 */
public record ValuePlaceholder(String typeName, String qualifiedTypeName, long objectId) implements Serializable {

    static ValuePlaceholder of(Object value, long objectId) {
        Class<?> cls = value.getClass();
        String simple = cls.getSimpleName().isEmpty() ? cls.getName() : cls.getSimpleName();
        return new ValuePlaceholder(simple, cls.getName(), objectId);
    }

    /** True if {@code name} is this value's simple or fully qualified type name. */
    public boolean isOfType(String name) {
        return typeName.equals(name) || qualifiedTypeName.equals(name);
    }

    @Override
    public String toString() {
        return "<unserializable: " + typeName + "#" + objectId + ">";
    }
}

package com.whyline.recorder;

import org.junit.jupiter.api.Test;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotCopierTest {

    private final ObjectRegistry registry = new ObjectRegistry();

    enum Colour { RED }

    static class Box implements Serializable {
        int size = 3;
        List<String> labels = new ArrayList<>(List.of("a"));

        @Override
        public boolean equals(Object o) {
            return o instanceof Box b && b.size == size && b.labels.equals(labels);
        }

        @Override
        public int hashCode() {
            return Objects.hash(size, labels);
        }
    }

    static class LeakyBox implements Serializable {
        Object handle = new Object();
    }

    @Test
    void immutablesAreKept() {
        String s = "text";
        BigDecimal d = new BigDecimal("1.50");
        assertSame(s, SnapshotCopier.copy(s, registry));
        assertSame(d, SnapshotCopier.copy(d, registry));
        assertSame(Colour.RED, SnapshotCopier.copy(Colour.RED, registry));
        assertNull(SnapshotCopier.copy(null, registry));
    }

    @Test
    void serializableValuesAreDeepCopied() {
        Box box = new Box();
        Object copy = SnapshotCopier.copy(box, registry);
        assertNotSame(box, copy);
        assertEquals(box, copy);
        box.labels.add("b");
        assertEquals(List.of("a"), ((Box) copy).labels);
    }

    @Test
    void unserializableFieldYieldsPlaceholder() {
        Object copy = SnapshotCopier.copy(new LeakyBox(), registry);
        ValuePlaceholder placeholder = assertInstanceOf(ValuePlaceholder.class, copy);
        assertTrue(placeholder.isOfType("LeakyBox"));
        assertTrue(placeholder.isOfType(LeakyBox.class.getName()));
    }

    @Test
    void copyBindingsSkipsInjectedNamesAndDanglingName() {
        Map<String, Object> copied = SnapshotCopier.copyBindings(
            new Object[]{"a", 1, "__whyline", "x", "b"}, registry);
        assertEquals(Map.of("a", 1), copied);
    }

    @Test
    void registryIdsAreSequentialPerIdentity() {
        Object first = new Object();
        Object second = new Object();
        assertEquals(1L, registry.idOf(first));
        assertEquals(2L, registry.idOf(second));
        assertEquals(1L, registry.idOf(first));
        registry.clear();
        assertEquals(0, registry.size());
        assertEquals(1L, registry.idOf(second));
    }
}

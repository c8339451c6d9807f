package com.whyline.recorder;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class EventKindTest {

    @Test
    void wireNamesResolve() {
        for (EventKind kind : EventKind.values()) {
            assertSame(kind, EventKind.fromWireName(kind.wireName()));
        }
        assertEquals(EventKind.AUGMENTED_ASSIGN, EventKind.fromWireName("augmented-assign"));
    }

    @Test
    void unknownWireNameThrows() {
        assertThrows(IllegalArgumentException.class, () -> EventKind.fromWireName("ASSIGN"));
    }

    @Test
    void assignmentFamily() {
        assertTrue(EventKind.SLICE_ASSIGN.isAssignment());
        assertTrue(EventKind.AUGMENTED_ASSIGN.isAssignment());
        assertFalse(EventKind.RETURN.isAssignment());
        assertTrue(EventKind.WHILE_CONDITION.isCondition());
        assertFalse(EventKind.LOOP_ITERATION.isCondition());
    }
}

package com.whyline.recorder;

/**
 * Closed set of trace event kinds. Each kind implies a payload shape, but every kind
 * shares the {@link TraceEvent} envelope.
 *
 * The wire name is the string instrumented code passes to
 * {@link TraceRecorder#recordEvent(int, String, int, String, Object...)}.
 */
public enum EventKind {
    ASSIGN("assign"),
    ATTRIBUTE_ASSIGN("attribute-assign"),
    INDEX_ASSIGN("index-assign"),
    SLICE_ASSIGN("slice-assign"),
    AUGMENTED_ASSIGN("augmented-assign"),
    FUNCTION_ENTRY("function-entry"),
    RETURN("return"),
    BRANCH("branch"),
    LOOP_ITERATION("loop-iteration"),
    WHILE_CONDITION("while-condition"),
    CALL("call");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** True for the kinds that write a variable, field or element. */
    public boolean isAssignment() {
        return switch (this) {
            case ASSIGN, ATTRIBUTE_ASSIGN, INDEX_ASSIGN, SLICE_ASSIGN, AUGMENTED_ASSIGN -> true;
            default -> false;
        };
    }

    /** True for the kinds that record a control-flow decision. */
    public boolean isCondition() {
        return this == BRANCH || this == WHILE_CONDITION;
    }

    public static EventKind fromWireName(String wireName) {
        for (EventKind kind : values()) {
            if (kind.wireName.equals(wireName)) return kind;
        }
        throw new IllegalArgumentException("Unknown event kind: " + wireName);
    }

    @Override
    public String toString() {
        return wireName;
    }
}

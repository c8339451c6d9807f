package com.whyline.recorder;

/**
 * Implemented by class loaders that define instrumented classes, so each run can inject
 * its own recorder instead of sharing the process-wide one.
 */
public interface RecorderProvider {

    TraceRecorder traceRecorder();

    /** Source file name reported for bytecode-level events of {@code type}. */
    default String sourceFileOf(Class<?> type) {
        Class<?> top = type;
        while (top.getEnclosingClass() != null) top = top.getEnclosingClass();
        return top.getSimpleName() + ".java";
    }
}

package com.whyline.recorder;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Target of {@link CallAdvice}: records a {@code call} event with the recorder bound to
 * the called type. Bytecode carries no source line here, so events use line 0.
 */
public final class CallTracing {

    /** Probe id used for bytecode-level events, which have no source instrumentation point. */
    public static final int BYTECODE_PROBE = -1;

    private CallTracing() {}

    public static void record(Class<?> type, String method, Object[] args) {
        TraceRecorder recorder = TraceRecorder.bind(type);
        if (!recorder.isEnabled()) return;
        ClassLoader loader = type.getClassLoader();
        String file = loader instanceof RecorderProvider provider
            ? provider.sourceFileOf(type)
            : type.getSimpleName() + ".java";
        List<Object> argList = args == null ? Collections.emptyList() : Arrays.asList(args);
        recorder.recordEvent(BYTECODE_PROBE, file, 0, EventKind.CALL.wireName(),
            "function", method,
            "declaringType", type.getName(),
            "args", argList);
    }
}

package com.whyline.recorder;

/**
 * A recorder paired with the bindings of one instrumentation point.
 * Instrumented code obtains it from {@link TraceRecorder#frame(Object, Object...)}
 * and records through it in the same expression.
 */
public final class FrameBinding {

    private final TraceRecorder recorder;
    private final Object self;
    private final Object[] locals;

    FrameBinding(TraceRecorder recorder, Object self, Object[] locals) {
        this.recorder = recorder;
        this.self = self;
        this.locals = locals;
    }

    public void recordEvent(int probeId, String file, int line, String kind, Object... payloadPairs) {
        recorder.record(probeId, file, line, kind, self, locals, payloadPairs);
    }

    /** Records a {@code return} event for {@code value} and hands the value back unchanged. */
    public <T> T recordReturn(int probeId, String file, int line, String function, T value) {
        recorder.record(probeId, file, line, EventKind.RETURN.wireName(), self, locals,
            new Object[]{"function", function, "value", value});
        return value;
    }
}

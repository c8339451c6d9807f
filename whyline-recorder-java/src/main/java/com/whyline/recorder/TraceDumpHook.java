package com.whyline.recorder;

import java.nio.file.Path;

/**
 * Writes the process-wide recorder's trace as JSON on JVM shutdown.
 * Registered by {@link TraceRecorder#global()} when the {@code output} option is set.
 */
public class TraceDumpHook implements Runnable {

    private final TraceRecorder recorder;
    private final Path outputPath;

    public TraceDumpHook(TraceRecorder recorder, Path outputPath) {
        this.recorder = recorder;
        this.outputPath = outputPath;
    }

    @Override
    public void run() {
        try {
            new TraceJsonExporter(recorder.config().renderLimits()).write(recorder.events(), outputPath);
        } catch (Exception e) {
            System.err.println("[whyline-recorder] ERROR writing trace dump: " + e.getMessage());
        }
    }
}

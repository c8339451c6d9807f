package com.whyline.recorder;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a trace as a pretty-printed JSON document for reading outside the engine.
 * The binary form from {@link TraceRecorder#toBytes()} remains the one that round-trips.
 */
public class TraceJsonExporter {

    static final String FORMAT_VERSION = "0.1";

    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
    private final RenderLimits limits;

    public TraceJsonExporter(RenderLimits limits) {
        this.limits = limits;
    }

    public TraceDump buildDump(List<TraceEvent> events) {
        TraceDump dump = new TraceDump();
        dump.formatVersion = FORMAT_VERSION;
        dump.eventCount = events.size();
        dump.filesTraced = new ArrayList<>(TraceStats.of(events).filesTraced());
        dump.events = new ArrayList<>(events.size());
        for (TraceEvent e : events) {
            TraceDump.Event out = new TraceDump.Event();
            out.id = e.id();
            out.probeId = e.probeId();
            out.file = e.sourceFile();
            out.line = e.sourceLine();
            out.kind = e.kind().wireName();
            out.thread = e.executingThread();
            out.timestamp = e.timestamp().toString();
            out.payload = renderAll(e.payload());
            out.locals = renderAll(e.localSnapshot());
            out.globals = renderAll(e.globalSnapshot());
            dump.events.add(out);
        }
        return dump;
    }

    public String toJson(List<TraceEvent> events) {
        return gson.toJson(buildDump(events));
    }

    public void write(List<TraceEvent> events, Path outputPath) {
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer w = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
                gson.toJson(buildDump(events), w);
            }
        } catch (IOException e) {
            throw new ExportException("Failed to write trace JSON: " + outputPath + ": " + e.getMessage(), e);
        }
        System.err.println("[whyline-recorder] trace JSON written: " + outputPath);
    }

    private Map<String, String> renderAll(Map<String, Object> values) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : values.entrySet()) {
            out.put(e.getKey(), ValueRenderer.render(e.getValue(), limits));
        }
        return out;
    }

    public static class ExportException extends RuntimeException {
        public ExportException(String message, Throwable cause) { super(message, cause); }
    }
}

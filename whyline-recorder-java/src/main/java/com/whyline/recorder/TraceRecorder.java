package com.whyline.recorder;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Thread-safe, append-only event log that instrumented programs call into while they run.
 *
 * Id allocation, event construction and the append happen under one lock, so ids are
 * gap-free and the log order matches allocation order under concurrent callers.
 * Snapshot copies are taken before the lock.
 *
 * Instrumented classes reach their recorder through {@link #bind(Class)}: the recorder
 * injected by the defining class loader when it is a {@link RecorderProvider}, otherwise
 * the process-wide {@link #global()} one.
 */
public final class TraceRecorder {

    /** Prefix of every name the rewriter injects into instrumented code. */
    public static final String INJECTED_PREFIX = "__whyline";

    private static final Set<Class<?>> OWN_FRAMES =
        Set.of(TraceRecorder.class, FrameBinding.class, CallTracing.class);

    private static final StackWalker STACK_WALKER =
        StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    private static final Object[] NO_BINDINGS = new Object[0];

    private static volatile TraceRecorder global;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<TraceEvent> events = new ArrayList<>();
    private final ObjectRegistry objects = new ObjectRegistry();
    private final RecorderConfig config;
    private long lastId;
    private volatile boolean enabled = true;

    public TraceRecorder() {
        this(RecorderConfig.defaults());
    }

    public TraceRecorder(RecorderConfig config) {
        this.config = config;
    }

    // -----------------------------------------------------------------------
    // Acquisition
    // -----------------------------------------------------------------------

    /** Process-wide recorder, configured from the {@code whyline.recorder} system property. */
    public static TraceRecorder global() {
        TraceRecorder r = global;
        if (r == null) {
            synchronized (TraceRecorder.class) {
                r = global;
                if (r == null) {
                    RecorderConfig config = RecorderConfig.fromSystemProperties();
                    r = new TraceRecorder(config);
                    if (config.outputPath() != null) {
                        Path dumpPath = Paths.get(config.outputPath());
                        Runtime.getRuntime().addShutdownHook(new Thread(new TraceDumpHook(r, dumpPath)));
                        System.err.println("[whyline-recorder] trace will be written to " + dumpPath);
                    }
                    global = r;
                }
            }
        }
        return r;
    }

    /** Recorder for code defined in {@code owner}'s class loader. */
    public static TraceRecorder bind(Class<?> owner) {
        ClassLoader loader = owner.getClassLoader();
        if (loader instanceof RecorderProvider provider) {
            return provider.traceRecorder();
        }
        return global();
    }

    /** Builds the name-to-value map a script publishes as its final bindings. */
    public static Map<String, Object> bindings(Object... namesAndValues) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < namesAndValues.length; i += 2) {
            out.put(String.valueOf(namesAndValues[i]), namesAndValues[i + 1]);
        }
        return out;
    }

    static boolean isInjectedName(String name) {
        return name.startsWith(INJECTED_PREFIX);
    }

    // -----------------------------------------------------------------------
    // Recording
    // -----------------------------------------------------------------------

    /**
     * Binds the receiver ({@code null} in static code) and the visible locals, given as
     * alternating name/value pairs, for the event recorded next.
     */
    public FrameBinding frame(Object self, Object... namesAndValues) {
        return new FrameBinding(this, self, namesAndValues);
    }

    /** Records an event without local bindings. */
    public void recordEvent(int probeId, String file, int line, String kind, Object... payloadPairs) {
        record(probeId, file, line, kind, null, NO_BINDINGS, payloadPairs);
    }

    void record(int probeId, String file, int line, String kindName,
                Object self, Object[] locals, Object[] payloadPairs) {
        if (!enabled) return;
        EventKind kind = EventKind.fromWireName(kindName);

        Map<String, Object> payload = buildPayload(payloadPairs);
        Map<String, Object> localSnapshot = config.captureLocals()
            ? SnapshotCopier.copyBindings(locals, objects)
            : Collections.emptyMap();
        Map<String, Object> globalSnapshot = config.captureGlobals()
            ? snapshotGlobals(self)
            : Collections.emptyMap();

        lock.lock();
        try {
            long id = nextEventId();
            events.add(new TraceEvent(id, probeId, file, line, kind, payload,
                Instant.now(), Thread.currentThread().getName(), localSnapshot, globalSnapshot));
        } finally {
            lock.unlock();
        }
    }

    /** Allocates the next event id. Ids start at 1 after construction or {@link #clear()}. */
    public long nextEventId() {
        lock.lock();
        try {
            return ++lastId;
        } finally {
            lock.unlock();
        }
    }

    private Map<String, Object> buildPayload(Object[] pairs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (pairs == null) return payload;
        for (int i = 0; i < pairs.length; i += 2) {
            String key = String.valueOf(pairs[i]);
            Object raw = i + 1 < pairs.length ? pairs[i + 1] : null;
            if ("args".equals(key) && raw instanceof List<?> args) {
                // element-wise, so one odd argument does not hide the others
                List<Object> copies = new ArrayList<>(args.size());
                for (Object arg : args) copies.add(SnapshotCopier.copy(arg, objects));
                payload.put(key, copies);
            } else {
                payload.put(key, SnapshotCopier.copy(raw, objects));
            }
            if (raw != null && ("object".equals(key) || "container".equals(key))) {
                payload.put("objectId", objects.idOf(raw));
            }
        }
        return payload;
    }

    private Map<String, Object> snapshotGlobals(Object self) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (self != null) {
            for (Field field : ValueRenderer.instanceFields(self.getClass())) {
                readField(field, self, out);
            }
        }
        Class<?> caller = STACK_WALKER.walk(frames -> frames
            .map(StackWalker.StackFrame::getDeclaringClass)
            .filter(c -> !OWN_FRAMES.contains(c))
            .findFirst()
            .orElse(null));
        for (Class<?> c = caller; c != null; c = c.getEnclosingClass()) {
            for (Field field : c.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) && !field.isSynthetic()) {
                    readField(field, null, out);
                }
            }
        }
        return out;
    }

    private void readField(Field field, Object target, Map<String, Object> out) {
        String name = field.getName();
        if (isInjectedName(name) || out.containsKey(name)) return;
        Object value;
        try {
            field.setAccessible(true);
            value = field.get(target);
        } catch (IllegalAccessException | RuntimeException e) {
            // fields of modules that are not open to us are left out
            return;
        }
        out.put(name, SnapshotCopier.copy(value, objects));
    }

    // -----------------------------------------------------------------------
    // Session control
    // -----------------------------------------------------------------------

    /** Empties the log, the object registry and resets the id counter to zero. */
    public void clear() {
        lock.lock();
        try {
            events.clear();
            lastId = 0;
            objects.clear();
        } finally {
            lock.unlock();
        }
    }

    public void enable() {
        enabled = true;
    }

    public void disable() {
        enabled = false;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public RecorderConfig config() {
        return config;
    }

    /** Display id of {@code obj} in this session's identity registry. */
    public long objectId(Object obj) {
        return objects.idOf(obj);
    }

    // -----------------------------------------------------------------------
    // Queries
    // -----------------------------------------------------------------------

    /** Snapshot of the log in id order. */
    public List<TraceEvent> events() {
        lock.lock();
        try {
            return List.copyOf(events);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    /** Id of the most recently allocated event, 0 if none. */
    public long lastEventId() {
        lock.lock();
        try {
            return lastId;
        } finally {
            lock.unlock();
        }
    }

    public List<TraceEvent> eventsAt(String file, int line) {
        return events().stream()
            .filter(e -> e.isAt(file, line))
            .collect(Collectors.toList());
    }

    /** Assignment-family events whose target or attribute is {@code name}. */
    public List<TraceEvent> assignmentsTo(String name) {
        return events().stream()
            .filter(e -> e.kind().isAssignment())
            .filter(e -> name.equals(e.targetName()) || name.equals(e.attribute()))
            .collect(Collectors.toList());
    }

    /** Function-entry and call events, for one function or for all when {@code name} is null. */
    public List<TraceEvent> functionCalls(String name) {
        return events().stream()
            .filter(e -> e.kind() == EventKind.FUNCTION_ENTRY || e.kind() == EventKind.CALL)
            .filter(e -> name == null || name.equals(e.functionName()))
            .collect(Collectors.toList());
    }

    /** Events whose line lies in {@code [startLine, endLine]}, optionally for one file. */
    public List<TraceEvent> eventsInRange(int startLine, int endLine, String file) {
        return events().stream()
            .filter(e -> e.sourceLine() >= startLine && e.sourceLine() <= endLine)
            .filter(e -> file == null || file.equals(e.sourceFile()))
            .collect(Collectors.toList());
    }

    public TraceStats stats() {
        return TraceStats.of(events());
    }

    // -----------------------------------------------------------------------
    // Persistence
    // -----------------------------------------------------------------------

    public byte[] toBytes() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(new ArrayList<>(events()));
        } catch (IOException e) {
            throw new TracePersistenceException("Failed to serialize trace: " + e.getMessage(), e);
        }
        return bytes.toByteArray();
    }

    public void save(Path path) {
        try {
            if (path.getParent() != null) Files.createDirectories(path.getParent());
            Files.write(path, toBytes());
        } catch (IOException e) {
            throw new TracePersistenceException("Failed to write trace: " + path, e);
        }
        System.err.println("[whyline-recorder] trace saved: " + path + " (" + size() + " events)");
    }

    public void load(Path path) {
        load(path, Thread.currentThread().getContextClassLoader());
    }

    public void load(Path path, ClassLoader loader) {
        if (!Files.exists(path)) {
            throw new TracePersistenceException("Trace file not found: " + path);
        }
        try {
            fromBytes(Files.readAllBytes(path), loader);
        } catch (IOException e) {
            throw new TracePersistenceException("Failed to read trace: " + path, e);
        }
    }

    public void fromBytes(byte[] data) {
        fromBytes(data, Thread.currentThread().getContextClassLoader());
    }

    /** Replaces the log with a serialized one. New ids continue after the highest loaded id. */
    public void fromBytes(byte[] data, ClassLoader loader) {
        List<TraceEvent> loaded = readEvents(data, loader);
        lock.lock();
        try {
            events.clear();
            events.addAll(loaded);
            lastId = loaded.isEmpty() ? 0 : loaded.get(loaded.size() - 1).id();
        } finally {
            lock.unlock();
        }
    }

    public static List<TraceEvent> readEvents(byte[] data, ClassLoader loader) {
        try (ObjectInputStream in = new LoaderAwareObjectInputStream(new ByteArrayInputStream(data), loader)) {
            Object obj = in.readObject();
            if (!(obj instanceof List<?> list)) {
                throw new TracePersistenceException("Not a trace: found " + (obj == null ? "null" : obj.getClass().getName()));
            }
            List<TraceEvent> result = new ArrayList<>(list.size());
            for (Object item : list) {
                if (!(item instanceof TraceEvent event)) {
                    throw new TracePersistenceException("Not a trace event: " + item);
                }
                result.add(event);
            }
            return result;
        } catch (IOException | ClassNotFoundException e) {
            throw new TracePersistenceException("Failed to deserialize trace: " + e.getMessage(), e);
        }
    }

    public static class TracePersistenceException extends RuntimeException {
        public TracePersistenceException(String message) { super(message); }
        public TracePersistenceException(String message, Throwable cause) { super(message, cause); }
    }
}

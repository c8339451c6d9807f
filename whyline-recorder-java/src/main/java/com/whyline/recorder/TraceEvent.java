package com.whyline.recorder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One recorded occurrence of an instrumentation point firing.
 *
 * @param id              log-wide, strictly increasing id assigned by the recorder
 * @param probeId         static number of the instrumentation point that fired
 * @param sourceFile      file name given to the rewriter
 * @param sourceLine      line of the instrumented construct in the original source
 * @param kind            event kind; determines the payload shape
 * @param payload         kind-specific fields, in the order the instrumented code passed them
 * @param timestamp       capture time
 * @param executingThread name of the thread that emitted the event
 * @param localSnapshot   copies of the parameters and locals visible at the point
 * @param globalSnapshot  copies of the static fields of the executing class and the
 *                        instance fields of the receiver
 *
 * Equality compares recorded values by content, arrays and lists of arrays included,
 * so an event equals its copy restored from a saved trace.
 */
public record TraceEvent(
        long id,
        int probeId,
        String sourceFile,
        int sourceLine,
        EventKind kind,
        Map<String, Object> payload,
        Instant timestamp,
        String executingThread,
        Map<String, Object> localSnapshot,
        Map<String, Object> globalSnapshot
) implements Serializable {

    public TraceEvent {
        payload = frozen(payload);
        localSnapshot = frozen(localSnapshot);
        globalSnapshot = frozen(globalSnapshot);
    }

    public Object payloadValue(String key) {
        return payload.get(key);
    }

    public boolean hasPayload(String key) {
        return payload.containsKey(key);
    }

    public String targetName() {
        return stringPayload("targetName");
    }

    public Object value() {
        return payload.get("value");
    }

    public String functionName() {
        return stringPayload("function");
    }

    public String condition() {
        return stringPayload("condition");
    }

    public String decision() {
        return stringPayload("decision");
    }

    public String attribute() {
        return stringPayload("attribute");
    }

    @SuppressWarnings("unchecked")
    public List<String> dependsOn() {
        Object deps = payload.get("dependsOn");
        return deps instanceof List<?> list ? (List<String>) list : List.of();
    }

    public boolean snapshotContains(String name) {
        return localSnapshot.containsKey(name) || globalSnapshot.containsKey(name);
    }

    /** Looks a name up in the locals first, then in the globals. */
    public Object snapshotValue(String name) {
        if (localSnapshot.containsKey(name)) return localSnapshot.get(name);
        return globalSnapshot.get(name);
    }

    public boolean isAt(String file, int line) {
        return sourceLine == line && sourceFile != null && sourceFile.equals(file);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceEvent other)) return false;
        return id == other.id
            && probeId == other.probeId
            && sourceLine == other.sourceLine
            && kind == other.kind
            && Objects.equals(sourceFile, other.sourceFile)
            && Objects.equals(timestamp, other.timestamp)
            && Objects.equals(executingThread, other.executingThread)
            && sameValues(payload, other.payload)
            && sameValues(localSnapshot, other.localSnapshot)
            && sameValues(globalSnapshot, other.globalSnapshot);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, probeId, sourceFile, sourceLine, kind, timestamp, executingThread,
            valuesHash(payload), valuesHash(localSnapshot), valuesHash(globalSnapshot));
    }

    private static boolean sameValues(Map<String, Object> a, Map<String, Object> b) {
        if (!a.keySet().equals(b.keySet())) return false;
        for (Map.Entry<String, Object> entry : a.entrySet()) {
            if (!sameValue(entry.getValue(), b.get(entry.getKey()))) return false;
        }
        return true;
    }

    private static boolean sameValue(Object a, Object b) {
        if (a instanceof List<?> left && b instanceof List<?> right) {
            if (left.size() != right.size()) return false;
            for (int i = 0; i < left.size(); i++) {
                if (!sameValue(left.get(i), right.get(i))) return false;
            }
            return true;
        }
        return Objects.deepEquals(a, b);
    }

    private static int valuesHash(Map<String, Object> values) {
        int hash = 0;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            hash += entry.getKey().hashCode() ^ valueHash(entry.getValue());
        }
        return hash;
    }

    private static int valueHash(Object value) {
        if (value instanceof List<?> list) {
            int hash = 1;
            for (Object element : list) hash = 31 * hash + valueHash(element);
            return hash;
        }
        return Arrays.deepHashCode(new Object[] {value});
    }

    private String stringPayload(String key) {
        Object v = payload.get(key);
        return v == null ? null : String.valueOf(v);
    }

    private static Map<String, Object> frozen(Map<String, Object> map) {
        if (map == null || map.isEmpty()) return Collections.emptyMap();
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}

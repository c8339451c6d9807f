package com.whyline.recorder;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Aggregate counts over a trace.
 *
 * @param timeSpan elapsed time between the first and the last event; zero for fewer than two events
 */
public record TraceStats(
    int totalEvents,
    Set<String> filesTraced,
    Map<EventKind, Long> eventsByKind,
    Duration timeSpan
) {

    public static TraceStats of(List<TraceEvent> events) {
        Set<String> files = new TreeSet<>();
        Map<EventKind, Long> byKind = new EnumMap<>(EventKind.class);
        for (TraceEvent e : events) {
            if (e.sourceFile() != null) files.add(e.sourceFile());
            byKind.merge(e.kind(), 1L, Long::sum);
        }
        Duration span = events.size() < 2
            ? Duration.ZERO
            : Duration.between(events.get(0).timestamp(), events.get(events.size() - 1).timestamp());
        return new TraceStats(
            events.size(),
            Collections.unmodifiableSet(files),
            Collections.unmodifiableMap(byKind),
            span);
    }

    public long count(EventKind kind) {
        return eventsByKind.getOrDefault(kind, 0L);
    }

    public int fileCount() {
        return filesTraced.size();
    }
}

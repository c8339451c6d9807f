package com.whyline.engine.question;

import com.whyline.recorder.EventKind;
import com.whyline.recorder.TraceEvent;
import com.whyline.recorder.TraceRecorder;

import java.util.List;

/**
 * Why did {@code property} get {@code value}? Matches assignments to the property, by
 * payload or by the locals snapshot, and traces the value back through earlier
 * assignments, calls and returns that carried an equal value.
 */
public class WhyDidPropertyGetAssigned extends Question {

    private final String property;
    private final Object value;

    public WhyDidPropertyGetAssigned(TraceRecorder recorder, String property, Object value) {
        super(recorder, property, "Why did property '" + property + "' get assigned " + value);
        this.property = property;
        this.value = value;
    }

    @Override
    protected ValueSourceAnswer analyze() {
        List<TraceEvent> assignments = select(this::assignsProperty);
        TraceEvent primary = last(assignments);
        if (primary == null) {
            return new ValueSourceAnswer(this,
                "No assignment found for property '" + property + "' with value " + value,
                List.of(), null, List.of());
        }

        List<TraceEvent> provenance = select(e -> e.id() < primary.id()
            && (e.kind() == EventKind.ASSIGN || e.kind() == EventKind.CALL || e.kind() == EventKind.RETURN)
            && !assignments.contains(e)
            && (ValueMatcher.containsMatch(e.payload(), value) || ValueMatcher.containsMatch(e.localSnapshot(), value)));

        String explanation = "Property '" + property + "' got value " + value + " from assignment at " + location(primary);
        if (!provenance.isEmpty()) {
            explanation += " via " + provenance.size() + " data dependencies";
        }
        List<TraceEvent> evidence = concat(assignments, provenance);
        return new ValueSourceAnswer(this, explanation, evidence, primary, evidence);
    }

    private boolean assignsProperty(TraceEvent event) {
        if (event.kind() != EventKind.ASSIGN && event.kind() != EventKind.ATTRIBUTE_ASSIGN) return false;
        boolean named = property.equals(event.targetName()) || property.equals(event.attribute());
        if (named && ValueMatcher.matches(event.value(), value)) return true;
        return event.localSnapshot().containsKey(property)
            && ValueMatcher.matches(event.localSnapshot().get(property), value);
    }
}

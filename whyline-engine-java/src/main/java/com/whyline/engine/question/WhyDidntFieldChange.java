package com.whyline.engine.question;

import com.whyline.recorder.EventKind;
import com.whyline.recorder.TraceEvent;
import com.whyline.recorder.TraceRecorder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Why didn't {@code field} change after {@code after}? Reports reassignments when there
 * were some. Otherwise reports the control-flow decisions taken after that time, and the
 * events whose snapshot shows the field as sites that could have assigned it.
 */
public class WhyDidntFieldChange extends Question {

    private final String field;
    private final Instant after;

    public WhyDidntFieldChange(TraceRecorder recorder, String field, Instant after) {
        super(recorder, field, "Why didn't field '" + field + "' change after " + after);
        this.field = field;
        this.after = after;
    }

    @Override
    protected ExecutionAnswer analyze() {
        List<TraceEvent> reassignments = new ArrayList<>();
        List<TraceEvent> potentialSites = new ArrayList<>();
        List<TraceEvent> blocking = new ArrayList<>();
        for (TraceEvent event : events()) {
            if (!event.timestamp().isAfter(after)) continue;
            if (isReassignment(event)) {
                reassignments.add(event);
            } else if (event.snapshotContains(field)) {
                potentialSites.add(event);
            }
            if (event.kind().isCondition()) {
                blocking.add(event);
            }
        }

        if (!reassignments.isEmpty()) {
            String explanation = "Field '" + field + "' actually did change " + reassignments.size()
                + " times after " + after;
            return new ExecutionAnswer(this, explanation, reassignments, last(reassignments),
                reassignments, List.of());
        }

        String explanation = "Field '" + field + "' didn't change after " + after;
        if (!blocking.isEmpty()) {
            explanation += " due to " + blocking.size() + " control flow decisions";
        } else if (!potentialSites.isEmpty()) {
            explanation += ", though " + potentialSites.size() + " potential assignment sites were reached";
        }
        return new ExecutionAnswer(this, explanation, concat(blocking, potentialSites), null, List.of(), blocking);
    }

    private boolean isReassignment(TraceEvent event) {
        EventKind kind = event.kind();
        if (kind != EventKind.ASSIGN && kind != EventKind.ATTRIBUTE_ASSIGN && kind != EventKind.AUGMENTED_ASSIGN) {
            return false;
        }
        return field.equals(event.targetName()) || field.equals(event.attribute());
    }
}

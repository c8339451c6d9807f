package com.whyline.engine.question;

import com.whyline.recorder.TraceEvent;

import java.util.List;

/** Answer naming the events a value came from. */
public class ValueSourceAnswer extends Answer {

    private final List<TraceEvent> sourceEvents;

    public ValueSourceAnswer(Question question, String explanation, List<TraceEvent> evidence,
                             TraceEvent primaryEvent, List<TraceEvent> sourceEvents) {
        super(question, explanation, evidence, primaryEvent);
        this.sourceEvents = List.copyOf(sourceEvents);
    }

    public List<TraceEvent> getSourceEvents() { return sourceEvents; }
}

package com.whyline.engine.question;

import com.whyline.recorder.TraceEvent;

import java.util.List;
import java.util.Optional;

/**
 * An explanation with the trace events that support it. Evidence is in log order unless
 * a question documents otherwise.
 */
public class Answer {

    private final Question question;
    private final String explanation;
    private final List<TraceEvent> evidence;
    private final TraceEvent primaryEvent;

    public Answer(Question question, String explanation, List<TraceEvent> evidence, TraceEvent primaryEvent) {
        this.question = question;
        this.explanation = explanation;
        this.evidence = List.copyOf(evidence);
        this.primaryEvent = primaryEvent;
    }

    public Question getQuestion() { return question; }
    public String getExplanation() { return explanation; }
    public List<TraceEvent> getEvidence() { return evidence; }

    /** The event that best explains the subject: the most recent match. */
    public Optional<TraceEvent> getPrimaryEvent() {
        return Optional.ofNullable(primaryEvent);
    }

    /** Whether the trace held the fact asked about. A miss is still a valid answer. */
    public boolean isFound() {
        return primaryEvent != null;
    }

    @Override
    public String toString() {
        return explanation;
    }
}

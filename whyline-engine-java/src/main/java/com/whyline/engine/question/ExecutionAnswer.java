package com.whyline.engine.question;

import com.whyline.recorder.TraceEvent;

import java.util.List;

/**
 * Answer about whether code ran: the executions found plus the events taken as their
 * causes. Causes are a coarse over-approximation, typically every earlier branch.
 */
public class ExecutionAnswer extends Answer {

    private final List<TraceEvent> executionEvents;
    private final List<TraceEvent> dependencies;

    public ExecutionAnswer(Question question, String explanation, List<TraceEvent> evidence,
                           TraceEvent primaryEvent, List<TraceEvent> executionEvents,
                           List<TraceEvent> dependencies) {
        super(question, explanation, evidence, primaryEvent);
        this.executionEvents = List.copyOf(executionEvents);
        this.dependencies = List.copyOf(dependencies);
    }

    public List<TraceEvent> getExecutionEvents() { return executionEvents; }
    public List<TraceEvent> getDependencies() { return dependencies; }
}

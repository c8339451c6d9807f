package com.whyline.engine.question;

import com.whyline.recorder.EventKind;
import com.whyline.recorder.TraceEvent;
import com.whyline.recorder.TraceRecorder;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * A why or why-not question about one recorded execution.
 *
 * The answer is computed by {@link #analyze()} on the first {@link #getAnswer()} call and
 * the same instance is returned afterwards. Analyses are linear scans of the log in id
 * order; questions are meant to be asked once recording has stopped.
 */
public abstract class Question {

    private final TraceRecorder recorder;
    private final String subject;
    private final String description;
    private Answer answer;

    protected Question(TraceRecorder recorder, String subject, String description) {
        this.recorder = recorder;
        this.subject = subject;
        this.description = description;
    }

    public String getSubject() { return subject; }
    public String getDescription() { return description; }

    public synchronized Answer getAnswer() {
        if (answer == null) {
            answer = analyze();
        }
        return answer;
    }

    protected abstract Answer analyze();

    protected List<TraceEvent> events() {
        return recorder.events();
    }

    protected List<TraceEvent> select(Predicate<TraceEvent> filter) {
        List<TraceEvent> out = new ArrayList<>();
        for (TraceEvent event : events()) {
            if (filter.test(event)) out.add(event);
        }
        return out;
    }

    /** Branch events recorded before {@code event} in its file. */
    protected List<TraceEvent> branchesBefore(TraceEvent event) {
        return select(e -> e.kind() == EventKind.BRANCH
            && e.id() < event.id()
            && e.sourceFile().equals(event.sourceFile()));
    }

    protected static String location(TraceEvent event) {
        return event.sourceFile() + ":" + event.sourceLine();
    }

    protected static TraceEvent last(List<TraceEvent> events) {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    protected static List<TraceEvent> concat(List<TraceEvent> first, List<TraceEvent> second) {
        List<TraceEvent> out = new ArrayList<>(first);
        out.addAll(second);
        return out;
    }

    @Override
    public String toString() {
        return description + "?";
    }
}

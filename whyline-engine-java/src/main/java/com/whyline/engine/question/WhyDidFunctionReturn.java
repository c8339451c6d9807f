package com.whyline.engine.question;

import com.whyline.recorder.TraceEvent;
import com.whyline.recorder.TraceRecorder;
import com.whyline.recorder.EventKind;

import java.util.List;

/**
 * Why did {@code function} return {@code value}? Takes the most recent matching return
 * and collects, as data dependencies, earlier assignments in the same file whose locals
 * held an equal value. This is an equality join, not a data-flow slice.
 */
public class WhyDidFunctionReturn extends Question {

    private final String function;
    private final Object value;

    public WhyDidFunctionReturn(TraceRecorder recorder, String function, Object value) {
        super(recorder, function, "Why did function '" + function + "' return " + value);
        this.function = function;
        this.value = value;
    }

    @Override
    protected ValueSourceAnswer analyze() {
        List<TraceEvent> returns = select(e -> e.kind() == EventKind.RETURN
            && function.equals(e.functionName())
            && ValueMatcher.matches(e.value(), value));
        TraceEvent primary = last(returns);
        if (primary == null) {
            return new ValueSourceAnswer(this,
                "No return found for function '" + function + "' with value " + value,
                List.of(), null, List.of());
        }

        List<TraceEvent> dependencies = select(e -> e.id() < primary.id()
            && e.kind().isAssignment()
            && e.sourceFile().equals(primary.sourceFile())
            && ValueMatcher.containsMatch(e.localSnapshot(), value));

        String explanation = "Function '" + function + "' returned " + value + " at " + location(primary);
        if (!dependencies.isEmpty()) {
            explanation += " due to " + dependencies.size() + " data dependencies";
        }
        List<TraceEvent> evidence = concat(List.of(primary), dependencies);
        return new ValueSourceAnswer(this, explanation, evidence, primary, evidence);
    }
}

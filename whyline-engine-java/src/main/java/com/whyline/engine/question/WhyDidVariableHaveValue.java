package com.whyline.engine.question;

import com.whyline.recorder.EventKind;
import com.whyline.recorder.TraceEvent;
import com.whyline.recorder.TraceRecorder;

import java.util.List;

/**
 * Why did {@code variable} hold {@code value}? Finds the assignments that stored it,
 * optionally restricted to one file and to lines up to {@code lineLimit}.
 */
public class WhyDidVariableHaveValue extends Question {

    private final String variable;
    private final Object value;
    private final String file;
    private final Integer lineLimit;

    public WhyDidVariableHaveValue(TraceRecorder recorder, String variable, Object value,
                                   String file, Integer lineLimit) {
        super(recorder, variable, "Why did variable '" + variable + "' have value " + value);
        this.variable = variable;
        this.value = value;
        this.file = file;
        this.lineLimit = lineLimit;
    }

    @Override
    protected ValueSourceAnswer analyze() {
        List<TraceEvent> assignments = select(e ->
            (e.kind() == EventKind.ASSIGN || e.kind() == EventKind.AUGMENTED_ASSIGN)
                && variable.equals(e.targetName())
                && (file == null || file.equals(e.sourceFile()))
                && (lineLimit == null || e.sourceLine() <= lineLimit)
                && holdsValue(e));

        TraceEvent primary = last(assignments);
        String explanation = primary == null
            ? "No assignment found for variable '" + variable + "' with value " + value
            : "Variable '" + variable + "' got value " + value + " from assignment at " + location(primary);
        return new ValueSourceAnswer(this, explanation, assignments, primary, assignments);
    }

    private boolean holdsValue(TraceEvent event) {
        if (ValueMatcher.matches(event.value(), value)) return true;
        return event.localSnapshot().containsKey(variable)
            && ValueMatcher.matches(event.localSnapshot().get(variable), value);
    }
}

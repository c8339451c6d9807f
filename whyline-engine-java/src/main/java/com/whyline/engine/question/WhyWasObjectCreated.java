package com.whyline.engine.question;

import com.whyline.recorder.EventKind;
import com.whyline.recorder.TraceEvent;
import com.whyline.recorder.TraceRecorder;
import com.whyline.recorder.ValuePlaceholder;

import java.util.List;

/**
 * Why was an object of {@code typeName} created? Matches assignments that stored, or saw
 * among their locals, a value of that type (simple or qualified name).
 */
public class WhyWasObjectCreated extends Question {

    private final String typeName;

    public WhyWasObjectCreated(TraceRecorder recorder, String typeName) {
        super(recorder, typeName, "Why was an object of type '" + typeName + "' created");
        this.typeName = typeName;
    }

    @Override
    protected ExecutionAnswer analyze() {
        List<TraceEvent> creations = select(e -> e.kind() == EventKind.ASSIGN
            && (isOfType(e.value()) || e.localSnapshot().values().stream().anyMatch(this::isOfType)));
        TraceEvent primary = last(creations);
        if (primary == null) {
            return new ExecutionAnswer(this, "No creation found for objects of type '" + typeName + "'",
                List.of(), null, List.of(), List.of());
        }

        List<TraceEvent> causes = branchesBefore(primary);
        String explanation = "Object of type '" + typeName + "' was created " + creations.size() + " times";
        if (!causes.isEmpty()) {
            explanation += " due to " + causes.size() + " control flow decisions";
        }
        return new ExecutionAnswer(this, explanation, concat(creations, causes), primary, creations, causes);
    }

    private boolean isOfType(Object value) {
        if (value == null) return false;
        if (value instanceof ValuePlaceholder placeholder) return placeholder.isOfType(typeName);
        Class<?> type = value.getClass();
        return typeName.equals(type.getSimpleName()) || typeName.equals(type.getName());
    }
}

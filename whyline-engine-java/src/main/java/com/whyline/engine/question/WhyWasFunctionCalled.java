package com.whyline.engine.question;

import com.whyline.recorder.EventKind;
import com.whyline.recorder.TraceEvent;
import com.whyline.recorder.TraceRecorder;

import java.util.List;

/**
 * Why was {@code function} called? Counts its entries and offers the branches before the
 * most recent one as control-flow causes. Bytecode {@code call} events are used only when
 * the trace has no source-level entries for the function.
 */
public class WhyWasFunctionCalled extends Question {

    private final String function;

    public WhyWasFunctionCalled(TraceRecorder recorder, String function) {
        super(recorder, function, "Why was function '" + function + "' called");
        this.function = function;
    }

    @Override
    protected ExecutionAnswer analyze() {
        List<TraceEvent> calls = entries(EventKind.FUNCTION_ENTRY);
        if (calls.isEmpty()) {
            calls = entries(EventKind.CALL);
        }
        TraceEvent primary = last(calls);
        if (primary == null) {
            return new ExecutionAnswer(this, "Function '" + function + "' was never called",
                List.of(), null, List.of(), List.of());
        }

        List<TraceEvent> causes = branchesBefore(primary);
        String explanation = "Function '" + function + "' was called " + calls.size() + " times";
        if (!causes.isEmpty()) {
            explanation += " due to " + causes.size() + " control flow decisions";
        }
        return new ExecutionAnswer(this, explanation, concat(calls, causes), primary, calls, causes);
    }

    private List<TraceEvent> entries(EventKind kind) {
        return select(e -> e.kind() == kind && function.equals(e.functionName()));
    }
}

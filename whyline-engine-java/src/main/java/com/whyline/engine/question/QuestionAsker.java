package com.whyline.engine.question;

import com.whyline.recorder.TraceRecorder;

import java.time.Instant;

/** Creates questions bound to one recorder's trace. */
public class QuestionAsker {

    private final TraceRecorder recorder;

    public QuestionAsker(TraceRecorder recorder) {
        this.recorder = recorder;
    }

    public WhyDidVariableHaveValue whyDidVariableHaveValue(String variable, Object value) {
        return new WhyDidVariableHaveValue(recorder, variable, value, null, null);
    }

    public WhyDidVariableHaveValue whyDidVariableHaveValue(String variable, Object value, String file, Integer lineLimit) {
        return new WhyDidVariableHaveValue(recorder, variable, value, file, lineLimit);
    }

    public WhyDidLineExecute whyDidLineExecute(String file, int line) {
        return new WhyDidLineExecute(recorder, file, line);
    }

    public WhyDidntLineExecute whyDidntLineExecute(String file, int line) {
        return new WhyDidntLineExecute(recorder, file, line);
    }

    public WhyDidFunctionReturn whyDidFunctionReturn(String function, Object value) {
        return new WhyDidFunctionReturn(recorder, function, value);
    }

    public WhyWasFunctionCalled whyWasFunctionCalled(String function) {
        return new WhyWasFunctionCalled(recorder, function);
    }

    public WhyDidntFieldChange whyDidntFieldChange(String field, Instant after) {
        return new WhyDidntFieldChange(recorder, field, after);
    }

    public WhyWasObjectCreated whyWasObjectCreated(String typeName) {
        return new WhyWasObjectCreated(recorder, typeName);
    }

    public WhyDidPropertyGetAssigned whyDidPropertyGetAssigned(String property, Object value) {
        return new WhyDidPropertyGetAssigned(recorder, property, value);
    }
}

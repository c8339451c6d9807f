package com.whyline.engine.question;

import com.whyline.recorder.TraceEvent;
import com.whyline.recorder.TraceRecorder;

import java.util.List;

/** Why did {@code file:line} execute? Every earlier branch in the file is a candidate cause. */
public class WhyDidLineExecute extends Question {

    private final String file;
    private final int line;

    public WhyDidLineExecute(TraceRecorder recorder, String file, int line) {
        super(recorder, file + ":" + line, "Why did line " + file + ":" + line + " execute");
        this.file = file;
        this.line = line;
    }

    @Override
    protected ExecutionAnswer analyze() {
        List<TraceEvent> executions = select(e -> e.isAt(file, line));
        TraceEvent primary = last(executions);
        List<TraceEvent> causes = primary == null ? List.of() : branchesBefore(primary);

        String explanation = "Line " + file + ":" + line + " executed " + executions.size() + " times";
        if (!causes.isEmpty()) {
            explanation += " after " + causes.size() + " control flow decisions";
        }
        return new ExecutionAnswer(this, explanation, concat(executions, causes), primary, executions, causes);
    }
}

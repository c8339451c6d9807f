package com.whyline.engine.question;

import com.whyline.recorder.EventKind;
import com.whyline.recorder.TraceEvent;
import com.whyline.recorder.TraceRecorder;

import java.util.List;

/**
 * Why didn't {@code file:line} execute? If it did after all, says how often. Otherwise
 * offers the branches recorded at smaller line numbers of the file as the decisions that
 * may have steered control away.
 */
public class WhyDidntLineExecute extends Question {

    private final String file;
    private final int line;

    public WhyDidntLineExecute(TraceRecorder recorder, String file, int line) {
        super(recorder, file + ":" + line, "Why didn't line " + file + ":" + line + " execute");
        this.file = file;
        this.line = line;
    }

    @Override
    protected ExecutionAnswer analyze() {
        List<TraceEvent> executions = select(e -> e.isAt(file, line));
        String explanation = "Line " + file + ":" + line + " executed " + executions.size() + " times";

        if (!executions.isEmpty()) {
            TraceEvent primary = last(executions);
            List<TraceEvent> causes = branchesBefore(primary);
            return new ExecutionAnswer(this, explanation, concat(executions, causes), primary, executions, causes);
        }

        List<TraceEvent> blocking = select(e -> e.kind() == EventKind.BRANCH
            && file.equals(e.sourceFile())
            && e.sourceLine() < line);
        if (!blocking.isEmpty()) {
            explanation += "; " + blocking.size() + " earlier control flow decisions may have prevented it";
        }
        return new ExecutionAnswer(this, explanation, blocking, null, List.of(), blocking);
    }
}

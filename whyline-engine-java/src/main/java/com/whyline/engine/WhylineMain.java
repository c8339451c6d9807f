package com.whyline.engine;

import com.whyline.engine.config.EngineConfig;
import com.whyline.engine.config.EngineConfigReader;
import com.whyline.engine.instrument.SourceInstrumenter;
import com.whyline.engine.instrument.SourceInstrumenter.InstrumentationFinalizeException;
import com.whyline.engine.question.Answer;
import com.whyline.engine.question.Question;
import com.whyline.engine.question.QuestionAsker;
import com.whyline.engine.run.InstrumentedRunner;
import com.whyline.engine.run.InstrumentedRunner.ProgramFailedException;
import com.whyline.recorder.EventKind;
import com.whyline.recorder.RenderLimits;
import com.whyline.recorder.TraceEvent;
import com.whyline.recorder.TraceJsonExporter;
import com.whyline.recorder.TraceRecorder;
import com.whyline.recorder.TraceStats;
import com.whyline.recorder.ValueRenderer;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;

/**
 * Command-line entry point.
 *
 * Usage:
 *   whyline instrument --source Calc.java [--output Calc.instrumented.java]
 *   whyline run        --source Calc.java [--config whyline.json] [--trace calc.trace] [--json calc.json]
 *   whyline stats      --trace calc.trace
 *   whyline why        --trace calc.trace variable result 120
 *
 * Questions for {@code why}: {@code variable NAME VALUE}, {@code line FILE LINE},
 * {@code not-line FILE LINE}, {@code returned FUNCTION VALUE}, {@code called FUNCTION},
 * {@code unchanged FIELD [AFTER_EVENT_ID]}, {@code created TYPE}, {@code property NAME VALUE}.
 */
public class WhylineMain {

    private static final String USAGE = "Usage: whyline instrument|run|stats|why --source <file> | --trace <file> ...";

    public static void main(String[] args) {
        try {
            run(args, System.out);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[whyline-engine] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[whyline-engine] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args, PrintStream out) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        String command = args[0];
        String source = null;
        String output = null;
        String configPath = null;
        String tracePath = null;
        String jsonPath = null;
        int i = 1;
        for (; i < args.length && args[i].startsWith("--"); i++) {
            switch (args[i]) {
                case "--source" -> source     = requireNext(args, i++, "--source");
                case "--output" -> output     = requireNext(args, i++, "--output");
                case "--config" -> configPath = requireNext(args, i++, "--config");
                case "--trace"  -> tracePath  = requireNext(args, i++, "--trace");
                case "--json"   -> jsonPath   = requireNext(args, i++, "--json");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        String[] rest = Arrays.copyOfRange(args, i, args.length);

        switch (command) {
            case "instrument" -> {
                if (source == null) throw new UsageException("--source is required");
                instrument(Paths.get(source), output, out);
            }
            case "run" -> {
                if (source == null) throw new UsageException("--source is required");
                EngineConfig config = configPath == null ? new EngineConfig() : new EngineConfigReader().read(Paths.get(configPath));
                runProgram(Paths.get(source), config,
                    tracePath != null ? tracePath : config.getTraceOutput(),
                    jsonPath != null ? jsonPath : config.getJsonOutput(), out);
            }
            case "stats" -> {
                if (tracePath == null) throw new UsageException("--trace is required");
                printStats(loadTrace(tracePath).stats(), out);
            }
            case "why" -> {
                if (tracePath == null) throw new UsageException("--trace is required");
                TraceRecorder trace = loadTrace(tracePath);
                printAnswer(ask(new QuestionAsker(trace), trace, rest), out);
            }
            default -> throw new UsageException("Unknown subcommand: " + command);
        }
    }

    private static void instrument(Path source, String output, PrintStream out) {
        String text = new SourceInstrumenter().instrumentSource(readSource(source), source.getFileName().toString());
        if (output == null) {
            out.print(text);
            return;
        }
        try {
            Files.writeString(Paths.get(output), text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + output, e);
        }
        System.err.println("[whyline-engine] instrumented source written to " + output);
    }

    private static void runProgram(Path source, EngineConfig config, String tracePath, String jsonPath, PrintStream out) {
        TraceRecorder recorder = new TraceRecorder(config.recorderConfig());
        InstrumentedRunner runner = new InstrumentedRunner(recorder, config.isCallTracing(),
            config.getClasspath(), config.getProgramArgs());
        String fileName = source.getFileName().toString();
        String text = readSource(source);

        Map<String, Object> bindings;
        ProgramFailedException failure = null;
        try {
            try {
                bindings = runner.instrumentAndRun(text, fileName, Map.of());
            } catch (InstrumentationFinalizeException e) {
                if (!config.isFallbackToOriginal()) throw e;
                System.err.println("[whyline-engine] WARN: " + e.getMessage() + "; running the original program");
                bindings = runner.runOriginal(text, fileName, Map.of());
            }
        } catch (ProgramFailedException e) {
            System.err.println("[whyline-engine] ERROR: " + e.getMessage());
            failure = e;
            bindings = Map.of();
        }

        System.err.println("[whyline-engine] recorded " + recorder.size() + " events");
        if (tracePath != null) {
            recorder.save(Paths.get(tracePath));
            System.err.println("[whyline-engine] trace saved to " + tracePath);
        }
        if (jsonPath != null) {
            new TraceJsonExporter(config.recorderConfig().renderLimits()).write(recorder.events(), Paths.get(jsonPath));
        }
        if (failure != null) throw failure;

        RenderLimits limits = config.recorderConfig().renderLimits();
        bindings.forEach((name, value) -> out.println(name + " = " + ValueRenderer.render(value, limits)));
    }

    static Question ask(QuestionAsker asker, TraceRecorder trace, String[] question) {
        if (question.length == 0) throw new UsageException("No question given");
        String kind = question[0];
        return switch (kind) {
            case "variable" -> asker.whyDidVariableHaveValue(arg(question, 1), parseValue(arg(question, 2)));
            case "line"     -> asker.whyDidLineExecute(arg(question, 1), parseLine(arg(question, 2)));
            case "not-line" -> asker.whyDidntLineExecute(arg(question, 1), parseLine(arg(question, 2)));
            case "returned" -> asker.whyDidFunctionReturn(arg(question, 1), parseValue(arg(question, 2)));
            case "called"   -> asker.whyWasFunctionCalled(arg(question, 1));
            case "unchanged" -> asker.whyDidntFieldChange(arg(question, 1),
                question.length > 2 ? timestampOf(trace, parseLine(question[2])) : Instant.EPOCH);
            case "created"  -> asker.whyWasObjectCreated(arg(question, 1));
            case "property" -> asker.whyDidPropertyGetAssigned(arg(question, 1), parseValue(arg(question, 2)));
            default -> throw new UsageException("Unknown question: " + kind);
        };
    }

    /**
     * Reads a question value: {@code null}, booleans and numbers are typed, quoted or
     * other text stays a string.
     */
    static Object parseValue(String text) {
        if (text.equals("null")) return null;
        if (text.equals("true") || text.equals("false")) return Boolean.parseBoolean(text);
        if (text.length() >= 2 && (text.startsWith("\"") && text.endsWith("\"")
            || text.startsWith("'") && text.endsWith("'"))) {
            return text.substring(1, text.length() - 1);
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException notIntegral) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException notNumeric) {
                return text;
            }
        }
    }

    private static void printAnswer(Question question, PrintStream out) {
        Answer answer = question.getAnswer();
        out.println(question);
        out.println(answer.getExplanation());
        for (TraceEvent event : answer.getEvidence()) {
            out.println("  " + describe(event));
        }
    }

    private static void printStats(TraceStats stats, PrintStream out) {
        out.println("events: " + stats.totalEvents());
        out.println("files: " + String.join(", ", stats.filesTraced()));
        out.println("span: " + stats.timeSpan().toMillis() + " ms");
        for (EventKind kind : EventKind.values()) {
            long count = stats.count(kind);
            if (count > 0) out.println("  " + kind.wireName() + ": " + count);
        }
    }

    static String describe(TraceEvent event) {
        RenderLimits limits = RenderLimits.defaults();
        StringBuilder line = new StringBuilder()
            .append('#').append(event.id()).append(' ')
            .append(event.sourceFile()).append(':').append(event.sourceLine()).append(' ')
            .append(event.kind().wireName());
        event.payload().forEach((key, value) ->
            line.append(' ').append(key).append('=').append(ValueRenderer.render(value, limits)));
        return line.toString();
    }

    private static TraceRecorder loadTrace(String path) {
        TraceRecorder recorder = new TraceRecorder();
        recorder.load(Paths.get(path), WhylineMain.class.getClassLoader());
        return recorder;
    }

    private static Instant timestampOf(TraceRecorder trace, int eventId) {
        for (TraceEvent event : trace.events()) {
            if (event.id() == eventId) return event.timestamp();
        }
        throw new UsageException("No event with id " + eventId);
    }

    private static String readSource(Path source) {
        try {
            return Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source, e);
        }
    }

    private static String arg(String[] question, int index) {
        if (index >= question.length) {
            throw new UsageException("Question '" + question[0] + "' needs more arguments");
        }
        return question[index];
    }

    private static int parseLine(String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new UsageException("Not a number: " + text);
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}

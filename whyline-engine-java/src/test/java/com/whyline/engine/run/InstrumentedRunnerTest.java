package com.whyline.engine.run;

import com.whyline.engine.instrument.JdtSourceParser.SourceParseException;
import com.whyline.engine.run.InstrumentedRunner.ProgramFailedException;
import com.whyline.engine.run.InstrumentedRunner.SourceCompileException;
import com.whyline.recorder.EventKind;
import com.whyline.recorder.TraceEvent;
import com.whyline.recorder.TraceRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentedRunnerTest {

    private TraceRecorder recorder;
    private InstrumentedRunner runner;

    @BeforeEach
    void setUp() {
        recorder = new TraceRecorder();
        runner = new InstrumentedRunner(recorder);
    }

    private List<TraceEvent> events(EventKind kind) {
        List<TraceEvent> out = new ArrayList<>();
        for (TraceEvent e : recorder.events()) {
            if (e.kind() == kind) out.add(e);
        }
        return out;
    }

    // --- Assignments and functions ---

    @Test
    void scriptAssignmentsRecordValuesAndDependencies() {
        Map<String, Object> bindings = runner.instrumentAndRun("int x = 10;\nint y = 20;\nint z = x + y;\n", "sum.jsh");

        List<TraceEvent> assigns = events(EventKind.ASSIGN);
        assertEquals(3, assigns.size());
        assertEquals("x", assigns.get(0).targetName());
        assertEquals(10, assigns.get(0).value());
        assertEquals(1, assigns.get(0).sourceLine());
        TraceEvent z = assigns.get(2);
        assertEquals("z", z.targetName());
        assertEquals(30, z.value());
        assertEquals(3, z.sourceLine());
        assertEquals("sum.jsh", z.sourceFile());
        assertEquals(List.of("x", "y"), z.dependsOn());
        assertEquals(10, z.localSnapshot().get("x"));

        assertEquals(Map.of("x", 10, "y", 20, "z", 30), bindings);
    }

    @Test
    void functionEntryAndReturnCarryArgumentsAndResult() {
        runner.instrumentAndRun("""
            public class Calc {
                static int add(int a, int b) {
                    return a + b;
                }

                public static void main(String[] args) {
                    int out = add(5, 3);
                }
            }
            """, "Calc.java");

        TraceEvent entry = events(EventKind.FUNCTION_ENTRY).stream()
            .filter(e -> "add".equals(e.functionName())).findFirst().orElseThrow();
        assertEquals(List.of("a", "b"), entry.payloadValue("parameters"));
        assertEquals(List.of(5, 3), entry.payloadValue("args"));
        assertEquals(2, entry.sourceLine());

        List<TraceEvent> returns = events(EventKind.RETURN);
        assertEquals(1, returns.size());
        assertEquals("add", returns.get(0).functionName());
        assertEquals(8, returns.get(0).value());
        assertEquals(3, returns.get(0).sourceLine());

        TraceEvent out = events(EventKind.ASSIGN).get(0);
        assertEquals("out", out.targetName());
        assertEquals(8, out.value());
        assertTrue(returns.get(0).id() < out.id(), "Return is recorded before the caller's assignment");
    }

    @Test
    void returnedCallIsEvaluatedOnce() {
        Map<String, Object> bindings = runner.instrumentAndRun("""
            public class Once {
                static int calls;

                static int next() {
                    calls++;
                    return calls;
                }

                static int wrapped() {
                    return next();
                }

                public static void main(String[] args) {
                    int v = wrapped();
                }
            }
            """, "Once.java");

        assertEquals(1, bindings.get("calls"));
        TraceEvent wrapped = events(EventKind.RETURN).stream()
            .filter(e -> "wrapped".equals(e.functionName())).findFirst().orElseThrow();
        assertEquals(1, wrapped.value());
    }

    @Test
    void calledIndexIsNotEvaluatedAgainForTheRecord() {
        Map<String, Object> bindings = runner.instrumentAndRun("""
            public class Slots {
                static int calls;
                static int[] data = new int[4];
                static java.util.List<Integer> items = new java.util.ArrayList<>(java.util.List.of(0, 0, 0, 0));

                static int next() {
                    calls++;
                    return calls;
                }

                public static void main(String[] args) {
                    data[next()] = 7;
                    items.set(next(), 5);
                }
            }
            """, "Slots.java");

        assertEquals(2, bindings.get("calls"));
        assertArrayEquals(new int[] {0, 7, 0, 0}, (int[]) bindings.get("data"));
        assertEquals(List.of(0, 0, 5, 0), bindings.get("items"));

        List<TraceEvent> writes = events(EventKind.INDEX_ASSIGN);
        assertEquals(2, writes.size());
        assertEquals("<not re-evaluated: next()>", writes.get(0).payloadValue("index"));
        assertEquals("<not re-evaluated: data[next()]>", writes.get(0).value());
        assertEquals(List.of("data"), writes.get(0).dependsOn());
        assertEquals("items", writes.get(1).targetName());
        assertEquals(5, writes.get(1).value());
    }

    @Test
    void fieldWritesAreAttributeAssignments() {
        runner.instrumentAndRun("""
            public class Shapes {
                static class Point {
                    int x;
                    int y;

                    Point(int x, int y) {
                        this.x = x;
                        this.y = y;
                    }
                }

                public static void main(String[] args) {
                    Point p = new Point(1, 2);
                    p.x = 5;
                }
            }
            """, "Shapes.java");

        List<TraceEvent> writes = events(EventKind.ATTRIBUTE_ASSIGN);
        assertEquals(3, writes.size());
        assertEquals("x", writes.get(0).attribute());
        assertEquals(1, writes.get(0).value());
        TraceEvent last = writes.get(2);
        assertEquals("p.x", last.targetName());
        assertEquals(5, last.value());
        assertEquals(14, last.sourceLine());
        assertEquals(List.of("p"), last.dependsOn());
        assertNotNull(last.payloadValue("objectId"));
    }

    @Test
    void elementWritesAreIndexAssignments() {
        runner.instrumentAndRun("""
            int[] values = new int[3];
            values[1] = 7;
            java.util.List<String> names = new java.util.ArrayList<>(java.util.List.of("a", "b"));
            names.set(0, "z");
            """, "arrays.jsh");

        List<TraceEvent> writes = events(EventKind.INDEX_ASSIGN);
        assertEquals(2, writes.size());
        assertEquals(1, writes.get(0).payloadValue("index"));
        assertEquals(7, writes.get(0).value());
        assertEquals("names", writes.get(1).targetName());
        assertEquals("z", writes.get(1).value());
    }

    // --- Control flow ---

    @Test
    void ifChainRecordsExactlyOneBranch() {
        runner.instrumentAndRun("""
            int x = 5;
            String label;
            if (x > 10) {
                label = "big";
            } else if (x > 3) {
                label = "medium";
            } else {
                label = "small";
            }
            """, "branch.jsh");

        List<TraceEvent> branches = events(EventKind.BRANCH);
        assertEquals(1, branches.size());
        assertEquals("elif", branches.get(0).decision());
        assertEquals("x > 3", branches.get(0).condition());
        assertEquals(true, branches.get(0).payloadValue("result"));
        assertEquals(5, branches.get(0).sourceLine());
        assertEquals("medium", events(EventKind.ASSIGN).stream()
            .filter(e -> "label".equals(e.targetName())).findFirst().orElseThrow().value());
    }

    @Test
    void ifWithoutElseRecordsImplicitSkip() {
        runner.instrumentAndRun("int x = 1;\nif (x > 3) {\n    x = 0;\n}\n", "skip.jsh");

        List<TraceEvent> branches = events(EventKind.BRANCH);
        assertEquals(1, branches.size());
        assertEquals("implicit-skip", branches.get(0).decision());
        assertEquals(false, branches.get(0).payloadValue("result"));
        assertEquals(List.of("x"), branches.get(0).dependsOn());
    }

    @Test
    void loopsRecordIterations() {
        Map<String, Object> bindings = runner.instrumentAndRun("""
            int total = 0;
            for (int i = 0; i < 3; i++) {
                total += i;
            }
            int n = 2;
            while (n > 0) n--;
            """, "loops.jsh");

        List<TraceEvent> iterations = events(EventKind.LOOP_ITERATION);
        assertEquals(3, iterations.size());
        for (int i = 0; i < 3; i++) {
            assertEquals("i", iterations.get(i).targetName());
            assertEquals(i, iterations.get(i).value());
        }
        assertEquals(2, events(EventKind.WHILE_CONDITION).size());
        assertEquals(5, events(EventKind.AUGMENTED_ASSIGN).size());
        assertEquals("+=", events(EventKind.AUGMENTED_ASSIGN).get(0).payloadValue("operator"));
        assertEquals("--", events(EventKind.AUGMENTED_ASSIGN).get(3).payloadValue("operator"));
        assertEquals(3, bindings.get("total"));
        assertEquals(0, bindings.get("n"));
    }

    @Test
    void enhancedForRecordsTheElement() {
        runner.instrumentAndRun("""
            int sum = 0;
            for (int v : new int[] {4, 5}) {
                sum += v;
            }
            """, "each.jsh");

        List<TraceEvent> iterations = events(EventKind.LOOP_ITERATION);
        assertEquals(2, iterations.size());
        assertEquals("v", iterations.get(1).targetName());
        assertEquals(5, iterations.get(1).value());
    }

    // --- Bindings ---

    @Test
    void inputBindingsAreVisibleToTheScript() {
        Map<String, Object> bindings = runner.instrumentAndRun("int doubled = limit * 2;\n", "double.jsh",
            Map.of("limit", 21));

        assertEquals(21, bindings.get("limit"));
        assertEquals(42, bindings.get("doubled"));
        assertEquals(List.of("limit"), events(EventKind.ASSIGN).get(0).dependsOn());
    }

    @Test
    void staticFieldsAreFinalBindingsOfAClass() {
        Map<String, Object> bindings = runner.instrumentAndRun("""
            public class Counter {
                static int count;

                public static void main(String[] args) {
                    for (int i = 0; i < 4; i++) {
                        count++;
                    }
                }
            }
            """, "Counter.java");

        assertEquals(Map.of("count", 4), bindings);
        TraceEvent step = events(EventKind.AUGMENTED_ASSIGN).get(3);
        assertEquals("count", step.targetName());
        assertEquals(4, step.globalSnapshot().get("count"));
    }

    @Test
    void programArgumentsReachMain() {
        InstrumentedRunner withArgs = new InstrumentedRunner(recorder, false, List.of(), List.of("a", "b"));
        withArgs.instrumentAndRun("int n = args.length;\n", "args.jsh");

        assertEquals(2, events(EventKind.ASSIGN).get(0).value());
    }

    @Test
    void classpathLoaderIsClosedAfterTheRun(@TempDir Path extra) throws IOException {
        Files.writeString(extra.resolve("marker.txt"), "present");
        InstrumentedRunner withClasspath = new InstrumentedRunner(recorder, false, List.of(extra.toString()), List.of());

        Map<String, Object> bindings = withClasspath.instrumentAndRun("""
            public class Lookup {
                static ClassLoader classpath;
                static boolean foundDuringRun;

                public static void main(String[] args) {
                    classpath = Thread.currentThread().getContextClassLoader().getParent();
                    foundDuringRun = classpath.getResource("marker.txt") != null;
                }
            }
            """, "Lookup.java");

        assertEquals(true, bindings.get("foundDuringRun"));
        URLClassLoader used = assertInstanceOf(URLClassLoader.class, bindings.get("classpath"));
        assertNull(used.getResource("marker.txt"));
    }

    @Test
    void eachRunRecordsIntoItsOwnRecorder() {
        TraceRecorder other = new TraceRecorder();
        int globalBefore = TraceRecorder.global().size();

        runner.instrumentAndRun("int a = 1;\n", "one.jsh");
        new InstrumentedRunner(other).instrumentAndRun("int a = 1;\nint b = 2;\n", "two.jsh");

        assertEquals(1, events(EventKind.ASSIGN).size());
        assertEquals(2, other.events().stream().filter(e -> e.kind() == EventKind.ASSIGN).count());
        assertEquals(globalBefore, TraceRecorder.global().size());
    }

    @Test
    void originalProgramRunsWithoutEvents() {
        Map<String, Object> bindings = runner.runOriginal("int x = limit + 1;\n", "orig.jsh", Map.of("limit", 4));

        assertEquals(0, recorder.size());
        assertEquals(4, bindings.get("limit"));
    }

    // --- Failures ---

    @Test
    void parseErrorIsReportedBeforeAnythingRuns() {
        assertThrows(SourceParseException.class, () -> runner.instrumentAndRun("int x = ;\n", "bad.jsh"));
        assertEquals(0, recorder.size());
    }

    @Test
    void programThatDoesNotCompileIsASourceError() {
        assertThrows(SourceCompileException.class, () -> runner.instrumentAndRun("int x = \"text\";\n", "bad.jsh"));
    }

    @Test
    void programFailureKeepsEventsRecordedSoFar() {
        ProgramFailedException e = assertThrows(ProgramFailedException.class,
            () -> runner.instrumentAndRun("int x = 1;\nthrow new IllegalStateException(\"boom\");\n", "boom.jsh"));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(1, events(EventKind.ASSIGN).size());
    }

    @Test
    void bindingTypesFollowTheValues() {
        Map<String, Object> values = new java.util.LinkedHashMap<>();
        values.put("n", 3);
        values.put("name", "x");
        values.put("items", List.of(1));
        values.put("missing", null);
        values.put("other", new Object());

        Map<String, String> types = InstrumentedRunner.bindingTypes(values);

        assertEquals("int", types.get("n"));
        assertEquals("String", types.get("name"));
        assertEquals("java.util.List<Object>", types.get("items"));
        assertEquals("Object", types.get("missing"));
        assertEquals("java.lang.Object", types.get("other"));
    }
}

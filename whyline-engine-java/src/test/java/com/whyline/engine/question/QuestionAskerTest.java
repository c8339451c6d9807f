package com.whyline.engine.question;

import com.whyline.engine.run.InstrumentedRunner;
import com.whyline.recorder.EventKind;
import com.whyline.recorder.TraceEvent;
import com.whyline.recorder.TraceRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/** Questions asked about real instrumented runs. */
class QuestionAskerTest {

    private static final String FACTORIAL = """
        int result = 1;
        for (int i = 1; i <= 5; i++) {
            result *= i;
        }
        """;

    private static final String RECURSIVE_FACTORIAL = """
        public class Factorial {
            static int factorial(int n) {
                if (n <= 1) {
                    return 1;
                }
                return n * factorial(n - 1);
            }

            public static void main(String[] args) {
                int result = factorial(5);
            }
        }
        """;

    private static final String SHAPES = """
        public class Shapes {
            static class Point {
                int x;
                int y;

                Point(int x, int y) {
                    this.x = x;
                    this.y = y;
                }
            }

            static int area(int w, int h) {
                int a = w * h;
                return a;
            }

            public static void main(String[] args) {
                Point p = new Point(1, 2);
                int size = area(3, 4);
                if (size > 100) {
                    p.x = size;
                }
                p.y = 7;
            }
        }
        """;

    private TraceRecorder recorder;
    private QuestionAsker asker;

    @BeforeEach
    void setUp() {
        recorder = new TraceRecorder();
        asker = new QuestionAsker(recorder);
    }

    @Test
    void factorialResultComesFromTheLastMultiplication() {
        new InstrumentedRunner(recorder).instrumentAndRun(FACTORIAL, "factorial.jsh");

        Answer answer = asker.whyDidVariableHaveValue("result", 120).getAnswer();

        TraceEvent primary = answer.getPrimaryEvent().orElseThrow();
        assertEquals(EventKind.AUGMENTED_ASSIGN, primary.kind());
        assertEquals(3, primary.sourceLine());
        assertEquals(5, primary.localSnapshot().get("i"));
        assertEquals("Variable 'result' got value 120 from assignment at factorial.jsh:3", answer.getExplanation());
    }

    @Test
    void recursiveFactorialResultIsTheAssignmentAfterTheRecursion() {
        new InstrumentedRunner(recorder).instrumentAndRun(RECURSIVE_FACTORIAL, "Factorial.java");

        List<TraceEvent> returns = recorder.events().stream()
            .filter(e -> e.kind() == EventKind.RETURN).toList();
        assertEquals(List.of(1, 2, 6, 24, 120), returns.stream().map(TraceEvent::value).toList());

        Answer answer = asker.whyDidVariableHaveValue("result", 120).getAnswer();
        TraceEvent primary = answer.getPrimaryEvent().orElseThrow();
        assertEquals(EventKind.ASSIGN, primary.kind());
        assertEquals(10, primary.sourceLine());
        assertTrue(primary.id() > returns.get(4).id());
        assertEquals("Variable 'result' got value 120 from assignment at Factorial.java:10", answer.getExplanation());

        ValueSourceAnswer returned = (ValueSourceAnswer) asker.whyDidFunctionReturn("factorial", 120).getAnswer();
        TraceEvent outermost = returned.getPrimaryEvent().orElseThrow();
        assertEquals(returns.get(4).id(), outermost.id());
        assertEquals(6, outermost.sourceLine());
        assertEquals("Function 'factorial' returned 120 at Factorial.java:6", returned.getExplanation());

        Answer base = asker.whyDidFunctionReturn("factorial", 1).getAnswer();
        assertEquals(4, base.getPrimaryEvent().orElseThrow().sourceLine());
    }

    @Test
    void repeatedValuePicksTheMostRecentAssignment() {
        new InstrumentedRunner(recorder).instrumentAndRun(FACTORIAL, "factorial.jsh");

        Answer answer = asker.whyDidVariableHaveValue("result", 1).getAnswer();

        assertEquals(2, answer.getEvidence().size());
        assertEquals(EventKind.ASSIGN, answer.getEvidence().get(0).kind());
        assertEquals(3, answer.getPrimaryEvent().orElseThrow().sourceLine());
    }

    @Test
    void returnedValueIsTracedToItsLocal() {
        new InstrumentedRunner(recorder).instrumentAndRun(SHAPES, "Shapes.java");

        ValueSourceAnswer answer = (ValueSourceAnswer) asker.whyDidFunctionReturn("area", 12).getAnswer();

        assertEquals(14, answer.getPrimaryEvent().orElseThrow().sourceLine());
        assertTrue(answer.getSourceEvents().stream()
            .anyMatch(e -> "a".equals(e.targetName()) && e.sourceLine() == 13));
    }

    @Test
    void skippedLineIsExplainedByTheBranch() {
        new InstrumentedRunner(recorder).instrumentAndRun(SHAPES, "Shapes.java");

        Answer answer = asker.whyDidntLineExecute("Shapes.java", 21).getAnswer();

        assertFalse(answer.isFound());
        assertEquals(1, answer.getEvidence().size());
        assertEquals("implicit-skip", answer.getEvidence().get(0).decision());
    }

    @Test
    void objectAndPropertyQuestions() {
        new InstrumentedRunner(recorder).instrumentAndRun(SHAPES, "Shapes.java");

        Answer created = asker.whyWasObjectCreated("Point").getAnswer();
        assertEquals(18, created.getEvidence().get(0).sourceLine());
        assertEquals("p", created.getEvidence().get(0).targetName());

        Answer property = asker.whyDidPropertyGetAssigned("y", 7).getAnswer();
        assertEquals(23, property.getPrimaryEvent().orElseThrow().sourceLine());

        Answer called = asker.whyWasFunctionCalled("area").getAnswer();
        assertEquals("Function 'area' was called 1 times", called.getExplanation());
    }

    @Test
    void inventoryProgram() throws IOException {
        Map<String, Object> bindings = new InstrumentedRunner(recorder).instrumentAndRun(program("Inventory.java"), "Inventory.java");

        assertEquals(List.of("nuts", "gears"), bindings.get("restocked"));
        assertEquals("Variable 'ordered' got value 17 from assignment at Inventory.java:21",
            asker.whyDidVariableHaveValue("ordered", 17).getAnswer().getExplanation());
        assertEquals("Line Inventory.java:13 executed 2 times after 3 control flow decisions",
            asker.whyDidLineExecute("Inventory.java", 13).getAnswer().getExplanation());
        assertEquals("Function 'reorder' was called 3 times due to 2 control flow decisions",
            asker.whyWasFunctionCalled("reorder").getAnswer().getExplanation());

        ValueSourceAnswer returned = (ValueSourceAnswer) asker.whyDidFunctionReturn("reorder", 10).getAnswer();
        assertEquals(13, returned.getPrimaryEvent().orElseThrow().sourceLine());
        assertTrue(returned.getSourceEvents().stream().anyMatch(e -> "amount".equals(e.targetName())));
    }

    private static String program(String name) throws IOException {
        try (InputStream in = QuestionAskerTest.class.getResourceAsStream("/programs/" + name)) {
            assertNotNull(in, "Missing test program " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}

package com.whyline.engine.instrument;

import com.whyline.engine.instrument.JdtSourceParser.SourceParseException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceInstrumenterTest {

    private static final String CALC = """
        public class Calc {
            static int add(int a, int b) {
                return a + b;
            }

            static int twice(int n) {
                return add(n, n);
            }

            public static void main(String[] args) {
                int x = 10;
                int y = 20;
                int z = add(x, y);
                if (z > 25) z = twice(z);
            }
        }
        """;

    private final SourceInstrumenter instrumenter = new SourceInstrumenter();

    private static void assertParses(String text) {
        assertTrue(JdtSourceParser.errors(new JdtSourceParser().parse(text)).isEmpty(), text);
    }

    @Test
    void classIsInstrumentedWithRecorderCalls() {
        InstrumentedSource out = instrumenter.instrument(CALC, "Calc.java");

        assertFalse(out.script());
        assertEquals("Calc", out.entryTypeName());
        assertEquals("Calc.java", out.compilationUnitPath());
        assertTrue(out.probeCount() > 0);
        assertTrue(out.text().contains("bind(Calc.class)"), out.text());
        assertTrue(out.text().contains("\"Calc.java\""));
        assertTrue(out.text().contains("\"function-entry\""));
        assertTrue(out.text().contains("\"assign\""));
        assertTrue(out.text().contains("\"return\""));
        assertTrue(out.text().contains("\"branch\""));
        assertParses(out.text());
    }

    @Test
    void callInReturnIsWrappedNotRepeated() {
        String text = instrumenter.instrumentSource(CALC, "Calc.java");
        assertTrue(text.contains("recordReturn("), text);
        assertEquals(1, text.split("add\\(n, n\\)", -1).length - 1, "Call appears exactly once");
    }

    @Test
    void ifWithoutElseGetsImplicitSkip() {
        String text = instrumenter.instrumentSource(CALC, "Calc.java");
        assertTrue(text.contains("\"implicit-skip\""), text);
        assertTrue(text.contains("\"then\""), text);
    }

    @Test
    void loopsRecordEachIteration() {
        String text = instrumenter.instrumentSource("""
            public class Loops {
                public static void main(String[] args) {
                    int total = 0;
                    for (int i = 0; i < 3; i++) total += i;
                    for (String s : args) total += s.length();
                    while (total > 0) total--;
                    do { total++; } while (total < 2);
                }
            }
            """, "Loops.java");

        assertTrue(text.contains("\"loop-iteration\""), text);
        assertTrue(text.contains("\"while-condition\""), text);
        assertTrue(text.contains("\"augmented-assign\""), text);
        assertParses(text);
    }

    @Test
    void statementsWithoutTypesAreAScript() {
        InstrumentedSource out = instrumenter.instrument("int x = 1;\nint y = x + 1;\n", "calc.jsh");

        assertTrue(out.script());
        assertEquals("CalcScript", out.entryTypeName());
        assertEquals("CalcScript.java", out.compilationUnitPath());
        assertTrue(out.text().contains(ScriptWrapper.BINDINGS_FIELD), out.text());
        assertTrue(out.text().contains("TraceRecorder.bindings("), out.text());
        assertParses(out.text());
    }

    @Test
    void scriptBindingsBecomeStaticFields() {
        PreparedSource prepared = instrumenter.prepare("int doubled = limit * 2;\n", "double.jsh", Map.of("limit", "int"));

        assertTrue(prepared.script());
        assertEquals(java.util.List.of("limit"), prepared.bindingNames());
        assertTrue(prepared.originalText().contains("public static int limit;"));
    }

    @Test
    void recordsInterfacesAndEnumsStayValid() {
        String text = instrumenter.instrumentSource("""
            interface Shape {
                double area();
                default boolean isLarge() {
                    double a = area();
                    return a > 100;
                }
            }

            enum Unit {
                CM, M;
                double scale() {
                    if (this == M) return 100;
                    return 1;
                }
            }

            public record Square(double side) implements Shape {
                public Square {
                    if (side < 0) throw new IllegalArgumentException("side");
                }

                public double area() {
                    return side * side;
                }
            }
            """, "Square.java");

        assertParses(text);
        assertTrue(text.contains("bind(Shape.class)"), text);
        assertTrue(text.contains("bind(Unit.class)"), text);
    }

    @Test
    void invalidScriptReportsLine() {
        SourceParseException e = assertThrows(SourceParseException.class,
            () -> instrumenter.instrument("int x = 1;\nint y = ;\n", "broken.jsh"));
        assertEquals(2, e.getLine());
        assertEquals("broken.jsh", e.getFileName());
    }

    @Test
    void invalidClassReportsItsOwnError() {
        SourceParseException e = assertThrows(SourceParseException.class, () -> instrumenter.instrument("""
            public class Broken {
                void m() {
                    int x = ;
                }
            }
            """, "Broken.java"));
        assertEquals(3, e.getLine());
    }
}

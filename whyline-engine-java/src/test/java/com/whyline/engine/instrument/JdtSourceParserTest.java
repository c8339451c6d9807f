package com.whyline.engine.instrument;

import com.whyline.engine.instrument.JdtSourceParser.SourceParseException;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JdtSourceParserTest {

    private final JdtSourceParser parser = new JdtSourceParser();

    @Test
    void parsesJava17Syntax() {
        CompilationUnit unit = parser.parseStrict("""
            public record Point(int x, int y) {
                String describe() {
                    return switch (x) {
                        case 0 -> "origin";
                        default -> "elsewhere";
                    };
                }
            }
            """, "Point.java");

        assertEquals(1, unit.types().size());
        assertTrue(JdtSourceParser.errors(unit).isEmpty());
    }

    @Test
    void lenientParseKeepsProblemsOnTheUnit() {
        CompilationUnit unit = parser.parse("class A { void m() { int x = ; } }");
        assertFalse(JdtSourceParser.errors(unit).isEmpty());
    }

    @Test
    void strictParseReportsFileAndLine() {
        SourceParseException e = assertThrows(SourceParseException.class, () -> parser.parseStrict("""
            class A {
                void m() {
                    int x = ;
                }
            }
            """, "A.java"));

        assertEquals("A.java", e.getFileName());
        assertEquals(3, e.getLine());
        assertTrue(e.getMessage().startsWith("A.java:3: "), e.getMessage());
    }
}

package com.whyline.engine.instrument;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScriptWrapperTest {

    @Test
    void statementsKeepTheirLines() {
        String wrapped = ScriptWrapper.wrap("import java.util.List;\n\nint x = 1;\nint y = x + 1;\n", "CalcScript", Map.of());

        String[] lines = wrapped.split("\n");
        assertEquals("import java.util.List;", lines[0]);
        assertEquals("", lines[1]);
        assertTrue(lines[2].startsWith("public class CalcScript { "), lines[2]);
        assertTrue(lines[2].endsWith("int x = 1;"), lines[2]);
        assertEquals("int y = x + 1;", lines[3]);
    }

    @Test
    void declaresBindingsFieldAndInputBindings() {
        Map<String, String> bindings = new LinkedHashMap<>();
        bindings.put("limit", "int");
        bindings.put("names", "java.util.List<Object>");

        String wrapped = ScriptWrapper.wrap("int x = limit;\n", "CalcScript", bindings);

        assertTrue(wrapped.contains("public static java.util.Map<String, Object> __whylineBindings; "));
        assertTrue(wrapped.contains("public static int limit; "));
        assertTrue(wrapped.contains("public static java.util.List<Object> names; "));
        assertTrue(wrapped.contains("public static void main(String[] args) throws Throwable { int x = limit;"));
        assertTrue(wrapped.endsWith("\n}\n}\n"));
    }

    @Test
    void scriptOfOnlyCommentsStillGetsAClass() {
        String wrapped = ScriptWrapper.wrap("// nothing yet", "EmptyScript", Map.of());
        assertTrue(wrapped.startsWith("// nothing yet"));
        assertTrue(wrapped.contains("public class EmptyScript"));
    }

    @Test
    void classNameComesFromFileName() {
        assertEquals("CalcScript", ScriptWrapper.classNameFor("calc.jsh"));
        assertEquals("MyprogScript", ScriptWrapper.classNameFor("scripts/my-prog.java"));
        assertEquals("WhylineScript", ScriptWrapper.classNameFor("123"));
        assertEquals("WhylineScript", ScriptWrapper.classNameFor(null));
    }
}

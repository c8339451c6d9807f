package com.whyline.engine.run;

import com.whyline.engine.run.InMemoryCompiler.CompilationFailedException;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCompilerTest {

    private final InMemoryCompiler compiler = new InMemoryCompiler();

    @Test
    void compilesEveryClassOfTheUnit() {
        Map<String, byte[]> classes = compiler.compile("demo/Hello.java", """
            package demo;

            public class Hello {
                static class Inner {}
                public static int answer() { return 42; }
            }
            """, List.of());

        assertTrue(classes.containsKey("demo.Hello"));
        assertTrue(classes.containsKey("demo.Hello$Inner"));
        assertTrue(classes.get("demo.Hello").length > 0);
    }

    @Test
    void recorderIsOnTheCompileClasspath() {
        Map<String, byte[]> classes = compiler.compile("Uses.java", """
            public class Uses {
                static com.whyline.recorder.TraceRecorder recorder = com.whyline.recorder.TraceRecorder.bind(Uses.class);
            }
            """, List.of());

        assertTrue(classes.containsKey("Uses"));
    }

    @Test
    void errorsCarryTheirLine() {
        CompilationFailedException e = assertThrows(CompilationFailedException.class,
            () -> compiler.compile("Bad.java", "public class Bad {\n    int x = \"text\";\n}\n", List.of()));

        assertFalse(e.getErrors().isEmpty());
        assertTrue(e.getErrors().get(0).startsWith("line 2: "), e.getErrors().get(0));
        assertTrue(e.getMessage().contains("Bad.java does not compile"));
    }

    @Test
    void extraEntriesAreAppended() {
        String classpath = InMemoryCompiler.classpath(List.of("lib/extra.jar"));
        assertTrue(classpath.endsWith(File.pathSeparator + "lib/extra.jar"), classpath);
    }
}

package com.whyline.engine.run;

import com.whyline.recorder.TraceRecorder;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Compiles one source text with the system Java compiler, entirely in memory.
 * The recorder's classes are always on the compile classpath, since instrumented code
 * calls into them.
 */
public class InMemoryCompiler {

    /**
     * @param unitPath  path javac expects for the unit, e.g. {@code com/acme/Calc.java}
     * @param classpath extra classpath entries
     * @return class bytes by binary name
     * @throws CompilationFailedException with the error diagnostics
     */
    public Map<String, byte[]> compile(String unitPath, String source, List<String> classpath) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new CompilationFailedException("No system Java compiler available; run on a JDK", List.of());
        }
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        StandardJavaFileManager standard = compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8);
        List<String> options = List.of("-classpath", classpath(classpath), "-g", "-parameters", "-proc:none");

        try (MemoryFileManager fileManager = new MemoryFileManager(standard)) {
            JavaFileObject unit = new SourceFile(unitPath, source);
            boolean ok = compiler.getTask(null, fileManager, diagnostics, options, null, List.of(unit)).call();
            if (!ok) {
                List<String> errors = new ArrayList<>();
                for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
                    if (d.getKind() == Diagnostic.Kind.ERROR) {
                        errors.add("line " + d.getLineNumber() + ": " + d.getMessage(Locale.ROOT));
                    }
                }
                throw new CompilationFailedException(unitPath + " does not compile: "
                    + (errors.isEmpty() ? "unknown error" : errors.get(0)), errors);
            }
            return fileManager.classes();
        } catch (IOException e) {
            throw new CompilationFailedException("Compiler I/O failure for " + unitPath, List.of(), e);
        }
    }

    static String classpath(List<String> extra) {
        Set<String> entries = new LinkedHashSet<>();
        String own = System.getProperty("java.class.path", "");
        if (!own.isEmpty()) entries.add(own);
        String recorder = recorderLocation();
        if (recorder != null) entries.add(recorder);
        entries.addAll(extra);
        return String.join(File.pathSeparator, entries);
    }

    private static String recorderLocation() {
        CodeSource source = TraceRecorder.class.getProtectionDomain().getCodeSource();
        if (source == null || source.getLocation() == null) return null;
        try {
            return Paths.get(source.getLocation().toURI()).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            System.err.println("[whyline-engine] WARN: cannot locate recorder classes: " + e.getMessage());
            return null;
        }
    }

    private static final class SourceFile extends SimpleJavaFileObject {
        private final String source;

        SourceFile(String unitPath, String source) {
            super(URI.create("string:///" + unitPath), Kind.SOURCE);
            this.source = source;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return source;
        }
    }

    private static final class MemoryFileManager extends ForwardingJavaFileManager<StandardJavaFileManager> {
        private final Map<String, ByteArrayOutputStream> outputs = new LinkedHashMap<>();

        MemoryFileManager(StandardJavaFileManager delegate) {
            super(delegate);
        }

        @Override
        public JavaFileObject getJavaFileForOutput(Location location, String className,
                                                   JavaFileObject.Kind kind, FileObject sibling) {
            URI uri = URI.create("mem:///" + className.replace('.', '/') + kind.extension);
            return new SimpleJavaFileObject(uri, kind) {
                @Override
                public OutputStream openOutputStream() {
                    ByteArrayOutputStream out = new ByteArrayOutputStream();
                    outputs.put(className, out);
                    return out;
                }
            };
        }

        Map<String, byte[]> classes() {
            Map<String, byte[]> classes = new LinkedHashMap<>();
            outputs.forEach((name, out) -> classes.put(name, out.toByteArray()));
            return classes;
        }
    }

    /** javac rejected the source. */
    public static class CompilationFailedException extends RuntimeException {
        private final List<String> errors;

        public CompilationFailedException(String message, List<String> errors) {
            super(message);
            this.errors = List.copyOf(errors);
        }

        public CompilationFailedException(String message, List<String> errors, Throwable cause) {
            super(message, cause);
            this.errors = List.copyOf(errors);
        }

        public List<String> getErrors() { return errors; }
    }
}

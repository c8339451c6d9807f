package com.whyline.engine.run;

import com.whyline.engine.instrument.InstrumentedSource;
import com.whyline.engine.instrument.PreparedSource;
import com.whyline.engine.instrument.ScriptWrapper;
import com.whyline.engine.instrument.SourceInstrumenter;
import com.whyline.engine.instrument.SourceInstrumenter.InstrumentationFinalizeException;
import com.whyline.engine.run.InMemoryCompiler.CompilationFailedException;
import com.whyline.recorder.TraceRecorder;

import java.io.IOException;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Instruments a program, compiles it in memory and runs its {@code main} on the calling
 * thread, recording into the runner's {@link TraceRecorder}.
 *
 * Input bindings are assigned to static fields of the entry class before {@code main}
 * runs (scripts declare a field per binding). The returned final bindings are the entry
 * class's static fields after the run, plus the locals a script published on completion.
 */
public class InstrumentedRunner {

    private static final Map<Class<?>, String> PRIMITIVE_BINDING_TYPES = Map.of(
        Integer.class, "int", Long.class, "long", Double.class, "double", Float.class, "float",
        Boolean.class, "boolean", Character.class, "char", Short.class, "short", Byte.class, "byte",
        String.class, "String");

    private final SourceInstrumenter instrumenter = new SourceInstrumenter();
    private final InMemoryCompiler compiler = new InMemoryCompiler();
    private final CallTracingWeaver weaver = new CallTracingWeaver();
    private final TraceRecorder recorder;
    private final boolean callTracing;
    private final List<String> classpath;
    private final List<String> programArgs;

    public InstrumentedRunner(TraceRecorder recorder) {
        this(recorder, false, List.of(), List.of());
    }

    public InstrumentedRunner(TraceRecorder recorder, boolean callTracing,
                              List<String> classpath, List<String> programArgs) {
        this.recorder = recorder;
        this.callTracing = callTracing;
        this.classpath = List.copyOf(classpath);
        this.programArgs = List.copyOf(programArgs);
    }

    public TraceRecorder recorder() {
        return recorder;
    }

    public Map<String, Object> instrumentAndRun(String source, String fileName) {
        return instrumentAndRun(source, fileName, Map.of());
    }

    /**
     * @throws com.whyline.engine.instrument.JdtSourceParser.SourceParseException if the source does not parse
     * @throws SourceCompileException if the program itself does not compile
     * @throws InstrumentationFinalizeException if only the instrumented version fails
     * @throws ProgramFailedException if the program throws; events recorded so far stay in the log
     */
    public Map<String, Object> instrumentAndRun(String source, String fileName, Map<String, Object> bindings) {
        PreparedSource prepared = instrumenter.prepare(source, fileName, bindingTypes(bindings));
        InstrumentedSource instrumented = instrumenter.instrument(prepared);
        System.err.println("[whyline-engine] instrumented " + fileName + ": " + instrumented.probeCount() + " probes");

        Map<String, byte[]> classes;
        try {
            classes = compiler.compile(prepared.compilationUnitPath(), instrumented.text(), classpath);
        } catch (CompilationFailedException instrumentedFailure) {
            compileOriginal(prepared);
            throw new InstrumentationFinalizeException("Instrumented " + fileName
                + " does not compile although the original does: " + instrumentedFailure.getMessage(),
                instrumentedFailure);
        }
        return weaveAndExecute(prepared, classes, bindings);
    }

    /** Runs the uninstrumented program. Events only come from call tracing, if enabled. */
    public Map<String, Object> runOriginal(String source, String fileName, Map<String, Object> bindings) {
        PreparedSource prepared = instrumenter.prepare(source, fileName, bindingTypes(bindings));
        return weaveAndExecute(prepared, compileOriginal(prepared), bindings);
    }

    /** Weaves if call tracing is on and runs; a classpath loader opened for the run is closed after it. */
    private Map<String, Object> weaveAndExecute(PreparedSource prepared, Map<String, byte[]> classes,
                                                Map<String, Object> bindings) {
        ClassLoader parent = parentLoader();
        try {
            if (callTracing) {
                classes = weaver.weave(classes, parent);
            }
            return execute(prepared, classes, parent, bindings);
        } finally {
            if (parent instanceof URLClassLoader opened && parent != InstrumentedRunner.class.getClassLoader()) {
                close(opened);
            }
        }
    }

    private static void close(URLClassLoader loader) {
        try {
            loader.close();
        } catch (IOException e) {
            System.err.println("[whyline-engine] WARN: could not close classpath loader: " + e.getMessage());
        }
    }

    private Map<String, byte[]> compileOriginal(PreparedSource prepared) {
        try {
            return compiler.compile(prepared.compilationUnitPath(), prepared.originalText(), classpath);
        } catch (CompilationFailedException e) {
            throw new SourceCompileException(prepared.fileName() + ": " + e.getMessage(), e);
        }
    }

    private Map<String, Object> execute(PreparedSource prepared, Map<String, byte[]> classes,
                                        ClassLoader parent, Map<String, Object> bindings) {
        InstrumentedClassLoader loader = new InstrumentedClassLoader(classes, recorder, prepared.fileName(), parent);
        Thread thread = Thread.currentThread();
        ClassLoader previous = thread.getContextClassLoader();
        thread.setContextClassLoader(loader);
        try {
            Class<?> entry = Class.forName(prepared.entryTypeName(), true, loader);
            assignBindings(entry, bindings);
            invokeMain(entry, prepared.fileName());
            return finalBindings(entry, prepared.script());
        } catch (ClassNotFoundException e) {
            throw new ProgramFailedException("Entry class " + prepared.entryTypeName() + " was not compiled", e);
        } catch (ExceptionInInitializerError e) {
            throw new ProgramFailedException(prepared.fileName() + " failed during class initialization: "
                + e.getCause(), e.getCause() != null ? e.getCause() : e);
        } finally {
            thread.setContextClassLoader(previous);
        }
    }

    private void invokeMain(Class<?> entry, String fileName) {
        Method main;
        try {
            main = entry.getMethod("main", String[].class);
        } catch (NoSuchMethodException e) {
            System.err.println("[whyline-engine] WARN: " + entry.getName() + " has no main method; nothing was run");
            return;
        }
        if (!Modifier.isStatic(main.getModifiers())) {
            System.err.println("[whyline-engine] WARN: " + entry.getName() + ".main is not static; nothing was run");
            return;
        }
        System.err.println("[whyline-engine] running " + entry.getName() + ".main");
        try {
            main.setAccessible(true);
            main.invoke(null, (Object) programArgs.toArray(new String[0]));
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            throw new ProgramFailedException(fileName + " threw " + cause, cause);
        } catch (IllegalAccessException e) {
            throw new ProgramFailedException("Cannot invoke " + entry.getName() + ".main", e);
        }
    }

    private static void assignBindings(Class<?> entry, Map<String, Object> bindings) {
        for (Map.Entry<String, Object> binding : bindings.entrySet()) {
            try {
                Field field = entry.getDeclaredField(binding.getKey());
                if (!Modifier.isStatic(field.getModifiers()) || Modifier.isFinal(field.getModifiers())) {
                    System.err.println("[whyline-engine] WARN: binding '" + binding.getKey()
                        + "' does not name a writable static field; ignored");
                    continue;
                }
                field.setAccessible(true);
                field.set(null, binding.getValue());
            } catch (NoSuchFieldException e) {
                System.err.println("[whyline-engine] WARN: no static field for binding '" + binding.getKey() + "'; ignored");
            } catch (IllegalAccessException | IllegalArgumentException e) {
                throw new ProgramFailedException("Cannot assign binding '" + binding.getKey() + "': " + e.getMessage(), e);
            }
        }
    }

    private static Map<String, Object> finalBindings(Class<?> entry, boolean script) {
        Map<String, Object> out = new LinkedHashMap<>();
        Map<?, ?> published = null;
        for (Field field : entry.getDeclaredFields()) {
            if (!Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) continue;
            try {
                field.setAccessible(true);
                Object value = field.get(null);
                if (script && field.getName().equals(ScriptWrapper.BINDINGS_FIELD)) {
                    published = (Map<?, ?>) value;
                } else if (!field.getName().startsWith(TraceRecorder.INJECTED_PREFIX)) {
                    out.put(field.getName(), value);
                }
            } catch (IllegalAccessException | RuntimeException e) {
                System.err.println("[whyline-engine] WARN: cannot read " + entry.getName() + "." + field.getName()
                    + ": " + e.getMessage());
            }
        }
        if (published != null) {
            published.forEach((name, value) -> out.put(String.valueOf(name), value));
        }
        return out;
    }

    /** Java types for script binding fields, derived from the bound values. */
    static Map<String, String> bindingTypes(Map<String, Object> bindings) {
        Map<String, String> types = new LinkedHashMap<>();
        bindings.forEach((name, value) -> types.put(name, bindingType(value)));
        return types;
    }

    private static String bindingType(Object value) {
        if (value == null) return "Object";
        String primitive = PRIMITIVE_BINDING_TYPES.get(value.getClass());
        if (primitive != null) return primitive;
        if (value instanceof List) return "java.util.List<Object>";
        if (value instanceof Set) return "java.util.Set<Object>";
        if (value instanceof Map) return "java.util.Map<Object, Object>";
        Class<?> type = value.getClass();
        if (Modifier.isPublic(type.getModifiers()) && type.getCanonicalName() != null) {
            return type.getCanonicalName();
        }
        return "Object";
    }

    private ClassLoader parentLoader() {
        ClassLoader own = InstrumentedRunner.class.getClassLoader();
        if (classpath.isEmpty()) return own;
        List<URL> urls = new ArrayList<>();
        for (String entry : classpath) {
            try {
                urls.add(Paths.get(entry).toUri().toURL());
            } catch (MalformedURLException e) {
                throw new IllegalArgumentException("Bad classpath entry: " + entry, e);
            }
        }
        return new URLClassLoader(urls.toArray(new URL[0]), own);
    }

    /** The program does not compile even without instrumentation. */
    public static class SourceCompileException extends RuntimeException {
        public SourceCompileException(String message) { super(message); }
        public SourceCompileException(String message, Throwable cause) { super(message, cause); }
    }

    /** The program ran and threw. */
    public static class ProgramFailedException extends RuntimeException {
        public ProgramFailedException(String message) { super(message); }
        public ProgramFailedException(String message, Throwable cause) { super(message, cause); }
    }
}

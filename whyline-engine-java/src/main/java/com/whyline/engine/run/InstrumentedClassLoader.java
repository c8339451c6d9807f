package com.whyline.engine.run;

import com.whyline.recorder.RecorderProvider;
import com.whyline.recorder.TraceRecorder;

import java.util.Map;

/**
 * Defines the classes of one compiled program, child-first, and hands instrumented code
 * the recorder of its run through {@link RecorderProvider}.
 */
public class InstrumentedClassLoader extends ClassLoader implements RecorderProvider {

    static {
        registerAsParallelCapable();
    }

    private final Map<String, byte[]> classes;
    private final TraceRecorder recorder;
    private final String sourceFile;

    public InstrumentedClassLoader(Map<String, byte[]> classes, TraceRecorder recorder,
                                   String sourceFile, ClassLoader parent) {
        super(parent);
        this.classes = Map.copyOf(classes);
        this.recorder = recorder;
        this.sourceFile = sourceFile;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        byte[] bytes = classes.get(name);
        if (bytes == null) {
            return super.loadClass(name, resolve);
        }
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c == null) {
                c = defineClass(name, bytes, 0, bytes.length);
            }
            if (resolve) resolveClass(c);
            return c;
        }
    }

    @Override
    public TraceRecorder traceRecorder() {
        return recorder;
    }

    /** Every class here comes from the same source file. */
    @Override
    public String sourceFileOf(Class<?> type) {
        return sourceFile;
    }
}

package com.whyline.engine.config;

import com.google.gson.annotations.SerializedName;
import com.whyline.recorder.RecorderConfig;

import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of the engine's JSON configuration file. Every key is optional.
 */
public class EngineConfig {

    /** Weave bytecode {@code call} advice into the program (default: false). */
    @SerializedName("call_tracing")
    private Boolean callTracing;

    /** Run the uninstrumented program when instrumentation fails (default: false). */
    @SerializedName("fallback_to_original")
    private Boolean fallbackToOriginal;

    /** Extra classpath entries for compiling and running the program. */
    @SerializedName("classpath")
    private List<String> classpath;

    /** Arguments passed to the program's main method. */
    @SerializedName("program_args")
    private List<String> programArgs;

    /** Where the binary trace is saved after a run. */
    @SerializedName("trace_output")
    private String traceOutput;

    /** Where the JSON rendering of the trace is written after a run. */
    @SerializedName("json_output")
    private String jsonOutput;

    /** Recorder options, e.g. {@code "locals=true,depth=3"}. */
    @SerializedName("recorder")
    private String recorder;

    public boolean isCallTracing()          { return callTracing != null && callTracing; }
    public boolean isFallbackToOriginal()   { return fallbackToOriginal != null && fallbackToOriginal; }
    public List<String> getClasspath()      { return classpath   != null ? classpath   : Collections.emptyList(); }
    public List<String> getProgramArgs()    { return programArgs != null ? programArgs : Collections.emptyList(); }
    public String getTraceOutput()          { return traceOutput; }
    public String getJsonOutput()           { return jsonOutput; }
    public String getRecorder()             { return recorder; }

    /** Recorder settings from the {@code recorder} key; defaults when absent. */
    public RecorderConfig recorderConfig() {
        return recorder == null ? RecorderConfig.defaults() : RecorderConfig.parse(recorder);
    }
}

package com.whyline.engine.instrument;

/**
 * Result of instrumenting one program.
 *
 * @param prepared   the program as parsed before instrumentation
 * @param text       instrumented source
 * @param probeCount number of recorder calls inserted
 */
public record InstrumentedSource(PreparedSource prepared, String text, int probeCount) {

    public String fileName() {
        return prepared.fileName();
    }

    public boolean script() {
        return prepared.script();
    }

    public String entryTypeName() {
        return prepared.entryTypeName();
    }

    public String compilationUnitPath() {
        return prepared.compilationUnitPath();
    }
}

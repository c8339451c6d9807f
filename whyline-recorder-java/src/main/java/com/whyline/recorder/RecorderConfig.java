package com.whyline.recorder;

/**
 * Recorder options.
 *
 * Parsed from key=value pairs separated by commas, e.g. the {@code whyline.recorder}
 * system property:
 *   locals      : "true"/"false" capture local snapshots (default: true)
 *   globals     : "true"/"false" capture static and receiver fields (default: true)
 *   depth       : render depth limit for the JSON export (default: 2)
 *   max_elements: max collection elements rendered (default: 3)
 *   output      : file the process-wide recorder dumps its trace to as JSON on shutdown
 *                  (default: none)
 */
public record RecorderConfig(
    boolean captureLocals,
    boolean captureGlobals,
    int depthLimit,
    int maxCollectionElements,
    String outputPath
) {

    public static final String SYSTEM_PROPERTY = "whyline.recorder";

    public static RecorderConfig defaults() {
        return new RecorderConfig(true, true, 2, 3, null);
    }

    public static RecorderConfig fromSystemProperties() {
        return parse(System.getProperty(SYSTEM_PROPERTY));
    }

    public static RecorderConfig parse(String args) {
        boolean captureLocals = true;
        boolean captureGlobals = true;
        int depthLimit = 2;
        int maxCollectionElements = 3;
        String outputPath = null;

        if (args != null && !args.isBlank()) {
            for (String part : args.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length != 2) continue;
                String value = kv[1].trim();
                switch (kv[0].trim()) {
                    case "locals"       -> captureLocals  = !"false".equalsIgnoreCase(value);
                    case "globals"      -> captureGlobals = !"false".equalsIgnoreCase(value);
                    case "depth"        -> depthLimit = parseInt(value, depthLimit);
                    case "max_elements" -> maxCollectionElements = parseInt(value, maxCollectionElements);
                    case "output"       -> outputPath = value.isEmpty() ? null : value;
                    default -> System.err.println("[whyline-recorder] WARN: ignoring unknown option: " + kv[0].trim());
                }
            }
        }
        return new RecorderConfig(captureLocals, captureGlobals, depthLimit, maxCollectionElements, outputPath);
    }

    public RenderLimits renderLimits() {
        return new RenderLimits(depthLimit, maxCollectionElements);
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            System.err.println("[whyline-recorder] WARN: not a number: " + value + ", using " + fallback);
            return fallback;
        }
    }
}

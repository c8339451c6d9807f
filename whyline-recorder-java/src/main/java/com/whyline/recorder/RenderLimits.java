package com.whyline.recorder;

/**
 * Limits for {@link ValueRenderer}, sourced from the recorder options.
 */
public class RenderLimits {

    /** Maximum object graph depth to recurse. At this depth, emit the type name only. */
    public final int depthLimit;

    /** Maximum collection elements to render before truncating. */
    public final int maxCollectionElements;

    public RenderLimits(int depthLimit, int maxCollectionElements) {
        this.depthLimit = depthLimit;
        this.maxCollectionElements = maxCollectionElements;
    }

    public static RenderLimits defaults() {
        return new RenderLimits(2, 3);
    }
}

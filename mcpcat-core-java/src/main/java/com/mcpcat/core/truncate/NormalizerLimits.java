package com.mcpcat.core.truncate;

/**
 * Limits for one {@link Normalizer} pass.
 */
public class NormalizerLimits {

    /** Containers at this nesting depth are replaced by {@code [Object]} / {@code [Array]}. */
    public final int depthLimit;

    /** Maximum entries kept per object or array before the {@code [MaxProperties ~]} sentinel. */
    public final int maxBreadth;

    /** Strings longer than this are cut and suffixed with {@code ...}. */
    public final int maxStringLength;

    public NormalizerLimits(int depthLimit, int maxBreadth, int maxStringLength) {
        this.depthLimit = depthLimit;
        this.maxBreadth = maxBreadth;
        this.maxStringLength = maxStringLength;
    }

    public static NormalizerLimits defaults() {
        return new NormalizerLimits(
            TruncationLimits.MAX_DEPTH,
            TruncationLimits.MAX_BREADTH,
            TruncationLimits.MAX_STRING_LENGTH);
    }

    public NormalizerLimits withDepth(int depth) {
        return new NormalizerLimits(depth, maxBreadth, maxStringLength);
    }
}

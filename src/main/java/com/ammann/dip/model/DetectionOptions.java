/* (C)2026 */
package com.ammann.dip.model;

/**
 * Tunable parameters of single-segment classification.
 *
 * @param preWindow       samples before the segment used as local context
 * @param postWindow      samples after the segment used as local context and for recovery
 * @param minWidth        minimal segment width in samples
 * @param k               depth threshold multiplier applied to the local MAD
 * @param minAbsDepth     absolute floor of the depth threshold
 * @param requireRecovery whether the signal must return near the baseline after the segment
 * @param n0              data volume at which the global baseline gains weight,
 *                        {@code alpha = 1 - exp(-N / n0)}
 */
public record DetectionOptions(
        int preWindow,
        int postWindow,
        int minWidth,
        double k,
        double minAbsDepth,
        boolean requireRecovery,
        int n0) {

    public static final int DEFAULT_PRE_WINDOW = 50;
    public static final int DEFAULT_POST_WINDOW = 50;
    public static final int DEFAULT_MIN_WIDTH = 2;
    public static final double DEFAULT_K = 0.25;
    public static final double DEFAULT_MIN_ABS_DEPTH = 0.0;
    public static final int DEFAULT_N0 = 200;

    public DetectionOptions {
        if (preWindow < 0 || postWindow < 0) {
            throw new IllegalArgumentException("Context windows must not be negative");
        }
        if (n0 <= 0) {
            throw new IllegalArgumentException("n0 must be positive, got " + n0);
        }
    }

    /** Options with the documented defaults. */
    public static DetectionOptions defaults() {
        return new DetectionOptions(
                DEFAULT_PRE_WINDOW,
                DEFAULT_POST_WINDOW,
                DEFAULT_MIN_WIDTH,
                DEFAULT_K,
                DEFAULT_MIN_ABS_DEPTH,
                true,
                DEFAULT_N0);
    }

    public DetectionOptions withMinWidth(int value) {
        return new DetectionOptions(preWindow, postWindow, value, k, minAbsDepth, requireRecovery, n0);
    }

    public DetectionOptions withK(double value) {
        return new DetectionOptions(preWindow, postWindow, minWidth, value, minAbsDepth, requireRecovery, n0);
    }

    public DetectionOptions withWindows(int pre, int post) {
        return new DetectionOptions(pre, post, minWidth, k, minAbsDepth, requireRecovery, n0);
    }

    public DetectionOptions withRequireRecovery(boolean value) {
        return new DetectionOptions(preWindow, postWindow, minWidth, k, minAbsDepth, value, n0);
    }
}

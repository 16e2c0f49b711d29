/* (C)2026 */
package com.ammann.dip.model;

import java.util.List;

/**
 * Tunable parameters of multi-scale dip discovery.
 *
 * <p>{@code preWindow} and {@code postWindow} may be {@code null}, in which case they
 * are derived from the series length. {@code scaleFactors} may be {@code null} to let
 * the discoverer pick them from the series length.
 */
public record DiscoveryOptions(
        int smoothingWindow,
        double minProminenceFactor,
        Integer preWindow,
        Integer postWindow,
        int minWidth,
        double k,
        double minAbsDepth,
        boolean requireRecovery,
        int n0,
        int maxDips,
        boolean multiScale,
        List<Integer> scaleFactors) {

    public static final int DEFAULT_SMOOTHING_WINDOW = 3;
    public static final double DEFAULT_MIN_PROMINENCE_FACTOR = 0.3;
    public static final int DEFAULT_MAX_DIPS = 50;

    public DiscoveryOptions {
        scaleFactors = scaleFactors == null ? null : List.copyOf(scaleFactors);
    }

    /** Options with the documented defaults. */
    public static DiscoveryOptions defaults() {
        return new DiscoveryOptions(
                DEFAULT_SMOOTHING_WINDOW,
                DEFAULT_MIN_PROMINENCE_FACTOR,
                null,
                null,
                DetectionOptions.DEFAULT_MIN_WIDTH,
                DetectionOptions.DEFAULT_K,
                DetectionOptions.DEFAULT_MIN_ABS_DEPTH,
                true,
                DetectionOptions.DEFAULT_N0,
                DEFAULT_MAX_DIPS,
                true,
                null);
    }

    public DiscoveryOptions withMultiScale(boolean value) {
        return new DiscoveryOptions(smoothingWindow, minProminenceFactor, preWindow, postWindow,
                minWidth, k, minAbsDepth, requireRecovery, n0, maxDips, value, scaleFactors);
    }

    public DiscoveryOptions withScaleFactors(List<Integer> value) {
        return new DiscoveryOptions(smoothingWindow, minProminenceFactor, preWindow, postWindow,
                minWidth, k, minAbsDepth, requireRecovery, n0, maxDips, multiScale, value);
    }

    public DiscoveryOptions withMaxDips(int value) {
        return new DiscoveryOptions(smoothingWindow, minProminenceFactor, preWindow, postWindow,
                minWidth, k, minAbsDepth, requireRecovery, n0, value, multiScale, scaleFactors);
    }

    public DiscoveryOptions withSmoothingWindow(int value) {
        return new DiscoveryOptions(value, minProminenceFactor, preWindow, postWindow,
                minWidth, k, minAbsDepth, requireRecovery, n0, maxDips, multiScale, scaleFactors);
    }

    /**
     * Classification options for one candidate, using the resolved context windows and
     * the scale-adjusted minimum width.
     */
    public DetectionOptions toDetectionOptions(int pre, int post, int scaledMinWidth) {
        return new DetectionOptions(pre, post, scaledMinWidth, k, minAbsDepth, requireRecovery, n0);
    }
}

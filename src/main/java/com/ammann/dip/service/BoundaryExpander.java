package com.ammann.dip.service;

import com.ammann.dip.model.Segment;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Grows a local minimum into a dip segment by walking outwards until the signal
 * crosses back above a level between the minimum and the baseline.
 */
@ApplicationScoped
public class BoundaryExpander
{

    public static final double DEFAULT_THRESHOLD_FACTOR = 0.3;

    private static final double EPSILON = 1e-9;

    /**
     * Expands around {@code minIndex} using the default threshold factor of 0.3.
     */
    public Segment expand(double[] series, int minIndex, double baseline)
    {
        return expand(series, minIndex, baseline, DEFAULT_THRESHOLD_FACTOR);
    }

    /**
     * Expands around {@code minIndex} to the nearest samples at or above the crossing
     * level {@code baseline - adaptiveFactor * depth}.
     *
     * <p>The segment starts right after the first such sample on the left (index 0 if
     * none) and ends right before the first such sample on the right (the last index if
     * none).
     *
     * @param series          samples, not modified
     * @param minIndex        index of the minimum
     * @param baseline        reference level
     * @param thresholdFactor fraction of the depth kept below the baseline as crossing level
     * @return inclusive segment containing {@code minIndex}
     */
    public Segment expand(double[] series, int minIndex, double baseline, double thresholdFactor)
    {
        if (minIndex < 0 || minIndex >= series.length) {
            throw new IllegalArgumentException(
                    String.format("Minimum index %d outside series of length %d", minIndex, series.length));
        }

        double depth = baseline - series[minIndex];
        double crossingLevel = baseline - adaptiveFactor(depth, baseline, thresholdFactor) * depth;

        int start = 0;
        for (int i = minIndex - 1; i >= 0; i--) {
            if (series[i] >= crossingLevel) {
                start = i + 1;
                break;
            }
        }

        int end = series.length - 1;
        for (int i = minIndex + 1; i < series.length; i++) {
            if (series[i] >= crossingLevel) {
                end = i - 1;
                break;
            }
        }

        return new Segment(start, end);
    }

    /**
     * Crossing factor, scaled by the depth relative to the baseline magnitude and
     * capped at {@code thresholdFactor}; exactly {@code thresholdFactor} for non-positive depths.
     */
    static double adaptiveFactor(double depth, double baseline, double thresholdFactor)
    {
        if (depth <= 0) {
            return thresholdFactor;
        }
        return Math.min(thresholdFactor, thresholdFactor * (1 + depth / (baseline + EPSILON)));
    }
}

/* (C)2026 */
package com.ammann.dip.statistics;

import java.util.Arrays;

/**
 * Robust location and scale estimators used by the dip detection engine.
 *
 * <p>All methods are pure: input arrays are never modified, sorting always happens
 * on a copy. Results are identical regardless of the order of the input samples.
 */
public final class RobustStatistics {

    /** Default fraction trimmed from each end by {@link #trimmedMean(double[])}. */
    public static final double DEFAULT_TRIM_FRACTION = 0.1;

    /** Ratio between the interquartile range and the MAD of a normal distribution. */
    public static final double IQR_TO_MAD = 1.349;

    /** Smallest scale estimate ever returned. */
    public static final double MIN_SCALE = 1e-9;

    private RobustStatistics() {}

    /**
     * Order-statistic median.
     *
     * @param values samples
     * @return the middle sample, the mean of the two middle samples for even lengths,
     *     or {@code NaN} for an empty array
     */
    public static double median(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = sortedCopy(values);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /** Arithmetic mean, {@code 0.0} for an empty array. */
    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Trimmed mean with the default 10 % trim fraction.
     *
     * @see #trimmedMean(double[], double)
     */
    public static double trimmedMean(double[] values) {
        return trimmedMean(values, DEFAULT_TRIM_FRACTION);
    }

    /**
     * Mean of the samples left after removing {@code max(1, floor(n * trimFraction))}
     * samples from each end of the sorted input.
     *
     * <p>Inputs with fewer than three samples return their plain mean (0 when empty).
     * If trimming would remove every sample the untrimmed mean is returned.
     *
     * @param values       samples
     * @param trimFraction fraction trimmed from each end
     * @return the trimmed mean
     */
    public static double trimmedMean(double[] values, double trimFraction) {
        if (values.length < 3) {
            return mean(values);
        }
        double[] sorted = sortedCopy(values);
        int trimCount = Math.max(1, (int) Math.floor(sorted.length * trimFraction));
        int from = trimCount;
        int to = sorted.length - trimCount;
        if (to <= from) {
            return mean(values);
        }
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += sorted[i];
        }
        return sum / (to - from);
    }

    /** Median absolute deviation around the median. */
    public static double mad(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return mad(values, median(values));
    }

    /**
     * Median of {@code |v - center|}.
     *
     * @param values samples
     * @param center reference location
     * @return the MAD, {@code 0.0} for an empty array
     */
    public static double mad(double[] values, double center) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        return median(deviations);
    }

    /**
     * Quantile with linear interpolation between the closest ranks, the sample
     * position being {@code q * (n - 1)} in the sorted input.
     *
     * @param values non-empty samples
     * @param q      probability in [0, 1]
     * @return the interpolated quantile, {@code NaN} for an empty array
     */
    public static double quantile(double[] values, double q) {
        if (values.length == 0) {
            return Double.NaN;
        }
        if (q < 0.0 || q > 1.0) {
            throw new IllegalArgumentException("Quantile must be within [0, 1], got " + q);
        }
        double[] sorted = sortedCopy(values);
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    /** Mean of {@code |v - mean(values)|}, {@code 0.0} for an empty array. */
    public static double meanAbsoluteDeviation(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            sum += Math.abs(v - mean);
        }
        return sum / values.length;
    }

    /**
     * Strictly positive scale estimate around {@code center}.
     *
     * <p>Uses the MAD; when it is zero, falls back to {@code IQR / 1.349}, then to the
     * mean absolute deviation, and finally to {@link #MIN_SCALE}.
     *
     * @param values samples
     * @param center reference location for the MAD
     * @return a scale estimate greater than zero
     */
    public static double robustScale(double[] values, double center) {
        double scale = mad(values, center);
        if (scale != 0.0) {
            return scale;
        }
        if (values.length == 0) {
            return MIN_SCALE;
        }
        double iqr = quantile(values, 0.75) - quantile(values, 0.25);
        if (iqr > 0.0) {
            return iqr / IQR_TO_MAD;
        }
        double meanAbsoluteDeviation = meanAbsoluteDeviation(values);
        return meanAbsoluteDeviation > 0.0 ? meanAbsoluteDeviation : MIN_SCALE;
    }

    /**
     * Whole-series scale used to derive prominence floors: the MAD around the median,
     * or a sixth of the range when the MAD is zero, or {@link #MIN_SCALE} for a flat series.
     */
    public static double globalScale(double[] values) {
        if (values.length == 0) {
            return MIN_SCALE;
        }
        double scale = mad(values, median(values));
        if (scale != 0.0) {
            return scale;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double rangeScale = (max - min) / 6.0;
        return rangeScale != 0.0 ? rangeScale : MIN_SCALE;
    }

    /**
     * Moving median with edge padding. Each output sample is the median of the
     * {@code window} samples starting {@code window / 2} positions to its left, indices
     * outside the series being clamped to the first or last sample.
     *
     * @param values samples
     * @param window window width; values of 1 or less return a copy of the input
     * @return smoothed series of the same length
     */
    public static double[] movingMedian(double[] values, int window) {
        if (window <= 1 || values.length == 0) {
            return values.clone();
        }
        int pad = window / 2;
        int last = values.length - 1;
        double[] result = new double[values.length];
        double[] buffer = new double[window];
        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < window; j++) {
                int idx = Math.min(last, Math.max(0, i - pad + j));
                buffer[j] = values[idx];
            }
            result[i] = median(buffer);
        }
        return result;
    }

    /** Minimum sample, {@code NaN} for an empty array. */
    public static double min(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double min = values[0];
        for (double v : values) {
            min = Math.min(min, v);
        }
        return min;
    }

    private static double[] sortedCopy(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return sorted;
    }
}

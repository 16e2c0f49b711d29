package com.ammann.dip.service;

import com.ammann.dip.enumeration.RejectionReason;
import com.ammann.dip.model.DetectionOptions;
import com.ammann.dip.model.DipClassification;
import com.ammann.dip.model.DipMetrics;
import com.ammann.dip.statistics.RobustStatistics;
import com.ammann.dip.statistics.SeriesEdge;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Arrays;

/**
 * Classifies an explicit segment of a series as a dip or not.
 *
 * <p>The depth of the segment minimum is measured against a baseline that blends a
 * local estimate (trimmed mean of the samples around the segment) with a global one
 * (trimmed mean of the whole series without the segment). The blend weight
 * {@code alpha = 1 - exp(-N / n0)} moves towards the global estimate as more data is
 * available. A segment is a dip when its depth reaches {@code max(minAbsDepth, k * MAD)}
 * and, optionally, the signal recovers towards the baseline afterwards.
 *
 * <p>Every call is a pure function of its arguments.
 */
@ApplicationScoped
public class DipClassifierService
{

    private static final Logger LOG = Logger.getLogger(DipClassifierService.class);

    private static final int MIN_LOCAL_CONTEXT = 5;
    private static final int MIN_FALLBACK_CONTEXT = 3;

    // Confidence weighting and squashing. Empirical, tune with care.
    static final double DEPTH_WEIGHT = 0.4;
    static final double AREA_WEIGHT = 0.3;
    static final double PROMINENCE_WEIGHT = 0.3;
    static final double CONFIDENCE_SQUASH_DIVISOR = 3.0;
    static final double CONFIDENCE_GAIN = 1.2;
    private static final double SCORE_EPSILON = 1e-12;

    // Recovery heuristics
    static final double RECOVERY_EPSILON_FACTOR = 0.5;
    static final double EXTENDED_RECOVERY_RATIO = 3.0;
    static final double RELAXED_RECOVERY_RATIO = 5.0;
    static final double GRADUAL_RECOVERY_FRACTION = 0.3;
    private static final int MIN_POST_FOR_GRADUAL_RECOVERY = 5;

    /**
     * Classifies {@code [start, end]} with the default options.
     *
     * @see #detectDip(double[], int, int, DetectionOptions)
     */
    public DipClassification detectDip(double[] series, int start, int end)
    {
        return detectDip(series, start, end, DetectionOptions.defaults());
    }

    /**
     * Classifies the inclusive segment {@code [start, end]} of {@code series}.
     *
     * @param series  samples, not modified
     * @param start   first index of the segment
     * @param end     last index of the segment
     * @param options classification parameters
     * @return the verdict and the metrics behind it
     * @throws IllegalArgumentException if {@code start < 0}, {@code end >= series.length}
     *                                  or {@code end < start}
     */
    public DipClassification detectDip(double[] series, int start, int end, DetectionOptions options)
    {
        int n = series.length;
        if (start < 0 || end >= n || end < start) {
            throw new IllegalArgumentException(String.format(
                    "Invalid segment bounds: start=%d, end=%d, series length=%d", start, end, n));
        }

        int width = end - start + 1;
        if (width < options.minWidth()) {
            LOG.debugf("Segment [%d, %d] rejected: width %d below minimum %d", start, end, width, options.minWidth());
            return new DipClassification(false, DipMetrics.widthBelowMinimum(
                    start, end, options.minWidth(), options.k(), options.minAbsDepth()));
        }

        double[] segment = Arrays.copyOfRange(series, start, end + 1);
        double[] pre = Arrays.copyOfRange(series, Math.max(0, start - options.preWindow()), start);
        double[] post = Arrays.copyOfRange(series, end + 1, Math.min(n, end + 1 + options.postWindow()));
        double[] outside = withoutSegment(series, start, end);

        boolean ongoing = SeriesEdge.isLiveEdge(end, n) || post.length == 0;

        double[] localContext = localContext(series, pre, post, outside, ongoing, options.minWidth());
        double localMedian = RobustStatistics.trimmedMean(localContext);
        double localMad = RobustStatistics.robustScale(localContext, localMedian);

        double[] globalContext = outside.length == 0 ? series : outside;
        double globalMedian = RobustStatistics.trimmedMean(globalContext);

        double alpha = 1 - Math.exp(-n / (double) options.n0());
        double baseline;
        if (ongoing || localMedian > globalMedian) {
            baseline = Math.max(localMedian, globalMedian);
        } else {
            baseline = alpha * globalMedian + (1 - alpha) * localMedian;
        }

        int segMinOffset = 0;
        for (int i = 1; i < segment.length; i++) {
            if (segment[i] < segment[segMinOffset]) {
                segMinOffset = i;
            }
        }
        double segMin = segment[segMinOffset];
        double depth = baseline - segMin;
        double depthThreshold = Math.max(options.minAbsDepth(), options.k() * localMad);
        boolean passesDepth = depth >= depthThreshold;

        double leftReference = pre.length > 0 ? RobustStatistics.trimmedMean(pre) : baseline;
        double rightReference = post.length > 0 ? RobustStatistics.trimmedMean(post) : baseline;
        double prominence = (leftReference + rightReference) / 2.0 - segMin;

        boolean recovered = true;
        if (options.requireRecovery() && post.length > 0) {
            recovered = hasRecovered(series, end, post, baseline, segMin, depth, depthThreshold,
                    localMad, options.postWindow());
        }

        double area = 0.0;
        for (double v : segment) {
            area += baseline - v;
        }

        double confidence = confidence(depth, area, prominence, localMad, width);
        boolean dip = passesDepth && recovered;

        RejectionReason reason = null;
        if (!passesDepth) {
            reason = RejectionReason.DEPTH_BELOW_THRESHOLD;
        } else if (options.requireRecovery() && !recovered) {
            reason = RejectionReason.NO_RECOVERY;
        }

        DipMetrics metrics = DipMetrics.builder()
                .start(start)
                .end(end)
                .width(width)
                .baseline(baseline)
                .localMedian(localMedian)
                .globalMedian(globalMedian)
                .localMad(localMad)
                .alpha(alpha)
                .segMin(segMin)
                .segMinIndex(start + segMinOffset)
                .depth(depth)
                .depthThreshold(depthThreshold)
                .prominence(prominence)
                .area(area)
                .recovered(recovered)
                .ongoing(ongoing)
                .confidence(confidence)
                .dip(dip)
                .k(options.k())
                .minAbsDepth(options.minAbsDepth())
                .minWidth(options.minWidth())
                .reason(reason)
                .build();

        LOG.debugf("Segment [%d, %d]: dip=%s depth=%.4g threshold=%.4g confidence=%.3f",
                start, end, dip, depth, depthThreshold, confidence);
        return new DipClassification(dip, metrics);
    }

    /**
     * Samples used for the local baseline: pre and post context (post left out for
     * ongoing segments), widened to the series without the segment, and finally to the
     * whole series when too few samples remain.
     */
    private double[] localContext(double[] series, double[] pre, double[] post, double[] outside,
                                  boolean ongoing, int minWidth)
    {
        double[] context = ongoing ? pre : concat(pre, post);
        if (context.length < Math.max(MIN_LOCAL_CONTEXT, minWidth)) {
            LOG.debugf("Local context of %d samples too small, using series without segment", context.length);
            context = outside;
        }
        if (context.length < MIN_FALLBACK_CONTEXT) {
            LOG.debugf("Context of %d samples too small, using whole series", context.length);
            context = series;
        }
        return context;
    }

    /**
     * Recovery check. Moderate dips must come back within {@code 0.5 * MAD} of the
     * baseline inside the post window, or show a gradual climb away from the minimum.
     * Dips deeper than three thresholds get twice the post window, and dips deeper than
     * five thresholds additionally get a tolerance of one MAD. Each deeper tier accepts
     * everything a shallower one does, so the verdict stays monotonic in {@code k}.
     */
    private boolean hasRecovered(double[] series, int end, double[] post, double baseline, double segMin,
                                 double depth, double depthThreshold, double localMad, int postWindow)
    {
        double epsilon = RECOVERY_EPSILON_FACTOR * localMad;
        double depthRatio = depthRatio(depth, depthThreshold);

        if (depthRatio > EXTENDED_RECOVERY_RATIO) {
            double[] extended = Arrays.copyOfRange(series, end + 1,
                    Math.min(series.length, end + 1 + 2 * postWindow));
            if (anyWithin(extended, baseline, epsilon)) {
                return true;
            }
            if (depthRatio > RELAXED_RECOVERY_RATIO && anyWithin(extended, baseline, localMad)) {
                return true;
            }
            return isGraduallyRecovering(post, segMin, depth);
        }

        if (anyWithin(post, baseline, epsilon)) {
            return true;
        }
        return isGraduallyRecovering(post, segMin, depth);
    }

    /** Depth in units of the threshold; unbounded for a zero threshold. */
    static double depthRatio(double depth, double depthThreshold)
    {
        if (depthThreshold > 0) {
            return depth / depthThreshold;
        }
        return depth > 0 ? Double.POSITIVE_INFINITY : 0.0;
    }

    /**
     * Accepts a slow recovery when the second half of the post window sits at least
     * {@code 0.3 * depth} further from the minimum, on average, than the first half.
     */
    private boolean isGraduallyRecovering(double[] post, double segMin, double depth)
    {
        if (post.length < MIN_POST_FOR_GRADUAL_RECOVERY) {
            return false;
        }
        int half = post.length / 2;
        if (half < 2 || post.length - half < 2) {
            return false;
        }
        double distFirst = meanDistance(post, 0, half, segMin);
        double distSecond = meanDistance(post, half, post.length, segMin);
        return distSecond - distFirst >= GRADUAL_RECOVERY_FRACTION * depth;
    }

    /**
     * Bounded confidence: a weighted sum of depth, mean area and prominence, each in
     * units of the local MAD, squashed with {@code tanh(raw / 3) * 1.2} and clamped to [0, 1].
     */
    static double confidence(double depth, double area, double prominence, double localMad, int width)
    {
        double scale = localMad + SCORE_EPSILON;
        double depthScore = depth / scale;
        double areaScore = area / (scale * width);
        double prominenceScore = prominence / scale;
        double raw = DEPTH_WEIGHT * depthScore + AREA_WEIGHT * areaScore + PROMINENCE_WEIGHT * prominenceScore;
        double squashed = Math.tanh(raw / CONFIDENCE_SQUASH_DIVISOR) * CONFIDENCE_GAIN;
        return Math.max(0.0, Math.min(1.0, squashed));
    }

    private static boolean anyWithin(double[] values, double target, double tolerance)
    {
        for (double v : values) {
            if (Math.abs(v - target) <= tolerance) {
                return true;
            }
        }
        return false;
    }

    private static double meanDistance(double[] values, int from, int to, double reference)
    {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += Math.abs(values[i] - reference);
        }
        return sum / (to - from);
    }

    private static double[] withoutSegment(double[] series, int start, int end)
    {
        double[] result = new double[series.length - (end - start + 1)];
        System.arraycopy(series, 0, result, 0, start);
        System.arraycopy(series, end + 1, result, start, series.length - end - 1);
        return result;
    }

    private static double[] concat(double[] first, double[] second)
    {
        double[] result = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, result, first.length, second.length);
        return result;
    }
}

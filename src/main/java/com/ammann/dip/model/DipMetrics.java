/* (C)2026 */
package com.ammann.dip.model;

import com.ammann.dip.enumeration.DetectionScale;
import com.ammann.dip.enumeration.RejectionReason;
import java.util.List;

/**
 * Measurements produced by classifying one segment.
 *
 * <p>{@code depth == baseline - segMin} always holds and {@code confidence} lies in
 * [0, 1]. Segments rejected for being too narrow carry {@code NaN} measurements, since
 * nothing beyond the width is computed for them.
 *
 * <p>The scale fields ({@code scaleFactor}, {@code detectionScale},
 * {@code detectedAtScales}, {@code scaleList}) are only filled in by multi-scale
 * discovery and are {@code null} otherwise.
 */
public record DipMetrics(
        int start,
        int end,
        int width,
        double baseline,
        double localMedian,
        double globalMedian,
        double localMad,
        double alpha,
        double segMin,
        int segMinIndex,
        double depth,
        double depthThreshold,
        double prominence,
        double area,
        boolean recovered,
        boolean ongoing,
        double confidence,
        boolean dip,
        double k,
        double minAbsDepth,
        int minWidth,
        RejectionReason reason,
        Integer scaleFactor,
        DetectionScale detectionScale,
        Integer detectedAtScales,
        List<Integer> scaleList) {

    public DipMetrics {
        scaleList = scaleList == null ? null : List.copyOf(scaleList);
    }

    /** Metrics for a segment rejected by the width gate before any measurement. */
    public static DipMetrics widthBelowMinimum(int start, int end, int minWidth, double k, double minAbsDepth) {
        return builder()
                .start(start)
                .end(end)
                .width(end - start + 1)
                .baseline(Double.NaN)
                .localMedian(Double.NaN)
                .globalMedian(Double.NaN)
                .localMad(Double.NaN)
                .alpha(Double.NaN)
                .segMin(Double.NaN)
                .segMinIndex(-1)
                .depth(Double.NaN)
                .depthThreshold(Double.NaN)
                .prominence(Double.NaN)
                .area(Double.NaN)
                .confidence(0.0)
                .k(k)
                .minAbsDepth(minAbsDepth)
                .minWidth(minWidth)
                .reason(RejectionReason.WIDTH_BELOW_MIN)
                .build();
    }

    /** Copy tagged with the smoothing scale that produced it. */
    public DipMetrics withScaleFactor(int factor) {
        return toBuilder()
                .scaleFactor(factor)
                .detectionScale(DetectionScale.forScaleFactor(factor))
                .build();
    }

    /** Copy carrying the distinct scales that confirmed it and a possibly boosted confidence. */
    public DipMetrics withScaleSummary(List<Integer> scales, double boostedConfidence) {
        return toBuilder()
                .scaleList(scales)
                .detectedAtScales(scales.size())
                .confidence(boostedConfidence)
                .build();
    }

    /** Copy with a new confidence. */
    public DipMetrics withConfidence(double value) {
        return toBuilder().confidence(value).build();
    }

    /** Copy with new bounds; width follows the bounds. */
    public DipMetrics withBounds(int newStart, int newEnd) {
        return toBuilder().start(newStart).end(newEnd).width(newEnd - newStart + 1).build();
    }

    /** Copy with a new ongoing flag. */
    public DipMetrics withOngoing(boolean value) {
        return toBuilder().ongoing(value).build();
    }

    /** Copy with every index moved by {@code offset}. */
    public DipMetrics shiftedBy(int offset) {
        return toBuilder()
                .start(start + offset)
                .end(end + offset)
                .segMinIndex(segMinIndex < 0 ? segMinIndex : segMinIndex + offset)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .start(start)
                .end(end)
                .width(width)
                .baseline(baseline)
                .localMedian(localMedian)
                .globalMedian(globalMedian)
                .localMad(localMad)
                .alpha(alpha)
                .segMin(segMin)
                .segMinIndex(segMinIndex)
                .depth(depth)
                .depthThreshold(depthThreshold)
                .prominence(prominence)
                .area(area)
                .recovered(recovered)
                .ongoing(ongoing)
                .confidence(confidence)
                .dip(dip)
                .k(k)
                .minAbsDepth(minAbsDepth)
                .minWidth(minWidth)
                .reason(reason)
                .scaleFactor(scaleFactor)
                .detectionScale(detectionScale)
                .detectedAtScales(detectedAtScales)
                .scaleList(scaleList);
    }

    /** Fluent builder, mainly used by the classifier and by the copy methods above. */
    public static final class Builder {
        private int start;
        private int end;
        private int width;
        private double baseline;
        private double localMedian;
        private double globalMedian;
        private double localMad;
        private double alpha;
        private double segMin;
        private int segMinIndex;
        private double depth;
        private double depthThreshold;
        private double prominence;
        private double area;
        private boolean recovered;
        private boolean ongoing;
        private double confidence;
        private boolean dip;
        private double k;
        private double minAbsDepth;
        private int minWidth;
        private RejectionReason reason;
        private Integer scaleFactor;
        private DetectionScale detectionScale;
        private Integer detectedAtScales;
        private List<Integer> scaleList;

        private Builder() {}

        public Builder start(int value) { this.start = value; return this; }
        public Builder end(int value) { this.end = value; return this; }
        public Builder width(int value) { this.width = value; return this; }
        public Builder baseline(double value) { this.baseline = value; return this; }
        public Builder localMedian(double value) { this.localMedian = value; return this; }
        public Builder globalMedian(double value) { this.globalMedian = value; return this; }
        public Builder localMad(double value) { this.localMad = value; return this; }
        public Builder alpha(double value) { this.alpha = value; return this; }
        public Builder segMin(double value) { this.segMin = value; return this; }
        public Builder segMinIndex(int value) { this.segMinIndex = value; return this; }
        public Builder depth(double value) { this.depth = value; return this; }
        public Builder depthThreshold(double value) { this.depthThreshold = value; return this; }
        public Builder prominence(double value) { this.prominence = value; return this; }
        public Builder area(double value) { this.area = value; return this; }
        public Builder recovered(boolean value) { this.recovered = value; return this; }
        public Builder ongoing(boolean value) { this.ongoing = value; return this; }
        public Builder confidence(double value) { this.confidence = value; return this; }
        public Builder dip(boolean value) { this.dip = value; return this; }
        public Builder k(double value) { this.k = value; return this; }
        public Builder minAbsDepth(double value) { this.minAbsDepth = value; return this; }
        public Builder minWidth(int value) { this.minWidth = value; return this; }
        public Builder reason(RejectionReason value) { this.reason = value; return this; }
        public Builder scaleFactor(Integer value) { this.scaleFactor = value; return this; }
        public Builder detectionScale(DetectionScale value) { this.detectionScale = value; return this; }
        public Builder detectedAtScales(Integer value) { this.detectedAtScales = value; return this; }
        public Builder scaleList(List<Integer> value) { this.scaleList = value; return this; }

        public DipMetrics build() {
            return new DipMetrics(
                    start, end, width, baseline, localMedian, globalMedian, localMad, alpha,
                    segMin, segMinIndex, depth, depthThreshold, prominence, area, recovered,
                    ongoing, confidence, dip, k, minAbsDepth, minWidth, reason, scaleFactor,
                    detectionScale, detectedAtScales, scaleList);
        }
    }
}

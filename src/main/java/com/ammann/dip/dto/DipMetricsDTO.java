/* (C)2026 */
package com.ammann.dip.dto;

import com.ammann.dip.enumeration.DetectionScale;
import com.ammann.dip.enumeration.RejectionReason;
import com.ammann.dip.model.DipMetrics;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * JSON view of {@link DipMetrics}. Measurements that were not computed (segments
 * rejected by the width gate) are omitted instead of serialized as {@code NaN}.
 */
@Schema(description = "Measurements of one classified segment")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DipMetricsDTO(
        @Schema(description = "First index of the segment") int start,
        @Schema(description = "Last index of the segment") int end,
        @Schema(description = "Segment width in samples") int width,
        @Schema(description = "Baseline the depth is measured against") Double baseline,
        @Schema(description = "Trimmed mean of the local context") Double localMedian,
        @Schema(description = "Trimmed mean of the series outside the segment") Double globalMedian,
        @Schema(description = "Robust scale of the local context") Double localMad,
        @Schema(description = "Weight of the global baseline") Double alpha,
        @Schema(description = "Minimum value inside the segment") Double segMin,
        @Schema(description = "Index of the segment minimum") Integer segMinIndex,
        @Schema(description = "baseline - segMin") Double depth,
        @Schema(description = "Depth required to accept the segment") Double depthThreshold,
        @Schema(description = "Depth relative to the surrounding shoulders") Double prominence,
        @Schema(description = "Sum of baseline - value over the segment") Double area,
        @Schema(description = "Whether the signal returned near the baseline") boolean recovered,
        @Schema(description = "Whether the segment touches the end of the series") boolean ongoing,
        @Schema(description = "Confidence in [0, 1]") double confidence,
        @Schema(description = "Final verdict") boolean dip,
        @Schema(description = "Depth threshold multiplier used") double k,
        @Schema(description = "Absolute depth floor used") double minAbsDepth,
        @Schema(description = "Minimal width used") int minWidth,
        @Schema(description = "Rejection reason, absent for accepted dips") RejectionReason reason,
        @Schema(description = "Smoothing scale factor that produced the dip") Integer scaleFactor,
        @Schema(description = "Scale label") DetectionScale detectionScale,
        @Schema(description = "Number of distinct scales confirming the dip") Integer detectedAtScales,
        @Schema(description = "Distinct scales confirming the dip") List<Integer> scaleList
) {
    public static DipMetricsDTO from(DipMetrics m) {
        return new DipMetricsDTO(
                m.start(),
                m.end(),
                m.width(),
                finite(m.baseline()),
                finite(m.localMedian()),
                finite(m.globalMedian()),
                finite(m.localMad()),
                finite(m.alpha()),
                finite(m.segMin()),
                m.segMinIndex() >= 0 ? m.segMinIndex() : null,
                finite(m.depth()),
                finite(m.depthThreshold()),
                finite(m.prominence()),
                finite(m.area()),
                m.recovered(),
                m.ongoing(),
                m.confidence(),
                m.dip(),
                m.k(),
                m.minAbsDepth(),
                m.minWidth(),
                m.reason(),
                m.scaleFactor(),
                m.detectionScale(),
                m.detectedAtScales(),
                m.scaleList()
        );
    }

    public static List<DipMetricsDTO> fromAll(List<DipMetrics> dips) {
        return dips.stream().map(DipMetricsDTO::from).toList();
    }

    private static Double finite(double value) {
        return Double.isFinite(value) ? value : null;
    }
}

/* (C)2026 */
package com.ammann.dip.dto;

import com.ammann.dip.enumeration.TrendDirection;
import com.ammann.dip.service.TrendContextService.HybridTrendContext;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Trend leading into a dip")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrendContextDTO(
        @Schema(description = "Common direction of both methods, MIXED when they disagree") TrendDirection finalTrend,
        @Schema(description = "Mean of both directions mapped to -1, 0 and 1") double combinedScore,
        @Schema(description = "Moving-average verdict") TrendDirection maTrend,
        @Schema(description = "Moving-average score in [-1, 1]") double maScore,
        @Schema(description = "Trailing mean per period") Map<Integer, Double> movingAverages,
        @Schema(description = "Slope verdict") TrendDirection slopeTrend,
        @Schema(description = "Slope in percent of the mean level per sample") Double slopePctPerBar
) {
    public static TrendContextDTO from(HybridTrendContext context) {
        return new TrendContextDTO(
                context.finalTrend(),
                context.combinedScore(),
                context.movingAverage().trend(),
                context.movingAverage().trendScore(),
                context.movingAverage().movingAverages(),
                context.slope().trend(),
                context.slope().slopePctPerBar()
        );
    }
}

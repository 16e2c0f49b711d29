/* (C)2026 */
package com.ammann.dip.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Trend context of a series at a given index")
public record TrendRequestDTO(
        @Schema(description = "Samples of the series", required = true)
        List<Double> series,

        @Schema(description = "Index of the dip minimum", required = true)
        Integer index,

        @Schema(description = "Moving-average periods", example = "[20, 50, 200]")
        List<Integer> maPeriods,

        @Schema(description = "Samples before the index used for the slope", example = "50")
        Integer lookback
) {}

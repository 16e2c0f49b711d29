/* (C)2026 */
package com.ammann.dip.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Classify one explicit segment of a series")
public record ClassifyRequestDTO(
        @Schema(description = "Samples of the series", required = true, example = "[5, 5, 4, 3, 2.5, 3, 4, 5, 5]")
        List<Double> series,

        @Schema(description = "First index of the segment (inclusive)", required = true, example = "3")
        Integer start,

        @Schema(description = "Last index of the segment (inclusive)", required = true, example = "4")
        Integer end,

        @Schema(description = "Classification options")
        DetectionOptionsDTO options
) {}

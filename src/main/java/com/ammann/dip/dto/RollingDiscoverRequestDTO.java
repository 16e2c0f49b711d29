/* (C)2026 */
package com.ammann.dip.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request for sliding-window discovery. When {@code interval} is set, the window
 * strategy is chosen from the interval; otherwise {@code windowSize} and
 * {@code stride} (or their configured defaults) are used.
 */
@Schema(description = "Discover dips over a long series with a sliding window")
public record RollingDiscoverRequestDTO(
        @Schema(description = "Samples of the series", required = true)
        List<Double> series,

        @Schema(description = "Period the series covers", enumeration = {"5y", "3y", "12m", "6m", "3m", "1m", "1w"})
        String interval,

        @Schema(description = "Window length in samples", example = "125")
        Integer windowSize,

        @Schema(description = "Step between windows in samples", example = "1")
        Integer stride,

        @Schema(description = "Discovery options applied to every window")
        DiscoveryOptionsDTO options
) {}
